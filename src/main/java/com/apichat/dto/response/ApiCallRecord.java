package com.apichat.dto.response;

/**
 * One HTTP request issued against the remote API. A status of 0 means no response arrived.
 */
public record ApiCallRecord(String method, String url, int statusCode, boolean success) {
}
