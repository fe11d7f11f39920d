package com.apichat.service.provider;

/**
 * How a reasoning backend can be offered functions.
 */
public enum ProviderCapability {

    /**
     * Functions are sent as native descriptors and the backend answers with a function call.
     */
    NATIVE_FUNCTION_CALLING,

    /**
     * Functions are sent as tools; requests and results are content blocks paired by id.
     */
    TOOL_USE,

    /**
     * The backend cannot call functions. Descriptions are appended to the system prompt and
     * every reply is plain text.
     */
    PROMPT_INJECTION_ONLY
}
