package com.apichat.dto.response;

/**
 * The outcome of a shell command execution.
 *
 * @param success Whether the command succeeded.
 * @param message A confirmation or an error explanation.
 */
public record CommandResponse(boolean success, String message) {

    public static CommandResponse ok(String message) {
        return new CommandResponse(true, message);
    }

    public static CommandResponse error(String message) {
        return new CommandResponse(false, message);
    }

    /**
     * Wraps the message in ANSI color codes: green for success, red for failure.
     */
    public String toAnsiString() {
        String color = success ? "\u001B[32m" : "\u001B[31m";
        return color + message + "\u001B[0m";
    }
}
