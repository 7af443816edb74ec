package com.redash.dto.response;

/**
 * The outcome of a shell command: whether it succeeded and a one-line message.
 *
 * @param success {@code true} if the command completed.
 * @param message What happened, or why it failed.
 */
public record CommandResponse(boolean success, String message) {

    public static CommandResponse ok(String message) {
        return new CommandResponse(true, message);
    }

    public static CommandResponse failure(String message) {
        return new CommandResponse(false, message);
    }

    /**
     * @return The message in green on success and red on failure.
     */
    public String toAnsiString() {
        String color = success ? "\u001B[32m" : "\u001B[31m";
        return color + message + "\u001B[0m";
    }
}
