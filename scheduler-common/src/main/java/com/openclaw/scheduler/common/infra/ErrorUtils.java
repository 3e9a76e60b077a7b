package com.openclaw.scheduler.common.infra;

/**
 * Error formatting utilities: safely extract messages from exceptions.
 */
public final class ErrorUtils {

    private ErrorUtils() {
    }

    /**
     * Format an exception message safely, unwrapping executor wrappers.
     *
     * @return a non-null human-readable error string
     */
    public static String formatErrorMessage(Throwable err) {
        if (err == null)
            return "Error";
        Throwable current = err;
        while ((current instanceof java.util.concurrent.ExecutionException
                || current instanceof java.util.concurrent.CompletionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        String msg = current.getMessage();
        if (msg != null && !msg.isEmpty()) {
            return msg;
        }
        return current.getClass().getSimpleName();
    }

    /**
     * Truncate text to at most {@code max} characters.
     */
    public static String truncate(String text, int max) {
        if (text == null || text.length() <= max) {
            return text;
        }
        return text.substring(0, max);
    }
}
