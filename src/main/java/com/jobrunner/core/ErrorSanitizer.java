package com.jobrunner.core;

import java.util.regex.Pattern;

/**
 * Scrubs job-supplied text before it reaches logs or callers.
 */
public final class ErrorSanitizer {

    public static final String PATH_PLACEHOLDER = "[PATH_REDACTED]";
    public static final int MAX_MESSAGE_LENGTH = 500;

    // file: and jar:file: locations from class loading and resource errors
    private static final Pattern FILE_URL = Pattern.compile("(?<![\\w.])(?:jar:)?file:/+\\S+");
    // Absolute unix paths not preceded by a word char, dot, colon or slash (keeps URLs intact)
    private static final Pattern UNIX_PATH = Pattern.compile("(?<![\\w.:/])/(?:[\\w\\-.]+/)*[\\w\\-.]+/?");
    private static final Pattern WINDOWS_PATH = Pattern.compile("\\b[A-Za-z]:\\\\(?:[\\w\\-. ]+\\\\)*[\\w\\-.]+");
    private static final Pattern UNSAFE_ID_CHARS = Pattern.compile("[^a-zA-Z0-9_\\-.]");

    private ErrorSanitizer() {
    }

    /**
     * Replace absolute paths with a placeholder and cap the length.
     */
    public static String sanitizeMessage(String message) {
        if (message == null || message.isEmpty()) {
            return "";
        }
        String result = FILE_URL.matcher(message).replaceAll(PATH_PLACEHOLDER);
        result = WINDOWS_PATH.matcher(result).replaceAll(PATH_PLACEHOLDER);
        result = UNIX_PATH.matcher(result).replaceAll(PATH_PLACEHOLDER);
        if (result.length() > MAX_MESSAGE_LENGTH) {
            result = result.substring(0, MAX_MESSAGE_LENGTH - 3) + "...";
        }
        return result;
    }

    /**
     * Message of a throwable, falling back to its class name when it has none.
     */
    public static String describe(Throwable error) {
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            message = error.getClass().getSimpleName();
        }
        return sanitizeMessage(message);
    }

    /**
     * Drop every character outside [A-Za-z0-9_.-].
     */
    public static String sanitizeJobId(String jobId) {
        if (jobId == null) {
            return "";
        }
        return UNSAFE_ID_CHARS.matcher(jobId).replaceAll("");
    }
}
