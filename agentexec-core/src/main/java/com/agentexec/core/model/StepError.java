package com.agentexec.core.model;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Structured failure recorded on a step.
 */
public record StepError(
    String code,
    String message,
    boolean recoverable,
    String stack,
    Map<String, Object> context
) {
    public static final String STEP_EXECUTION_FAILED = "STEP_EXECUTION_FAILED";

    private static final Pattern TRANSIENT = Pattern.compile(
        "timeout|timed out|network|econn\\w*|connection|rate limit|429|503");

    /**
     * Build a step error from a thrown exception, classifying transient failures as recoverable.
     */
    public static StepError from(Throwable error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new StepError(
            STEP_EXECUTION_FAILED,
            message,
            isTransient(message),
            stackOf(error),
            Map.of("exception", error.getClass().getName())
        );
    }

    public static boolean isTransient(String message) {
        return message != null && TRANSIENT.matcher(message.toLowerCase(Locale.ROOT)).find();
    }

    private static String stackOf(Throwable error) {
        StringBuilder sb = new StringBuilder();
        StackTraceElement[] frames = error.getStackTrace();
        for (int i = 0; i < Math.min(frames.length, 10); i++) {
            sb.append("at ").append(frames[i]).append('\n');
        }
        return sb.toString();
    }
}
