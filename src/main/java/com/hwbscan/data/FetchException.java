package com.hwbscan.data;

/**
 * Provider failure after retries, with a coarse category
 * ({@code timeout}, {@code rate_limit}, {@code no_data}, {@code parse_error}, {@code other}).
 */
public class FetchException extends Exception {
    private final String category;
    private final int attempts;

    public FetchException(String message, String category, int attempts) {
        super(message);
        this.category = category == null ? "other" : category;
        this.attempts = Math.max(0, attempts);
    }

    public FetchException(String message, String category, int attempts, Throwable cause) {
        super(message, cause);
        this.category = category == null ? "other" : category;
        this.attempts = Math.max(0, attempts);
    }

    public String category() {
        return category;
    }

    public int attempts() {
        return attempts;
    }
}
