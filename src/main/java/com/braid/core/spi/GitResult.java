package com.braid.core.spi;

/**
 * Outcome of a git operation. Expected failures (conflicts, missing branches,
 * existing paths) are reported here instead of being thrown.
 *
 * @param success  true when git exited with status 0
 * @param exitCode process exit code, or -1 when git could not be run
 * @param stdout   captured standard output
 * @param stderr   captured standard error
 * @param message  short human-readable summary
 */
public record GitResult(boolean success, int exitCode, String stdout, String stderr, String message) {

    public static GitResult ok(String stdout) {
        return new GitResult(true, 0, stdout, "", "ok");
    }

    public static GitResult failure(String message) {
        return new GitResult(false, -1, "", "", message);
    }

    public boolean hasConflict() {
        return contains(stdout, "CONFLICT") || contains(stderr, "CONFLICT");
    }

    /**
     * Best available error text: stderr, then stdout, then the message.
     */
    public String error() {
        if (stderr != null && !stderr.isBlank()) return stderr.trim();
        if (stdout != null && !stdout.isBlank() && !success) return stdout.trim();
        return message;
    }

    private static boolean contains(String text, String token) {
        return text != null && text.contains(token);
    }
}
