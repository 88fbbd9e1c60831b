package io.github.sigwasm.core;

import org.jetbrains.annotations.Nullable;

/**
 * Thrown when a component cannot be compiled.
 * <p>
 * Every compilation error aborts the compilation of the whole module; no module is produced
 * with a handler missing.
 */
public class CompilationException extends RuntimeException {
    @Nullable
    private final String subject;

    /**
     * Construct a compilation exception.
     *
     * @param subject What the error is attributed to, such as {@code handler_3} or {@code signal_2}, or null.
     * @param message The message.
     */
    public CompilationException(@Nullable String subject, String message) {
        super(subject == null ? message : subject + ": " + message);
        this.subject = subject;
    }

    public CompilationException(@Nullable String subject, String message, Throwable cause) {
        super(subject == null ? message : subject + ": " + message, cause);
        this.subject = subject;
    }

    /**
     * Get what this error is attributed to.
     *
     * @return The subject, such as {@code handler_3} or {@code signal_2}, or null if there is none.
     */
    @Nullable
    public String getSubject() {
        return subject;
    }

    public static String handler(int id) {
        return "handler_" + id;
    }

    public static String signal(long id) {
        return "signal_" + id;
    }
}
