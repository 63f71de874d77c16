package com.purchasingpower.storyflow.workflow;

/**
 * Result of a single step attempt as classified by {@link RetryPolicy}.
 *
 * @param <T> step result type
 */
public final class StepOutcome<T> {

    public enum Kind {
        SUCCESS,
        /**
         * Failed, another attempt may succeed.
         */
        RETRYABLE,
        /**
         * Failed, retrying cannot help.
         */
        FATAL
    }

    private final Kind kind;
    private final T value;
    private final Throwable error;
    private final boolean timedOut;

    private StepOutcome(Kind kind, T value, Throwable error, boolean timedOut) {
        this.kind = kind;
        this.value = value;
        this.error = error;
        this.timedOut = timedOut;
    }

    public static <T> StepOutcome<T> success(T value) {
        return new StepOutcome<>(Kind.SUCCESS, value, null, false);
    }

    public static <T> StepOutcome<T> retryable(Throwable error) {
        return new StepOutcome<>(Kind.RETRYABLE, null, error, false);
    }

    public static <T> StepOutcome<T> fatal(Throwable error) {
        return new StepOutcome<>(Kind.FATAL, null, error, false);
    }

    public static <T> StepOutcome<T> timedOut() {
        return new StepOutcome<>(Kind.RETRYABLE, null, null, true);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }

    public T getValue() {
        return value;
    }

    /**
     * Failure cause; null for successes and timeouts.
     */
    public Throwable getError() {
        return error;
    }

    public boolean isTimedOut() {
        return timedOut;
    }

    public String describe() {
        if (timedOut) {
            return "timed out";
        }
        return error == null ? kind.name() : error.getClass().getSimpleName() + ": " + error.getMessage();
    }
}
