package domreplay.model;

/**
 * Kinds of {@link Transition} misuse. Every kind is a broken sequencing
 * contract in the calling code, never a recoverable condition.
 */
public enum TransitionError {
    /** The transition has already completed. */
    ALREADY_COMPLETED("Transition has completed."),
    /** {@code start} was called on a running transition. */
    ALREADY_RUNNING("Transition is already running."),
    /** {@code complete} was called before {@code start}. */
    NOT_RUNNING("Transition is not running."),
    /** The element key is not a string-like or symbolic identifier. */
    INVALID_ELEMENT("Invalid element identifier.");

    private final String message;

    TransitionError(String message) {
        this.message = message;
    }

    public String getMessage() { return message; }
}
