package domreplay.model;

/**
 * Unchecked exception thrown when a {@link Transition} operation is invoked
 * in a state that does not allow it. Switch on {@link #getError()} to tell
 * the kinds apart.
 */
public class TransitionException extends RuntimeException {

    private final TransitionError error;

    public TransitionException(TransitionError error) {
        super(error.getMessage());
        this.error = error;
    }

    public TransitionException(TransitionError error, String detail) {
        super(error.getMessage() + " " + detail);
        this.error = error;
    }

    public TransitionError getError() { return error; }
}
