package domreplay.player;

/**
 * Unchecked exception thrown by player components when an event cannot be
 * replayed, e.g. the element is gone or the browser rejected the dispatch.
 */
public class ReplayException extends RuntimeException {

    public ReplayException(String msg) {
        super(msg);
    }

    public ReplayException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
