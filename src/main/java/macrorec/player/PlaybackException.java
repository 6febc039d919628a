package macrorec.player;

/**
 * Unchecked exception thrown when a snapshot cannot be replayed: unknown key
 * or button, pointer position off screen.
 */
public class PlaybackException extends RuntimeException {

    public PlaybackException(String msg) {
        super(msg);
    }

    public PlaybackException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
