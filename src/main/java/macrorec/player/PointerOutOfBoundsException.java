package macrorec.player;

/**
 * Thrown when a snapshot's pointer position lies outside the current screen.
 * The pointer is not moved.
 */
public class PointerOutOfBoundsException extends PlaybackException {

    public PointerOutOfBoundsException(String msg) {
        super(msg);
    }
}
