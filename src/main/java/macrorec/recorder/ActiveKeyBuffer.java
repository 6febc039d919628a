package macrorec.recorder;

import macrorec.model.Key;
import macrorec.model.KeyPress;

import java.util.ArrayList;
import java.util.List;

/**
 * Keys currently held down, each with the time it went down.
 *
 * <p>A press stays here until its key is released; only then is it reported
 * to the in-flight snapshot, so a key held across several sampling intervals is
 * reported once with its original press time. Guarded by its own monitor,
 * independent of the snapshot lock.
 */
final class ActiveKeyBuffer {

    private final List<KeyPress> held = new ArrayList<>();

    /**
     * Records a key press. A repeated press of a key that is already held
     * (keyboard auto-repeat) is ignored.
     *
     * @return {@code true} if the press was recorded
     */
    synchronized boolean press(Key key, double timestamp) {
        for (KeyPress p : held) {
            if (p.key() == key) return false;
        }
        held.add(new KeyPress(key, timestamp));
        return true;
    }

    /**
     * Releases a key and returns the chord it completes: every held key,
     * released key included, in press order. The released key's entries are
     * dropped from the buffer; the other keys stay held.
     *
     * @return the chord, or an empty list if the key was not held
     */
    synchronized List<KeyPress> release(Key key) {
        boolean wasHeld = held.stream().anyMatch(p -> p.key() == key);
        if (!wasHeld) return List.of();

        List<KeyPress> chord = List.copyOf(held);
        held.removeIf(p -> p.key() == key);
        return chord;
    }

    /** Keys currently held, in press order. */
    synchronized List<KeyPress> heldKeys() {
        return List.copyOf(held);
    }
}
