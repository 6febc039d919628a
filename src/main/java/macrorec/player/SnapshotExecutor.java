package macrorec.player;

import macrorec.device.InputDevice;
import macrorec.model.ButtonEvent;
import macrorec.model.CursorPosition;
import macrorec.model.Key;
import macrorec.model.KeyPress;
import macrorec.model.MouseButton;
import macrorec.model.ScrollDelta;
import macrorec.model.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Dimension;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies one {@link Snapshot} to an {@link InputDevice}, in a fixed order:
 * <ol>
 *   <li>move the pointer,</li>
 *   <li>press or release the button,</li>
 *   <li>scroll,</li>
 *   <li>press then release the snapshot's keys.</li>
 * </ol>
 *
 * <p>The whole snapshot is checked before the first action: an off-screen
 * pointer, an unknown button or a key identifier that cannot be typed fails
 * without touching the device.
 *
 * <p>Keys pass through a de-duplication cache holding, per identifier, the latest
 * press time already executed: a key whose recorded press time is not newer than
 * the cached one is skipped. Shift, ctrl, alt and cmd bypass the cache so they are
 * re-applied with every chord they appear in. An upper-case letter or shifted
 * symbol is typed as shift plus the base key.
 *
 * <p>One executor per playback; not thread-safe.
 */
class SnapshotExecutor {

    private static final Logger log = LoggerFactory.getLogger(SnapshotExecutor.class);

    private final InputDevice device;
    private final Map<String, Double> keypressCache = new HashMap<>();

    SnapshotExecutor(InputDevice device) {
        this.device = device;
    }

    void execute(Snapshot snapshot) {
        List<List<Key>> strokes = validate(snapshot);

        CursorPosition pos = snapshot.getMousePosition();
        device.movePointer(pos.x(), pos.y());
        if (snapshot.hasButton()) {
            applyButton(snapshot.getButton());
        }
        if (snapshot.hasScroll()) {
            applyScroll(snapshot.getScroll());
        }
        pressAndReleaseKeys(snapshot.getKeys(), strokes);
    }

    // ── Validation ────────────────────────────────────────────────────────

    /** Rejects bad data up front; returns the key strokes for each of the snapshot's keys. */
    private List<List<Key>> validate(Snapshot snapshot) {
        CursorPosition pos = snapshot.getMousePosition();
        Dimension screen = device.screenSize();
        if (!pos.isWithin(screen.width, screen.height)) {
            throw new PointerOutOfBoundsException(String.format(
                    "mouse position (%d, %d) out of range [0,%d) x [0,%d)",
                    pos.x(), pos.y(), screen.width, screen.height));
        }
        if (snapshot.hasButton() && snapshot.getButton().button() == MouseButton.UNKNOWN) {
            throw new PlaybackException("unknown button type in " + snapshot.getButton());
        }
        List<List<Key>> strokes = new ArrayList<>(snapshot.getKeys().size());
        for (KeyPress p : snapshot.getKeys()) {
            List<Key> keys = Key.strokesFor(p.identifier());
            if (keys.isEmpty()) {
                throw new PlaybackException("unrecognized key identifier '" + p.identifier()
                        + "' at press time " + p.pressTimestamp());
            }
            strokes.add(keys);
        }
        return strokes;
    }

    // ── Actions ───────────────────────────────────────────────────────────

    private void applyButton(ButtonEvent event) {
        if (event.pressed()) {
            device.pressButton(event.button());
        } else {
            device.releaseButton(event.button());
        }
    }

    private void applyScroll(ScrollDelta delta) {
        if (delta.horizontal() != 0 || delta.vertical() != 0) {
            device.scroll(delta.horizontal(), delta.vertical());
        }
    }

    private void pressAndReleaseKeys(List<KeyPress> presses, List<List<Key>> strokes) {
        if (presses.isEmpty()) return;

        List<List<Key>> combo = new ArrayList<>(presses.size());
        for (int i = 0; i < presses.size(); i++) {
            KeyPress p = presses.get(i);
            if (p.key().isModifier()) {
                combo.add(strokes.get(i));
                continue;
            }
            Double executed = keypressCache.get(p.identifier());
            if (executed == null || p.pressTimestamp() > executed) {
                keypressCache.put(p.identifier(), p.pressTimestamp());
                combo.add(strokes.get(i));
            }
        }
        if (combo.isEmpty()) return;

        log.debug("Key combo {}", combo);
        for (List<Key> keys : combo) {
            for (Key key : keys) {
                device.pressKey(key);
            }
        }
        for (List<Key> keys : combo) {
            for (int j = keys.size() - 1; j >= 0; j--) {
                device.releaseKey(keys.get(j));
            }
        }
    }
}
