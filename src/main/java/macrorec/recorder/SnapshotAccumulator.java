package macrorec.recorder;

import macrorec.model.ButtonEvent;
import macrorec.model.CursorPosition;
import macrorec.model.KeyPress;
import macrorec.model.ScrollDelta;
import macrorec.model.Snapshot;

import java.util.ArrayList;
import java.util.List;

/**
 * The in-flight snapshot: transient key, button and scroll state accumulated
 * by the listener threads between two sampler ticks.
 *
 * <p>All access goes through this object's monitor, so a listener update and
 * the sampler's {@link #drain} never interleave. {@code drain} builds an
 * immutable {@link Snapshot} from copies and resets the transient fields.
 */
final class SnapshotAccumulator {

    private final List<KeyPress> keys = new ArrayList<>();
    private ButtonEvent button;
    private ScrollDelta scroll;

    /** Merges key presses into this interval, skipping entries already staged. */
    synchronized void stageKeys(List<KeyPress> presses) {
        for (KeyPress p : presses) {
            if (!keys.contains(p)) keys.add(p);
        }
    }

    /** Latest button transition of the interval wins. */
    synchronized void recordButton(ButtonEvent event) {
        this.button = event;
    }

    /** Latest scroll of the interval wins. */
    synchronized void recordScroll(ScrollDelta delta) {
        this.scroll = delta;
    }

    /**
     * Stamps the accumulated state with time and position, returns it as a
     * snapshot and clears the transient fields.
     */
    synchronized Snapshot drain(double timestamp, CursorPosition position) {
        Snapshot snapshot = new Snapshot(timestamp, position, keys, button, scroll);
        keys.clear();
        button = null;
        scroll = null;
        return snapshot;
    }
}
