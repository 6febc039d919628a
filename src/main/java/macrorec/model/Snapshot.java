package macrorec.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * One sample of input-device state, produced once per sampling interval by
 * {@code Recorder} and consumed by {@code Player}.
 *
 * <ul>
 *   <li>{@code timestamp}: epoch seconds at which the sample was taken.</li>
 *   <li>{@code mousePosition}: pointer position, always present.</li>
 *   <li>{@code keys}: keys released during the interval, each with its press
 *       time, plus any keys still held when that release happened. Empty when no
 *       key was released.</li>
 *   <li>{@code button}: most recent button transition of the interval, or {@code null}.</li>
 *   <li>{@code scroll}: most recent scroll of the interval, or {@code null}.</li>
 * </ul>
 *
 * <p>Instances are immutable; the key list is copied on construction.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({"timestamp", "mouse_pos", "button", "keys", "scroll"})
public final class Snapshot {

    @JsonProperty("timestamp")
    private final double timestamp;

    @JsonProperty("mouse_pos")
    private final CursorPosition mousePosition;

    @JsonProperty("button")
    private final ButtonEvent button;

    @JsonProperty("keys")
    private final List<KeyPress> keys;

    @JsonProperty("scroll")
    private final ScrollDelta scroll;

    @JsonCreator
    public Snapshot(@JsonProperty(value = "timestamp", required = true) double timestamp,
                    @JsonProperty(value = "mouse_pos", required = true) CursorPosition mousePosition,
                    @JsonProperty("keys") List<KeyPress> keys,
                    @JsonProperty("button") ButtonEvent button,
                    @JsonProperty("scroll") ScrollDelta scroll) {
        this.timestamp     = timestamp;
        this.mousePosition = Objects.requireNonNull(mousePosition, "mouse_pos");
        this.keys          = keys == null ? List.of() : List.copyOf(keys);
        this.button        = button;
        this.scroll        = scroll;
    }

    /** Snapshot with a position only; no key, button or scroll activity. */
    public static Snapshot at(double timestamp, int x, int y) {
        return new Snapshot(timestamp, new CursorPosition(x, y), List.of(), null, null);
    }

    public double         getTimestamp()     { return timestamp; }
    public CursorPosition getMousePosition() { return mousePosition; }
    public List<KeyPress> getKeys()          { return keys; }
    public ButtonEvent    getButton()        { return button; }
    public ScrollDelta    getScroll()        { return scroll; }

    public boolean hasButton() { return button != null; }
    public boolean hasScroll() { return scroll != null; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Snapshot)) return false;
        Snapshot other = (Snapshot) o;
        return Double.compare(timestamp, other.timestamp) == 0
                && mousePosition.equals(other.mousePosition)
                && keys.equals(other.keys)
                && Objects.equals(button, other.button)
                && Objects.equals(scroll, other.scroll);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, mousePosition, keys, button, scroll);
    }

    @Override
    public String toString() {
        return String.format("Snapshot{t=%.3f, pos=(%d,%d), keys=%d, button=%s, scroll=%s}",
                timestamp, mousePosition.x(), mousePosition.y(), keys.size(), button, scroll);
    }
}
