package macrorec.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Scroll amount in wheel notches, positive meaning down / right. Persisted as
 * {@code [horizontal, vertical]}.
 *
 * <p>The recorder only ever sets one axis per snapshot, but both axes may be
 * non-zero in a loaded recording and the player applies both.
 */
public record ScrollDelta(int horizontal, int vertical) {

    public static ScrollDelta horizontal(int amount) {
        return new ScrollDelta(amount, 0);
    }

    public static ScrollDelta vertical(int amount) {
        return new ScrollDelta(0, amount);
    }

    @JsonValue
    int[] toArray() {
        return new int[] {horizontal, vertical};
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    static ScrollDelta fromArray(int[] hv) {
        if (hv == null || hv.length != 2) {
            throw new IllegalArgumentException("scroll must hold exactly two integers");
        }
        return new ScrollDelta(hv[0], hv[1]);
    }
}
