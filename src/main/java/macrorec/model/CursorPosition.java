package macrorec.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Absolute pointer position in screen pixels. Persisted as a two-integer
 * array {@code [x, y]}.
 */
public record CursorPosition(int x, int y) {

    @JsonValue
    int[] toArray() {
        return new int[] {x, y};
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    static CursorPosition fromArray(int[] xy) {
        if (xy == null || xy.length != 2) {
            throw new IllegalArgumentException("mouse_pos must hold exactly two integers");
        }
        return new CursorPosition(xy[0], xy[1]);
    }

    /** True when this position lies within {@code [0, width) x [0, height)}. */
    public boolean isWithin(int width, int height) {
        return x >= 0 && x < width && y >= 0 && y < height;
    }
}
