package macrorec.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.awt.event.InputEvent;

/**
 * Mouse buttons known to the recorder and player.
 */
public enum MouseButton {

    LEFT("Button.left", InputEvent.BUTTON1_DOWN_MASK),
    MIDDLE("Button.middle", InputEvent.BUTTON2_DOWN_MASK),
    RIGHT("Button.right", InputEvent.BUTTON3_DOWN_MASK),
    UNKNOWN("unknown", 0);

    private final String identifier;
    private final int awtButtonMask;

    MouseButton(String identifier, int awtButtonMask) {
        this.identifier = identifier;
        this.awtButtonMask = awtButtonMask;
    }

    @JsonValue
    public String identifier() { return identifier; }

    /** Button mask accepted by {@code java.awt.Robot#mousePress(int)}. */
    public int awtButtonMask() { return awtButtonMask; }

    @JsonCreator
    public static MouseButton fromIdentifier(String identifier) {
        for (MouseButton button : values()) {
            if (button != UNKNOWN && button.identifier.equals(identifier)) return button;
        }
        return UNKNOWN;
    }
}
