package macrorec.device;

import macrorec.model.Key;
import macrorec.model.MouseButton;

import java.awt.Dimension;

/**
 * Synthetic input capability used by the player to reproduce recorded device
 * state. Implementations talk to the operating system; tests substitute an
 * in-memory fake.
 */
public interface InputDevice {

    /** Current screen size in pixels. */
    Dimension screenSize();

    /** Moves the pointer to an absolute screen position. */
    void movePointer(int x, int y);

    void pressButton(MouseButton button);

    void releaseButton(MouseButton button);

    /**
     * Scrolls by the given number of wheel notches on each axis; positive means
     * down / right. A zero axis is not scrolled.
     */
    void scroll(int horizontal, int vertical);

    void pressKey(Key key);

    void releaseKey(Key key);
}
