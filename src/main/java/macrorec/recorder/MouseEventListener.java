package macrorec.recorder;

import macrorec.model.MouseButton;

/** Receives decoded button and wheel events from an {@link InputCaptureAdapter}. */
public interface MouseEventListener {

    void buttonChanged(MouseButton button, boolean pressed);

    /**
     * @param horizontal notches scrolled sideways, positive to the right
     * @param vertical   notches scrolled vertically, positive downwards
     */
    void scrolled(int horizontal, int vertical);
}
