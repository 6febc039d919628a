package macrorec.recorder;

import macrorec.model.Key;

/** Receives decoded key transitions from an {@link InputCaptureAdapter}. */
public interface KeyEventListener {

    void keyPressed(Key key);

    void keyReleased(Key key);
}
