package macrorec.recorder;

import macrorec.model.CursorPosition;

/**
 * Abstraction over OS-level input capture backends.
 *
 * <p>{@link #start()} installs the global hook; listeners may then be added and
 * removed from any thread. Events are delivered on the backend's own dispatch
 * thread, already decoded into {@link macrorec.model.Key} and
 * {@link macrorec.model.MouseButton} values.
 */
public interface InputCaptureAdapter {

    /**
     * Installs the global hook.
     *
     * @throws CaptureException if the hook cannot be installed
     */
    void start();

    /** Removes the global hook and releases native resources. */
    void stop();

    void addKeyListener(KeyEventListener listener);

    void removeKeyListener(KeyEventListener listener);

    void addMouseListener(MouseEventListener listener);

    void removeMouseListener(MouseEventListener listener);

    /** Latest known pointer position; both coordinates come from the same observation. */
    CursorPosition pointerPosition();
}
