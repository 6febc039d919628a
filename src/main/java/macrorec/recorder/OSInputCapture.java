package macrorec.recorder;

import com.github.kwhat.jnativehook.GlobalScreen;
import com.github.kwhat.jnativehook.NativeHookException;
import com.github.kwhat.jnativehook.keyboard.NativeKeyEvent;
import com.github.kwhat.jnativehook.keyboard.NativeKeyListener;
import com.github.kwhat.jnativehook.mouse.NativeMouseEvent;
import com.github.kwhat.jnativehook.mouse.NativeMouseListener;
import com.github.kwhat.jnativehook.mouse.NativeMouseMotionListener;
import com.github.kwhat.jnativehook.mouse.NativeMouseWheelEvent;
import com.github.kwhat.jnativehook.mouse.NativeMouseWheelListener;
import macrorec.model.CursorPosition;
import macrorec.model.Key;
import macrorec.model.MouseButton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.GraphicsEnvironment;
import java.awt.MouseInfo;
import java.awt.Point;
import java.awt.PointerInfo;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Captures global OS mouse + keyboard events using JNativeHook and forwards
 * them, decoded, to the registered {@link KeyEventListener}s and
 * {@link MouseEventListener}s.
 *
 * <p>Native key codes are translated to {@link Key} here and nowhere else;
 * codes without a counterpart become {@link Key#UNKNOWN}. The pointer position
 * is tracked from native motion events and seeded from AWT when a display is
 * available.
 */
public class OSInputCapture implements InputCaptureAdapter,
        NativeKeyListener, NativeMouseListener, NativeMouseMotionListener, NativeMouseWheelListener {

    private static final Logger log = LoggerFactory.getLogger(OSInputCapture.class);

    private final List<KeyEventListener> keyListeners = new CopyOnWriteArrayList<>();
    private final List<MouseEventListener> mouseListeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean active = new AtomicBoolean(false);

    /** Last known cursor position, replaced as a whole so readers never see a torn pair. */
    private volatile CursorPosition position = new CursorPosition(0, 0);

    // ── InputCaptureAdapter ───────────────────────────────────────────────

    @Override
    public void start() {
        if (active.get()) return;
        try {
            // Suppress JNativeHook's verbose console output; SLF4J handles our logging.
            java.util.logging.Logger nativeLogger =
                    java.util.logging.Logger.getLogger(
                            GlobalScreen.class.getPackage().getName());
            nativeLogger.setLevel(java.util.logging.Level.WARNING);
            nativeLogger.setUseParentHandlers(false);

            seedPosition();
            GlobalScreen.registerNativeHook();
            GlobalScreen.addNativeKeyListener(this);
            GlobalScreen.addNativeMouseListener(this);
            GlobalScreen.addNativeMouseMotionListener(this);
            GlobalScreen.addNativeMouseWheelListener(this);
            active.set(true);
            log.info("OS input capture started");
        } catch (NativeHookException e) {
            throw new CaptureException("Failed to register native hook", e);
        }
    }

    @Override
    public void stop() {
        if (!active.getAndSet(false)) return;
        GlobalScreen.removeNativeKeyListener(this);
        GlobalScreen.removeNativeMouseListener(this);
        GlobalScreen.removeNativeMouseMotionListener(this);
        GlobalScreen.removeNativeMouseWheelListener(this);
        try {
            GlobalScreen.unregisterNativeHook();
        } catch (NativeHookException e) {
            log.warn("Error unregistering native hook: {}", e.getMessage());
        }
        log.info("OS input capture stopped");
    }

    @Override
    public void addKeyListener(KeyEventListener listener) {
        keyListeners.add(listener);
    }

    @Override
    public void removeKeyListener(KeyEventListener listener) {
        keyListeners.remove(listener);
    }

    @Override
    public void addMouseListener(MouseEventListener listener) {
        mouseListeners.add(listener);
    }

    @Override
    public void removeMouseListener(MouseEventListener listener) {
        mouseListeners.remove(listener);
    }

    @Override
    public CursorPosition pointerPosition() {
        return position;
    }

    // ── NativeKeyListener ─────────────────────────────────────────────────

    @Override
    public void nativeKeyPressed(NativeKeyEvent e) {
        if (!active.get()) return;
        Key key = mapKeyCode(e.getKeyCode());
        for (KeyEventListener l : keyListeners) {
            l.keyPressed(key);
        }
    }

    @Override
    public void nativeKeyReleased(NativeKeyEvent e) {
        if (!active.get()) return;
        Key key = mapKeyCode(e.getKeyCode());
        for (KeyEventListener l : keyListeners) {
            l.keyReleased(key);
        }
    }

    /** Typed characters duplicate press/release; not used. */
    @Override
    public void nativeKeyTyped(NativeKeyEvent e) {
        // not recorded
    }

    // ── NativeMouseListener / NativeMouseMotionListener ───────────────────

    @Override
    public void nativeMousePressed(NativeMouseEvent e) {
        onButton(e, true);
    }

    @Override
    public void nativeMouseReleased(NativeMouseEvent e) {
        onButton(e, false);
    }

    /** Clicks are reported as separate press and release transitions. */
    @Override
    public void nativeMouseClicked(NativeMouseEvent e) {
        // handled in nativeMousePressed / nativeMouseReleased
    }

    @Override
    public void nativeMouseMoved(NativeMouseEvent e) {
        position = new CursorPosition(e.getX(), e.getY());
    }

    @Override
    public void nativeMouseDragged(NativeMouseEvent e) {
        position = new CursorPosition(e.getX(), e.getY());
    }

    // ── NativeMouseWheelListener ──────────────────────────────────────────

    @Override
    public void nativeMouseWheelMoved(NativeMouseWheelEvent e) {
        if (!active.get()) return;
        int rotation = e.getWheelRotation();
        if (rotation == 0) return;

        boolean horizontal = e.getWheelDirection() == NativeMouseWheelEvent.WHEEL_HORIZONTAL_DIRECTION;
        for (MouseEventListener l : mouseListeners) {
            if (horizontal) {
                l.scrolled(rotation, 0);
            } else {
                l.scrolled(0, rotation);
            }
        }
    }

    // ── Internal helpers ──────────────────────────────────────────────────

    private void onButton(NativeMouseEvent e, boolean pressed) {
        position = new CursorPosition(e.getX(), e.getY());
        if (!active.get()) return;
        MouseButton button = mapButton(e.getButton());
        for (MouseEventListener l : mouseListeners) {
            l.buttonChanged(button, pressed);
        }
    }

    private void seedPosition() {
        if (GraphicsEnvironment.isHeadless()) return;
        PointerInfo info = MouseInfo.getPointerInfo();
        if (info != null) {
            Point p = info.getLocation();
            position = new CursorPosition(p.x, p.y);
        }
    }

    static MouseButton mapButton(int nativeButton) {
        return switch (nativeButton) {
            case NativeMouseEvent.BUTTON1 -> MouseButton.LEFT;
            case NativeMouseEvent.BUTTON2 -> MouseButton.RIGHT;
            case NativeMouseEvent.BUTTON3 -> MouseButton.MIDDLE;
            default                       -> MouseButton.UNKNOWN;
        };
    }

    /**
     * Maps JNativeHook virtual-key codes to {@link Key}. Left and right
     * variants of a modifier share one native code and one {@link Key}.
     */
    static Key mapKeyCode(int code) {
        return switch (code) {
            case NativeKeyEvent.VC_A -> Key.A;
            case NativeKeyEvent.VC_B -> Key.B;
            case NativeKeyEvent.VC_C -> Key.C;
            case NativeKeyEvent.VC_D -> Key.D;
            case NativeKeyEvent.VC_E -> Key.E;
            case NativeKeyEvent.VC_F -> Key.F;
            case NativeKeyEvent.VC_G -> Key.G;
            case NativeKeyEvent.VC_H -> Key.H;
            case NativeKeyEvent.VC_I -> Key.I;
            case NativeKeyEvent.VC_J -> Key.J;
            case NativeKeyEvent.VC_K -> Key.K;
            case NativeKeyEvent.VC_L -> Key.L;
            case NativeKeyEvent.VC_M -> Key.M;
            case NativeKeyEvent.VC_N -> Key.N;
            case NativeKeyEvent.VC_O -> Key.O;
            case NativeKeyEvent.VC_P -> Key.P;
            case NativeKeyEvent.VC_Q -> Key.Q;
            case NativeKeyEvent.VC_R -> Key.R;
            case NativeKeyEvent.VC_S -> Key.S;
            case NativeKeyEvent.VC_T -> Key.T;
            case NativeKeyEvent.VC_U -> Key.U;
            case NativeKeyEvent.VC_V -> Key.V;
            case NativeKeyEvent.VC_W -> Key.W;
            case NativeKeyEvent.VC_X -> Key.X;
            case NativeKeyEvent.VC_Y -> Key.Y;
            case NativeKeyEvent.VC_Z -> Key.Z;

            case NativeKeyEvent.VC_0 -> Key.DIGIT_0;
            case NativeKeyEvent.VC_1 -> Key.DIGIT_1;
            case NativeKeyEvent.VC_2 -> Key.DIGIT_2;
            case NativeKeyEvent.VC_3 -> Key.DIGIT_3;
            case NativeKeyEvent.VC_4 -> Key.DIGIT_4;
            case NativeKeyEvent.VC_5 -> Key.DIGIT_5;
            case NativeKeyEvent.VC_6 -> Key.DIGIT_6;
            case NativeKeyEvent.VC_7 -> Key.DIGIT_7;
            case NativeKeyEvent.VC_8 -> Key.DIGIT_8;
            case NativeKeyEvent.VC_9 -> Key.DIGIT_9;

            case NativeKeyEvent.VC_MINUS         -> Key.MINUS;
            case NativeKeyEvent.VC_EQUALS        -> Key.EQUALS;
            case NativeKeyEvent.VC_OPEN_BRACKET  -> Key.OPEN_BRACKET;
            case NativeKeyEvent.VC_CLOSE_BRACKET -> Key.CLOSE_BRACKET;
            case NativeKeyEvent.VC_BACK_SLASH    -> Key.BACK_SLASH;
            case NativeKeyEvent.VC_SEMICOLON     -> Key.SEMICOLON;
            case NativeKeyEvent.VC_QUOTE         -> Key.QUOTE;
            case NativeKeyEvent.VC_COMMA         -> Key.COMMA;
            case NativeKeyEvent.VC_PERIOD        -> Key.PERIOD;
            case NativeKeyEvent.VC_SLASH         -> Key.SLASH;
            case NativeKeyEvent.VC_BACKQUOTE     -> Key.BACK_QUOTE;

            case NativeKeyEvent.VC_SPACE     -> Key.SPACE;
            case NativeKeyEvent.VC_ENTER     -> Key.ENTER;
            case NativeKeyEvent.VC_TAB       -> Key.TAB;
            case NativeKeyEvent.VC_BACKSPACE -> Key.BACKSPACE;
            case NativeKeyEvent.VC_ESCAPE    -> Key.ESCAPE;
            case NativeKeyEvent.VC_DELETE    -> Key.DELETE;
            case NativeKeyEvent.VC_INSERT    -> Key.INSERT;
            case NativeKeyEvent.VC_HOME      -> Key.HOME;
            case NativeKeyEvent.VC_END       -> Key.END;
            case NativeKeyEvent.VC_PAGE_UP   -> Key.PAGE_UP;
            case NativeKeyEvent.VC_PAGE_DOWN -> Key.PAGE_DOWN;
            case NativeKeyEvent.VC_UP        -> Key.UP;
            case NativeKeyEvent.VC_DOWN      -> Key.DOWN;
            case NativeKeyEvent.VC_LEFT      -> Key.LEFT;
            case NativeKeyEvent.VC_RIGHT     -> Key.RIGHT;
            case NativeKeyEvent.VC_CAPS_LOCK -> Key.CAPS_LOCK;
            case NativeKeyEvent.VC_NUM_LOCK    -> Key.NUM_LOCK;
            case NativeKeyEvent.VC_SCROLL_LOCK -> Key.SCROLL_LOCK;
            case NativeKeyEvent.VC_PRINTSCREEN -> Key.PRINT_SCREEN;
            case NativeKeyEvent.VC_PAUSE       -> Key.PAUSE;
            case NativeKeyEvent.VC_CONTEXT_MENU -> Key.MENU;

            case NativeKeyEvent.VC_F1  -> Key.F1;
            case NativeKeyEvent.VC_F2  -> Key.F2;
            case NativeKeyEvent.VC_F3  -> Key.F3;
            case NativeKeyEvent.VC_F4  -> Key.F4;
            case NativeKeyEvent.VC_F5  -> Key.F5;
            case NativeKeyEvent.VC_F6  -> Key.F6;
            case NativeKeyEvent.VC_F7  -> Key.F7;
            case NativeKeyEvent.VC_F8  -> Key.F8;
            case NativeKeyEvent.VC_F9  -> Key.F9;
            case NativeKeyEvent.VC_F10 -> Key.F10;
            case NativeKeyEvent.VC_F11 -> Key.F11;
            case NativeKeyEvent.VC_F12 -> Key.F12;
            case NativeKeyEvent.VC_F13 -> Key.F13;
            case NativeKeyEvent.VC_F14 -> Key.F14;
            case NativeKeyEvent.VC_F15 -> Key.F15;
            case NativeKeyEvent.VC_F16 -> Key.F16;
            case NativeKeyEvent.VC_F17 -> Key.F17;
            case NativeKeyEvent.VC_F18 -> Key.F18;
            case NativeKeyEvent.VC_F19 -> Key.F19;
            case NativeKeyEvent.VC_F20 -> Key.F20;

            case NativeKeyEvent.VC_SHIFT   -> Key.SHIFT;
            case NativeKeyEvent.VC_CONTROL -> Key.CTRL;
            case NativeKeyEvent.VC_ALT     -> Key.ALT;
            case NativeKeyEvent.VC_META    -> Key.CMD;

            default -> Key.UNKNOWN;
        };
    }

    // ── Package-visible accessors for tests ───────────────────────────────

    /** Returns {@code true} if capture is currently active. */
    boolean isActive() { return active.get(); }
}
