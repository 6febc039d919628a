package macrorec.device;

import macrorec.model.Key;
import macrorec.model.MouseButton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.AWTException;
import java.awt.Dimension;
import java.awt.Robot;
import java.awt.Toolkit;
import java.awt.event.KeyEvent;
import java.util.function.Supplier;

/**
 * {@link InputDevice} backed by {@link Robot}.
 *
 * <p>AWT has no horizontal wheel, so horizontal scroll is sent as SHIFT + wheel,
 * which most desktop toolkits interpret as a sideways scroll.
 */
public class RobotInputDevice implements InputDevice {

    private static final Logger log = LoggerFactory.getLogger(RobotInputDevice.class);

    /** The subset of {@link Robot} this device needs; replaced by a fake in tests. */
    interface RobotFacade {
        void mouseMove(int x, int y);
        void mousePress(int buttonMask);
        void mouseRelease(int buttonMask);
        void mouseWheel(int notches);
        void keyPress(int keyCode);
        void keyRelease(int keyCode);
    }

    static final class AwtRobotFacade implements RobotFacade {
        private final Robot robot;

        AwtRobotFacade() throws AWTException {
            this.robot = new Robot();
            this.robot.setAutoDelay(0);
        }

        @Override public void mouseMove(int x, int y)      { robot.mouseMove(x, y); }
        @Override public void mousePress(int buttonMask)   { robot.mousePress(buttonMask); }
        @Override public void mouseRelease(int buttonMask) { robot.mouseRelease(buttonMask); }
        @Override public void mouseWheel(int notches)      { robot.mouseWheel(notches); }
        @Override public void keyPress(int keyCode)        { robot.keyPress(keyCode); }
        @Override public void keyRelease(int keyCode)      { robot.keyRelease(keyCode); }
    }

    private final RobotFacade robot;
    private final Supplier<Dimension> screenSize;

    /**
     * Creates a device driving the local display.
     *
     * @throws DeviceUnavailableException if the platform does not allow synthetic input
     *         (headless JVM, missing accessibility permission)
     */
    public RobotInputDevice() {
        this(createRobotFacade(), () -> Toolkit.getDefaultToolkit().getScreenSize());
    }

    // Package-private for tests
    RobotInputDevice(RobotFacade robot, Supplier<Dimension> screenSize) {
        this.robot = robot;
        this.screenSize = screenSize;
    }

    private static RobotFacade createRobotFacade() {
        try {
            return new AwtRobotFacade();
        } catch (AWTException | SecurityException | UnsupportedOperationException e) {
            throw new DeviceUnavailableException("Synthetic input is not available: " + e.getMessage(), e);
        }
    }

    // ── InputDevice ───────────────────────────────────────────────────────

    @Override
    public Dimension screenSize() {
        return screenSize.get();
    }

    @Override
    public void movePointer(int x, int y) {
        robot.mouseMove(x, y);
    }

    @Override
    public void pressButton(MouseButton button) {
        robot.mousePress(button.awtButtonMask());
    }

    @Override
    public void releaseButton(MouseButton button) {
        robot.mouseRelease(button.awtButtonMask());
    }

    @Override
    public void scroll(int horizontal, int vertical) {
        if (vertical != 0) {
            robot.mouseWheel(vertical);
        }
        if (horizontal != 0) {
            robot.keyPress(KeyEvent.VK_SHIFT);
            try {
                robot.mouseWheel(horizontal);
            } finally {
                robot.keyRelease(KeyEvent.VK_SHIFT);
            }
        }
        log.debug("Scrolled h={} v={}", horizontal, vertical);
    }

    @Override
    public void pressKey(Key key) {
        robot.keyPress(key.awtKeyCode());
    }

    @Override
    public void releaseKey(Key key) {
        robot.keyRelease(key.awtKeyCode());
    }
}
