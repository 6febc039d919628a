package macrorec.recorder;

import macrorec.model.ButtonEvent;
import macrorec.model.Key;
import macrorec.model.KeyPress;
import macrorec.model.MouseButton;
import macrorec.model.RecordingIO;
import macrorec.model.ScrollDelta;
import macrorec.model.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Records mouse and keyboard activity as a sequence of {@link Snapshot}s taken
 * at a fixed sampling rate.
 *
 * <h3>Typical usage</h3>
 * <pre>{@code
 * Recorder recorder = new Recorder();
 * recorder.start(100);
 * // user interacts with the desktop ...
 * recorder.stop();
 * recorder.save(Path.of("recordings/demo.json"));
 * }</pre>
 *
 * <p>Each {@link #start(int)} creates a fresh capture session with three
 * threads: a key listener and a mouse listener that register with the
 * {@link InputCaptureAdapter} and then wait on the session's stop token, and a
 * sampler that drains the shared {@link SnapshotAccumulator} into the output
 * list once per interval. {@link #stop()} trips the token and joins all three
 * before returning, so the captured list is stable afterwards.
 *
 * <p>Data accumulated after the sampler's last tick is not flushed on stop.
 */
public class Recorder {

    private static final Logger log = LoggerFactory.getLogger(Recorder.class);

    private final InputCaptureAdapter capture;
    private final Clock clock;

    /** Serializes start / stop / reads so a new session never overlaps a closing one. */
    private final Object lifecycleLock = new Object();
    private final AtomicBoolean recording = new AtomicBoolean(false);

    private CaptureSession session;          // guarded by lifecycleLock
    private List<Snapshot> records = List.of(); // guarded by lifecycleLock

    // ── Construction ──────────────────────────────────────────────────────

    /** Creates a recorder backed by the JNativeHook global hook. */
    public Recorder() {
        this(new OSInputCapture());
    }

    public Recorder(InputCaptureAdapter capture) {
        this(capture, Clock.systemUTC());
    }

    /** Package-private constructor for tests, accepts a fixed or stepping clock. */
    Recorder(InputCaptureAdapter capture, Clock clock) {
        this.capture = capture;
        this.clock = clock;
    }

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * Begins capture. Returns once the key and mouse listeners are registered,
     * so input arriving after this call is captured.
     *
     * @param rateHz snapshots per second, must be positive
     * @throws IllegalStateException if a recording is already in progress
     * @throws CaptureException      if the input hook cannot be installed
     */
    public void start(int rateHz) {
        if (rateHz <= 0) {
            throw new IllegalArgumentException("rate_hz must be a positive integer, got " + rateHz);
        }
        synchronized (lifecycleLock) {
            if (recording.get()) {
                throw new IllegalStateException("recording already in progress");
            }
            capture.start();
            records = List.of();
            session = new CaptureSession(TimeUnit.SECONDS.toNanos(1) / rateHz);
            recording.set(true);
            session.launch();
            session.awaitListeners();
        }
        log.info("Recording started at {} Hz", rateHz);
    }

    /**
     * Stops the current recording and waits for all capture threads to finish.
     *
     * @throws IllegalStateException if no recording is in progress
     * @throws CaptureException      if a capture thread failed; the snapshots
     *                               taken before the failure are still kept
     */
    public void stop() {
        Throwable failure;
        int count;
        synchronized (lifecycleLock) {
            if (!recording.getAndSet(false)) {
                throw new IllegalStateException("stop called but a recording was never started");
            }
            CaptureSession ending = session;
            session = null;

            ending.stopSignal.countDown();
            failure = ending.join();
            capture.stop();

            records = List.copyOf(ending.records);
            count = records.size();
            int stillHeld = ending.activeKeys.heldKeys().size();
            if (stillHeld > 0) {
                log.debug("{} key(s) still held at stop were not recorded", stillHeld);
            }
        }
        log.info("Recording stopped, {} snapshot(s) captured", count);
        if (failure != null) {
            throw new CaptureException("Capture thread failed: " + failure.getMessage(), failure);
        }
    }

    /** Point-in-time recording status; never blocks on a stop in progress. */
    public boolean isRecording() {
        return recording.get();
    }

    /**
     * Returns the snapshots of the last completed recording.
     *
     * @throws IllegalStateException if a recording is in progress
     */
    public List<Snapshot> getRecords() {
        synchronized (lifecycleLock) {
            if (recording.get()) {
                throw new IllegalStateException("failed to read records, recording in progress");
            }
            return records;
        }
    }

    /**
     * Saves the last completed recording to a JSON file.
     *
     * @throws IllegalStateException if a recording is in progress or nothing was recorded
     * @throws IOException           if the file cannot be written
     */
    public void save(Path path) throws IOException {
        List<Snapshot> snapshots;
        synchronized (lifecycleLock) {
            if (recording.get()) {
                throw new IllegalStateException("failed to save, recording in progress");
            }
            snapshots = records;
        }
        if (snapshots.isEmpty()) {
            throw new IllegalStateException("failed to save, no data has been recorded");
        }
        RecordingIO.write(snapshots, path);
    }

    // ── Internal helpers ──────────────────────────────────────────────────

    private double nowSeconds() {
        Instant now = clock.instant();
        return now.getEpochSecond() + now.getNano() / 1_000_000_000.0;
    }

    /**
     * One recording session: its own stop token, accumulator, key buffer,
     * output list and threads. Discarded after {@link Recorder#stop()}.
     */
    private final class CaptureSession implements KeyEventListener, MouseEventListener {

        final long periodNanos;
        final CountDownLatch stopSignal = new CountDownLatch(1);
        /** Counted down by each listener worker once its listener is registered (or failed to be). */
        final CountDownLatch listenersReady = new CountDownLatch(2);
        final SnapshotAccumulator accumulator = new SnapshotAccumulator();
        final ActiveKeyBuffer activeKeys = new ActiveKeyBuffer();

        /** Written by the sampler thread only; read after join. */
        final List<Snapshot> records = new ArrayList<>();

        private final List<FutureTask<Void>> tasks = new ArrayList<>();
        private final List<Thread> threads = new ArrayList<>();
        private double lastTimestamp = Double.NEGATIVE_INFINITY;

        CaptureSession(long periodNanos) {
            this.periodNanos = periodNanos;
        }

        void launch() {
            spawn("recorder-keys", this::runKeyListener);
            spawn("recorder-mouse", this::runMouseListener);
            spawn("recorder-sampler", this::runSampler);
        }

        private void spawn(String name, Callable<Void> body) {
            FutureTask<Void> task = new FutureTask<>(body);
            Thread thread = new Thread(task, name);
            thread.setDaemon(true);
            tasks.add(task);
            threads.add(thread);
            thread.start();
        }

        /** Blocks until both listener workers have registered, even if the caller is interrupted. */
        void awaitListeners() {
            boolean interrupted = false;
            while (true) {
                try {
                    listenersReady.await();
                    break;
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
            if (interrupted) Thread.currentThread().interrupt();
        }

        /**
         * Waits for every thread to finish, even if the caller is interrupted.
         *
         * @return the first worker failure, or {@code null}
         */
        Throwable join() {
            Throwable failure = null;
            boolean interrupted = false;
            for (int i = 0; i < tasks.size(); i++) {
                while (true) {
                    try {
                        tasks.get(i).get();
                        threads.get(i).join();
                        break;
                    } catch (InterruptedException e) {
                        interrupted = true;
                    } catch (ExecutionException e) {
                        if (failure == null) failure = e.getCause();
                        else failure.addSuppressed(e.getCause());
                        break;
                    }
                }
            }
            if (interrupted) Thread.currentThread().interrupt();
            return failure;
        }

        // ── Workers ──────────────────────────────────────────────────────

        private Void runKeyListener() throws InterruptedException {
            try {
                capture.addKeyListener(this);
            } finally {
                listenersReady.countDown();
            }
            try {
                stopSignal.await();
            } finally {
                capture.removeKeyListener(this);
            }
            return null;
        }

        private Void runMouseListener() throws InterruptedException {
            try {
                capture.addMouseListener(this);
            } finally {
                listenersReady.countDown();
            }
            try {
                stopSignal.await();
            } finally {
                capture.removeMouseListener(this);
            }
            return null;
        }

        /** Fixed-rate loop: tick n is due at start + n * period; late ticks run immediately. */
        private Void runSampler() throws InterruptedException {
            long deadline = System.nanoTime();
            while (recording.get()) {
                tick();
                deadline += periodNanos;
                long waitNanos = Math.max(0L, deadline - System.nanoTime());
                if (stopSignal.await(waitNanos, TimeUnit.NANOSECONDS)) {
                    break;
                }
            }
            return null;
        }

        private void tick() {
            double timestamp = nowSeconds();
            if (timestamp <= lastTimestamp) {
                timestamp = Math.nextUp(lastTimestamp);
            }
            lastTimestamp = timestamp;
            Snapshot snapshot = accumulator.drain(timestamp, capture.pointerPosition());
            records.add(snapshot);
            if (log.isTraceEnabled()) log.trace("Sampled {}", snapshot);
        }

        // ── Listener callbacks (capture backend thread) ──────────────────

        @Override
        public void keyPressed(Key key) {
            if (key == Key.UNKNOWN) {
                log.debug("Ignoring press of unmapped key");
                return;
            }
            activeKeys.press(key, nowSeconds());
        }

        @Override
        public void keyReleased(Key key) {
            List<KeyPress> chord = activeKeys.release(key);
            if (!chord.isEmpty()) {
                accumulator.stageKeys(chord);
            }
        }

        @Override
        public void buttonChanged(MouseButton button, boolean pressed) {
            if (button == MouseButton.UNKNOWN) {
                log.debug("Ignoring unmapped mouse button ({})", pressed ? "press" : "release");
                return;
            }
            accumulator.recordButton(new ButtonEvent(button, pressed));
        }

        @Override
        public void scrolled(int horizontal, int vertical) {
            if (vertical != 0) accumulator.recordScroll(ScrollDelta.vertical(vertical));
            if (horizontal != 0) accumulator.recordScroll(ScrollDelta.horizontal(horizontal));
        }
    }
}
