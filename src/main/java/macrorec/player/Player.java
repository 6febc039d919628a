package macrorec.player;

import macrorec.device.InputDevice;
import macrorec.model.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Replays a recorded {@link Snapshot} sequence on an {@link InputDevice},
 * reproducing the relative timing between snapshots, optionally scaled.
 *
 * <h3>Typical usage</h3>
 * <pre>{@code
 * Player player = new Player(new RobotInputDevice());
 * player.start(RecordingIO.read(path), 2.0, () -> log.info("done"));
 * player.awaitCompletion();
 * }</pre>
 *
 * <p>For each adjacent pair the earlier snapshot is executed, then the thread
 * sleeps {@code (next.timestamp - previous.timestamp) / speed} seconds. The last
 * snapshot is always executed once, including after {@link #stop()}, so the
 * devices end in the recorded end state.
 *
 * <p>State: {@code IDLE -> PLAYING} on start, {@code PLAYING <-> PAUSED} on
 * {@link #pause()}, back to {@code IDLE} when the playback thread exits.
 */
public class Player {

    private static final Logger log = LoggerFactory.getLogger(Player.class);

    private final InputDevice device;

    private final ReentrantLock lock = new ReentrantLock();
    /** Signalled on pause toggle, stop, and playback completion. */
    private final Condition changed = lock.newCondition();

    // guarded by lock
    private PlayerState state = PlayerState.IDLE;
    private boolean stopRequested;
    private Thread playbackThread;
    private long generation;
    private Throwable lastFailure;

    public Player(InputDevice device) {
        this.device = device;
    }

    // ── Public API ────────────────────────────────────────────────────────

    /** Plays at recorded speed without a completion callback. */
    public void start(List<Snapshot> records) {
        start(records, 1.0, null);
    }

    public void start(List<Snapshot> records, double speed) {
        start(records, speed, null);
    }

    /**
     * Begins asynchronous playback on a dedicated thread.
     *
     * @param records    snapshots in recorded order; copied before playback
     * @param speed      positive multiplier; sleeps are divided by it
     * @param onComplete run exactly once when playback ends for any reason; may be null
     * @throws IllegalArgumentException if {@code records} is empty or {@code speed} is not positive
     * @throws IllegalStateException    if a playback is already in progress
     */
    public void start(List<Snapshot> records, double speed, Runnable onComplete) {
        if (records == null || records.isEmpty()) {
            throw new IllegalArgumentException("nothing to play: snapshot sequence is empty");
        }
        if (!(speed > 0) || Double.isInfinite(speed)) {
            throw new IllegalArgumentException("speed multiplier must be a positive number, got " + speed);
        }
        List<Snapshot> snapshots = List.copyOf(records);

        lock.lock();
        try {
            if (state != PlayerState.IDLE) {
                throw new IllegalStateException("playback already in progress");
            }
            state = PlayerState.PLAYING;
            stopRequested = false;
            lastFailure = null;
            long run = ++generation;
            Thread thread = new Thread(() -> run(snapshots, speed, onComplete, run), "player-" + run);
            thread.setDaemon(true);
            playbackThread = thread;
            thread.start();
        } finally {
            lock.unlock();
        }
        log.info("Playback started: {} snapshot(s) at {}x", snapshots.size(), speed);
    }

    /**
     * Toggles pause. A pausing playback blocks before executing its next snapshot.
     *
     * @return {@code true} if playback is now paused, {@code false} if resumed
     * @throws IllegalStateException if no playback is active
     */
    public boolean pause() {
        lock.lock();
        try {
            switch (state) {
                case PLAYING -> state = PlayerState.PAUSED;
                case PAUSED  -> state = PlayerState.PLAYING;
                default      -> throw new IllegalStateException("pause called but no playback is active");
            }
            changed.signalAll();
            log.info("Playback {}", state == PlayerState.PAUSED ? "paused" : "resumed");
            return state == PlayerState.PAUSED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Requests cancellation and waits for the playback thread to finish. The final
     * snapshot is still executed before the thread exits. Does not wait when
     * called on the playback thread itself.
     *
     * @throws IllegalStateException if no playback is active
     */
    public void stop() {
        Thread thread;
        lock.lock();
        try {
            if (state == PlayerState.IDLE) {
                throw new IllegalStateException("stop called but no playback is active");
            }
            stopRequested = true;
            changed.signalAll();
            thread = playbackThread;
        } finally {
            lock.unlock();
        }
        log.info("Playback stop requested");
        if (thread != null && thread != Thread.currentThread()) {
            joinUninterruptibly(thread);
        }
    }

    /**
     * Blocks until the current playback completes, naturally or by {@link #stop()}.
     *
     * @throws IllegalStateException if no playback is active
     * @throws InterruptedException  if the caller is interrupted while waiting
     */
    public void awaitCompletion() throws InterruptedException {
        lock.lock();
        try {
            long run = requireActive();
            while (state != PlayerState.IDLE && generation == run) {
                changed.await();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Bounded variant of {@link #awaitCompletion()}.
     *
     * @return {@code true} if playback completed within the timeout
     */
    public boolean awaitCompletion(Duration timeout) throws InterruptedException {
        lock.lock();
        try {
            long run = requireActive();
            long remaining = timeout.toNanos();
            while (state != PlayerState.IDLE && generation == run) {
                if (remaining <= 0) return false;
                remaining = changed.awaitNanos(remaining);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    public PlayerState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /** True while a playback is active, paused or not. */
    public boolean isPlaying() {
        return getState() != PlayerState.IDLE;
    }

    public boolean isPaused() {
        return getState() == PlayerState.PAUSED;
    }

    /** The error that aborted the most recent playback, or {@code null} if it ran to its end. */
    public Throwable getLastFailure() {
        lock.lock();
        try {
            return lastFailure;
        } finally {
            lock.unlock();
        }
    }

    // ── Playback thread ───────────────────────────────────────────────────

    private void run(List<Snapshot> snapshots, double speed, Runnable onComplete, long run) {
        SnapshotExecutor executor = new SnapshotExecutor(device);
        Throwable failure = null;
        try {
            for (int i = 0; i + 1 < snapshots.size(); i++) {
                if (!awaitResumeUnlessStopped()) break;
                Snapshot previous = snapshots.get(i);
                Snapshot next = snapshots.get(i + 1);
                executor.execute(previous);
                double delaySec = (next.getTimestamp() - previous.getTimestamp()) / speed;
                if (!sleepUnlessStopped(Math.max(0L, (long) (delaySec * 1_000_000_000L)))) break;
            }
            // a pause still holds back the final snapshot; a stop does not skip it
            awaitResumeUnlessStopped();
            executor.execute(snapshots.get(snapshots.size() - 1));
        } catch (RuntimeException e) {
            failure = e;
            log.error("Playback aborted: {}", e.getMessage());
        } finally {
            lock.lock();
            try {
                lastFailure = failure;
                if (generation == run) {
                    state = PlayerState.IDLE;
                    playbackThread = null;
                }
                changed.signalAll();
            } finally {
                lock.unlock();
            }
        }
        log.info("Playback finished{}", failure == null ? "" : " with error");
        if (onComplete != null) {
            try {
                onComplete.run();
            } catch (RuntimeException e) {
                log.warn("Completion callback failed: {}", e.getMessage(), e);
            }
        }
    }

    /**
     * Blocks while paused.
     *
     * @return {@code false} if a stop was requested
     */
    private boolean awaitResumeUnlessStopped() {
        lock.lock();
        try {
            while (state == PlayerState.PAUSED && !stopRequested) {
                try {
                    changed.await();
                } catch (InterruptedException e) {
                    stopRequested = true;
                }
            }
            return !stopRequested;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sleeps for the given time unless a stop arrives first.
     *
     * @return {@code false} if a stop was requested
     */
    private boolean sleepUnlessStopped(long nanos) {
        lock.lock();
        try {
            long remaining = nanos;
            while (remaining > 0 && !stopRequested) {
                try {
                    remaining = changed.awaitNanos(remaining);
                } catch (InterruptedException e) {
                    stopRequested = true;
                }
            }
            return !stopRequested;
        } finally {
            lock.unlock();
        }
    }

    private long requireActive() {
        if (state == PlayerState.IDLE) {
            throw new IllegalStateException("wait called but no playback is active");
        }
        return generation;
    }

    private static void joinUninterruptibly(Thread thread) {
        boolean interrupted = false;
        while (true) {
            try {
                thread.join();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) Thread.currentThread().interrupt();
    }
}
