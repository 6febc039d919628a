package macrorec.player;

import macrorec.model.ButtonEvent;
import macrorec.model.CursorPosition;
import macrorec.model.Key;
import macrorec.model.KeyPress;
import macrorec.model.MouseButton;
import macrorec.model.Snapshot;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Timing, state machine and cancellation tests for {@link Player}, run
 * against {@link FakeInputDevice}.
 */
public class PlayerTest {

    private FakeInputDevice device;
    private Player player;

    @BeforeMethod
    public void setUp() {
        device = new FakeInputDevice();
        player = new Player(device);
    }

    @AfterMethod(alwaysRun = true)
    public void tearDown() {
        try {
            if (player.isPlaying()) player.stop();
        } catch (IllegalStateException e) {
            // finished on its own
        }
    }

    // ── Argument and state misuse ─────────────────────────────────────────

    @Test(description = "Empty sequences and non-positive or NaN speeds are rejected")
    public void start_invalidArguments_throw() {
        assertThatThrownBy(() -> player.start(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> player.start(List.of(Snapshot.at(0, 1, 1)), 0.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> player.start(List.of(Snapshot.at(0, 1, 1)), -1.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> player.start(List.of(Snapshot.at(0, 1, 1)), Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(player.getState()).isEqualTo(PlayerState.IDLE);
    }

    @Test(description = "Starting while a playback is active fails")
    public void start_whilePlaying_throws() {
        player.start(span(0.0, 5.0));

        assertThatThrownBy(() -> player.start(span(0.0, 1.0)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already in progress");
    }

    @Test(description = "Pause, stop and wait fail when nothing is playing")
    public void idle_rejectsPauseStopAndWait() {
        assertThatThrownBy(() -> player.pause()).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> player.stop()).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> player.awaitCompletion()).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> player.awaitCompletion(Duration.ofMillis(10)))
                .isInstanceOf(IllegalStateException.class);
    }

    // ── Playback ──────────────────────────────────────────────────────────

    @Test(description = "A one-snapshot sequence executes once and returns to IDLE")
    public void singleSnapshot_executesOnce_withoutSleeping() throws InterruptedException {
        CountDownLatch done = new CountDownLatch(1);
        player.start(List.of(Snapshot.at(5.0, 7, 8)), 1.0, done::countDown);

        assertThat(done.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(device.actions()).containsExactly("move 7,8");
        assertThat(player.getState()).isEqualTo(PlayerState.IDLE);
        assertThat(player.getLastFailure()).isNull();
    }

    @Test(description = "Every snapshot executes in recorded order")
    public void allSnapshots_executeInOrder() throws InterruptedException {
        List<Snapshot> records = List.of(
                Snapshot.at(0.00, 1, 1),
                new Snapshot(0.01, new CursorPosition(2, 2), List.of(), new ButtonEvent(MouseButton.LEFT, true), null),
                new Snapshot(0.02, new CursorPosition(3, 3), List.of(), new ButtonEvent(MouseButton.LEFT, false), null));

        CountDownLatch done = new CountDownLatch(1);
        player.start(records, 1.0, done::countDown);
        assertThat(done.await(2, TimeUnit.SECONDS)).isTrue();

        assertThat(device.actions()).containsExactly(
                "move 1,1", "move 2,2", "press LEFT", "move 3,3", "release LEFT");
    }

    @Test(description = "A speed of 2.0 halves the recorded gap")
    public void speedMultiplier_dividesSleep() throws InterruptedException {
        player.start(span(0.0, 2.0), 2.0);
        assertThat(player.awaitCompletion(Duration.ofSeconds(5))).isTrue();

        long gap = device.timeOf("move 2,2", 0) - device.timeOf("move 1,1", 0);
        assertThat(TimeUnit.NANOSECONDS.toMillis(gap)).isBetween(950L, 1300L);
    }

    @Test(description = "A speed of 0.5 doubles the recorded gap")
    public void slowMotion_multipliesSleep() throws InterruptedException {
        player.start(span(0.0, 0.1), 0.5);
        assertThat(player.awaitCompletion(Duration.ofSeconds(5))).isTrue();

        long gap = device.timeOf("move 2,2", 0) - device.timeOf("move 1,1", 0);
        assertThat(TimeUnit.NANOSECONDS.toMillis(gap)).isBetween(190L, 450L);
    }

    @Test(description = "The completion callback runs once, after the state is IDLE")
    public void callback_runsExactlyOnce_afterReturningToIdle() throws InterruptedException {
        AtomicInteger calls = new AtomicInteger();
        List<PlayerState> seen = new ArrayList<>();
        CountDownLatch done = new CountDownLatch(1);

        player.start(span(0.0, 0.05), 1.0, () -> {
            calls.incrementAndGet();
            seen.add(player.getState());
            done.countDown();
        });

        assertThat(done.await(2, TimeUnit.SECONDS)).isTrue();
        Thread.sleep(50);
        assertThat(calls.get()).isEqualTo(1);
        assertThat(seen).containsExactly(PlayerState.IDLE);
    }

    // ── Cancellation ──────────────────────────────────────────────────────

    @Test(description = "Stop interrupts a long sleep and still applies the final snapshot")
    public void stop_duringLongSleep_returnsPromptly_andRunsFinalSnapshot() throws InterruptedException {
        List<Snapshot> records = List.of(
                Snapshot.at(0.0, 1, 1),
                Snapshot.at(30.0, 2, 2),
                new Snapshot(60.0, new CursorPosition(3, 3), List.of(new KeyPress(Key.ESCAPE, 59.0)),
                        new ButtonEvent(MouseButton.LEFT, false), null));
        AtomicInteger calls = new AtomicInteger();

        player.start(records, 1.0, calls::incrementAndGet);
        Thread.sleep(100);
        long before = System.nanoTime();
        player.stop();
        long stopMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - before);

        assertThat(stopMillis).isLessThan(1000L);
        assertThat(player.getState()).isEqualTo(PlayerState.IDLE);
        assertThat(device.actions()).containsExactly(
                "move 1,1", "move 3,3", "release LEFT", "keydown ESCAPE", "keyup ESCAPE");
        Thread.sleep(50);
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test(description = "Stop wakes a paused playback and applies the final snapshot")
    public void stop_whilePaused_wakesThread_andRunsFinalSnapshot() throws InterruptedException {
        player.start(span(0.0, 0.2), 1.0);
        assertThat(player.pause()).isTrue();
        Thread.sleep(400);

        player.stop();

        assertThat(player.getState()).isEqualTo(PlayerState.IDLE);
        assertThat(device.actions()).last().isEqualTo("move 2,2");
    }

    @Test(description = "Pause holds back the next snapshot until resumed")
    public void pause_blocksNextSnapshot_untilResumed() throws InterruptedException {
        player.start(List.of(Snapshot.at(0.0, 1, 1), Snapshot.at(0.05, 2, 2), Snapshot.at(0.1, 3, 3)));
        assertThat(player.pause()).isTrue();
        assertThat(player.isPaused()).isTrue();

        Thread.sleep(400);
        List<String> whilePaused = device.actions();
        assertThat(whilePaused).doesNotContain("move 3,3");
        assertThat(player.isPlaying()).isTrue();

        assertThat(player.pause()).isFalse();
        assertThat(player.awaitCompletion(Duration.ofSeconds(2))).isTrue();
        assertThat(device.actions()).containsExactly("move 1,1", "move 2,2", "move 3,3");
    }

    @Test(description = "Pausing during the last interval holds back the final snapshot")
    public void pause_duringLastInterval_holdsFinalSnapshot() throws InterruptedException {
        CountDownLatch done = new CountDownLatch(1);
        player.start(List.of(Snapshot.at(0.0, 1, 1), Snapshot.at(0.3, 2, 2)), 1.0, done::countDown);
        Thread.sleep(100);
        assertThat(player.pause()).isTrue();

        Thread.sleep(600);
        assertThat(device.actions()).containsExactly("move 1,1");
        assertThat(player.getState()).isEqualTo(PlayerState.PAUSED);
        assertThat(done.getCount()).isEqualTo(1);

        assertThat(player.pause()).isFalse();
        assertThat(done.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(device.actions()).containsExactly("move 1,1", "move 2,2");
        assertThat(player.getState()).isEqualTo(PlayerState.IDLE);
    }

    @Test(description = "Bounded wait returns false while playback continues")
    public void awaitCompletion_timesOut_whileStillPlaying() throws InterruptedException {
        player.start(span(0.0, 10.0));

        assertThat(player.awaitCompletion(Duration.ofMillis(50))).isFalse();
        assertThat(player.isPlaying()).isTrue();
    }

    @Test(description = "Interrupting the playback thread acts as a stop")
    public void interruptingPlaybackThread_actsAsStop() throws InterruptedException {
        CountDownLatch done = new CountDownLatch(1);
        player.start(span(0.0, 30.0), 1.0, done::countDown);
        Thread.sleep(100);
        Thread playback = Thread.getAllStackTraces().keySet().stream()
                .filter(t -> t.getName().startsWith("player-"))
                .findFirst().orElseThrow();

        playback.interrupt();

        assertThat(done.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(device.actions()).containsExactly("move 1,1", "move 2,2");
    }

    // ── Failures ──────────────────────────────────────────────────────────

    @Test(description = "A data error aborts playback and is kept as the last failure")
    public void dataError_abortsPlayback_andIsReported() throws InterruptedException {
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch done = new CountDownLatch(1);
        List<Snapshot> records = List.of(
                Snapshot.at(0.0, 1, 1),
                Snapshot.at(0.01, 5000, 1),
                Snapshot.at(0.02, 3, 3));

        player.start(records, 1.0, () -> { calls.incrementAndGet(); done.countDown(); });

        assertThat(done.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(player.getLastFailure()).isInstanceOf(PointerOutOfBoundsException.class);
        assertThat(device.actions()).containsExactly("move 1,1");
        assertThat(player.getState()).isEqualTo(PlayerState.IDLE);
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test(description = "A finished player can start a new playback")
    public void player_isReusable_afterCompletion() throws InterruptedException {
        CountDownLatch first = new CountDownLatch(1);
        player.start(List.of(Snapshot.at(0.0, 1, 1)), 1.0, first::countDown);
        assertThat(first.await(2, TimeUnit.SECONDS)).isTrue();

        CountDownLatch second = new CountDownLatch(1);
        player.start(List.of(Snapshot.at(0.0, 4, 4)), 1.0, second::countDown);
        assertThat(second.await(2, TimeUnit.SECONDS)).isTrue();

        assertThat(device.actions()).containsExactly("move 1,1", "move 4,4");
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private static List<Snapshot> span(double from, double to) {
        return List.of(Snapshot.at(from, 1, 1), Snapshot.at(to, 2, 2));
    }
}
