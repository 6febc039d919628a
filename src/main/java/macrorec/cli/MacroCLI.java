package macrorec.cli;

import macrorec.device.DeviceUnavailableException;
import macrorec.device.RobotInputDevice;
import macrorec.model.RecordingIO;
import macrorec.model.Snapshot;
import macrorec.player.Player;
import macrorec.player.PlayerConfig;
import macrorec.recorder.RecorderCLI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

/**
 * Unified CLI entry-point for macrorec.
 *
 * <p>Sub-commands:
 * <ul>
 *   <li>{@code macrorec record}  record mouse and keyboard (delegates to RecorderCLI)</li>
 *   <li>{@code macrorec play}    replay a saved recording</li>
 *   <li>{@code macrorec version} print build version</li>
 * </ul>
 *
 * <p>Main class wired into the fat-JAR manifest by maven-shade-plugin.
 */
@Command(
        name        = "macrorec",
        description = "Mouse and keyboard macro recorder and player",
        version     = MacroCLI.VERSION,
        mixinStandardHelpOptions = true,
        subcommands = {
                RecorderCLI.class,
                MacroCLI.PlayCommand.class,
                MacroCLI.VersionCommand.class
        }
)
public class MacroCLI implements Callable<Integer> {

    static final String VERSION = "1.0.0-SNAPSHOT";

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    // ── Entry-point ─────────────────────────────────────────────────────────

    public static void main(String[] args) {
        int exit = new CommandLine(new MacroCLI()).execute(args);
        System.exit(exit);
    }

    // ── Sub-commands ─────────────────────────────────────────────────────────

    /**
     * Replays a saved recording on the local display. Ctrl+C stops the player;
     * the last snapshot is still applied so no key or button is left held.
     */
    @Command(
            name        = "play",
            description = "Replay a saved recording",
            mixinStandardHelpOptions = true
    )
    static class PlayCommand implements Callable<Integer> {

        private static final Logger log = LoggerFactory.getLogger(PlayCommand.class);

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Path to recording JSON file")
        Path recordingFile;

        @Option(
                names       = {"-s", "--speed"},
                description = "Playback speed multiplier, e.g. 0.5 for half speed (default: from config, 1.0)"
        )
        Double speed;

        @Override
        public Integer call() throws Exception {
            PrintWriter out = spec.commandLine().getOut();
            PrintWriter err = spec.commandLine().getErr();

            double multiplier = speed != null ? speed : new PlayerConfig().getSpeed();
            if (!(multiplier > 0) || Double.isInfinite(multiplier)) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                        "speed must be a positive number, got " + multiplier);
            }
            if (!Files.exists(recordingFile)) {
                err.println("Recording file not found: " + recordingFile.toAbsolutePath());
                return 1;
            }

            List<Snapshot> records;
            try {
                records = RecordingIO.read(recordingFile);
            } catch (RecordingIO.RecordingDecodeException | RecordingIO.InvalidRecordingException e) {
                err.println("error: " + e.getMessage());
                return 1;
            }
            if (records.isEmpty()) {
                err.println("Recording contains no snapshots: " + recordingFile.toAbsolutePath());
                return 1;
            }

            Player player;
            try {
                player = new Player(new RobotInputDevice());
            } catch (DeviceUnavailableException e) {
                err.println("error: " + e.getMessage());
                return 1;
            }

            out.println("Loading recording: " + recordingFile.toAbsolutePath());
            out.printf("  Snapshots : %d%n", records.size());
            out.printf("  Speed     : %.2fx%n", multiplier);
            out.flush();

            Thread hook = new Thread(() -> {
                if (player.isPlaying()) {
                    log.info("Interrupted; stopping playback");
                    try {
                        player.stop();
                    } catch (IllegalStateException e) {
                        // finished between the check and the stop
                        log.debug("Playback already finished");
                    }
                }
            }, "player-shutdown");
            Runtime.getRuntime().addShutdownHook(hook);

            CountDownLatch done = new CountDownLatch(1);
            player.start(records, multiplier, done::countDown);
            done.await();
            Runtime.getRuntime().removeShutdownHook(hook);

            Throwable failure = player.getLastFailure();
            if (failure != null) {
                err.println("Playback FAILED: " + failure.getMessage());
                return 2;
            }
            out.println("Playback complete.");
            return 0;
        }
    }

    @Command(
            name        = "version",
            description = "Print version information"
    )
    static class VersionCommand implements Callable<Integer> {

        @Spec
        CommandSpec spec;

        @Override
        public Integer call() {
            PrintWriter out = spec.commandLine().getOut();
            out.println("macrorec " + VERSION);
            out.println("JNativeHook 2.2.2 | Jackson 2.17 | picocli 4.7");
            return 0;
        }
    }
}
