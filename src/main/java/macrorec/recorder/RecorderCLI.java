package macrorec.recorder;

import macrorec.model.RecordingIO;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * PicoCLI entry-point for the recorder subsystem.
 *
 * <p>Sub-commands:
 * <ul>
 *   <li>{@code record start} records mouse and keyboard for a number of minutes
 *       and saves the result as JSON. Ctrl+C or {@code record stop} ends it early.</li>
 *   <li>{@code record stop} removes the sentinel lock file the running recorder watches.</li>
 *   <li>{@code record list} lists recordings in a directory with snapshot counts.</li>
 * </ul>
 *
 * <p>This class is wired into {@code macrorec.cli.MacroCLI} as a sub-command.
 */
@Command(
        name        = "record",
        description = "Record mouse and keyboard activity",
        mixinStandardHelpOptions = true,
        subcommands = {
                RecorderCLI.StartCommand.class,
                RecorderCLI.StopCommand.class,
                RecorderCLI.ListCommand.class
        }
)
public class RecorderCLI implements Callable<Integer> {

    static final String LOCK_FILE_NAME = ".macrorec-recording.lock";

    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        // No sub-command selected, print usage.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    /** {@code <dir>/<prefix>-<yyyyMMdd-HHmmss>.json} */
    static Path outputFile(RecorderConfig config, LocalDateTime startedAt) {
        return Path.of(config.getOutputDir())
                .resolve(config.getSessionPrefix() + "-" + FILE_STAMP.format(startedAt) + ".json");
    }

    // ── Sub-commands ──────────────────────────────────────────────────────

    /**
     * Records for the given number of minutes, then saves. A shutdown hook
     * stops the recorder and saves best-effort when the process is interrupted.
     */
    @Command(
            name        = "start",
            description = "Start recording (Ctrl+C or 'record stop' to finish early)",
            mixinStandardHelpOptions = true
    )
    static class StartCommand implements Callable<Integer> {

        private static final Logger log = LoggerFactory.getLogger(StartCommand.class);

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", paramLabel = "DURATION", description = "Length of the recording in minutes")
        int durationMinutes;

        @Option(names = {"-r", "--rate-hz"}, description = "Snapshots per second (default: from config, 100)")
        Integer rateHz;

        @Option(names = {"-d", "--start-delay-sec"}, description = "Seconds to wait before recording (default: 0)")
        Integer startDelaySec;

        @Option(names = {"-o", "--output"}, description = "Directory for saved recordings (default: recordings)")
        String outputDir;

        @Option(names = {"--name"}, description = "Recording file prefix (default: recording)")
        String sessionName;

        @Override
        public Integer call() throws Exception {
            RecorderConfig config = new RecorderConfig();
            applyOverrides(config);

            PrintWriter out = spec.commandLine().getOut();
            Path outFile = outputFile(config, LocalDateTime.now());
            Path lockFile = Path.of(config.getOutputDir()).resolve(LOCK_FILE_NAME);

            if (config.getStartDelaySec() > 0) {
                out.printf("Recording starts in %d second(s)...%n", config.getStartDelaySec());
                out.flush();
                TimeUnit.SECONDS.sleep(config.getStartDelaySec());
            }

            // Sentinel lock file so 'record stop' can signal graceful shutdown
            Files.createDirectories(lockFile.getParent());
            Files.writeString(lockFile, String.valueOf(ProcessHandle.current().pid()));

            Recorder recorder = new Recorder();
            AtomicBoolean finished = new AtomicBoolean(false);

            Thread hook = new Thread(() -> {
                if (finished.getAndSet(true)) return;
                out.println();
                out.println("Recording interrupted, saving what was captured...");
                finish(recorder, outFile, lockFile, out);
            }, "recorder-shutdown");
            Runtime.getRuntime().addShutdownHook(hook);

            recorder.start(config.getRateHz());
            out.printf("Recording started for %d minute(s). Press Ctrl+C or run 'macrorec record stop' to finish early.%n",
                    durationMinutes);
            out.printf("  Rate       : %d Hz%n", config.getRateHz());
            out.printf("  Output     : %s%n", outFile.toAbsolutePath());
            out.printf("  Lock file  : %s%n", lockFile.toAbsolutePath());
            out.flush();

            long deadline = System.nanoTime() + TimeUnit.MINUTES.toNanos(durationMinutes);
            while (Files.exists(lockFile)) {
                long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remainingMs <= 0) break;
                Thread.sleep(Math.min(500L, remainingMs));
            }
            if (!Files.exists(lockFile)) {
                log.info("Sentinel lock file removed; stopping recording");
            }

            if (finished.getAndSet(true)) return 0;
            Runtime.getRuntime().removeShutdownHook(hook);
            return finish(recorder, outFile, lockFile, out) ? 0 : 1;
        }

        private void applyOverrides(RecorderConfig config) {
            if (durationMinutes <= 0) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                        "duration must be a positive integer, got " + durationMinutes);
            }
            if (rateHz != null) {
                if (rateHz <= 0) {
                    throw new CommandLine.ParameterException(spec.commandLine(),
                            "rate-hz must be a positive integer, got " + rateHz);
                }
                config.setRateHz(rateHz);
            }
            if (startDelaySec != null) {
                if (startDelaySec < 0) {
                    throw new CommandLine.ParameterException(spec.commandLine(),
                            "start-delay-sec must be >= 0, got " + startDelaySec);
                }
                config.setStartDelaySec(startDelaySec);
            }
            if (outputDir != null && !outputDir.isBlank()) config.setOutputDir(outputDir);
            if (sessionName != null && !sessionName.isBlank()) config.setSessionPrefix(sessionName);
        }

        /** Stops and saves; returns false if nothing could be saved. */
        private static boolean finish(Recorder recorder, Path outFile, Path lockFile, PrintWriter out) {
            boolean saved = false;
            try {
                if (recorder.isRecording()) {
                    try {
                        recorder.stop();
                    } catch (CaptureException e) {
                        // snapshots taken before the failure are still saved
                        out.println("Capture failed: " + e.getMessage());
                        log.error("Capture thread failed", e);
                    }
                }
                recorder.save(outFile);
                out.println("Recording saved: " + outFile.toAbsolutePath());
                saved = true;
            } catch (IllegalStateException e) {
                out.println("Recording stopped, nothing saved: " + e.getMessage());
            } catch (IOException e) {
                out.println("Error saving recording: " + e.getMessage());
                log.error("Failed to finish recording", e);
            } finally {
                try {
                    Files.deleteIfExists(lockFile);
                } catch (IOException e) {
                    log.warn("Could not remove lock file {}: {}", lockFile, e.getMessage());
                }
                out.flush();
            }
            return saved;
        }
    }

    /**
     * Stops an active recording by deleting the sentinel lock file.
     *
     * <p>The running {@code record start} process polls for the lock file and
     * saves when it disappears. No POSIX signals required.
     */
    @Command(
            name        = "stop",
            description = "Stop an active recording by removing the sentinel lock file",
            mixinStandardHelpOptions = true
    )
    static class StopCommand implements Callable<Integer> {

        @Spec
        CommandSpec spec;

        @Option(
                names       = {"-d", "--dir"},
                description = "Recordings directory (default: recordings)",
                defaultValue = "recordings"
        )
        String dir;

        @Override
        public Integer call() throws Exception {
            PrintWriter out = spec.commandLine().getOut();
            Path lockFile = Path.of(dir, LOCK_FILE_NAME);
            if (Files.deleteIfExists(lockFile)) {
                out.println("Stop signal sent. The recording will be saved automatically.");
                out.println("(Lock file removed: " + lockFile.toAbsolutePath() + ")");
                return 0;
            }
            out.println("No active recording lock file found at: " + lockFile.toAbsolutePath());
            return 1;
        }
    }

    /**
     * Lists all {@code .json} recording files in a directory with snapshot
     * count and recorded duration.
     */
    @Command(
            name        = "list",
            description = "List saved recordings with snapshot counts and durations",
            mixinStandardHelpOptions = true
    )
    static class ListCommand implements Callable<Integer> {

        private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

        @Spec
        CommandSpec spec;

        @Option(
                names       = {"-d", "--dir"},
                description = "Recordings directory to list (default: recordings)",
                defaultValue = "recordings"
        )
        String dir;

        @Override
        public Integer call() throws Exception {
            PrintWriter out = spec.commandLine().getOut();
            Path recordingsDir = Path.of(dir);
            if (!Files.isDirectory(recordingsDir)) {
                out.println("No recordings directory found: " + recordingsDir.toAbsolutePath());
                return 1;
            }

            List<Path> files;
            try (Stream<Path> listing = Files.list(recordingsDir)) {
                files = listing.filter(p -> p.getFileName().toString().endsWith(".json"))
                        .sorted()
                        .collect(Collectors.toList());
            }
            if (files.isEmpty()) {
                out.println("No recordings found in: " + recordingsDir.toAbsolutePath());
                return 0;
            }

            out.printf("%-44s %10s %12s%n", "File", "Snapshots", "Duration(s)");
            out.println("-".repeat(68));
            long snapshots = 0;
            for (Path p : files) {
                try {
                    RecordingIO.Summary summary = RecordingIO.summarize(p);
                    out.printf(Locale.ROOT, "%-44s %10d %12.2f%n", p.getFileName(), summary.snapshotCount(),
                            summary.durationSeconds());
                    snapshots += summary.snapshotCount();
                } catch (IOException | RuntimeException e) {
                    log.debug("Could not read recording {}: {}", p, e.getMessage());
                    out.printf("%-44s %10s %12s%n", p.getFileName(), "ERROR", "-");
                }
            }
            out.println("-".repeat(68));
            out.printf("%-44s %10d%n", files.size() + " file(s) total", snapshots);
            return 0;
        }
    }
}
