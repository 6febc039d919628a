package macrorec.cli;

import macrorec.model.RecordingIO;
import macrorec.model.Snapshot;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Command-line parsing and the commands that need no display or native hook.
 */
public class MacroCLITest {

    private Path dir;
    private StringWriter out;
    private StringWriter err;
    private CommandLine cli;

    @BeforeMethod
    public void setUp() throws IOException {
        dir = Files.createTempDirectory("macrorec-cli-");
        out = new StringWriter();
        err = new StringWriter();
        cli = new CommandLine(new MacroCLI());
        cli.setOut(new PrintWriter(out));
        cli.setErr(new PrintWriter(err));
    }

    @AfterMethod(alwaysRun = true)
    public void tearDown() throws IOException {
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
        }
    }

    @Test
    public void version_printsVersion() {
        assertThat(cli.execute("version")).isZero();
        assertThat(out.toString()).contains("macrorec 1.0.0-SNAPSHOT");
    }

    @Test
    public void noArguments_printsUsage() {
        assertThat(cli.execute()).isZero();
        assertThat(out.toString()).contains("record").contains("play");
    }

    @Test
    public void recordList_showsCountsAndDurations() throws IOException {
        RecordingIO.write(List.of(Snapshot.at(100.0, 1, 1), Snapshot.at(101.5, 2, 2)),
                dir.resolve("a-recording.json"));
        Files.writeString(dir.resolve("broken.json"), "not json");

        int exit = cli.execute("record", "list", "-d", dir.toString());

        assertThat(exit).isZero();
        assertThat(out.toString())
                .contains("a-recording.json")
                .contains("1.50")
                .contains("ERROR")
                .contains("2 file(s) total");
    }

    @Test
    public void recordList_missingDirectory_fails() {
        assertThat(cli.execute("record", "list", "-d", dir.resolve("absent").toString())).isEqualTo(1);
    }

    @Test
    public void recordStop_removesLockFile() throws IOException {
        Path lock = dir.resolve(".macrorec-recording.lock");
        Files.writeString(lock, "1234");

        assertThat(cli.execute("record", "stop", "-d", dir.toString())).isZero();
        assertThat(lock).doesNotExist();
        assertThat(cli.execute("record", "stop", "-d", dir.toString())).isEqualTo(1);
    }

    @Test
    public void recordStart_invalidArguments_areUsageErrors() {
        assertThat(cli.execute("record", "start", "0")).isEqualTo(2);
        assertThat(cli.execute("record", "start", "1", "-r", "0")).isEqualTo(2);
        assertThat(cli.execute("record", "start", "1", "-d", "-1")).isEqualTo(2);
        assertThat(cli.execute("record", "start", "soon")).isEqualTo(2);
    }

    @Test
    public void play_invalidSpeed_isUsageError() {
        assertThat(cli.execute("play", dir.resolve("x.json").toString(), "-s", "0")).isEqualTo(2);
    }

    @Test
    public void play_missingFile_fails() {
        assertThat(cli.execute("play", dir.resolve("absent.json").toString())).isEqualTo(1);
        assertThat(err.toString()).contains("not found");
    }

    @Test
    public void play_malformedFile_fails() throws IOException {
        Path file = dir.resolve("bad.json");
        Files.writeString(file, "{\"records\": 5}");

        assertThat(cli.execute("play", file.toString())).isEqualTo(1);
        assertThat(err.toString()).contains("error:");
    }
}
