package work.lcod.notegen.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import work.lcod.notegen.support.NotegenTestSupport;

class NotegenCommandTest {
    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        var commandLine = new CommandLine(new NotegenCommand())
            .setExecutionExceptionHandler(new ShortErrorHandler())
            .setOut(new PrintWriter(out))
            .setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    @Test
    void compilesAndPrintsResult() {
        int exit = run(
            "--template", NotegenTestSupport.progressNoteTemplate().toString(),
            "--source", NotegenTestSupport.progressNoteSource().toString(),
            "--fact-pack", NotegenTestSupport.progressNoteFacts().toString(),
            "--out", tempDir.toString(),
            "--timestamp", "2024-01-01T00:00:00Z"
        );
        assertEquals(0, exit, err::toString);
        assertTrue(out.toString().contains("\"status\" : \"success\""), out::toString);
        assertTrue(out.toString().contains("progress-note@1.0.0_2024-01-01T00:00:00Z"));
        assertTrue(Files.exists(tempDir.resolve("prompt-bundle.json")));
    }

    @Test
    void failOnWarningsSettingGivesNonZeroExit() {
        int exit = run(
            "-t", NotegenTestSupport.progressNoteTemplate().toString(),
            "-s", NotegenTestSupport.progressNoteSource().toString(),
            "-o", tempDir.toString(),
            "--config", NotegenTestSupport.resource("settings", "notegen.toml").toString()
        );
        assertEquals(1, exit);
        assertTrue(out.toString().contains("\"status\" : \"failure\""), out::toString);
    }

    @Test
    void rejectsInvalidArguments() {
        assertEquals(CommandLine.ExitCode.USAGE, run("--source", "x.json"));
        assertEquals(CommandLine.ExitCode.USAGE, run(
            "-t", "a.yaml", "-s", "b.json", "-o", tempDir.toString(), "--timestamp", "yesterday"
        ));
        assertTrue(err.toString().contains("Invalid --timestamp value: yesterday"), err::toString);
        assertEquals(CommandLine.ExitCode.USAGE, run(
            "-t", "a.yaml", "-s", "b.json", "-o", tempDir.toString(), "--log-level", "loud"
        ));
    }

    @Test
    void printsVersion() {
        assertEquals(0, run("--version"));
        assertTrue(out.toString().startsWith("notegen "), out::toString);
    }
}
