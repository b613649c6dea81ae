package work.lcod.derivation.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;
import work.lcod.derivation.api.RunResult;

class DeriveCommandTest {
    private static final Path SCRIPTS = Path.of("src", "test", "resources", "scripts").toAbsolutePath();

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int execute(String... args) {
        CommandLine cmd = Main.commandLine();
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    @Test
    void printsJsonForEachScript() {
        int exit = execute(
            "--log-level", "off",
            "-s", SCRIPTS.resolve("external-merge.yaml").toString(),
            SCRIPTS.resolve("movement.yaml").toString()
        );
        assertEquals(0, exit);
        var output = out.toString();
        assertTrue(output.contains("[ John [ left ] ]"));
        assertTrue(output.contains("[ who [ John [ likes [ who ] ] ] ]"));
    }

    @Test
    void incompleteExitsWithDedicatedCodeWhenRequired() {
        var script = SCRIPTS.resolve("incomplete.yaml").toString();
        assertEquals(0, execute("--log-level", "off", "-s", script));
        assertEquals(RunResult.INCOMPLETE_EXIT_CODE, execute("--log-level", "off", "--require-complete", "-s", script));
    }

    @Test
    void failureExitsWithOne() {
        int exit = execute("--log-level", "off", "-s", SCRIPTS.resolve("out-of-range.yaml").toString());
        assertEquals(1, exit);
        assertTrue(out.toString().contains("index_out_of_range"));
    }

    @Test
    void rejectsUnknownLogLevel() {
        int exit = execute("--log-level", "loud", "-s", SCRIPTS.resolve("movement.yaml").toString());
        assertEquals(2, exit);
        assertTrue(err.toString().contains("Unsupported log level"));
    }

    @Test
    void requiresScript() {
        assertEquals(2, execute());
    }

    @Test
    void versionListsOperations() {
        assertEquals(0, execute("--version"));
        assertTrue(out.toString().contains("lcod-derive (java)"));
        assertTrue(out.toString().contains("select3"));
    }
}
