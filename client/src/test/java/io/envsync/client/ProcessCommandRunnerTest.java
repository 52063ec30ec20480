// file: client/src/test/java/io/envsync/client/ProcessCommandRunnerTest.java
package io.envsync.client;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class ProcessCommandRunnerTest {

    private static final String SH = "/bin/sh";

    @Test
    void captures_stdout_stderr_and_exit_code() throws Exception {
        assumeTrue(Files.isExecutable(Path.of(SH)), "needs a POSIX shell");
        var runner = new ProcessCommandRunner(Duration.ofSeconds(30));

        CommandRunner.Result r = runner.run(List.of(SH, "-c", "echo '[]'; echo oops >&2; exit 3"));

        assertEquals(3, r.exitCode());
        assertEquals("[]", r.stdout().strip());
        assertEquals("oops", r.stderr().strip());
        assertFalse(r.succeeded());
    }

    @Test
    void slow_command_times_out() {
        assumeTrue(Files.isExecutable(Path.of(SH)), "needs a POSIX shell");
        var runner = new ProcessCommandRunner(Duration.ofMillis(200));

        assertThrows(IOException.class, () -> runner.run(List.of(SH, "-c", "sleep 5")));
    }

    @Test
    void missing_program_fails_to_start() {
        var runner = new ProcessCommandRunner(null);

        assertThrows(IOException.class, () -> runner.run(List.of("/nonexistent/okta-cli-client-xyz")));
    }
}
