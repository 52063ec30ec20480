// file: client/src/main/java/io/envsync/client/CommandRunner.java
package io.envsync.client;

import java.io.IOException;
import java.util.List;

/**
 * Runs an external command to completion and captures its output.
 * Abstracted so {@link CliBackend} can be exercised without the real binary.
 */
public interface CommandRunner {

    /**
     * @param command program followed by its arguments
     * @throws IOException if the program cannot be started, its output cannot
     *                     be read, or it exceeds the runner's time limit
     */
    Result run(List<String> command) throws IOException, InterruptedException;

    record Result(int exitCode, String stdout, String stderr) {
        public boolean succeeded() {
            return exitCode == 0;
        }
    }
}
