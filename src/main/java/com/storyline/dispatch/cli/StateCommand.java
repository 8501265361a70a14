package com.storyline.dispatch.cli;

import com.storyline.core.state.InMemorySequenceStateStore;
import com.storyline.core.state.SequenceState;
import com.storyline.core.state.SequenceStateSnapshots;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: storyline state &lt;file&gt;
 * <p>
 * Lists the entries of a saved sequence state file.
 */
@Command(name = "state", mixinStandardHelpOptions = true, description = "Show a saved sequence state file")
@Component
public class StateCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Sequence state file")
    private Path file;

    @Override
    public Integer call() {
        InMemorySequenceStateStore store;
        try {
            store = SequenceStateSnapshots.read(file);
        } catch (IOException | IllegalArgumentException e) {
            ConsoleOutput.error("Cannot load state from " + file + ": " + e.getMessage());
            return ExitCodes.IO_ERROR;
        }

        if (store.size() == 0) {
            ConsoleOutput.info("No sequence state recorded");
            return ExitCodes.OK;
        }

        System.out.printf("  %-30s %-8s %s%n", "IDENTITY", "COUNTER", "SHUFFLE");
        System.out.println("  " + "-".repeat(56));
        for (Map.Entry<String, SequenceState> entry : store.snapshot().entrySet()) {
            SequenceState state = entry.getValue();
            String shuffle = state.hasShuffleOrder()
                    ? "order=" + state.order() + " cursor=" + state.cursor()
                    : "-";
            System.out.printf("  %-30s %-8d %s%n", entry.getKey(), state.counter(), shuffle);
        }
        return ExitCodes.OK;
    }
}
