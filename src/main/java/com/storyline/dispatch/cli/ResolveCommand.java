package com.storyline.dispatch.cli;

import com.storyline.core.StorylineException;
import com.storyline.core.compose.TextResolver;
import com.storyline.core.config.TextResolverFactory;
import com.storyline.core.expression.VariableContext;
import com.storyline.core.model.ParsedDocument;
import com.storyline.core.parser.TextSyntaxException;
import com.storyline.core.selection.SeededRandomSource;
import com.storyline.core.state.InMemorySequenceStateStore;
import com.storyline.core.state.SequenceStateSnapshots;
import com.storyline.core.state.SequenceStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.regex.Pattern;

/**
 * CLI command: storyline resolve &lt;file&gt;
 * <p>
 * Resolves a text file one or more times within a single session and prints each result on its
 * own line. With {@code --state}, the session's sequence state is loaded before and saved after,
 * so consecutive invocations continue where the previous one stopped.
 */
@Command(name = "resolve", mixinStandardHelpOptions = true, description = "Resolve the directives in a text file")
@Component
public class ResolveCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ResolveCommand.class);

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?");

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Text file to resolve")
    private Path file;

    @Option(names = {"--document-id", "-d"}, description = "Document id used in directive identities")
    private String documentId;

    @Option(names = "-D", paramLabel = "NAME=VALUE", description = "Guard variable; repeatable")
    private Map<String, String> variables = new LinkedHashMap<>();

    @Option(names = {"--times", "-n"}, description = "Number of evaluations (default: ${DEFAULT-VALUE})",
            defaultValue = "1")
    private int times;

    @Option(names = {"--state", "-s"}, description = "Sequence state file to load and save")
    private Path stateFile;

    @Option(names = "--seed", description = "Shuffle seed")
    private Long seed;

    private final TextResolverFactory resolverFactory;

    public ResolveCommand(TextResolverFactory resolverFactory) {
        this.resolverFactory = resolverFactory;
    }

    @Override
    public Integer call() {
        if (times < 1) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--times must be at least 1: " + times);
        }
        var properties = resolverFactory.properties();

        String source;
        try {
            source = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read " + file + ": " + e.getMessage());
            return ExitCodes.IO_ERROR;
        }

        Path statePath = stateFile;
        if (statePath == null && properties.hasStateFile()) {
            statePath = Path.of(properties.getStateFile());
        }
        SequenceStateStore store;
        try {
            store = statePath != null && Files.exists(statePath)
                    ? SequenceStateSnapshots.read(statePath)
                    : new InMemorySequenceStateStore();
        } catch (IOException | IllegalArgumentException e) {
            ConsoleOutput.error("Cannot load state from " + statePath + ": " + e.getMessage());
            return ExitCodes.IO_ERROR;
        }

        long shuffleSeed;
        if (seed != null) {
            shuffleSeed = seed;
        } else if (properties.hasShuffleSeed()) {
            shuffleSeed = properties.getShuffleSeed();
        } else {
            shuffleSeed = System.currentTimeMillis();
            ConsoleOutput.info("Using shuffle seed " + shuffleSeed);
        }

        TextResolver resolver = resolverFactory.create(store, new SeededRandomSource(shuffleSeed));
        String docId = documentId != null ? documentId : properties.getDefaultDocumentId();
        VariableContext context = VariableContext.of(coerce(variables));

        try {
            ParsedDocument document = resolver.parse(source, docId);
            for (int i = 0; i < times; i++) {
                System.out.println(resolver.resolve(document, context));
            }
        } catch (TextSyntaxException e) {
            ConsoleOutput.syntaxError(file.toString(), e);
            return ExitCodes.RESOLUTION_ERROR;
        } catch (StorylineException e) {
            ConsoleOutput.error(e.getMessage());
            return ExitCodes.RESOLUTION_ERROR;
        }

        if (statePath != null) {
            try {
                SequenceStateSnapshots.write(store, statePath);
            } catch (IOException e) {
                ConsoleOutput.error("Cannot save state to " + statePath + ": " + e.getMessage());
                return ExitCodes.IO_ERROR;
            }
            log.debug("Saved {} sequence states to {}", store.identities().size(), statePath);
        }
        return ExitCodes.OK;
    }

    /**
     * Converts raw {@code -D} values: {@code true}/{@code false} become booleans, integer and
     * decimal literals become numbers, anything else stays a string.
     */
    static Map<String, Object> coerce(Map<String, String> raw) {
        var result = new LinkedHashMap<String, Object>();
        raw.forEach((name, value) -> result.put(name, coerceValue(value)));
        return result;
    }

    static Object coerceValue(String value) {
        if (value.equals("true") || value.equals("false")) {
            return Boolean.valueOf(value);
        }
        if (NUMBER.matcher(value).matches()) {
            return new BigDecimal(value);
        }
        return value;
    }
}
