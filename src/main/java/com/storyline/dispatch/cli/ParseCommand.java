package com.storyline.dispatch.cli;

import com.storyline.core.config.TextResolverFactory;
import com.storyline.core.model.Branch;
import com.storyline.core.model.Directive;
import com.storyline.core.model.ParsedDocument;
import com.storyline.core.model.ParsedNode;
import com.storyline.core.model.TextNode;
import com.storyline.core.parser.TextSyntaxException;
import com.storyline.core.selection.SeededRandomSource;
import com.storyline.core.state.InMemorySequenceStateStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: storyline parse &lt;file&gt;
 * <p>
 * Parses a text file without resolving it and prints its directive tree: kind, identity,
 * span and branch guards of every directive, nested ones indented under their branch.
 */
@Command(name = "parse", mixinStandardHelpOptions = true, description = "Print the directive tree of a text file")
@Component
public class ParseCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Text file to parse")
    private Path file;

    @Option(names = {"--document-id", "-d"}, description = "Document id used in directive identities")
    private String documentId;

    private final TextResolverFactory resolverFactory;

    public ParseCommand(TextResolverFactory resolverFactory) {
        this.resolverFactory = resolverFactory;
    }

    @Override
    public Integer call() {
        String source;
        try {
            source = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read " + file + ": " + e.getMessage());
            return ExitCodes.IO_ERROR;
        }

        String docId = documentId != null ? documentId : resolverFactory.properties().getDefaultDocumentId();
        ParsedDocument document;
        try {
            document = resolverFactory.create(new InMemorySequenceStateStore(), new SeededRandomSource(0L))
                    .parse(source, docId);
        } catch (TextSyntaxException e) {
            ConsoleOutput.syntaxError(file.toString(), e);
            return ExitCodes.RESOLUTION_ERROR;
        }

        int count = document.directives().size();
        ConsoleOutput.info(file + ": " + count + " directive" + (count != 1 ? "s" : ""));
        printNodes(document.nodes(), 0);
        return ExitCodes.OK;
    }

    private void printNodes(List<ParsedNode> nodes, int depth) {
        for (ParsedNode node : nodes) {
            if (node instanceof Directive directive) {
                printDirective(directive, depth);
            }
        }
    }

    private void printDirective(Directive directive, int depth) {
        String detail = directive.form().name().toLowerCase().replace('_', '-') + " " + directive.span()
                + (directive.guard() != null ? " if '" + directive.guard() + "'" : "");
        ConsoleOutput.directive(depth, directive.kind().name(), directive.identity(), detail);
        List<Branch> branches = directive.branches();
        for (int i = 0; i < branches.size(); i++) {
            Branch branch = branches.get(i);
            String guard = branch.hasGuard() ? "if '" + branch.guard() + "' " : "";
            ConsoleOutput.branch(depth + 1, i, guard + preview(branch.content()));
            printNodes(branch.content(), depth + 2);
        }
    }

    private static String preview(List<ParsedNode> content) {
        var sb = new StringBuilder();
        for (ParsedNode node : content) {
            sb.append(node instanceof TextNode text ? text.text() : "{...}");
        }
        String flat = sb.toString().replace("\n", "\\n");
        return "\"" + (flat.length() <= 40 ? flat : flat.substring(0, 37) + "...") + "\"";
    }
}
