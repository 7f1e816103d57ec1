package com.ansible.visualizer.cli;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ansible.visualizer.cli.exception.OptionsValidationException;
import com.ansible.visualizer.cli.model.ValidatedVisualizeOptions;
import com.ansible.visualizer.cli.model.VisualizeOptions;
import com.ansible.visualizer.cli.output.VisualizeResultsPrinter;
import com.ansible.visualizer.cli.validation.VisualizeOptionsValidator;
import com.ansible.visualizer.core.context.VisualizerConfig;
import com.ansible.visualizer.generator.DiagramGenerator;
import com.ansible.visualizer.generator.GeneratorResult;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * CLI command that renders an Ansible repository as a Mermaid diagram.
 */
@Command(
        name = "visualize",
        mixinStandardHelpOptions = true,
        version = "ansible-uml-visualizer 1.0.0",
        description = "Parses Ansible inventories, playbooks and roles and prints a Mermaid graph of them."
)
public class VisualizeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(VisualizeCommand.class);

    static final int EXIT_FAILURE = 1;

    @Mixin
    private VisualizeOptions options;

    @Spec
    private CommandSpec spec;

    private final VisualizeOptionsValidator validator = new VisualizeOptionsValidator();
    private final VisualizeResultsPrinter printer = new VisualizeResultsPrinter();

    @Override
    public Integer call() {
        if (options.isVerbose()) {
            enableDebugLogging();
        }

        ValidatedVisualizeOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error(error));
            return CommandLine.ExitCode.USAGE;
        }

        printer.printBanner(options, validated);

        VisualizerConfig config = VisualizerConfig.builder()
                .repoRoot(validated.getRepoRoot())
                .inventoryPaths(validated.getInventoryPaths())
                .playbookPaths(validated.getPlaybookPaths())
                .layout(options.getLayout())
                .markdown(options.isMarkdown())
                .build();

        GeneratorResult result = new DiagramGenerator(config).generate();
        if (!result.isSuccess()) {
            printer.printFailure(result);
            return EXIT_FAILURE;
        }

        try {
            writeDiagram(validated, result.getDiagram());
        } catch (IOException e) {
            log.error("Could not write diagram to {}", validated.getOutputFile(), e);
            return EXIT_FAILURE;
        }

        printer.printSuccess(validated, result);
        return CommandLine.ExitCode.OK;
    }

    private void writeDiagram(ValidatedVisualizeOptions validated, String diagram) throws IOException {
        if (validated.getOutputFile() != null) {
            Files.writeString(validated.getOutputFile(), diagram, StandardCharsets.UTF_8);
            return;
        }
        PrintWriter out = spec.commandLine().getOut();
        out.println(diagram);
        out.flush();
    }

    private void enableDebugLogging() {
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext context) {
            context.getLogger("com.ansible.visualizer").setLevel(Level.DEBUG);
        }
    }
}
