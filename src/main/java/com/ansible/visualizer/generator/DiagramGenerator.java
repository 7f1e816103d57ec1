package com.ansible.visualizer.generator;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ansible.visualizer.assembly.RepositoryModelAssembler;
import com.ansible.visualizer.core.context.ToolDiagnostics;
import com.ansible.visualizer.core.context.VisualizerConfig;
import com.ansible.visualizer.diagram.MermaidDiagramEmitter;
import com.ansible.visualizer.model.Play;
import com.ansible.visualizer.model.Playbook;
import com.ansible.visualizer.model.RepositoryModel;
import com.ansible.visualizer.model.TaskNode;
import com.ansible.visualizer.model.TaskNodeCounter;
import com.ansible.visualizer.parser.exception.FormatException;
import com.ansible.visualizer.parser.exception.MissingResourceException;

/**
 * End-to-end generation: assemble the repository model, then render it.
 *
 * Fatal parse errors are returned as a failed {@link GeneratorResult}; warnings
 * collected along the way are returned with a successful one.
 */
public class DiagramGenerator {
    private static final Logger log = LoggerFactory.getLogger(DiagramGenerator.class);

    private static final String MARKDOWN_FENCE_START = "```mermaid";
    private static final String MARKDOWN_FENCE_END = "```";

    private final VisualizerConfig config;
    private final MermaidDiagramEmitter emitter;

    public DiagramGenerator(VisualizerConfig config) {
        this(config, new MermaidDiagramEmitter());
    }

    public DiagramGenerator(VisualizerConfig config, MermaidDiagramEmitter emitter) {
        this.config = config;
        this.emitter = emitter;
    }

    public GeneratorResult generate() {
        ToolDiagnostics diagnostics = new ToolDiagnostics();
        try {
            log.info("Step 1: Assembling repository model...");
            RepositoryModelAssembler assembler = new RepositoryModelAssembler(config.getRepoRoot());
            RepositoryModel model = assembler.assemble(
                    config.getInventoryPaths(), config.getPlaybookPaths(), diagnostics);

            log.info("Step 2: Rendering diagram...");
            String diagram = emitter.emit(model, config.getLayout());
            if (config.isMarkdown()) {
                diagram = MARKDOWN_FENCE_START + "\n" + diagram + "\n" + MARKDOWN_FENCE_END + "\n";
            }

            if (diagnostics.hasWarnings()) {
                log.info("Completed with {} warnings", diagnostics.getWarnings().size());
            }

            return GeneratorResult.builder()
                    .success(true)
                    .diagram(diagram)
                    .groupsParsed(model.getGroups().size())
                    .hostsParsed(model.getGroups().values().stream().mapToInt(List::size).sum())
                    .playbooksParsed(model.getPlaybooks().size())
                    .playsParsed(model.getPlaybooks().values().stream()
                            .mapToInt(playbook -> playbook.getPlays().size()).sum())
                    .rolesResolved(model.getRoles().size())
                    .taskNodesExtracted(countTaskNodes(model))
                    .diagramLines((int) diagram.lines().count())
                    .warnings(List.copyOf(diagnostics.getWarnings()))
                    .build();

        } catch (FormatException e) {
            log.error("Parsing failed: {}", e.getMessage());
            return GeneratorResult.failure(GeneratorResult.ErrorKind.FORMAT, e.getMessage(), e.getPath());
        } catch (MissingResourceException e) {
            log.error("Missing input: {}", e.getMessage());
            return GeneratorResult.failure(GeneratorResult.ErrorKind.MISSING_RESOURCE, e.getMessage(), e.getPath());
        } catch (RuntimeException e) {
            log.error("Generation failed with exception", e);
            return GeneratorResult.failure(GeneratorResult.ErrorKind.INTERNAL,
                    "Generation failed: " + e.getMessage(), null);
        }
    }

    private static int countTaskNodes(RepositoryModel model) {
        int count = 0;
        for (Playbook playbook : model.getPlaybooks().values()) {
            for (Play play : playbook.getPlays()) {
                count += TaskNodeCounter.count(play.getTasks());
            }
        }
        for (List<TaskNode> tasks : model.getRoleTasks().values()) {
            count += TaskNodeCounter.count(tasks);
        }
        return count;
    }
}
