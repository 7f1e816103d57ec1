package com.ansible.visualizer.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ansible.visualizer.cli.model.ValidatedVisualizeOptions;
import com.ansible.visualizer.cli.model.VisualizeOptions;
import com.ansible.visualizer.generator.GeneratorResult;

/**
 * Responsible only for printing CLI output for the "visualize" command.
 * No validation, no execution. The diagram itself is written by the command.
 */
public class VisualizeResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(VisualizeResultsPrinter.class);

    public void printBanner(VisualizeOptions o, ValidatedVisualizeOptions v) {
        log.info("=================================================");
        log.info("Ansible UML Visualizer");
        log.info("=================================================");
        log.info("Repository: {}", v.getRepoRoot());
        log.info("Inventories: {}", v.getInventoryPaths().isEmpty() ? "None" : v.getInventoryPaths());
        log.info("Playbooks: {}", v.getPlaybookPaths().isEmpty() ? "None" : v.getPlaybookPaths());
        log.info("Layout: {}", o.getLayout());
        log.info("Output: {}", v.getOutputFile() != null ? v.getOutputFile() : "stdout");
        log.info("=================================================");
    }

    public void printSuccess(ValidatedVisualizeOptions v, GeneratorResult result) {
        log.info("");
        log.info("=================================================");
        log.info("DIAGRAM GENERATED");
        log.info("=================================================");
        log.info("Inventory Groups: {}", result.getGroupsParsed());
        log.info("Hosts: {}", result.getHostsParsed());
        log.info("Playbooks Parsed: {}", result.getPlaybooksParsed());
        log.info("Plays: {}", result.getPlaysParsed());
        log.info("Roles Resolved: {}", result.getRolesResolved());
        log.info("Task Nodes: {}", result.getTaskNodesExtracted());
        log.info("Diagram Lines: {}", result.getDiagramLines());

        if (!result.getWarnings().isEmpty()) {
            log.info("");
            log.info("Warnings ({}):", result.getWarnings().size());
            result.getWarnings().forEach(w -> log.info("  - {}", w));
        }

        if (v.getOutputFile() != null) {
            log.info("");
            log.info("Diagram written to: {}", v.getOutputFile());
        }
        log.info("=================================================");
    }

    public void printFailure(GeneratorResult result) {
        log.error("Generation failed: {}", result.getErrorMessage());
        if (result.getFailedPath() != null) {
            log.error("Offending file: {}", result.getFailedPath());
        }
    }
}
