package com.ansible.visualizer.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.ansible.visualizer.model.LayoutDirection;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "visualize" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class VisualizeOptions {

	@Option(names = { "--repo", "-r" }, required = true, description = "Root directory of the Ansible repository")
	private Path repoRoot;

	@Option(names = { "--inventory",
			"-i" }, description = "Inventory file (YAML or INI), relative to the repository root; repeatable")
	private List<Path> inventories = new ArrayList<>();

	@Option(names = { "--playbook",
			"-p" }, description = "Playbook file, relative to the repository root; repeatable")
	private List<Path> playbooks = new ArrayList<>();

	@Option(names = { "--layout",
			"-l" }, defaultValue = "LR", description = "Graph direction: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
	private LayoutDirection layout;

	@Option(names = { "--output", "-o" }, description = "Write the diagram to this file instead of stdout")
	private Path output;

	@Option(names = { "--markdown" }, description = "Wrap the diagram in a Markdown mermaid code fence")
	private boolean markdown;

	@Option(names = { "--verbose", "-v" }, description = "Enable debug logging")
	private boolean verbose;

}
