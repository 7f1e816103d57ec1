package com.ansible.visualizer.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.ansible.visualizer.cli.exception.OptionsValidationException;
import com.ansible.visualizer.cli.model.ValidatedVisualizeOptions;
import com.ansible.visualizer.cli.model.VisualizeOptions;

public class VisualizeOptionsValidator {

	public ValidatedVisualizeOptions validate(VisualizeOptions o) {
		List<String> errors = new ArrayList<>();

		Path repoRoot = null;
		if (o.getRepoRoot() == null) {
			errors.add("Repository root is required (--repo / -r).");
		} else {
			repoRoot = o.getRepoRoot().toAbsolutePath().normalize();
			if (!Files.isDirectory(repoRoot)) {
				errors.add("Repository root does not exist or is not a directory: " + repoRoot);
			}
		}

		if (isEmpty(o.getInventories()) && isEmpty(o.getPlaybooks())) {
			errors.add("At least one --inventory or --playbook must be provided.");
		}

		List<Path> inventoryPaths = resolveFiles(repoRoot, o.getInventories(), "Inventory", errors);
		List<Path> playbookPaths = resolveFiles(repoRoot, o.getPlaybooks(), "Playbook", errors);

		Path outputFile = null;
		if (o.getOutput() != null) {
			outputFile = o.getOutput().toAbsolutePath().normalize();
			Path parent = outputFile.getParent();
			if (parent != null && !Files.isDirectory(parent)) {
				errors.add("Output directory does not exist: " + parent);
			}
			if (Files.isDirectory(outputFile)) {
				errors.add("Output path is a directory: " + outputFile);
			}
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedVisualizeOptions(repoRoot, inventoryPaths, playbookPaths, outputFile);
	}

	private static List<Path> resolveFiles(Path repoRoot, List<Path> raw, String kind, List<String> errors) {
		if (isEmpty(raw)) {
			return List.of();
		}
		List<Path> result = new ArrayList<>();
		for (Path p : raw) {
			Path resolved = (p.isAbsolute() || repoRoot == null ? p : repoRoot.resolve(p)).toAbsolutePath()
					.normalize();
			if (!Files.isRegularFile(resolved)) {
				errors.add(kind + " file does not exist: " + resolved);
			}
			result.add(resolved);
		}
		return List.copyOf(result);
	}

	private static boolean isEmpty(List<?> list) {
		return list == null || list.isEmpty();
	}
}
