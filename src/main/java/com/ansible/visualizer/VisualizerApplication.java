package com.ansible.visualizer;

import com.ansible.visualizer.cli.VisualizeCommand;

import picocli.CommandLine;

/**
 * Main entry point for the Ansible UML Visualizer.
 * Reads inventories, playbooks and roles of a local repository and prints a Mermaid graph.
 */
public class VisualizerApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new VisualizeCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
