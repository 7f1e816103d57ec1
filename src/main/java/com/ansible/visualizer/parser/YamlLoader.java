package com.ansible.visualizer.parser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import com.ansible.visualizer.core.context.ToolDiagnostics;

/**
 * Reads YAML documents from repository files.
 *
 * Files are read fully and closed before parsing. Only standard YAML types are
 * constructed (maps, lists, scalars); tags in repository content never instantiate classes.
 */
public class YamlLoader {
    private static final Logger log = LoggerFactory.getLogger(YamlLoader.class);

    /**
     * Load the first document of a file.
     *
     * @throws IOException   if the file cannot be read
     * @throws YAMLException if the content is not valid YAML
     */
    public Object load(Path path) throws IOException {
        String content = Files.readString(path, StandardCharsets.UTF_8);
        return load(content);
    }

    public Object load(String content) {
        // Yaml instances are not thread-safe; one per call
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        return yaml.load(content);
    }

    /**
     * Load a task list (include file, role tasks). Anything that is not a
     * non-empty sequence yields an empty list and a warning; never throws.
     */
    public List<?> loadSequence(Path path, ToolDiagnostics diagnostics) {
        try {
            Object data = load(path);
            if (data instanceof List<?> list && !list.isEmpty()) {
                return list;
            }
            String msg = "Empty or non-list task file: " + path;
            diagnostics.warn(msg);
            log.warn(msg);
        } catch (IOException | YAMLException e) {
            String msg = "Could not load task file: " + path + " - " + e.getMessage();
            diagnostics.warn(msg);
            log.warn(msg);
        }
        return List.of();
    }
}
