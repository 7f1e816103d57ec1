package com.ansible.visualizer.parser;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.error.YAMLException;

import com.ansible.visualizer.core.context.ToolDiagnostics;
import com.ansible.visualizer.model.Play;
import com.ansible.visualizer.model.Playbook;
import com.ansible.visualizer.parser.exception.FormatException;
import com.ansible.visualizer.parser.exception.MissingResourceException;

/**
 * Parser for playbook files.
 *
 * Each top-level mapping with {@code import_playbook} becomes an import target; every
 * other mapping becomes a {@link Play} whose tasks are pre_tasks ++ tasks ++ post_tasks.
 */
public class PlaybookParser {
    private static final Logger log = LoggerFactory.getLogger(PlaybookParser.class);

    private static final List<String> TASK_SECTIONS = List.of("pre_tasks", "tasks", "post_tasks");
    private static final String DEFAULT_HANDLER_NAME = "unnamed_handler";

    private final Path repoRoot;
    private final YamlLoader yamlLoader;

    public PlaybookParser(Path repoRoot) {
        this(repoRoot, new YamlLoader());
    }

    public PlaybookParser(Path repoRoot, YamlLoader yamlLoader) {
        this.repoRoot = Objects.requireNonNull(repoRoot, "repoRoot");
        this.yamlLoader = Objects.requireNonNull(yamlLoader, "yamlLoader");
    }

    /**
     * Parse one playbook.
     *
     * @throws FormatException          if the file is not valid UTF-8 YAML
     * @throws MissingResourceException if the file cannot be read
     */
    public Playbook parse(Path path, ToolDiagnostics diagnostics) {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(diagnostics, "diagnostics");

        Path playbookPath = path.toAbsolutePath().normalize();
        log.info("Parsing playbook: {}", playbookPath);

        Object data;
        try {
            data = yamlLoader.load(playbookPath);
        } catch (YAMLException | CharacterCodingException e) {
            throw new FormatException(playbookPath, e);
        } catch (IOException e) {
            throw new MissingResourceException(playbookPath, e);
        }

        Playbook.PlaybookBuilder playbook = Playbook.builder()
                .path(playbookPath)
                .name(playbookPath.getFileName().toString());

        if (!(data instanceof List<?> entries) || entries.isEmpty()) {
            String msg = "Empty or invalid playbook: " + playbookPath;
            diagnostics.warn(msg);
            log.warn(msg);
            return playbook.build();
        }

        TaskExtractor extractor = new TaskExtractor(repoRoot, yamlLoader, diagnostics);
        for (Object entry : entries) {
            if (!(entry instanceof Map<?, ?> raw)) {
                continue;
            }

            Object importTarget = YamlValues.moduleValue(raw, "import_playbook");
            if (importTarget != null) {
                Path resolved = playbookPath.getParent().resolve(String.valueOf(importTarget)).normalize();
                if (Files.exists(resolved)) {
                    playbook.importedPlaybook(resolved);
                } else {
                    String msg = "Imported playbook not found: " + resolved + " (from " + playbookPath + ")";
                    diagnostics.warn(msg);
                    log.warn(msg);
                }
                continue;
            }

            playbook.play(parsePlay(raw, playbookPath, extractor));
        }

        return playbook.build();
    }

    private Play parsePlay(Map<?, ?> raw, Path playbookPath, TaskExtractor extractor) {
        Play.PlayBuilder play = Play.builder()
                .hosts(YamlValues.asString(raw.get("hosts")));

        if (YamlValues.isTruthy(raw.get("become"))) {
            play.become(true);
            Object becomeUser = raw.get("become_user");
            if (YamlValues.isTruthy(becomeUser)) {
                play.becomeUser(String.valueOf(becomeUser));
            }
        }

        play.tags(YamlValues.toStringList(raw.get("tags")));

        for (Object role : YamlValues.asList(raw.get("roles"))) {
            String roleName = YamlValues.roleName(role);
            if (roleName != null) {
                play.role(roleName);
            }
        }

        for (String section : TASK_SECTIONS) {
            play.tasks(extractor.extractAll(YamlValues.asList(raw.get(section)), playbookPath));
        }

        for (Object handler : YamlValues.asList(raw.get("handlers"))) {
            if (handler instanceof Map<?, ?> handlerMap) {
                Object name = handlerMap.get("name");
                play.handler(name != null ? String.valueOf(name) : DEFAULT_HANDLER_NAME);
            }
        }

        return play.build();
    }
}
