package com.ansible.visualizer.parser;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ansible.visualizer.core.context.ToolDiagnostics;
import com.ansible.visualizer.model.BlockNode;
import com.ansible.visualizer.model.IncludeNode;
import com.ansible.visualizer.model.PlainTaskNode;
import com.ansible.visualizer.model.RoleRefNode;
import com.ansible.visualizer.model.TaskMetadata;
import com.ansible.visualizer.model.TaskNode;

/**
 * Turns raw task declarations into typed task-tree nodes.
 *
 * Dispatch order per task:
 * 1. block                          -> BlockNode (block ++ rescue ++ always)
 * 2. include_role / import_role     -> RoleRefNode
 * 3. include_tasks / import_tasks   -> IncludeNode (target file loaded and extracted)
 * 4. anything else                  -> PlainTaskNode
 *
 * Missing or unreadable include files are reported to ToolDiagnostics and yield
 * an empty include; they never abort extraction.
 */
public class TaskExtractor {
    private static final Logger log = LoggerFactory.getLogger(TaskExtractor.class);

    private static final List<String> BLOCK_SECTIONS = List.of("block", "rescue", "always");

    private final Path repoRoot;
    private final YamlLoader yamlLoader;
    private final ToolDiagnostics diagnostics;

    /** Include files currently being extracted, to stop self-including chains. */
    private final Set<Path> currentlyIncluding = new HashSet<>();

    public TaskExtractor(Path repoRoot, YamlLoader yamlLoader, ToolDiagnostics diagnostics) {
        this.repoRoot = Objects.requireNonNull(repoRoot, "repoRoot");
        this.yamlLoader = Objects.requireNonNull(yamlLoader, "yamlLoader");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    /**
     * Extract every mapping element of a raw task list; other elements are skipped.
     *
     * @param baseFile the file the tasks were declared in (include resolution base)
     */
    public List<TaskNode> extractAll(Collection<?> rawTasks, Path baseFile) {
        List<TaskNode> nodes = new ArrayList<>();
        if (rawTasks == null) {
            return nodes;
        }
        for (Object raw : rawTasks) {
            if (raw instanceof Map<?, ?> task) {
                nodes.add(extract(task, baseFile));
            } else {
                log.debug("Skipping non-mapping task entry in {}: {}", baseFile, raw);
            }
        }
        return nodes;
    }

    public TaskNode extract(Map<?, ?> raw, Path baseFile) {
        TaskMetadata metadata = extractMetadata(raw);

        if (raw.containsKey("block")) {
            List<TaskNode> children = new ArrayList<>();
            for (String section : BLOCK_SECTIONS) {
                children.addAll(extractAll(YamlValues.asList(raw.get(section)), baseFile));
            }
            return BlockNode.builder()
                    .metadata(metadata)
                    .children(children)
                    .build();
        }

        Object roleValue = YamlValues.moduleValue(raw, "include_role");
        if (roleValue == null) {
            roleValue = YamlValues.moduleValue(raw, "import_role");
        }
        if (roleValue != null) {
            String roleName = roleValue instanceof Map<?, ?> roleMap
                    ? YamlValues.asString(roleMap.get("name"))
                    : String.valueOf(roleValue);
            if (roleName != null && !roleName.isBlank()) {
                return RoleRefNode.builder()
                        .metadata(metadata)
                        .roleName(roleName)
                        .build();
            }
            String msg = "Role include without a role name in " + baseFile + " (task '" + metadata.getName() + "')";
            diagnostics.warn(msg);
            log.warn(msg);
        }

        Object includeValue = YamlValues.moduleValue(raw, "include_tasks");
        if (includeValue == null) {
            includeValue = YamlValues.moduleValue(raw, "import_tasks");
        }
        if (includeValue != null) {
            String file = includeValue instanceof Map<?, ?> includeMap
                    ? YamlValues.asString(includeMap.get("file"))
                    : String.valueOf(includeValue);
            if (file != null && !file.isBlank()) {
                return IncludeNode.builder()
                        .metadata(metadata)
                        .file(file)
                        .included(loadIncludedTasks(file, baseFile))
                        .build();
            }
            String msg = "Task include without a file in " + baseFile + " (task '" + metadata.getName() + "')";
            diagnostics.warn(msg);
            log.warn(msg);
        }

        return PlainTaskNode.builder()
                .metadata(metadata)
                .build();
    }

    private TaskMetadata extractMetadata(Map<?, ?> raw) {
        TaskMetadata.TaskMetadataBuilder builder = TaskMetadata.builder()
                .when(YamlValues.toStringList(raw.get("when")))
                .tags(YamlValues.toStringList(raw.get("tags")))
                .notify(extractNotify(raw.get("notify")));

        Object name = raw.get("name");
        if (name != null) {
            builder.name(String.valueOf(name));
        }

        if (YamlValues.isTruthy(raw.get("become"))) {
            builder.become(true);
            Object becomeUser = raw.get("become_user");
            if (YamlValues.isTruthy(becomeUser)) {
                builder.becomeUser(String.valueOf(becomeUser));
            }
        }
        return builder.build();
    }

    private List<String> extractNotify(Object notify) {
        if (notify instanceof CharSequence handler) {
            return handler.length() > 0 ? List.of(handler.toString()) : List.of();
        }
        if (notify instanceof Collection<?>) {
            return YamlValues.toStringList(notify);
        }
        return List.of();
    }

    /**
     * Candidates in order: relative to the including file's directory, then relative
     * to the repository root. The first readable non-empty task list wins.
     */
    private List<TaskNode> loadIncludedTasks(String file, Path baseFile) {
        List<Path> candidates = new ArrayList<>();
        Path baseDir = baseFile != null ? baseFile.toAbsolutePath().getParent() : null;
        if (baseDir != null) {
            candidates.add(baseDir.resolve(file).normalize());
        }
        candidates.add(repoRoot.toAbsolutePath().resolve(file).normalize());

        for (Path candidate : candidates) {
            if (!Files.isRegularFile(candidate)) {
                continue;
            }
            if (currentlyIncluding.contains(candidate)) {
                String msg = "Include cycle skipped: " + candidate + " included from " + baseFile;
                diagnostics.info(msg);
                log.debug(msg);
                return List.of();
            }
            List<?> rawTasks = yamlLoader.loadSequence(candidate, diagnostics);
            if (rawTasks.isEmpty()) {
                continue;
            }

            log.debug("Resolved include {} -> {}", file, candidate);
            currentlyIncluding.add(candidate);
            try {
                return extractAll(rawTasks, candidate);
            } finally {
                currentlyIncluding.remove(candidate);
            }
        }

        String msg = "No usable task file for include: " + file + " (from " + baseFile + ")";
        diagnostics.warn(msg);
        log.warn(msg);
        return List.of();
    }
}
