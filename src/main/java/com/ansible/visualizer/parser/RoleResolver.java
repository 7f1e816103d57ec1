package com.ansible.visualizer.parser;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.error.YAMLException;

import com.ansible.visualizer.core.context.ToolDiagnostics;
import com.ansible.visualizer.model.Role;
import com.ansible.visualizer.model.RoleReferenceCollector;
import com.ansible.visualizer.model.TaskNode;

/**
 * Locates role task and meta files by convention and resolves the transitive
 * closure of role dependencies.
 *
 * Lookup: every {@code roles} directory below the repository root (hidden directories
 * excluded) is discovered once. For a role, {@code <rolesDir>/<name>/<sub>/main.yml} is
 * tried in every roles directory, then the same with {@code main.yaml}. Missing or
 * malformed files are reported to ToolDiagnostics and never abort resolution.
 */
public class RoleResolver {
    private static final Logger log = LoggerFactory.getLogger(RoleResolver.class);

    private static final String ROLES_DIR = "roles";
    private static final List<String> EXTENSIONS = List.of("yml", "yaml");

    private final Path repoRoot;
    private final YamlLoader yamlLoader;

    /** Lazily discovered roles directories, sorted. */
    private List<Path> rolesDirectories;

    public RoleResolver(Path repoRoot) {
        this(repoRoot, new YamlLoader());
    }

    public RoleResolver(Path repoRoot, YamlLoader yamlLoader) {
        this.repoRoot = Objects.requireNonNull(repoRoot, "repoRoot").toAbsolutePath().normalize();
        this.yamlLoader = Objects.requireNonNull(yamlLoader, "yamlLoader");
    }

    /**
     * Resolve the given roles and everything they depend on. Each role is loaded at
     * most once; a role rediscovered after processing is skipped, which also ends
     * dependency cycles.
     *
     * @return resolved roles in processing order
     */
    public Map<String, Role> resolveAll(Collection<String> roleNames, ToolDiagnostics diagnostics) {
        Objects.requireNonNull(diagnostics, "diagnostics");

        Set<String> discovered = new LinkedHashSet<>(roleNames);
        Set<String> processed = new LinkedHashSet<>();
        Map<String, Role> resolved = new LinkedHashMap<>();

        while (!processed.containsAll(discovered)) {
            for (String roleName : List.copyOf(discovered)) {
                if (processed.contains(roleName)) {
                    continue;
                }
                processed.add(roleName);

                Role role = loadRole(roleName, diagnostics);
                resolved.put(roleName, role);

                Set<String> referenced = new LinkedHashSet<>(role.getDependencies());
                referenced.addAll(RoleReferenceCollector.collect(role.getTasks()));
                for (String next : referenced) {
                    if (processed.contains(next)) {
                        diagnostics.info("Role " + next + " already resolved (referenced by " + roleName + ")");
                    } else if (discovered.add(next)) {
                        log.debug("Discovered role {} via {}", next, roleName);
                    }
                }
            }
        }

        log.info("Resolved {} roles", resolved.size());
        return resolved;
    }

    public Role loadRole(String roleName, ToolDiagnostics diagnostics) {
        return Role.builder()
                .name(roleName)
                .tasks(findRoleTasks(roleName, diagnostics))
                .dependencies(findRoleDependencies(roleName, diagnostics))
                .build();
    }

    /**
     * Tasks of {@code roles/<name>/tasks/main.{yml,yaml}}; the first non-empty task list wins.
     */
    public List<TaskNode> findRoleTasks(String roleName, ToolDiagnostics diagnostics) {
        TaskExtractor extractor = new TaskExtractor(repoRoot, yamlLoader, diagnostics);
        for (Path candidate : candidatePaths(roleName, "tasks", diagnostics)) {
            if (!Files.isRegularFile(candidate)) {
                continue;
            }
            List<?> rawTasks = yamlLoader.loadSequence(candidate, diagnostics);
            if (!rawTasks.isEmpty()) {
                log.debug("Loaded tasks of role {} from {}", roleName, candidate);
                return extractor.extractAll(rawTasks, candidate);
            }
        }

        String msg = "No tasks found for role: " + roleName;
        diagnostics.warn(msg);
        log.warn(msg);
        return List.of();
    }

    /**
     * Dependencies from {@code roles/<name>/meta/main.{yml,yaml}}. Entries are bare
     * names or mappings with {@code role} / {@code name}.
     */
    public List<String> findRoleDependencies(String roleName, ToolDiagnostics diagnostics) {
        for (Path candidate : candidatePaths(roleName, "meta", diagnostics)) {
            if (!Files.isRegularFile(candidate)) {
                continue;
            }
            try {
                Object meta = yamlLoader.load(candidate);
                if (meta instanceof Map<?, ?> metaMap) {
                    List<String> dependencies = new ArrayList<>();
                    for (Object dependency : YamlValues.asList(metaMap.get("dependencies"))) {
                        String name = YamlValues.roleName(dependency);
                        if (name != null) {
                            dependencies.add(name);
                        }
                    }
                    return dependencies;
                }
                String msg = "Role meta is not a mapping: " + candidate;
                diagnostics.warn(msg);
                log.warn(msg);
            } catch (IOException | YAMLException e) {
                String msg = "Could not load role meta: " + candidate + " - " + e.getMessage();
                diagnostics.warn(msg);
                log.warn(msg);
            }
        }

        log.debug("No meta dependencies for role {}", roleName);
        return List.of();
    }

    /**
     * Candidate files for a role sub directory, in lookup order.
     */
    public List<Path> candidatePaths(String roleName, String subDirectory, ToolDiagnostics diagnostics) {
        List<Path> candidates = new ArrayList<>();
        for (String extension : EXTENSIONS) {
            for (Path rolesDir : getRolesDirectories(diagnostics)) {
                candidates.add(rolesDir.resolve(roleName).resolve(subDirectory).resolve("main." + extension));
            }
        }
        return candidates;
    }

    /**
     * Scan failures are reported once, when the directories are first discovered.
     */
    List<Path> getRolesDirectories(ToolDiagnostics diagnostics) {
        if (rolesDirectories == null) {
            rolesDirectories = discoverRolesDirectories(diagnostics);
        }
        return rolesDirectories;
    }

    private List<Path> discoverRolesDirectories(ToolDiagnostics diagnostics) {
        if (!Files.isDirectory(repoRoot)) {
            String msg = "Repository root is not a directory, no roles can be found: " + repoRoot;
            diagnostics.warn(msg);
            log.warn(msg);
            return List.of();
        }
        try (Stream<Path> walk = Files.walk(repoRoot)) {
            List<Path> found = walk
                    .filter(Files::isDirectory)
                    .filter(dir -> dir.getFileName() != null && ROLES_DIR.equals(dir.getFileName().toString()))
                    .filter(dir -> !isHidden(repoRoot.relativize(dir)))
                    .sorted()
                    .toList();
            log.debug("Found {} roles directories under {}", found.size(), repoRoot);
            return found;
        } catch (IOException | UncheckedIOException e) {
            String msg = "Could not scan " + repoRoot + " for roles directories: " + e.getMessage();
            diagnostics.warn(msg);
            log.warn(msg);
            return List.of();
        }
    }

    private static boolean isHidden(Path relative) {
        for (Path segment : relative) {
            if (segment.toString().startsWith(".")) {
                return true;
            }
        }
        return false;
    }
}
