package com.ansible.visualizer.assembly;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ansible.visualizer.core.context.ToolDiagnostics;
import com.ansible.visualizer.model.Play;
import com.ansible.visualizer.model.Playbook;
import com.ansible.visualizer.model.RepositoryModel;
import com.ansible.visualizer.model.Role;
import com.ansible.visualizer.model.RoleReferenceCollector;
import com.ansible.visualizer.model.TaskNode;
import com.ansible.visualizer.parser.InventoryParser;
import com.ansible.visualizer.parser.PlaybookParser;
import com.ansible.visualizer.parser.RoleResolver;
import com.ansible.visualizer.parser.YamlLoader;
import com.ansible.visualizer.parser.exception.FormatException;
import com.ansible.visualizer.parser.exception.MissingResourceException;

/**
 * Builds the aggregate {@link RepositoryModel} from inventories, playbooks and roles.
 *
 * Steps:
 * 1. Inventories are parsed in order; later files overwrite same-named groups.
 * 2. Playbooks are parsed through a work queue; imported playbooks are enqueued and
 *    every distinct path is parsed once.
 * 3. Roles referenced by plays (roles lists and RoleRef nodes) are resolved transitively.
 *
 * FormatException and MissingResourceException propagate unchanged.
 */
public class RepositoryModelAssembler {
    private static final Logger log = LoggerFactory.getLogger(RepositoryModelAssembler.class);

    private final Path repoRoot;
    private final InventoryParser inventoryParser;
    private final PlaybookParser playbookParser;
    private final RoleResolver roleResolver;

    public RepositoryModelAssembler(Path repoRoot) {
        this(repoRoot, new YamlLoader());
    }

    public RepositoryModelAssembler(Path repoRoot, YamlLoader yamlLoader) {
        this.repoRoot = Objects.requireNonNull(repoRoot, "repoRoot").toAbsolutePath().normalize();
        this.inventoryParser = new InventoryParser(yamlLoader);
        this.playbookParser = new PlaybookParser(this.repoRoot, yamlLoader);
        this.roleResolver = new RoleResolver(this.repoRoot, yamlLoader);
    }

    /**
     * @throws FormatException          on malformed playbook YAML
     * @throws MissingResourceException when a supplied inventory or playbook cannot be read
     */
    public RepositoryModel assemble(List<Path> inventoryPaths, List<Path> playbookPaths,
                                    ToolDiagnostics diagnostics) {
        Objects.requireNonNull(diagnostics, "diagnostics");

        Map<String, List<String>> groups = parseInventories(inventoryPaths);
        Map<Path, Playbook> playbooks = parsePlaybooks(playbookPaths, diagnostics);

        Set<String> roles = new LinkedHashSet<>();
        for (Playbook playbook : playbooks.values()) {
            for (Play play : playbook.getPlays()) {
                roles.addAll(play.getRoles());
                roles.addAll(RoleReferenceCollector.collect(play.getTasks()));
            }
        }
        log.info("Found {} roles referenced by playbooks", roles.size());

        Map<String, Role> resolved = roleResolver.resolveAll(roles, diagnostics);
        roles.addAll(resolved.keySet());

        Map<String, List<TaskNode>> roleTasks = new LinkedHashMap<>();
        Map<String, List<String>> roleDependencies = new LinkedHashMap<>();
        resolved.forEach((name, role) -> {
            roleTasks.put(name, role.getTasks());
            if (!role.getDependencies().isEmpty()) {
                roleDependencies.put(name, role.getDependencies());
            }
        });

        return RepositoryModel.builder()
                .repoRoot(repoRoot)
                .groups(groups)
                .playbooks(playbooks)
                .roles(roles)
                .roleTasks(roleTasks)
                .roleDependencies(roleDependencies)
                .build();
    }

    private Map<String, List<String>> parseInventories(List<Path> inventoryPaths) {
        Map<String, List<String>> groups = new LinkedHashMap<>();
        for (Path inventory : inventoryPaths) {
            Path path = inventory.toAbsolutePath().normalize();
            if (!Files.exists(path)) {
                throw new MissingResourceException(path, null);
            }
            groups.putAll(inventoryParser.parse(path));
        }
        log.info("Parsed {} inventory groups from {} files", groups.size(), inventoryPaths.size());
        return groups;
    }

    private Map<Path, Playbook> parsePlaybooks(List<Path> playbookPaths, ToolDiagnostics diagnostics) {
        Map<Path, Playbook> playbooks = new LinkedHashMap<>();
        Deque<Path> pending = new ArrayDeque<>();
        playbookPaths.forEach(path -> pending.add(path.toAbsolutePath().normalize()));

        while (!pending.isEmpty()) {
            Path path = pending.poll();
            if (playbooks.containsKey(path)) {
                diagnostics.info("Playbook already parsed: " + path);
                continue;
            }
            if (!Files.exists(path)) {
                throw new MissingResourceException(path, null);
            }

            Playbook playbook = playbookParser.parse(path, diagnostics);
            playbooks.put(path, playbook);

            for (Path imported : playbook.getImportedPlaybooks()) {
                if (Files.exists(imported) && !playbooks.containsKey(imported)) {
                    pending.add(imported);
                }
            }
        }
        log.info("Parsed {} playbooks", playbooks.size());
        return playbooks;
    }
}
