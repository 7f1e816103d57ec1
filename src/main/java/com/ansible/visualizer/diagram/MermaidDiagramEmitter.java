package com.ansible.visualizer.diagram;

import static com.ansible.visualizer.diagram.MermaidNamingUtil.escapeLabel;
import static com.ansible.visualizer.diagram.MermaidNamingUtil.fileName;
import static com.ansible.visualizer.diagram.MermaidNamingUtil.sanitize;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ansible.visualizer.model.BlockNode;
import com.ansible.visualizer.model.IncludeNode;
import com.ansible.visualizer.model.LayoutDirection;
import com.ansible.visualizer.model.PlainTaskNode;
import com.ansible.visualizer.model.Play;
import com.ansible.visualizer.model.Playbook;
import com.ansible.visualizer.model.RepositoryModel;
import com.ansible.visualizer.model.RoleRefNode;
import com.ansible.visualizer.model.TaskNode;
import com.ansible.visualizer.model.TaskNodeVisitor;

/**
 * Renders a {@link RepositoryModel} as a Mermaid flowchart.
 *
 * Output layout:
 * <pre>
 * graph LR
 *     subgraph inventory["Inventory"]            groups, hosts
 *     subgraph playbooks_section["Playbooks"]    playbooks, task trees, handlers
 *     subgraph roles_section["Roles"]            roles and their task trees
 *     cross-section edges (runs, uses, imports, depends, notifies, role references)
 *     classDef ...
 *     class ... per populated node category
 * </pre>
 *
 * Identifiers only depend on the model, so the same model always renders to the same text.
 */
public class MermaidDiagramEmitter {
    private static final Logger log = LoggerFactory.getLogger(MermaidDiagramEmitter.class);

    private static final String INDENT = "    ";
    private static final String NODE_INDENT = "        ";

    private static final String DEFAULT_BECOME_USER = "root";

    public String emit(RepositoryModel model, LayoutDirection layout) {
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(layout, "layout");
        String diagram = new Emission(model).render(layout);
        log.debug("Emitted diagram with {} lines", diagram.lines().count());
        return diagram;
    }

    /**
     * State of one rendering pass.
     */
    private static final class Emission {
        private final RepositoryModel model;
        private final List<String> lines = new ArrayList<>();
        private final List<String> connections = new ArrayList<>();
        private final DiagramNodes nodes = new DiagramNodes();
        private final Set<String> renderedRoles = new HashSet<>();
        private int taskCounter;

        Emission(RepositoryModel model) {
            this.model = model;
        }

        String render(LayoutDirection layout) {
            lines.add("graph " + layout.name());

            renderInventory();
            renderPlaybooks();
            renderRoles();

            lines.addAll(connections);
            for (NodeCategory category : NodeCategory.values()) {
                lines.add(category.classDefinition());
            }
            applyClasses();

            return String.join("\n", lines);
        }

        private void renderInventory() {
            openSection("inventory", "Inventory");
            for (Map.Entry<String, List<String>> group : model.getGroups().entrySet()) {
                String groupId = sanitize(group.getKey());
                nodes.add(NodeCategory.GROUP, groupId);
                node(groupId + "[[\"fa:fa-layer-group " + escapeLabel(group.getKey()) + "\"]]");

                for (String host : group.getValue()) {
                    String hostId = sanitize(host);
                    nodes.add(NodeCategory.HOST, hostId);
                    node(hostId + "((\"fa:fa-server " + escapeLabel(host) + "\"))");
                    node(groupId + " --- " + hostId);
                }
            }
            closeSection();
        }

        private void renderPlaybooks() {
            openSection("playbooks_section", "Playbooks");
            for (Playbook playbook : model.getPlaybooks().values()) {
                String playbookId = sanitize(playbook.getName());
                nodes.add(NodeCategory.PLAYBOOK, playbookId);
                node(playbookId + "[\"fa:fa-book " + escapeLabel(playbook.getName()) + "\"]");

                List<Play> plays = playbook.getPlays();
                for (int playIndex = 0; playIndex < plays.size(); playIndex++) {
                    renderPlay(playbookId, playIndex, plays.get(playIndex));
                }

                for (Path imported : playbook.getImportedPlaybooks()) {
                    String importedId = sanitize(imported.getFileName().toString());
                    connect(playbookId + " -->|\"imports\"| " + importedId);
                }
            }
            closeSection();
        }

        private void renderPlay(String playbookId, int playIndex, Play play) {
            if (play.getHosts() != null && !play.getHosts().isBlank()) {
                connect(sanitize(play.getHosts()) + " -->|\"runs\"| " + playbookId);
            }

            String annotationPrefix = playbookId + "_play_" + playIndex;
            addTagNode(playbookId, annotationPrefix, play.getTags());
            addBecomeNode(playbookId, annotationPrefix, play.isBecome(), play.getBecomeUser());

            for (String role : play.getRoles()) {
                connect(playbookId + " ==>|\"uses\"| " + roleId(role));
            }

            for (TaskNode task : play.getTasks()) {
                renderTask(playbookId, task);
            }

            // notify edges are drawn from tasks
            for (String handler : play.getHandlers()) {
                ensureHandler(handler);
            }
        }

        private void renderRoles() {
            openSection("roles_section", "Roles");
            for (String role : model.getRoles()) {
                ensureRole(role);
            }
            for (Map.Entry<String, List<String>> entry : model.getRoleDependencies().entrySet()) {
                String roleId = roleId(entry.getKey());
                for (String dependency : entry.getValue()) {
                    connect(roleId + " -->|\"depends\"| " + roleId(dependency));
                }
            }
            closeSection();
        }

        /**
         * Declares the role node and renders its task tree the first time the role is seen.
         * Keyed by role name: distinct names that sanitize to one id share the node
         * and each contributes its own tasks.
         */
        private String ensureRole(String role) {
            String roleId = roleId(role);
            if (renderedRoles.add(role)) {
                if (nodes.add(NodeCategory.ROLE, roleId)) {
                    node(roleId + "{\"fa:fa-cube " + escapeLabel(role) + "\"}");
                }
                for (TaskNode task : model.getTasksOfRole(role)) {
                    renderTask(roleId, task);
                }
            }
            return roleId;
        }

        private void renderTask(String parentId, TaskNode task) {
            task.accept(new TaskRenderer(parentId));
        }

        private void renderInclude(String parentId, IncludeNode include) {
            String file = fileName(include.getFile());
            String includeId = sanitize("include_" + file);
            nodes.add(NodeCategory.INCLUDE, includeId);
            node(includeId + "[/\"" + escapeLabel(file) + "\"/]");
            node(parentId + " --> " + includeId);

            for (TaskNode child : include.getIncluded()) {
                renderTask(includeId, child);
            }
        }

        private void renderBlock(String parentId, BlockNode block) {
            String blockId = parentId + "_block_" + taskCounter++;
            nodes.add(NodeCategory.TASK, blockId);
            node(blockId + "[\"" + taskLabel(block) + "\"]");
            node(parentId + " --> " + blockId);
            addTagNode(blockId, blockId, block.getTags());
            addBecomeNode(blockId, blockId, block.isBecome(), block.getBecomeUser());

            for (TaskNode child : block.getChildren()) {
                renderTask(blockId, child);
            }
        }

        private void renderPlainTask(String parentId, PlainTaskNode task) {
            String taskId = parentId + "_task_" + taskCounter++;
            nodes.add(NodeCategory.TASK, taskId);
            node(taskId + "[\"" + taskLabel(task) + "\"]");
            node(parentId + " --> " + taskId);
            addTagNode(taskId, taskId, task.getTags());
            addBecomeNode(taskId, taskId, task.isBecome(), task.getBecomeUser());

            for (String handler : task.getNotify()) {
                String handlerId = ensureHandler(handler);
                connect(taskId + " -.->|\"notifies\"| " + handlerId);
            }
        }

        private String taskLabel(TaskNode task) {
            String label = escapeLabel(task.getName());
            if (task.getWhen().isEmpty()) {
                return label;
            }
            String condition = String.join(" AND ", task.getWhen());
            return label + "<br/>fa:fa-question when: " + escapeLabel(condition);
        }

        private void addTagNode(String ownerId, String idPrefix, List<String> tags) {
            if (tags.isEmpty()) {
                return;
            }
            String tagId = idPrefix + "_tags";
            nodes.add(NodeCategory.TAG, tagId);
            node(tagId + ">\"fa:fa-tags " + escapeLabel(String.join(", ", tags)) + "\"]");
            node(ownerId + " -.- " + tagId);
        }

        private void addBecomeNode(String ownerId, String idPrefix, boolean become, String becomeUser) {
            if (!become) {
                return;
            }
            String becomeId = idPrefix + "_become";
            nodes.add(NodeCategory.BECOME, becomeId);
            String user = becomeUser != null ? becomeUser : DEFAULT_BECOME_USER;
            node(becomeId + "([\"fa:fa-key " + escapeLabel(user) + "\"])");
            node(ownerId + " -.- " + becomeId);
        }

        private String ensureHandler(String handler) {
            String handlerId = sanitize("handler_" + handler);
            if (nodes.add(NodeCategory.HANDLER, handlerId)) {
                node(handlerId + "([\"fa:fa-bell " + escapeLabel(handler) + "\"])");
            }
            return handlerId;
        }

        private void applyClasses() {
            for (NodeCategory category : NodeCategory.values()) {
                Set<String> ids = nodes.get(category);
                if (!ids.isEmpty()) {
                    lines.add(INDENT + "class " + String.join(",", ids) + " " + category.getStyleClass());
                }
            }
        }

        private static String roleId(String role) {
            return sanitize("role_" + role);
        }

        /**
         * Renders one task-tree node beneath a fixed parent node.
         */
        private final class TaskRenderer implements TaskNodeVisitor {
            private final String parentId;

            TaskRenderer(String parentId) {
                this.parentId = parentId;
            }

            @Override
            public void visit(PlainTaskNode task) {
                renderPlainTask(parentId, task);
            }

            @Override
            public void visit(BlockNode block) {
                renderBlock(parentId, block);
            }

            @Override
            public void visit(RoleRefNode roleRef) {
                connect(parentId + " ==> " + ensureRole(roleRef.getRoleName()));
            }

            @Override
            public void visit(IncludeNode include) {
                renderInclude(parentId, include);
            }
        }

        private void openSection(String id, String title) {
            lines.add(INDENT + "subgraph " + id + "[\"" + title + "\"]");
            lines.add(INDENT + "direction TB");
        }

        private void closeSection() {
            lines.add(INDENT + "end");
        }

        private void node(String line) {
            lines.add(NODE_INDENT + line);
        }

        private void connect(String edge) {
            connections.add(INDENT + edge);
        }
    }
}
