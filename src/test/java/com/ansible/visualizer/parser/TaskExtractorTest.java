package com.ansible.visualizer.parser;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.ansible.visualizer.core.context.ToolDiagnostics;
import com.ansible.visualizer.model.BlockNode;
import com.ansible.visualizer.model.IncludeNode;
import com.ansible.visualizer.model.PlainTaskNode;
import com.ansible.visualizer.model.RoleRefNode;
import com.ansible.visualizer.model.TaskMetadata;
import com.ansible.visualizer.model.TaskNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for TaskExtractor dispatch and normalization.
 */
class TaskExtractorTest {

    @TempDir
    Path repoRoot;

    private final YamlLoader yamlLoader = new YamlLoader();
    private ToolDiagnostics diagnostics;
    private TaskExtractor extractor;
    private Path playbook;

    @BeforeEach
    void setUp() throws IOException {
        diagnostics = new ToolDiagnostics();
        extractor = new TaskExtractor(repoRoot, yamlLoader, diagnostics);
        Files.createDirectories(repoRoot.resolve("playbooks"));
        playbook = repoRoot.resolve("playbooks/site.yml");
    }

    @Test
    void testPlainTaskDefaults() {
        TaskNode node = extract("apt: name=nginx");

        assertThat(node).isInstanceOf(PlainTaskNode.class);
        assertThat(node.getName()).isEqualTo(TaskMetadata.DEFAULT_NAME);
        assertThat(node.getWhen()).isEmpty();
        assertThat(node.getTags()).isEmpty();
        assertThat(node.getNotify()).isEmpty();
        assertThat(node.isBecome()).isFalse();
        assertThat(node.getBecomeUser()).isNull();
    }

    @Test
    void testScalarsNormalizeToLists() {
        TaskNode node = extract("""
                name: Install nginx
                apt: name=nginx
                when: ansible_os_family == 'Debian'
                tags: web
                notify: Restart nginx
                """);

        assertThat(node.getWhen()).containsExactly("ansible_os_family == 'Debian'");
        assertThat(node.getTags()).containsExactly("web");
        assertThat(node.getNotify()).containsExactly("Restart nginx");
    }

    @Test
    void testListValuesAreKept() {
        TaskNode node = extract("""
                name: Configure
                template: src=a dest=b
                when: [a is defined, b | bool]
                tags: [web, config]
                notify: [X, Y]
                """);

        assertThat(node.getWhen()).containsExactly("a is defined", "b | bool");
        assertThat(node.getTags()).containsExactly("web", "config");
        assertThat(node.getNotify()).containsExactly("X", "Y");
    }

    @Test
    void testBecomeOnlyRecordedWhenTruthy() {
        TaskNode privileged = extract("""
                name: As postgres
                command: psql
                become: yes
                become_user: postgres
                """);
        TaskNode unprivileged = extract("""
                name: Plain
                command: id
                become: false
                become_user: postgres
                """);

        assertThat(privileged.isBecome()).isTrue();
        assertThat(privileged.getBecomeUser()).isEqualTo("postgres");
        assertThat(unprivileged.isBecome()).isFalse();
        assertThat(unprivileged.getBecomeUser()).isNull();
    }

    @Test
    void testBlockChildrenOrder() {
        TaskNode node = extract("""
                name: Error handling
                when: deploy_enabled
                tags: deploy
                become: true
                block:
                  - name: A
                    command: a
                  - name: B
                    command: b
                rescue:
                  - name: C
                    command: c
                always:
                  - name: D
                    command: d
                """);

        assertThat(node).isInstanceOf(BlockNode.class);
        BlockNode block = (BlockNode) node;
        assertThat(block.getChildren()).extracting(TaskNode::getName).containsExactly("A", "B", "C", "D");
        assertThat(block.getWhen()).containsExactly("deploy_enabled");
        assertThat(block.getTags()).containsExactly("deploy");
        assertThat(block.isBecome()).isTrue();
        assertThat(block.getChildren()).allSatisfy(child -> {
            assertThat(child.getWhen()).isEmpty();
            assertThat(child.getTags()).isEmpty();
            assertThat(child.isBecome()).isFalse();
        });
    }

    @Test
    void testBlockTakesPriorityOverRoleInclude() {
        TaskNode node = extract("""
                block:
                  - include_role:
                      name: nested
                include_role: ignored
                """);

        assertThat(node).isInstanceOf(BlockNode.class);
        assertThat(((BlockNode) node).getChildren().get(0)).isInstanceOf(RoleRefNode.class);
    }

    @Test
    void testRoleReferences() {
        TaskNode mapping = extract("""
                name: Apply nginx
                include_role:
                  name: nginx
                """);
        TaskNode scalar = extract("import_role: common");
        TaskNode qualified = extract("""
                ansible.builtin.include_role:
                  name: monitoring
                """);

        assertThat(mapping).isInstanceOf(RoleRefNode.class);
        assertThat(((RoleRefNode) mapping).getRoleName()).isEqualTo("nginx");
        assertThat(((RoleRefNode) scalar).getRoleName()).isEqualTo("common");
        assertThat(((RoleRefNode) qualified).getRoleName()).isEqualTo("monitoring");
    }

    @Test
    void testIncludeResolvedRelativeToIncludingFile() throws IOException {
        Files.writeString(repoRoot.resolve("playbooks/extra.yml"), """
                - name: Subtask 1
                  command: one
                - name: Subtask 2
                  command: two
                """);

        TaskNode node = extract("""
                name: Include extra
                include_tasks: extra.yml
                """);

        assertThat(node).isInstanceOf(IncludeNode.class);
        IncludeNode include = (IncludeNode) node;
        assertThat(include.getFile()).isEqualTo("extra.yml");
        assertThat(include.getIncluded()).extracting(TaskNode::getName).containsExactly("Subtask 1", "Subtask 2");
        assertThat(diagnostics.getWarnings()).isEmpty();
    }

    @Test
    void testIncludeFallsBackToRepoRootAndAcceptsFileMapping() throws IOException {
        Files.createDirectories(repoRoot.resolve("tasks"));
        Files.writeString(repoRoot.resolve("tasks/common.yml"), """
                - name: Shared step
                  debug: msg=hi
                """);

        TaskNode node = extract("""
                import_tasks:
                  file: tasks/common.yml
                """);

        assertThat(((IncludeNode) node).getIncluded()).extracting(TaskNode::getName).containsExactly("Shared step");
    }

    @Test
    void testNestedIncludeResolvesRelativeToIncludedFile() throws IOException {
        Files.createDirectories(repoRoot.resolve("playbooks/tasks"));
        Files.writeString(repoRoot.resolve("playbooks/tasks/outer.yml"), """
                - include_tasks: inner.yml
                """);
        Files.writeString(repoRoot.resolve("playbooks/tasks/inner.yml"), """
                - name: Innermost
                  command: x
                """);

        IncludeNode outer = (IncludeNode) extract("include_tasks: tasks/outer.yml");

        IncludeNode inner = (IncludeNode) outer.getIncluded().get(0);
        assertThat(inner.getIncluded()).extracting(TaskNode::getName).containsExactly("Innermost");
    }

    @Test
    void testMissingIncludeIsEmptyAndWarns() {
        TaskNode node = extract("include_tasks: nowhere.yml");

        assertThat(node).isInstanceOf(IncludeNode.class);
        assertThat(((IncludeNode) node).getIncluded()).isEmpty();
        assertThat(diagnostics.getWarnings()).anyMatch(w -> w.contains("nowhere.yml"));
    }

    @Test
    void testSelfIncludingFileTerminates() throws IOException {
        Files.writeString(repoRoot.resolve("playbooks/loop.yml"), """
                - name: Step
                  command: x
                - include_tasks: loop.yml
                """);

        IncludeNode node = (IncludeNode) extract("include_tasks: loop.yml");

        assertThat(node.getIncluded()).hasSize(2);
        IncludeNode nested = (IncludeNode) node.getIncluded().get(1);
        assertThat(nested.getIncluded()).isEmpty();
        assertThat(diagnostics.getInfos()).anyMatch(i -> i.contains("Include cycle"));
    }

    @Test
    void testExtractAllSkipsNonMappings() {
        List<?> raw = (List<?>) yamlLoader.load("""
                - name: real
                  command: x
                - just a string
                - 42
                """);

        List<TaskNode> nodes = extractor.extractAll(raw, playbook);

        assertThat(nodes).extracting(TaskNode::getName).containsExactly("real");
    }

    private TaskNode extract(String yaml) {
        Map<?, ?> raw = (Map<?, ?>) yamlLoader.load(yaml);
        return extractor.extract(raw, playbook);
    }
}
