package com.ansible.visualizer.parser;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.ansible.visualizer.core.context.ToolDiagnostics;
import com.ansible.visualizer.model.Play;
import com.ansible.visualizer.model.Playbook;
import com.ansible.visualizer.model.RoleRefNode;
import com.ansible.visualizer.model.TaskNode;
import com.ansible.visualizer.parser.exception.FormatException;
import com.ansible.visualizer.parser.exception.MissingResourceException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for PlaybookParser.
 */
class PlaybookParserTest {

    @TempDir
    Path repoRoot;

    private PlaybookParser parser;
    private ToolDiagnostics diagnostics;

    @BeforeEach
    void setUp() {
        parser = new PlaybookParser(repoRoot);
        diagnostics = new ToolDiagnostics();
    }

    @Test
    void testParsePlayWithAllSections() throws IOException {
        Path path = write("site.yml", """
                - name: Web servers
                  hosts: webservers
                  become: true
                  become_user: admin
                  tags: [web, setup]
                  roles:
                    - common
                    - role: nginx
                    - name: monitoring
                  pre_tasks:
                    - name: Pre
                      command: pre
                  tasks:
                    - name: Main
                      command: main
                      notify: Restart nginx
                    - include_role:
                        name: app
                  post_tasks:
                    - name: Post
                      command: post
                  handlers:
                    - name: Restart nginx
                      service: name=nginx state=restarted
                    - service: name=app state=restarted
                """);

        Playbook playbook = parser.parse(path, diagnostics);

        assertThat(playbook.getName()).isEqualTo("site.yml");
        assertThat(playbook.getPath()).isEqualTo(path.toAbsolutePath().normalize());
        assertThat(playbook.getPlays()).hasSize(1);

        Play play = playbook.getPlays().get(0);
        assertThat(play.getHosts()).isEqualTo("webservers");
        assertThat(play.isBecome()).isTrue();
        assertThat(play.getBecomeUser()).isEqualTo("admin");
        assertThat(play.getTags()).containsExactly("web", "setup");
        assertThat(play.getRoles()).containsExactly("common", "nginx", "monitoring");
        assertThat(play.getTasks()).extracting(TaskNode::getName)
                .containsExactly("Pre", "Main", "unnamed_task", "Post");
        assertThat(play.getTasks().get(2)).isInstanceOf(RoleRefNode.class);
        assertThat(play.getHandlers()).containsExactly("Restart nginx", "unnamed_handler");
        assertThat(diagnostics.getWarnings()).isEmpty();
    }

    @Test
    void testPlayWithoutHostsOrSections() throws IOException {
        Path path = write("minimal.yml", """
                - name: Nothing to do
                  gather_facts: false
                """);

        Play play = parser.parse(path, diagnostics).getPlays().get(0);

        assertThat(play.getHosts()).isNull();
        assertThat(play.isBecome()).isFalse();
        assertThat(play.getRoles()).isEmpty();
        assertThat(play.getTasks()).isEmpty();
        assertThat(play.getHandlers()).isEmpty();
    }

    @Test
    void testImportPlaybookResolvedRelativeToPlaybook() throws IOException {
        Files.createDirectories(repoRoot.resolve("playbooks"));
        write("playbooks/shared.yml", "- hosts: all\n");
        Path path = write("playbooks/site.yml", """
                - import_playbook: shared.yml
                - ansible.builtin.import_playbook: missing.yml
                - hosts: web
                  tasks: []
                """);

        Playbook playbook = parser.parse(path, diagnostics);

        assertThat(playbook.getImportedPlaybooks())
                .containsExactly(repoRoot.resolve("playbooks/shared.yml").toAbsolutePath().normalize());
        assertThat(playbook.getPlays()).extracting(Play::getHosts).containsExactly("web");
        assertThat(diagnostics.getWarnings()).anyMatch(w -> w.contains("missing.yml"));
    }

    @Test
    void testEmptyPlaybookWarns() throws IOException {
        Path path = write("empty.yml", "");

        Playbook playbook = parser.parse(path, diagnostics);

        assertThat(playbook.getPlays()).isEmpty();
        assertThat(playbook.getImportedPlaybooks()).isEmpty();
        assertThat(diagnostics.getWarnings()).hasSize(1);
    }

    @Test
    void testMappingRootIsNotAPlaybook() throws IOException {
        Path path = write("vars.yml", "key: value\n");

        Playbook playbook = parser.parse(path, diagnostics);

        assertThat(playbook.getPlays()).isEmpty();
        assertThat(diagnostics.getWarnings()).anyMatch(w -> w.contains("vars.yml"));
    }

    @Test
    void testMalformedYamlFails() throws IOException {
        Path path = write("broken.yml", """
                - name: Broken
                  hosts: [unclosed
                """);

        assertThatThrownBy(() -> parser.parse(path, diagnostics))
                .isInstanceOf(FormatException.class)
                .satisfies(e -> assertThat(((FormatException) e).getPath())
                        .isEqualTo(path.toAbsolutePath().normalize()));
    }

    @Test
    void testUndecodablePlaybookIsFormatError() throws IOException {
        Path path = repoRoot.resolve("latin1.yml");
        Files.write(path, new byte[] { '-', ' ', 'h', 'o', 's', 't', 's', ':', ' ', (byte) 0xE9, '\n' });

        assertThatThrownBy(() -> parser.parse(path, diagnostics))
                .isInstanceOf(FormatException.class);
    }

    @Test
    void testMissingPlaybookFails() {
        assertThatThrownBy(() -> parser.parse(repoRoot.resolve("nope.yml"), diagnostics))
                .isInstanceOf(MissingResourceException.class);
    }

    private Path write(String name, String content) throws IOException {
        Path file = repoRoot.resolve(name);
        Files.writeString(file, content);
        return file;
    }
}
