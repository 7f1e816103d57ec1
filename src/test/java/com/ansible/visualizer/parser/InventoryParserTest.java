package com.ansible.visualizer.parser;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.ansible.visualizer.parser.exception.FormatException;
import com.ansible.visualizer.parser.exception.MissingResourceException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for InventoryParser (YAML and INI formats).
 */
class InventoryParserTest {

    @TempDir
    Path tempDir;

    private final InventoryParser parser = new InventoryParser();

    @Test
    void testParseYamlHosts() throws IOException {
        Path inventory = write("hosts.yml", """
                webservers:
                  hosts:
                    web1: {}
                    web2: {}
                """);

        Map<String, List<String>> groups = parser.parse(inventory);

        assertThat(groups).isEqualTo(Map.of("webservers", List.of("web1", "web2")));
    }

    @Test
    void testParseNestedYamlChildren() throws IOException {
        Path inventory = write("hosts.yml", """
                all:
                  children:
                    web:
                      hosts:
                        web1:
                    db:
                      children:
                        mysql:
                          hosts:
                            db1:
                              ansible_host: 10.0.0.5
                """);

        Map<String, List<String>> groups = parser.parse(inventory);

        assertThat(groups.keySet()).containsExactly("all", "web", "db", "mysql");
        assertThat(groups.get("all")).isEmpty();
        assertThat(groups.get("web")).containsExactly("web1");
        assertThat(groups.get("db")).isEmpty();
        assertThat(groups.get("mysql")).containsExactly("db1");
    }

    @Test
    void testYamlGroupWithoutContentIsEmpty() throws IOException {
        Path inventory = write("hosts.yml", """
                all:
                  children:
                    empty_group:
                    scalar_group: just-a-string
                """);

        Map<String, List<String>> groups = parser.parse(inventory);

        assertThat(groups.get("empty_group")).isEmpty();
        assertThat(groups.get("scalar_group")).isEmpty();
    }

    @Test
    void testParseIniIgnoresVars() throws IOException {
        Path inventory = write("hosts.ini", "[web]\nweb1\n\n[web:vars]\nport=80\n");

        Map<String, List<String>> groups = parser.parse(inventory);

        assertThat(groups).isEqualTo(Map.of("web", List.of("web1")));
    }

    @Test
    void testParseIniChildrenCommentsAndHostVars() throws IOException {
        Path inventory = write("hosts", """
                # production inventory
                [web]
                web1.example.com ansible_host=10.0.0.1 ansible_user=deploy
                web2.example.com
                ; legacy comment

                [db]
                db1.example.com

                [prod:children]
                web
                db
                cache
                """);

        Map<String, List<String>> groups = parser.parse(inventory);

        assertThat(groups.get("web")).containsExactly("web1.example.com", "web2.example.com");
        assertThat(groups.get("db")).containsExactly("db1.example.com");
        assertThat(groups.get("prod")).isEmpty();
        assertThat(groups.get("cache")).isEmpty();
    }

    @Test
    void testIniHostsBeforeFirstSectionAreIgnored() {
        Map<String, List<String>> groups = parser.parseIni(List.of("orphan", "[web]", "web1"));

        assertThat(groups).containsOnlyKeys("web");
        assertThat(groups.get("web")).containsExactly("web1");
    }

    @Test
    void testParsingTwiceYieldsSameGroups() throws IOException {
        Path inventory = write("hosts.ini", "[web]\nweb1\nweb2\n[db]\ndb1\n");

        assertThat(parser.parse(inventory)).isEqualTo(parser.parse(inventory));
    }

    @Test
    void testUndecodableInventoryIsFormatError() throws IOException {
        Path inventory = tempDir.resolve("hosts.ini");
        Files.write(inventory, new byte[] { '[', 'w', 'e', 'b', ']', '\n', (byte) 0xC3, (byte) 0x28, '\n' });

        assertThatThrownBy(() -> parser.parse(inventory))
                .isInstanceOf(FormatException.class)
                .hasMessageContaining("hosts.ini");
    }

    @Test
    void testMissingInventoryFails() {
        Path missing = tempDir.resolve("does-not-exist.yml");

        assertThatThrownBy(() -> parser.parse(missing))
                .isInstanceOf(MissingResourceException.class)
                .hasMessageContaining("does-not-exist.yml");
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }
}
