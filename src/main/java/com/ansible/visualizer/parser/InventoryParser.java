package com.ansible.visualizer.parser;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.error.YAMLException;

import com.ansible.visualizer.parser.exception.FormatException;
import com.ansible.visualizer.parser.exception.MissingResourceException;

/**
 * Parser for inventory files.
 *
 * Tries YAML first (group -> {hosts, children} mappings, flattened so that each group
 * lists only its directly declared hosts). Falls back to the INI format when the file
 * is not valid YAML or its root is not a mapping:
 * - [group]          hosts section
 * - [group:children] child groups, registered as empty groups
 * - [group:vars]     ignored
 * - # and ; start comments
 */
public class InventoryParser {
    private static final Logger log = LoggerFactory.getLogger(InventoryParser.class);

    private static final Pattern SECTION_PATTERN = Pattern.compile("^\\[([^:\\]]+)(?::(\\w+))?\\]$");

    private static final String SECTION_HOSTS = "hosts";
    private static final String SECTION_CHILDREN = "children";

    private final YamlLoader yamlLoader;

    public InventoryParser() {
        this(new YamlLoader());
    }

    public InventoryParser(YamlLoader yamlLoader) {
        this.yamlLoader = yamlLoader;
    }

    /**
     * Parse an inventory into group name -> directly declared hosts.
     *
     * @throws FormatException          if the file is not UTF-8 text
     * @throws MissingResourceException if the file cannot be read
     */
    public Map<String, List<String>> parse(Path path) {
        log.info("Parsing inventory: {}", path);
        try {
            Object data = yamlLoader.load(path);
            if (data instanceof Map<?, ?> root && !root.isEmpty()) {
                Map<String, List<String>> groups = new LinkedHashMap<>();
                for (Map.Entry<?, ?> entry : root.entrySet()) {
                    Object content = entry.getValue() instanceof Map<?, ?> ? entry.getValue() : Map.of();
                    parseYamlGroup(groups, String.valueOf(entry.getKey()), content);
                }
                log.debug("Parsed {} groups from YAML inventory {}", groups.size(), path);
                return groups;
            }
        } catch (YAMLException e) {
            log.debug("Inventory {} is not YAML, trying INI: {}", path, e.getMessage());
        } catch (CharacterCodingException e) {
            throw new FormatException(path, e);
        } catch (IOException e) {
            throw new MissingResourceException(path, e);
        }

        try {
            return parseIni(Files.readAllLines(path, StandardCharsets.UTF_8));
        } catch (CharacterCodingException e) {
            throw new FormatException(path, e);
        } catch (IOException e) {
            throw new MissingResourceException(path, e);
        }
    }

    private void parseYamlGroup(Map<String, List<String>> groups, String groupName, Object content) {
        if (!(content instanceof Map<?, ?> group)) {
            groups.put(groupName, new ArrayList<>());
            return;
        }

        List<String> hosts = new ArrayList<>();
        if (group.get(SECTION_HOSTS) instanceof Map<?, ?> hostMap) {
            hostMap.keySet().forEach(host -> hosts.add(String.valueOf(host)));
        }
        groups.put(groupName, hosts);

        if (group.get(SECTION_CHILDREN) instanceof Map<?, ?> children) {
            for (Map.Entry<?, ?> child : children.entrySet()) {
                parseYamlGroup(groups, String.valueOf(child.getKey()), child.getValue());
            }
        }
    }

    /**
     * Line-oriented INI scan. Host lines keep only their first token;
     * trailing key=value variables are discarded.
     */
    public Map<String, List<String>> parseIni(List<String> lines) {
        Map<String, List<String>> groups = new LinkedHashMap<>();
        String currentGroup = null;
        String currentSection = SECTION_HOSTS;

        for (String line : lines) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#") || trimmed.startsWith(";")) {
                continue;
            }

            Matcher matcher = SECTION_PATTERN.matcher(trimmed);
            if (matcher.matches()) {
                currentGroup = matcher.group(1);
                currentSection = matcher.group(2) != null ? matcher.group(2) : SECTION_HOSTS;
                groups.putIfAbsent(currentGroup, new ArrayList<>());
                continue;
            }

            if (currentGroup == null) {
                continue;
            }

            String firstToken = trimmed.split("\\s+")[0];
            if (SECTION_HOSTS.equals(currentSection)) {
                groups.get(currentGroup).add(firstToken);
            } else if (SECTION_CHILDREN.equals(currentSection)) {
                groups.putIfAbsent(firstToken, new ArrayList<>());
            }
        }

        return groups;
    }
}
