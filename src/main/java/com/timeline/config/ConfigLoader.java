package com.timeline.config;

import com.timeline.exception.ConfigurationException;
import com.timeline.model.AnchorKind;
import com.timeline.model.TaskTemplate;
import com.timeline.rule.DateRuleEntry;
import com.timeline.rule.DateRuleTable;
import com.timeline.rule.DateShift;
import com.timeline.rule.RuleModifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Loads timeline configuration from YAML files.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static SchedulingConfig load(String path) {
        log.info("Loading timeline configuration from: {}", path);

        Resource resource = getResource(path);
        if (!resource.exists()) {
            throw new ConfigurationException("Configuration file not found: " + path);
        }
        try (InputStream inputStream = resource.getInputStream()) {
            return parseYaml(inputStream);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    static SchedulingConfig parseYaml(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Object loaded = yaml.load(inputStream);

        if (loaded == null) {
            throw new ConfigurationException("Configuration file is empty");
        }
        Map<String, Object> root = asMap(loaded, "configuration root");

        // The timeline section may sit at the root or under a 'timeline' key
        Map<String, Object> config = root.containsKey("timeline")
                ? asMap(root.get("timeline"), "'timeline'")
                : root;

        String name = getString(config, "name", "default");
        String version = getString(config, "version", "1.0");

        DateRuleTable dateRules = parseDateRules(
                getMapList(config, "date-rules", "'date-rules'"),
                getString(config, "ongoing-keyword", DateRuleTable.DEFAULT_ONGOING));
        List<TaskTemplate> templates = parseTaskTemplates(
                getMapList(config, "task-templates", "'task-templates'"));

        log.info("Loaded timeline configuration: {} v{} with {} date rule groups, {} task templates",
                name, version, dateRules.entries().size(), templates.size());

        return new SchedulingConfig(name, version, dateRules, templates);
    }

    private static DateRuleTable parseDateRules(List<Map<String, Object>> list, String ongoing) {
        if (list == null || list.isEmpty()) {
            log.warn("No date-rules configured, using built-in vocabulary");
            return new DateRuleTable(DateRuleTable.defaults().entries(), ongoing);
        }

        List<DateRuleEntry> entries = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (int i = 0; i < list.size(); i++) {
            DateRuleEntry entry = parseDateRule(list.get(i), i);
            if (!names.add(entry.name())) {
                throw new ConfigurationException("Duplicate date rule name '" + entry.name() + "'");
            }
            entries.add(entry);
        }
        return new DateRuleTable(entries, ongoing);
    }

    private static DateRuleEntry parseDateRule(Map<String, Object> map, int position) {
        String name = getString(map, "name", "rule-" + position);

        String anchorStr = getString(map, "anchor", null);
        if (anchorStr == null) {
            throw new ConfigurationException("Date rule '" + name + "' requires an anchor");
        }
        AnchorKind anchor;
        try {
            anchor = AnchorKind.valueOf(anchorStr.toUpperCase(Locale.ROOT).replace("-", "_"));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Date rule '" + name + "' has unknown anchor '" + anchorStr + "'", e);
        }

        List<String> keywords = getStringList(map, "keywords");
        if (keywords.isEmpty()) {
            throw new ConfigurationException("Date rule '" + name + "' requires at least one keyword");
        }

        List<Map<String, Object>> modifierList =
                getMapList(map, "modifiers", "modifiers of date rule '" + name + "'");
        if (modifierList == null || modifierList.isEmpty()) {
            throw new ConfigurationException("Date rule '" + name + "' requires at least one modifier");
        }
        List<RuleModifier> modifiers = new ArrayList<>();
        for (Map<String, Object> modifierMap : modifierList) {
            String shiftStr = getString(modifierMap, "shift", null);
            if (shiftStr == null) {
                throw new ConfigurationException("Modifier of date rule '" + name + "' requires a shift");
            }
            DateShift shift;
            try {
                shift = DateShift.parse(shiftStr);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Date rule '" + name + "' has unknown shift '" + shiftStr + "'", e);
            }
            modifiers.add(new RuleModifier(getString(modifierMap, "when", null), shift));
        }

        log.debug("Parsed date rule: name={}, anchor={}, keywords={}, modifiers={}",
                name, anchor, keywords, modifiers);
        return new DateRuleEntry(name, anchor, keywords, modifiers);
    }

    private static List<TaskTemplate> parseTaskTemplates(List<Map<String, Object>> list) {
        if (list == null) {
            return List.of();
        }
        List<TaskTemplate> templates = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < list.size(); i++) {
            Map<String, Object> map = list.get(i);
            String id = getString(map, "id", null);
            if (id == null || id.isBlank()) {
                throw new ConfigurationException("Task template at position " + i + " requires an id");
            }
            if (!ids.add(id)) {
                throw new ConfigurationException("Duplicate task template id '" + id + "'");
            }
            templates.add(new TaskTemplate(
                    id,
                    getString(map, "quant-qual", null),
                    getString(map, "phase", null),
                    getString(map, "task", null),
                    getString(map, "date-notes", null),
                    getString(map, "role", null),
                    getString(map, "notes", null)
            ));
        }
        return templates;
    }

    // Helper methods

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value, String what) {
        if (!(value instanceof Map)) {
            throw new ConfigurationException(what + " must be a mapping, got: " + value);
        }
        return (Map<String, Object>) value;
    }

    private static List<Map<String, Object>> getMapList(Map<String, Object> map, String key, String what) {
        Object value = map.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof List<?> list)) {
            throw new ConfigurationException(what + " must be a list, got: " + value);
        }
        List<Map<String, Object>> maps = new ArrayList<>(list.size());
        for (Object item : list) {
            maps.add(asMap(item, "Entry of " + what));
        }
        return maps;
    }

    private static List<String> getStringList(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return List.of();
        }
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of(value.toString());
    }
}
