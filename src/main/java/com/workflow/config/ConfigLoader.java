package com.workflow.config;

import com.workflow.command.CommentEventMapping;
import com.workflow.command.CommentEventTable;
import com.workflow.exception.ConfigurationException;
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
import java.util.Map;
import java.util.Set;

/**
 * Loads the comment event table from YAML files.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {
    }

    /**
     * Load the comment event table from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the event table file
     * @return Loaded event table
     */
    public static CommentEventTable loadCommentEvents(String path) {
        log.info("Loading comment event table from: {}", path);

        Resource resource = getResource(path);
        try (InputStream inputStream = resource.getInputStream()) {
            return parseYaml(inputStream);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load comment event table from: " + path, e);
        }
    }

    /**
     * Parse a comment event table from a YAML stream.
     */
    public static CommentEventTable loadCommentEvents(InputStream inputStream) {
        return parseYaml(inputStream);
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    private static CommentEventTable parseYaml(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Object loaded = yaml.load(inputStream);

        if (loaded == null) {
            throw new ConfigurationException("Comment event table is empty");
        }

        // Entries may sit at the root or under 'comment-events'
        Object entries = loaded;
        if (loaded instanceof Map<?, ?> root) {
            entries = root.get("comment-events");
        }
        if (!(entries instanceof List<?> list) || list.isEmpty()) {
            throw new ConfigurationException("Comment event table must contain a non-empty 'comment-events' list");
        }

        List<CommentEventMapping> mappings = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < list.size(); i++) {
            Object item = list.get(i);
            if (!(item instanceof Map<?, ?>)) {
                throw new ConfigurationException("Comment event entry " + i + " must be a mapping");
            }
            CommentEventMapping mapping = parseMapping((Map<String, Object>) item, i);
            if (!seen.add(mapping.eventName())) {
                throw new ConfigurationException("Duplicate comment event '" + mapping.eventName() + "'");
            }
            mappings.add(mapping);
            log.debug("Parsed comment event: name={}, types={}, bodyProperty={}",
                    mapping.eventName(), mapping.types(), mapping.bodyProperty());
        }

        log.info("Loaded comment event table with {} events", mappings.size());
        return new CommentEventTable(mappings);
    }

    private static CommentEventMapping parseMapping(Map<String, Object> map, int index) {
        String eventName = getString(map, "event-name", null);
        if (eventName == null || eventName.isBlank()) {
            throw new ConfigurationException("Comment event entry " + index + " has no event-name");
        }
        String bodyProperty = getString(map, "body-property", null);
        if (bodyProperty == null || bodyProperty.isBlank()) {
            throw new ConfigurationException("Comment event '" + eventName + "' has no body-property");
        }

        boolean prComment = getBoolean(map, "pr-comment", false);
        boolean issueComment = getBoolean(map, "issue-comment", false);
        if (prComment && issueComment) {
            throw new ConfigurationException("Comment event '" + eventName
                    + "' cannot be restricted to both issues and pull requests");
        }

        List<String> types = new ArrayList<>();
        Object typesValue = map.get("types");
        if (typesValue instanceof List<?> typeList) {
            for (Object type : typeList) {
                types.add(type.toString());
            }
        } else if (typesValue != null) {
            types.add(typesValue.toString());
        }

        return new CommentEventMapping(eventName, types, prComment, issueComment, bodyProperty);
    }

    // Helper methods

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString());
    }
}
