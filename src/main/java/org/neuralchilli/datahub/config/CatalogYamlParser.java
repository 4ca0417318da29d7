package org.neuralchilli.datahub.config;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.datahub.domain.SchedulePeriod;
import org.neuralchilli.datahub.domain.Task;
import org.neuralchilli.datahub.domain.TaskPayload;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.util.*;

/**
 * Parses catalog YAML files into Task definitions.
 * A file holds either a single task or a {@code tasks:} list.
 */
@ApplicationScoped
public class CatalogYamlParser {

    static final String VIRTUAL_TYPE = "virtual";

    private final Yaml yaml = new Yaml();

    /**
     * Parse all tasks from a YAML string
     */
    public List<Task> parseTasks(String yamlContent) {
        Object data = yaml.load(yamlContent);
        return parseDocument(data);
    }

    /**
     * Parse all tasks from an InputStream
     */
    public List<Task> parseTasks(InputStream inputStream) {
        Object data = yaml.load(inputStream);
        return parseDocument(data);
    }

    @SuppressWarnings("unchecked")
    private List<Task> parseDocument(Object data) {
        if (!(data instanceof Map)) {
            throw new IllegalArgumentException("Catalog document must be a mapping");
        }
        Map<String, Object> root = (Map<String, Object>) data;

        if (!root.containsKey("tasks")) {
            return List.of(parseTaskFromMap(root));
        }

        Object tasks = root.get("tasks");
        if (!(tasks instanceof List)) {
            throw new IllegalArgumentException("'tasks' must be a list");
        }

        List<Task> result = new ArrayList<>();
        for (Object entry : (List<Object>) tasks) {
            if (!(entry instanceof Map)) {
                throw new IllegalArgumentException("Each task must be a mapping, got: " + entry);
            }
            result.add(parseTaskFromMap((Map<String, Object>) entry));
        }
        return result;
    }

    private Task parseTaskFromMap(Map<String, Object> data) {
        long id = getLong(data, "id", true, 0L);
        String name = getString(data, "name", true);
        String type = getString(data, "type", false);

        TaskPayload payload;
        if (VIRTUAL_TYPE.equalsIgnoreCase(type)) {
            payload = TaskPayload.virtual();
        } else {
            long mirrorId = getLong(data, "mirror_id", true, 0L);
            payload = TaskPayload.real(mirrorId, getString(data, "args", false));
        }

        return new Task(
                id,
                name,
                getLongSet(data, "owners"),
                payload,
                SchedulePeriod.fromString(getString(data, "period", true)),
                getBoolean(data, "valid", true),
                getBoolean(data, "removed", false),
                getParents(data, "parents"),
                getString(data, "queue", false),
                getInt(data, "priority", 0),
                getInt(data, "pending_timeout", 0),
                getInt(data, "running_timeout", 0),
                getInt(data, "retries", 0),
                getInt(data, "retry_delay", 0),
                getBoolean(data, "soft_fail", false)
        );
    }

    // Helper methods for type-safe extraction

    private String getString(Map<String, Object> map, String key, boolean required) {
        Object value = map.get(key);
        if (value == null) {
            if (required) {
                throw new IllegalArgumentException("Missing required field: " + key);
            }
            return null;
        }
        return value.toString();
    }

    private boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return Boolean.parseBoolean(value.toString());
    }

    private int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return Integer.parseInt(value.toString());
    }

    private long getLong(Map<String, Object> map, String key, boolean required, long defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            if (required) {
                throw new IllegalArgumentException("Missing required field: " + key);
            }
            return defaultValue;
        }
        return toLong(value, key);
    }

    private Set<Long> getLongSet(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (!(value instanceof Collection)) {
            return Set.of();
        }
        Set<Long> result = new LinkedHashSet<>();
        for (Object item : (Collection<?>) value) {
            result.add(toLong(item, key));
        }
        return result;
    }

    /**
     * Parent ids map to an open descriptor; the condition kind inside it is
     * checked later, when the dependency graph is built.
     */
    private Map<Long, Map<String, String>> getParents(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return Map.of();
        }

        Map<Long, Map<String, String>> result = new LinkedHashMap<>();
        if (value instanceof Collection) {
            // Shorthand: a plain list of parent ids means "success" on each
            for (Object parentId : (Collection<?>) value) {
                result.put(toLong(parentId, key), Map.of());
            }
            return result;
        }
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException("'" + key + "' must be a mapping or a list");
        }

        ((Map<?, ?>) value).forEach((parentId, descriptor) -> {
            Map<String, String> converted = new HashMap<>();
            if (descriptor instanceof Map) {
                ((Map<?, ?>) descriptor).forEach((k, v) -> {
                    if (v != null) {
                        converted.put(k.toString(), v.toString());
                    }
                });
            } else if (descriptor != null) {
                throw new IllegalArgumentException(
                        "Descriptor of parent " + parentId + " must be a mapping");
            }
            result.put(toLong(parentId, key), converted);
        });
        return result;
    }

    private long toLong(Object value, String key) {
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Field '" + key + "' expects a number, got: " + value);
        }
    }
}
