package work.lcod.probe.trace;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Loads recorded traces from YAML or JSON documents with a top-level {@code trace} list.
 *
 * <pre>
 * trace:
 *   - enter: outer
 *     function: main
 *   - bind: outer
 *     name: x
 *     value: 3
 *   - exit: outer
 *     value: 7
 * </pre>
 */
public final class TraceLoader {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private TraceLoader() {}

    public static List<TraceEvent> loadFromLocalFile(Path path) {
        try (var in = Files.newInputStream(path)) {
            return parse(in);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read trace: " + path, ex);
        }
    }

    public static List<TraceEvent> loadFromResource(String resource) {
        var loader = Thread.currentThread().getContextClassLoader();
        try (var in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Trace resource not found: " + resource);
            }
            return parse(in);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read trace resource: " + resource, ex);
        }
    }

    /**
     * Parses a trace document. JSON is accepted as well since it is valid YAML.
     */
    public static List<TraceEvent> parse(InputStream in) throws IOException {
        var root = YAML_MAPPER.readTree(in);
        if (root == null || !root.hasNonNull("trace")) {
            return List.of();
        }
        var traceNode = root.get("trace");
        if (!traceNode.isArray()) {
            throw new IOException("'trace' must be a list");
        }
        var events = new ArrayList<TraceEvent>();
        int index = 0;
        for (var eventNode : traceNode) {
            events.add(toEvent(eventNode, index++));
        }
        return events;
    }

    private static TraceEvent toEvent(JsonNode node, int index) throws IOException {
        if (node == null || !node.isObject()) {
            throw new IOException("Trace event #" + index + " must be an object: " + node);
        }
        TraceEvent.Type type = null;
        String scope = null;
        for (TraceEvent.Type candidate : TraceEvent.Type.values()) {
            if (node.hasNonNull(candidate.key())) {
                if (type != null) {
                    throw new IOException("Trace event #" + index + " names both '" + type.key() + "' and '" + candidate.key() + "'");
                }
                type = candidate;
                scope = node.get(candidate.key()).asText();
            }
        }
        if (type == null) {
            throw new IOException("Trace event #" + index + " has no event type: " + node);
        }
        if (type == TraceEvent.Type.ENTER && !node.hasNonNull("function")) {
            throw new IOException("Trace event #" + index + " enters '" + scope + "' without a function");
        }
        if (type == TraceEvent.Type.BIND && !node.hasNonNull("name")) {
            throw new IOException("Trace event #" + index + " binds in '" + scope + "' without a name");
        }
        var valueField = type == TraceEvent.Type.FAIL ? "error" : "value";
        return new TraceEvent(
            type,
            scope,
            text(node, "parent"),
            text(node, "function"),
            text(node, "name"),
            node.has(valueField) ? convertNode(node.get(valueField)) : null,
            strings(node.get("tags")),
            node.has("key") ? convertNode(node.get("key")) : null,
            !node.has("overridable") || node.get("overridable").asBoolean(true)
        );
    }

    private static String text(JsonNode node, String field) {
        return node.hasNonNull(field) ? node.get(field).asText() : null;
    }

    private static List<String> strings(JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        var out = new ArrayList<String>();
        if (node.isArray()) {
            for (var item : node) {
                out.add(item.asText());
            }
        } else {
            out.add(node.asText());
        }
        return out;
    }

    private static Object convertNode(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isObject()) {
            var map = new LinkedHashMap<String, Object>();
            var fields = node.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                map.put(entry.getKey(), convertNode(entry.getValue()));
            }
            return map;
        }
        if (node.isArray()) {
            var list = new ArrayList<Object>();
            for (var item : node) {
                list.add(convertNode(item));
            }
            return list;
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        return node.asText();
    }
}
