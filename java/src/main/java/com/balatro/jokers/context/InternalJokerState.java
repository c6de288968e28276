package com.balatro.jokers.context;

import com.balatro.jokers.joker.JokerId;
import com.balatro.jokers.joker.StateDeserializeException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Generic per-instance storage for advanced jokers: named integer counters,
 * named decimal values, boolean flags and a free-form JSON object.
 * <p>
 * Serialized as {@code {"version":n,"counters":{},"values":{},"flags":{},"data":{}}}.
 * Sections missing from older payloads default to empty.
 */
public final class InternalJokerState {
    private final Map<String, Long> counters = new TreeMap<>();
    private final Map<String, Double> values = new TreeMap<>();
    private final Map<String, Boolean> flags = new TreeMap<>();
    private ObjectNode data = JsonNodeFactory.instance.objectNode();
    private int version;

    public InternalJokerState() {
        this(1);
    }

    public InternalJokerState(int version) {
        this.version = version;
    }

    // ==================== COUNTERS ====================

    public long counter(String name) {
        return counters.getOrDefault(name, 0L);
    }

    public void setCounter(String name, long value) {
        counters.put(name, value);
    }

    public long increment(String name, long delta) {
        long updated = counter(name) + delta;
        counters.put(name, updated);
        return updated;
    }

    // ==================== VALUES ====================

    public double value(String name, double defaultValue) {
        return values.getOrDefault(name, defaultValue);
    }

    public void setValue(String name, double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("value '" + name + "' must be finite: " + value);
        }
        values.put(name, value);
    }

    public boolean hasValue(String name) {
        return values.containsKey(name);
    }

    // ==================== FLAGS ====================

    public boolean flag(String name) {
        return flags.getOrDefault(name, false);
    }

    public void setFlag(String name, boolean value) {
        flags.put(name, value);
    }

    // ==================== DATA ====================

    public ObjectNode data() {
        return data;
    }

    public int version() {
        return version;
    }

    public InternalJokerState copy() {
        InternalJokerState copy = new InternalJokerState(version);
        copy.counters.putAll(counters);
        copy.values.putAll(values);
        copy.flags.putAll(flags);
        copy.data = data.deepCopy();
        return copy;
    }

    // ==================== JSON ====================

    public ObjectNode toJson() {
        JsonNodeFactory f = JsonNodeFactory.instance;
        ObjectNode root = f.objectNode();
        root.put("version", version);
        ObjectNode c = root.putObject("counters");
        counters.forEach(c::put);
        ObjectNode v = root.putObject("values");
        values.forEach(v::put);
        ObjectNode fl = root.putObject("flags");
        flags.forEach(fl::put);
        root.set("data", data.deepCopy());
        return root;
    }

    /**
     * Parse a payload written by {@link #toJson()}. Never partially applies: on any
     * error nothing is returned and the caller keeps its previous state.
     */
    public static InternalJokerState fromJson(JokerId owner, JsonNode node) throws StateDeserializeException {
        if (node == null || !node.isObject()) {
            throw new StateDeserializeException(owner, "state must be a JSON object");
        }
        JsonNode versionNode = node.get("version");
        int version = 1;
        if (versionNode != null) {
            if (!versionNode.canConvertToInt() || !versionNode.isIntegralNumber()) {
                throw new StateDeserializeException(owner, "'version' must be an integer");
            }
            version = versionNode.intValue();
        }
        InternalJokerState state = new InternalJokerState(version);

        for (Map.Entry<String, JsonNode> e : fields(owner, node, "counters")) {
            if (!e.getValue().isIntegralNumber() || !e.getValue().canConvertToLong()) {
                throw new StateDeserializeException(owner, "counter '" + e.getKey() + "' must be an integer");
            }
            state.counters.put(e.getKey(), e.getValue().longValue());
        }
        for (Map.Entry<String, JsonNode> e : fields(owner, node, "values")) {
            if (!e.getValue().isNumber() || !Double.isFinite(e.getValue().doubleValue())) {
                throw new StateDeserializeException(owner, "value '" + e.getKey() + "' must be a finite number");
            }
            state.values.put(e.getKey(), e.getValue().doubleValue());
        }
        for (Map.Entry<String, JsonNode> e : fields(owner, node, "flags")) {
            if (!e.getValue().isBoolean()) {
                throw new StateDeserializeException(owner, "flag '" + e.getKey() + "' must be a boolean");
            }
            state.flags.put(e.getKey(), e.getValue().booleanValue());
        }
        JsonNode data = node.get("data");
        if (data != null && !data.isNull()) {
            if (!data.isObject()) {
                throw new StateDeserializeException(owner, "'data' must be an object");
            }
            state.data = ((ObjectNode) data).deepCopy();
        }
        return state;
    }

    private static Iterable<Map.Entry<String, JsonNode>> fields(JokerId owner, JsonNode root, String section)
            throws StateDeserializeException {
        JsonNode node = root.get(section);
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isObject()) {
            throw new StateDeserializeException(owner, "'" + section + "' must be an object");
        }
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        return () -> it;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InternalJokerState)) return false;
        InternalJokerState that = (InternalJokerState) o;
        return version == that.version
            && counters.equals(that.counters)
            && values.equals(that.values)
            && flags.equals(that.flags)
            && data.equals(that.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, counters, values, flags, data);
    }

    @Override
    public String toString() {
        return toJson().toString();
    }
}
