package com.balatro.jokers.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes the versioned joker save blob (UTF-8 JSON).
 * <pre>
 * {"format_version": 2,
 *  "jokers": [{"id": "green_joker", "slot": 3, "schema_version": 1,
 *              "sell_value_bonus": 0, "state": {...}}]}
 * </pre>
 * Format 1 entries carry only {@code id} and {@code state}; the other fields default
 * (slot from position, schema version 1, no sell bonus).
 */
public final class JokerSaveCodec {
    public static final int FORMAT_VERSION = 2;

    private final ObjectMapper mapper;

    public JokerSaveCodec() {
        this(new ObjectMapper());
    }

    public JokerSaveCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    // ==================== ENCODE ====================

    public byte[] encode(List<SaveEntry> entries) throws SaveFormatException {
        ObjectNode root = mapper.createObjectNode();
        root.put("format_version", FORMAT_VERSION);
        ArrayNode jokers = root.putArray("jokers");
        for (SaveEntry entry : entries) {
            ObjectNode node = jokers.addObject();
            node.put("id", entry.id());
            node.put("slot", entry.slot());
            node.put("schema_version", entry.schemaVersion());
            node.put("sell_value_bonus", entry.sellValueBonus());
            if (entry.state() != null) {
                node.set("state", entry.state());
            } else {
                node.putNull("state");
            }
        }
        try {
            return mapper.writeValueAsBytes(root);
        } catch (IOException e) {
            throw new SaveFormatException("Could not write save: " + e.getMessage(), e);
        }
    }

    // ==================== DECODE ====================

    /**
     * Parse a blob.
     * @throws UnsupportedSaveVersionException if the format is newer than {@link #FORMAT_VERSION}
     * @throws SaveFormatException if the blob as a whole is unreadable
     */
    public DecodedSave decode(byte[] blob) throws SaveFormatException {
        JsonNode root;
        try {
            root = mapper.readTree(blob);
        } catch (IOException e) {
            throw new SaveFormatException("Save is not valid JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new SaveFormatException("Save root must be a JSON object");
        }

        JsonNode versionNode = root.get("format_version");
        if (!isInt(versionNode)) {
            throw new SaveFormatException("Save has no integer format_version");
        }
        int version = versionNode.intValue();
        if (version > FORMAT_VERSION) {
            throw new UnsupportedSaveVersionException(version, FORMAT_VERSION);
        }
        if (version < 1) {
            throw new SaveFormatException("Invalid format_version: " + version);
        }

        JsonNode jokers = root.get("jokers");
        if (jokers == null || !jokers.isArray()) {
            throw new SaveFormatException("Save has no jokers array");
        }

        List<SaveEntry> entries = new ArrayList<>();
        List<EntryFailure> failures = new ArrayList<>();
        for (int i = 0; i < jokers.size(); i++) {
            JsonNode node = jokers.get(i);
            if (!node.isObject() || !node.path("id").isTextual()) {
                failures.add(new EntryFailure(i, node.path("id").asText("?"), EntryFailure.Reason.MALFORMED_ENTRY,
                    "entry is not an object with a textual id"));
                continue;
            }
            String id = node.get("id").textValue();
            JsonNode state = node.get("state");
            if (state != null && state.isNull()) {
                state = null;
            }
            if (version == 1) {
                entries.add(new SaveEntry(i, id, i + 1, 1, 0, state));
                continue;
            }
            JsonNode bonus = node.get("sell_value_bonus");
            if (!isInt(node.get("slot")) || !isInt(node.get("schema_version")) || (bonus != null && !isInt(bonus))) {
                failures.add(new EntryFailure(i, id, EntryFailure.Reason.MALFORMED_ENTRY,
                    "slot, schema_version and sell_value_bonus must be integers"));
                continue;
            }
            entries.add(new SaveEntry(i, id,
                node.get("slot").intValue(),
                node.get("schema_version").intValue(),
                bonus != null ? bonus.intValue() : 0,
                state));
        }
        return new DecodedSave(version, entries, failures);
    }

    private static boolean isInt(JsonNode node) {
        return node != null && node.isIntegralNumber() && node.canConvertToInt();
    }
}
