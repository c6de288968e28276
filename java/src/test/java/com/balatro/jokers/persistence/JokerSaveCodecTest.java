package com.balatro.jokers.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for JokerSaveCodec blob handling.
 */
class JokerSaveCodecTest {

    private final JokerSaveCodec codec = new JokerSaveCodec();

    private static byte[] utf8(String json) {
        return json.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void testEncodeWritesCurrentFormat() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        byte[] blob = codec.encode(List.of(
            new SaveEntry(0, "green_joker", 3, 1, 2, mapper.readTree("{\"values\":{\"value\":4}}")),
            new SaveEntry(1, "joker", 4, 1, 0, null)));

        DecodedSave decoded = codec.decode(blob);

        assertEquals(JokerSaveCodec.FORMAT_VERSION, decoded.formatVersion());
        assertTrue(decoded.failures().isEmpty());
        assertEquals(2, decoded.entries().size());
        SaveEntry green = decoded.entries().get(0);
        assertEquals("green_joker", green.id());
        assertEquals(3, green.slot());
        assertEquals(2, green.sellValueBonus());
        assertEquals(4, green.state().path("values").path("value").asInt());
        assertNull(decoded.entries().get(1).state());
    }

    @Test
    void testFormatOneEntriesGetDefaults() throws Exception {
        DecodedSave decoded = codec.decode(utf8(
            "{\"format_version\":1,\"jokers\":[{\"id\":\"joker\",\"state\":null},{\"id\":\"green_joker\"}]}"));

        assertEquals(1, decoded.formatVersion());
        List<SaveEntry> entries = decoded.entries();
        assertEquals(1, entries.get(0).slot());
        assertEquals(2, entries.get(1).slot());
        assertEquals(1, entries.get(1).schemaVersion());
        assertEquals(0, entries.get(1).sellValueBonus());
        assertEquals(1, entries.get(1).position());
    }

    @Test
    void testNewerFormatIsRejected() {
        UnsupportedSaveVersionException e = assertThrows(UnsupportedSaveVersionException.class,
            () -> codec.decode(utf8("{\"format_version\":3,\"jokers\":[]}")));
        assertEquals(3, e.getFound());
        assertEquals(JokerSaveCodec.FORMAT_VERSION, e.getSupported());
    }

    @Test
    void testUnreadableBlobsAreRejected() {
        assertThrows(SaveFormatException.class, () -> codec.decode(utf8("not json at all")));
        assertThrows(SaveFormatException.class, () -> codec.decode(utf8("[1, 2, 3]")));
        assertThrows(SaveFormatException.class, () -> codec.decode(utf8("{\"jokers\":[]}")));
        assertThrows(SaveFormatException.class, () -> codec.decode(utf8("{\"format_version\":0,\"jokers\":[]}")));
        assertThrows(SaveFormatException.class, () -> codec.decode(utf8("{\"format_version\":2}")));
        assertThrows(SaveFormatException.class, () -> codec.decode(new byte[0]));
    }

    @Test
    void testMalformedEntriesAreReportedIndividually() throws Exception {
        DecodedSave decoded = codec.decode(utf8("{\"format_version\":2,\"jokers\":["
            + "{\"id\":\"joker\",\"slot\":1,\"schema_version\":1},"
            + "42,"
            + "{\"id\":\"green_joker\",\"slot\":\"two\",\"schema_version\":1},"
            + "{\"id\":\"egg\",\"slot\":4,\"schema_version\":1,\"sell_value_bonus\":6}"
            + "]}"));

        assertEquals(2, decoded.entries().size());
        assertEquals(2, decoded.failures().size());
        EntryFailure notObject = decoded.failures().get(0);
        assertEquals(1, notObject.position());
        assertEquals(EntryFailure.Reason.MALFORMED_ENTRY, notObject.reason());
        assertEquals("green_joker", decoded.failures().get(1).identifier());
        assertEquals(6, decoded.entries().get(1).sellValueBonus());
        assertEquals(3, decoded.entries().get(1).position());
    }

    @Test
    void testFractionalNumbersAreNotTruncated() throws Exception {
        assertThrows(SaveFormatException.class,
            () -> codec.decode(utf8("{\"format_version\":2.5,\"jokers\":[]}")));
        assertThrows(SaveFormatException.class,
            () -> codec.decode(utf8("{\"format_version\":\"2\",\"jokers\":[]}")));

        DecodedSave decoded = codec.decode(utf8("{\"format_version\":2,\"jokers\":["
            + "{\"id\":\"joker\",\"slot\":3.7,\"schema_version\":1},"
            + "{\"id\":\"egg\",\"slot\":2,\"schema_version\":1.0},"
            + "{\"id\":\"egg\",\"slot\":3,\"schema_version\":1,\"sell_value_bonus\":1.5},"
            + "{\"id\":\"joker\",\"slot\":4,\"schema_version\":1}"
            + "]}"));

        assertEquals(1, decoded.entries().size());
        assertEquals(4, decoded.entries().get(0).slot());
        assertEquals(List.of(0, 1, 2), decoded.failures().stream().map(EntryFailure::position).toList());
        for (EntryFailure failure : decoded.failures()) {
            assertEquals(EntryFailure.Reason.MALFORMED_ENTRY, failure.reason());
        }
    }
}
