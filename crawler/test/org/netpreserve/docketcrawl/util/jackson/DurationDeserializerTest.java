package org.netpreserve.docketcrawl.util.jackson;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DurationDeserializerTest {
    record Holder(@JsonDeserialize(using = DurationDeserializer.class) Duration value) {
    }

    private static Duration read(String json) throws Exception {
        return new ObjectMapper().readValue("{\"value\":" + json + "}", Holder.class).value();
    }

    @Test
    void acceptsShortAndIsoForms() throws Exception {
        assertEquals(Duration.ofMillis(250), read("250"));
        assertEquals(Duration.ofMillis(500), read("\"500ms\""));
        assertEquals(Duration.ofSeconds(30), read("\"30s\""));
        assertEquals(Duration.ofMinutes(2), read("\"2m\""));
        assertEquals(Duration.ofHours(1), read("\"1h\""));
        assertEquals(Duration.ofSeconds(90), read("\"PT1M30S\""));
    }

    @Test
    void rejectsGarbage() {
        assertThrows(JsonMappingException.class, () -> read("\"soon\""));
    }
}
