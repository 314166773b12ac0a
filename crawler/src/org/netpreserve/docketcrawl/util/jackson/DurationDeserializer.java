package org.netpreserve.docketcrawl.util.jackson;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;

import java.io.IOException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Reads durations written as "500ms", "30s", "2m", "1h", ISO-8601 ("PT30S") or a plain number of milliseconds.
 */
public class DurationDeserializer extends JsonDeserializer<Duration> {
    @Override
    public Duration deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException, JacksonException {
        if (jsonParser.currentToken().isNumeric()) return Duration.ofMillis(jsonParser.getLongValue());
        String text = jsonParser.getText().trim().toUpperCase(Locale.ROOT);
        try {
            if (text.startsWith("P")) return Duration.parse(text);
            if (text.endsWith("MS")) return Duration.ofMillis(Long.parseLong(text.substring(0, text.length() - 2).trim()));
            return Duration.parse("PT" + text.replace(" ", ""));
        } catch (DateTimeParseException | NumberFormatException e) {
            throw new JsonMappingException(jsonParser, "Invalid duration: " + jsonParser.getText(), e);
        }
    }
}
