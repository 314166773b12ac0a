package org.netpreserve.docketcrawl.util.jackson;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads command-line arguments given either as a list or as a single string split like a shell would,
 * so "--proxy-server='socks://127.0.0.1:1080' --lang=ru" becomes two arguments.
 */
public class ArgumentListDeserializer extends JsonDeserializer<List<String>> {
    @Override
    public List<String> deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException, JacksonException {
        JsonNode node = jsonParser.getCodec().readTree(jsonParser);
        if (node.isTextual()) {
            return split(node.asText());
        } else if (node.isArray()) {
            List<String> arguments = new ArrayList<>();
            for (JsonNode element : node) {
                arguments.add(element.asText());
            }
            return arguments;
        } else if (node.isNull()) {
            return List.of();
        }
        throw new JsonMappingException(jsonParser, "Invalid argument list: " + node.asText(null) + " (expected string or array of strings)");
    }

    static List<String> split(String commandLine) throws IOException {
        List<String> arguments = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char activeQuote = 0;
        boolean started = false;

        for (int i = 0; i < commandLine.length(); i++) {
            char c = commandLine.charAt(i);
            if (activeQuote != 0) {
                if (c == activeQuote) {
                    activeQuote = 0;
                } else {
                    current.append(c);
                }
            } else if (c == '\'' || c == '"') {
                activeQuote = c;
                started = true;
            } else if (Character.isWhitespace(c)) {
                if (started) {
                    arguments.add(current.toString());
                    current.setLength(0);
                    started = false;
                }
            } else {
                current.append(c);
                started = true;
            }
        }
        if (activeQuote != 0) throw new IOException("Unterminated quote in: \"" + commandLine + "\"");
        if (started) arguments.add(current.toString());
        return arguments;
    }
}
