package org.netpreserve.docketcrawl.cdp.domains;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.netpreserve.docketcrawl.cdp.protocol.RPC;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;

public interface Runtime {
    Evaluate evaluate(String expression, Integer timeout, boolean returnByValue, boolean awaitPromise);

    record Evaluate(RemoteObject result, ExceptionDetails exceptionDetails) {
    }

    record RemoteObject(String type, String subtype, JsonNode value, String description) {
        public Object toJavaObject() {
            if (value == null || value.isNull()) return null;
            switch (type) {
                case "string":
                    return value.asText();
                case "boolean":
                    return value.asBoolean();
                case "number":
                    return value.isIntegralNumber() ? (Object) value.asLong() : (Object) value.asDouble();
                case "object":
                    try {
                        if (value.isArray()) {
                            return RPC.JSON.treeToValue(value, List.class);
                        } else {
                            return RPC.JSON.treeToValue(value, Map.class);
                        }
                    } catch (JsonProcessingException e) {
                        throw new UncheckedIOException(e);
                    }
                case "undefined":
                    return null;
                default:
                    throw new IllegalStateException("Don't know how to convert to Java object: " + type);
            }
        }
    }

    record ExceptionDetails(int exceptionId, String text, int lineNumber, int columnNumber, RemoteObject exception) {
        @Override
        public String toString() {
            String description = exception == null ? null : exception.description();
            return (description != null ? description : text) + " at " + lineNumber + ":" + columnNumber;
        }
    }
}
