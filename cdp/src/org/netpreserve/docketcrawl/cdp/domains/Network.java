package org.netpreserve.docketcrawl.cdp.domains;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import java.util.Objects;

/**
 * Network domain types shared with the Fetch domain.
 */
public interface Network {

    class ResponseBody {
        private final byte[] body;

        @JsonCreator
        public ResponseBody(@JsonProperty("body") String body, @JsonProperty("base64Encoded") boolean base64Encoded) {
            if (body == null) {
                this.body = new byte[0];
            } else if (base64Encoded) {
                this.body = Base64.getDecoder().decode(body);
            } else {
                this.body = body.getBytes(StandardCharsets.UTF_8);
            }
        }

        public byte[] body() {
            return body;
        }
    }

    record LoaderId(@JsonValue String value) {
        @JsonCreator
        public LoaderId {
            Objects.requireNonNull(value);
        }
    }

    record MonotonicTime(@JsonValue double value) {
        @JsonCreator
        public MonotonicTime {
        }
    }

    record RequestId(@JsonValue String value) {
        @JsonCreator
        public RequestId {
            Objects.requireNonNull(value);
        }

        public String toString() {
            return value;
        }
    }

    record ResourceType(@JsonValue String value) {
        @JsonCreator
        public ResourceType {
            Objects.requireNonNull(value);
        }
    }

    record Request(String url, String method, Map<String, String> headers) {
    }
}
