package org.netpreserve.docketcrawl.cdp.domains;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;

public interface Fetch {
    void enable(List<RequestPattern> patterns);

    void disable();

    CompletionStage<Void> continueRequestAsync(RequestId requestId);

    CompletionStage<Void> continueResponseAsync(RequestId requestId);

    CompletionStage<Network.ResponseBody> getResponseBodyAsync(RequestId requestId);

    void onRequestPaused(Consumer<RequestPaused> handler);

    record RequestId(@JsonValue String value) {
        @JsonCreator
        public RequestId {
            Objects.requireNonNull(value);
        }
    }

    record RequestPattern(
            String urlPattern,
            String resourceType,
            String requestStage
    ) {
    }

    record RequestPaused(
            RequestId requestId,
            Network.Request request,
            Page.FrameId frameId,
            Network.ResourceType resourceType,
            String responseErrorReason,
            Integer responseStatusCode,
            String responseStatusText,
            List<HeaderEntry> responseHeaders,
            Network.RequestId networkId,
            RequestId redirectedRequestId
    ) {
        public boolean isResponseStage() {
            return responseStatusCode != null || responseErrorReason != null;
        }

        public boolean isRedirect() {
            return responseStatusCode != null && responseStatusCode >= 300 && responseStatusCode < 400;
        }

        /**
         * Returns the first response header with the given name, ignoring case, or null.
         */
        public String responseHeader(String name) {
            if (responseHeaders == null) return null;
            for (var header : responseHeaders) {
                if (header.name().toLowerCase(Locale.ROOT).equals(name.toLowerCase(Locale.ROOT))) {
                    return header.value();
                }
            }
            return null;
        }
    }

    record HeaderEntry(String name, String value) {
    }
}
