package org.netpreserve.docketcrawl.cdp.domains;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.netpreserve.docketcrawl.cdp.protocol.Unwrap;

import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;

public interface Page {
    CompletionStage<Navigate> navigateAsync(String url);

    void enable();

    void onLifecycleEvent(Consumer<LifecycleEvent> handler);

    void setLifecycleEventsEnabled(boolean enabled);

    @Unwrap("identifier")
    ScriptIdentifier addScriptToEvaluateOnNewDocument(String source, String worldName);

    record LifecycleEvent(FrameId frameId, Network.LoaderId loaderId, String name, Network.MonotonicTime timestamp) {
    }

    record ScriptIdentifier(@JsonValue String value) {
        @JsonCreator
        public ScriptIdentifier {
            Objects.requireNonNull(value);
        }
    }

    record FrameId(@JsonValue String value) {
        @JsonCreator
        public FrameId {
            Objects.requireNonNull(value);
        }
    }

    /**
     * Result of Page.navigate. The loaderId is absent for same-document navigations.
     */
    record Navigate(FrameId frameId, Network.LoaderId loaderId, String errorText) {
    }
}
