package org.netpreserve.docketcrawl.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

/**
 * Root configuration of a crawl.
 *
 * @param archive    the site being crawled and the shape of its attachments
 * @param browser    how the browser is launched
 * @param challenge  challenge handshake and re-warm behaviour
 * @param navigation timeouts for driving the primary window
 * @param fetch      attachment capture, retries and concurrency
 * @param pacing     human-like delays
 * @param rateLimit  throttling detection
 * @param storage    output directory contents
 */
public record CrawlerConfig(
        ArchiveConfig archive,
        BrowserConfig browser,
        ChallengeConfig challenge,
        NavigationConfig navigation,
        FetchConfig fetch,
        PacingConfig pacing,
        RateLimitConfig rateLimit,
        StorageConfig storage
) {
    public static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory())
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    /**
     * Loads the built-in defaults overridden by the given file, if any.
     */
    public static CrawlerConfig load(Path userFile) throws IOException {
        JsonNode tree = defaultsTree();
        if (userFile != null) {
            JsonNode override = YAML.readTree(userFile.toFile());
            if (override != null && !override.isMissingNode()) {
                tree = deepMerge(tree, override);
            }
        }
        return YAML.treeToValue(tree, CrawlerConfig.class);
    }

    /**
     * The built-in defaults overridden by an in-memory YAML document.
     */
    public static CrawlerConfig loadWithOverrides(String yaml) throws IOException {
        return YAML.treeToValue(deepMerge(defaultsTree(), YAML.readTree(yaml)), CrawlerConfig.class);
    }

    public static CrawlerConfig defaults() throws IOException {
        return YAML.treeToValue(defaultsTree(), CrawlerConfig.class);
    }

    public String toYaml() throws IOException {
        return YAML.writeValueAsString(this);
    }

    private static JsonNode defaultsTree() throws IOException {
        try (InputStream stream = CrawlerConfig.class.getResourceAsStream("defaults.yaml")) {
            if (stream == null) throw new IOException("defaults.yaml missing from classpath");
            return YAML.readTree(stream);
        }
    }

    static JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (!base.isObject() || !override.isObject()) {
            // scalars and lists are replaced wholesale
            return override;
        }
        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode baseValue = merged.get(entry.getKey());
            merged.set(entry.getKey(), baseValue == null ? entry.getValue() : deepMerge(baseValue, entry.getValue()));
        });
        return merged;
    }
}
