package org.netpreserve.docketcrawl.config;

import java.util.List;

/**
 * @param phrases page text containing any of these (ignoring case) means the session is being throttled
 */
public record RateLimitConfig(List<String> phrases) {
}
