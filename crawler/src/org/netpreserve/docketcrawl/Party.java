package org.netpreserve.docketcrawl;

/**
 * A participant listed on the case card.
 *
 * @param role "plaintiff", "defendant", "third_party" or "other"
 */
public record Party(String role, String name) {
}
