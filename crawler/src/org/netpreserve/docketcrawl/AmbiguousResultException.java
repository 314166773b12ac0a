package org.netpreserve.docketcrawl;

import java.util.List;

/**
 * Search returned several suggestions and none of them is the requested case.
 */
public class AmbiguousResultException extends CrawlException {
    private final List<String> suggestions;

    public AmbiguousResultException(String caseNumber, List<String> suggestions) {
        super("Search for " + caseNumber + " returned " + suggestions.size() + " unrelated suggestions: "
              + suggestions, NOT_FOUND);
        this.suggestions = List.copyOf(suggestions);
    }

    public List<String> suggestions() {
        return suggestions;
    }
}
