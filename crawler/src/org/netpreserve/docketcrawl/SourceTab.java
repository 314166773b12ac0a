package org.netpreserve.docketcrawl;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The three case card views that list documents.
 */
public enum SourceTab {
    COURT_ACTS("court_acts"),
    CARDS("cards"),
    ELECTRONIC_CASE("electronic_case");

    private final String key;

    SourceTab(String key) {
        this.key = key;
    }

    /**
     * Name used in output files.
     */
    @JsonValue
    public String key() {
        return key;
    }
}
