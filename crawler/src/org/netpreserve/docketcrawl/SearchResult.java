package org.netpreserve.docketcrawl;

import java.util.Map;

/**
 * @param fields what the chosen suggestion showed, kept in case.json
 */
public record SearchResult(String caseGuid, Map<String, String> fields) {
}
