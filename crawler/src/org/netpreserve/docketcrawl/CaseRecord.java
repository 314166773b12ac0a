package org.netpreserve.docketcrawl;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Case-level metadata written to case.json.
 *
 * @param searchResultFields what the search suggestion showed for the case
 * @param instanceIds        judicial instances in tab order
 * @param totalDocuments     distinct documents seen over all tabs in the last run
 * @param fingerprints       first document key per instance and per flat tab, for spotting changes between runs
 */
public record CaseRecord(
        String caseNumber,
        String caseGuid,
        String status,
        String url,
        List<Party> parties,
        Map<String, String> searchResultFields,
        Instant parsedAt,
        List<String> instanceIds,
        int totalDocuments,
        Map<String, String> fingerprints
) {
    public CaseRecord withSearchResultFields(Map<String, String> searchResultFields) {
        return new CaseRecord(caseNumber, caseGuid, status, url, parties, searchResultFields, parsedAt, instanceIds,
                totalDocuments, fingerprints);
    }

    public CaseRecord withStatus(String status) {
        return new CaseRecord(caseNumber, caseGuid, status, url, parties, searchResultFields, parsedAt, instanceIds,
                totalDocuments, fingerprints);
    }

    public CaseRecord withSummary(List<String> instanceIds, int totalDocuments, Map<String, String> fingerprints) {
        return new CaseRecord(caseNumber, caseGuid, status, url, parties, searchResultFields, parsedAt,
                List.copyOf(instanceIds), totalDocuments, Collections.unmodifiableMap(new LinkedHashMap<>(fingerprints)));
    }
}
