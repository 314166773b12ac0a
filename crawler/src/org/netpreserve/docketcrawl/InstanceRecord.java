package org.netpreserve.docketcrawl;

import org.jetbrains.annotations.Nullable;

/**
 * One judicial instance of a case, as shown by an accordion header on the cards tab.
 *
 * @param courtCode    court prefix of the case number
 * @param instanceId   the header's data-id
 * @param instanceType header title, e.g. "Первая инстанция"
 * @param regDate      registration date text shown in the header
 * @param caseNumber   case number shown in the header
 * @param courtName    court name shown in the header
 * @param order        1-based position from the top of the tab
 */
public record InstanceRecord(
        String courtCode,
        String instanceId,
        @Nullable String instanceType,
        @Nullable String regDate,
        @Nullable String caseNumber,
        @Nullable String courtName,
        int order
) {
}
