package org.netpreserve.docketcrawl;

public class InvalidCaseNumberException extends CrawlException {
    public InvalidCaseNumberException(String input) {
        super("Invalid case number: '" + input + "' (expected e.g. А60-21280/2023)", INVALID_CASE_NUMBER);
    }
}
