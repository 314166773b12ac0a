package org.netpreserve.docketcrawl;

public class CaseNotFoundException extends CrawlException {
    public CaseNotFoundException(String message) {
        super(message, NOT_FOUND);
    }
}
