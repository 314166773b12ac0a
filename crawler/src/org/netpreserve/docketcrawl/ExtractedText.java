package org.netpreserve.docketcrawl;

/**
 * Text pulled out of an attachment.
 *
 * @param pageCount number of pages, 0 if the attachment couldn't be parsed
 */
public record ExtractedText(String text, int pageCount) {
    public static final ExtractedText EMPTY = new ExtractedText("", 0);
}
