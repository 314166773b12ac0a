package org.netpreserve.docketcrawl;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Pulls the text layer out of captured PDF attachments. Scans yield little or no text and are flagged for manual
 * review downstream.
 */
public class DocumentTextExtractor {
    private static final Logger log = LoggerFactory.getLogger(DocumentTextExtractor.class);

    public ExtractedText extract(byte[] pdf) {
        if (pdf == null || pdf.length == 0) return ExtractedText.EMPTY;
        try (PDDocument document = Loader.loadPDF(pdf)) {
            var stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            return new ExtractedText(stripper.getText(document), document.getNumberOfPages());
        } catch (IOException e) {
            log.atWarn().addKeyValue("bytes", pdf.length).log("PDF text extraction failed: {}", e.getMessage());
            return ExtractedText.EMPTY;
        }
    }
}
