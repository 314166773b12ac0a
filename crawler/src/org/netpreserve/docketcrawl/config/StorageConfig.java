package org.netpreserve.docketcrawl.config;

import java.nio.file.Path;

/**
 * Storage configuration.
 *
 * @param outputRoot          directory case directories are created in
 * @param keepAttachments     also store the captured attachment bytes next to the document JSON
 * @param minTextLengthForOcr documents with less extracted text than this are flagged for manual review
 */
public record StorageConfig(
        Path outputRoot,
        boolean keepAttachments,
        int minTextLengthForOcr
) {
}
