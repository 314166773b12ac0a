package org.netpreserve.docketcrawl.page;

import org.jetbrains.annotations.Nullable;

/**
 * A document link as listed on a tab, with whatever the surrounding row says about it.
 */
public record DocumentRow(
        String url,
        @Nullable String title,
        boolean signed,
        boolean signatureValid,
        @Nullable String judge,
        @Nullable String court
) {
}
