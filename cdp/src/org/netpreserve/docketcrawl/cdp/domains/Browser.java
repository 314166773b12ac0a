package org.netpreserve.docketcrawl.cdp.domains;

public interface Browser {
    void close();

    Version getVersion();

    /**
     * @param behavior one of "deny", "allow", "allowAndName" or "default"
     */
    void setDownloadBehavior(String behavior, String downloadPath, Boolean eventsEnabled);

    record Version(String protocolVersion, String product, String revision, String userAgent,
                   String jsVersion) {
    }
}
