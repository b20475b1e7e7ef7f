package org.dxworks.celerrate.dialect;

/**
 * Outcome of resolving a requested dialect tag.
 */
public final class DialectSelection {
    private final String requestedTag;
    private final Dialect dialect;
    private final boolean fallback;

    public DialectSelection(String requestedTag, Dialect dialect, boolean fallback) {
        this.requestedTag = requestedTag;
        this.dialect = dialect;
        this.fallback = fallback;
    }

    public String getRequestedTag() {
        return requestedTag;
    }

    public Dialect getDialect() {
        return dialect;
    }

    /**
     * True when the tag was not recognised and the highest known dialect was substituted.
     */
    public boolean isFallback() {
        return fallback;
    }
}
