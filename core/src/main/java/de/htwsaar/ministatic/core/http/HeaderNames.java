package de.htwsaar.ministatic.core.http;

/**
 * Header-Namen, wie sie der Handler sendet (klein geschrieben).
 */
public final class HeaderNames {

    public static final String CONTENT_TYPE = "content-type";
    public static final String CONTENT_LENGTH = "content-length";
    public static final String CONTENT_DISPOSITION = "content-disposition";
    public static final String LAST_MODIFIED = "last-modified";
    public static final String CACHE_CONTROL = "cache-control";
    public static final String ETAG = "etag";
    public static final String EXPIRES = "expires";
    public static final String IF_NONE_MATCH = "if-none-match";
    public static final String IF_MODIFIED_SINCE = "if-modified-since";

    private HeaderNames() {}
}
