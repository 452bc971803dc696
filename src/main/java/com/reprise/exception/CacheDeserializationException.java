package com.reprise.exception;

import lombok.Getter;

/**
 * A persisted entry could not be turned back into a {@link com.reprise.model.CacheEntry}.
 * Carries the source (file path, payload name) and the record identifier
 * (line number, row key) so operators can find the offending record.
 */
@Getter
public class CacheDeserializationException extends CacheException {

    private final String source;
    private final String record;
    private final String detail;

    public CacheDeserializationException(String detail) {
        this(null, null, detail, null);
    }

    public CacheDeserializationException(String detail, Throwable cause) {
        this(null, null, detail, cause);
    }

    public CacheDeserializationException(String source, String record, String detail, Throwable cause) {
        super(describe(source, record, detail), cause);
        this.source = source;
        this.record = record;
        this.detail = detail;
    }

    /**
     * Copy of this exception with location information attached.
     */
    public CacheDeserializationException at(String source, String record) {
        return new CacheDeserializationException(source, record, detail, getCause());
    }

    private static String describe(String source, String record, String detail) {
        if (source == null && record == null) {
            return detail;
        }
        return (source != null ? source : "?") + (record != null ? ":" + record : "") + ": " + detail;
    }
}
