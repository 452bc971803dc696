package com.reprise.repository;

import com.reprise.exception.CacheException;

import java.nio.file.Path;
import java.util.Locale;

/**
 * On-disk encodings, chosen by file extension.
 */
public enum CacheFileFormat {

    JSONL(".jsonl"),
    SQLITE(".db");

    private final String extension;

    CacheFileFormat(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    /**
     * @throws CacheException if the extension is neither .jsonl nor .db
     */
    public static CacheFileFormat of(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        for (CacheFileFormat format : values()) {
            if (name.endsWith(format.extension)) {
                return format;
            }
        }
        throw new CacheException("Invalid file extension for " + path + ". Must be .jsonl or .db");
    }
}
