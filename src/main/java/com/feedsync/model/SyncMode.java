package com.feedsync.model;

import java.util.Locale;

public enum SyncMode {
    /** Stops paging at the first page made only of known, unchanged articles. */
    INCREMENTAL,
    /** Pages through every cursor the feed offers. */
    FULL;

    public static SyncMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return INCREMENTAL;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown sync mode: " + value);
        }
    }
}
