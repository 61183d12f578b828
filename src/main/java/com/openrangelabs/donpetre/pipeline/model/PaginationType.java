package com.openrangelabs.donpetre.pipeline.model;

import java.util.Locale;

/**
 * Strategy for advancing through a paged REST API.
 */
public enum PaginationType {
    NONE, OFFSET, CURSOR, PAGE;

    public static PaginationType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
