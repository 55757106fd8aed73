package com.securepad.portal.repository;

import java.util.UUID;

/**
 * Record identifiers are random UUID strings. Anything that does not parse as one can never
 * match a stored row.
 */
public final class RecordIds {
    private RecordIds() {}

    public static String newId() {
        return UUID.randomUUID().toString();
    }

    public static boolean isWellFormed(String id) {
        if (id == null || id.length() != 36) return false;
        try {
            UUID.fromString(id);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
