package com.hermes.core.model;

import java.time.Instant;

/**
 * Wire format for timestamps: ISO-8601, or null when unset.
 */
public final class Timestamps {

    private Timestamps() {
    }

    public static String format(Instant instant) {
        return instant != null ? instant.toString() : null;
    }
}
