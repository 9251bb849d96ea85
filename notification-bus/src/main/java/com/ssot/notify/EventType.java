package com.ssot.notify;

import java.util.Locale;

/**
 * Kind of mutation a {@link ChangeEvent} describes.
 */
public enum EventType {
    ENTITY,
    RELATION,
    SCHEMA;

    /**
     * @return the lower-case name used on the wire ({@code "entity"}, {@code "relation"}, {@code "schema"})
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
