package com.ssot.notify;

import java.util.Locale;

/**
 * What happened to the value carried by a {@link ChangeEvent}.
 */
public enum ChangeType {
    CREATE,
    UPDATE,
    DELETE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
