package com.questrail.janus.manifest;

import java.util.Locale;
import java.util.Optional;

/**
 * Declared type of an argument, model property or response value.
 */
public enum ArgumentType
{
    STRING,
    INTEGER,
    NUMBER,
    BOOLEAN,
    ARRAY,
    OBJECT,
    NULL,
    /** Reference to a named model declared in the manifest. */
    REFERENCE;

    /** Name used in manifest documents ({@code "string"}, {@code "integer"}, ...). */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ArgumentType> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (ArgumentType t : values()) {
            if (t.wireName().equals(name)) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }
}
