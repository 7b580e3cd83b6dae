package com.argus.activity.model;

import java.util.function.Function;

final class WireNames {

    private WireNames() {
    }

    static <E extends Enum<E>> E lookup(Class<E> type, E[] values, String value, Function<E, String> wireName) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase();
        for (E candidate : values) {
            if (wireName.apply(candidate).equals(normalized)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown " + type.getSimpleName() + ": " + value);
    }
}
