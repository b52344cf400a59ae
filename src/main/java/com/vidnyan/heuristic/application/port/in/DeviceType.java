package com.vidnyan.heuristic.application.port.in;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

/**
 * Device profile a page was captured with.
 */
public enum DeviceType {
    DESKTOP,
    TABLET,
    MOBILE;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Case-insensitive lookup.
     *
     * @throws IllegalArgumentException for an unknown device type
     */
    @JsonCreator
    public static DeviceType fromKey(String key) {
        return Arrays.stream(values())
                .filter(d -> d.name().equalsIgnoreCase(key == null ? "" : key.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown device type '" + key + "', expected one of desktop, tablet, mobile"));
    }
}
