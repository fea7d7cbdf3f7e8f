package vn.com.fecredit.flowable.layout.model;

import java.util.Locale;

public enum GatewayType {
    EXCLUSIVE("X"),
    PARALLEL("+"),
    INCLUSIVE("O");

    private final String marker;

    GatewayType(String marker) {
        this.marker = marker;
    }

    /** Symbol drawn inside the gateway diamond. */
    public String marker() {
        return marker;
    }

    /** Lenient lookup; unknown or missing values fall back to {@link #EXCLUSIVE}. */
    public static GatewayType from(String value) {
        if (value == null || value.isBlank()) return EXCLUSIVE;
        try {
            return GatewayType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return EXCLUSIVE;
        }
    }
}
