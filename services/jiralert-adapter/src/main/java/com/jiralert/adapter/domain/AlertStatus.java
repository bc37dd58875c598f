package com.jiralert.adapter.domain;

import java.util.Locale;

/**
 * Status of an alert group as reported by Alertmanager.
 */
public enum AlertStatus {
    FIRING,
    RESOLVED;

    public static AlertStatus fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
