package com.jiralert.adapter.domain;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Stable identifier of an alert group, derived from its group labels.
 *
 * <p>Labels are sorted by name and rendered as {@code {"name"="value", ...}}.
 * Names and values are quoted with quotes and backslashes escaped, and a
 * missing value renders as a bare {@code null}, so two label sets produce the
 * same rendering exactly when they hold the same pairs. The rendering is hashed
 * with SHA-1 and shortened to {@value #LENGTH} hex characters, which keeps the
 * Jira label short.</p>
 */
public record Fingerprint(String value) {

    public static final String LABEL_PREFIX = "jiralert:";

    static final int LENGTH = 16;

    public Fingerprint {
        Objects.requireNonNull(value, "value must not be null");
    }

    public static Fingerprint of(Map<String, String> labels) {
        Objects.requireNonNull(labels, "labels must not be null");
        byte[] digest = sha1(canonical(labels).getBytes(StandardCharsets.UTF_8));
        return new Fingerprint(HexFormat.of().formatHex(digest).substring(0, LENGTH));
    }

    static String canonical(Map<String, String> labels) {
        return new TreeMap<>(labels).entrySet().stream()
            .map(e -> quote(e.getKey()) + "=" + quote(e.getValue()))
            .collect(Collectors.joining(", ", "{", "}"));
    }

    /**
     * The Jira label correlating issues with this alert group.
     */
    public String label() {
        return LABEL_PREFIX + value;
    }

    @Override
    public String toString() {
        return value;
    }

    private static String quote(String value) {
        if (value == null) {
            return "null";
        }
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    private static byte[] sha1(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-1").digest(input);
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-1
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
