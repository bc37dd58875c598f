package com.jiralert.adapter.domain;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single alert inside an Alertmanager notification.
 */
public record Alert(
    String status,
    Map<String, String> labels,
    Map<String, String> annotations,
    String startsAt,
    String endsAt,
    @JsonProperty("generatorURL") String generatorUrl,
    String fingerprint
) {

    public Alert {
        labels = labels == null ? Map.of() : labels;
        annotations = annotations == null ? Map.of() : annotations;
    }
}
