package com.jiralert.adapter.domain;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

/**
 * Alertmanager generic webhook notification (message versions 3 and 4). One
 * notification always describes one alert group.
 */
public record AlertGroup(
    @Pattern(regexp = "[34]", message = "unknown message version")
    String version,
    String groupKey,
    @NotBlank
    @Pattern(regexp = "firing|resolved", message = "must be 'firing' or 'resolved'")
    String status,
    String receiver,
    @NotNull
    Map<String, String> groupLabels,
    Map<String, String> commonLabels,
    Map<String, String> commonAnnotations,
    @JsonProperty("externalURL") String externalUrl,
    List<Alert> alerts
) {

    public AlertGroup {
        commonLabels = commonLabels == null ? Map.of() : commonLabels;
        commonAnnotations = commonAnnotations == null ? Map.of() : commonAnnotations;
        alerts = alerts == null ? List.of() : alerts;
    }

    @JsonIgnore
    public AlertStatus alertStatus() {
        return AlertStatus.fromValue(status);
    }

    @JsonIgnore
    public boolean isResolved() {
        return alertStatus() == AlertStatus.RESOLVED;
    }

    @JsonIgnore
    public Fingerprint fingerprint() {
        return Fingerprint.of(groupLabels);
    }

    /**
     * Number of alerts of the group that are still firing.
     */
    @JsonIgnore
    public long firingCount() {
        return alerts.stream()
            .filter(alert -> AlertStatus.FIRING.value().equalsIgnoreCase(alert.status()))
            .count();
    }
}
