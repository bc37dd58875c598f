package com.jiralert.adapter.service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import com.jiralert.adapter.domain.Alert;
import com.jiralert.adapter.domain.AlertGroup;
import com.jiralert.adapter.domain.Fingerprint;
import com.jiralert.adapter.integration.props.JiralertProperties;

/**
 * Renders the Jira side of an alert group: summary, description (Jira wiki
 * markup) and labels.
 *
 * <p>Descriptions are split by {@link #DESCRIPTION_BOUNDARY}. Text above it
 * belongs to humans and survives updates; everything below is regenerated.</p>
 */
@Component
public class IssueRenderer {

    public static final String DESCRIPTION_BOUNDARY = "_-- Alertmanager -- [only edit above]_";

    static final String ALERT_LABEL = "alert";

    static final int MAX_SUMMARY_LENGTH = 255;

    // Alertmanager sends the zero time for alerts that have not ended
    private static final String UNSET_TIME = "0001-01-01T00:00:00Z";

    private final Set<String> labelWhitelist;

    public IssueRenderer(JiralertProperties properties) {
        this.labelWhitelist = Set.copyOf(properties.getLabelWhitelist());
    }

    public String summary(AlertGroup group) {
        String status = group.isResolved()
            ? "[RESOLVED]"
            : "[FIRING:%d]".formatted(group.firingCount());

        String subject = new TreeMap<>(group.groupLabels()).values().stream()
            .filter(StringUtils::hasText)
            .collect(Collectors.joining(" "));
        if (subject.isEmpty()) {
            subject = group.commonLabels().getOrDefault("alertname", "alert group " + group.fingerprint());
        }

        String summary = status + " " + subject;
        return summary.length() <= MAX_SUMMARY_LENGTH ? summary : summary.substring(0, MAX_SUMMARY_LENGTH);
    }

    /**
     * Description for a new issue: an empty human section followed by the boundary.
     */
    public String newDescription(AlertGroup group) {
        return DESCRIPTION_BOUNDARY + "\n\n" + generated(group);
    }

    /**
     * Keeps whatever a human wrote above the boundary of {@code current} and
     * regenerates the rest.
     */
    public String mergedDescription(String current, AlertGroup group) {
        if (!StringUtils.hasText(current)) {
            return newDescription(group);
        }
        int boundary = current.lastIndexOf(DESCRIPTION_BOUNDARY);
        String custom = boundary < 0 ? current : current.substring(0, boundary);
        if (custom.isBlank()) {
            return newDescription(group);
        }
        return "%s\n\n%s\n%s".formatted(custom.strip(), DESCRIPTION_BOUNDARY, generated(group));
    }

    /**
     * Labels for the issue: {@code alert}, whitelisted common labels as
     * {@code key:value}, the values of the {@code tags} label and the fingerprint.
     */
    public List<String> labels(AlertGroup group) {
        Set<String> labels = new LinkedHashSet<>();
        labels.add(ALERT_LABEL);
        new TreeMap<>(group.commonLabels()).forEach((key, value) -> {
            if (labelWhitelist.contains(key)) {
                labels.add(sanitize(key + ":" + value));
            }
            if ("tags".equals(key) && value != null) {
                for (String tag : value.split(",")) {
                    if (StringUtils.hasText(tag)) {
                        labels.add(sanitize(tag.strip()));
                    }
                }
            }
        });
        labels.add(group.fingerprint().label());
        return new ArrayList<>(labels);
    }

    /**
     * Union of the labels already on the issue and the rendered ones, existing first.
     */
    public List<String> mergedLabels(List<String> current, AlertGroup group) {
        Set<String> merged = new LinkedHashSet<>(current);
        merged.addAll(labels(group));
        return new ArrayList<>(merged);
    }

    private String generated(AlertGroup group) {
        Fingerprint fingerprint = group.fingerprint();
        String alerts = group.alerts().stream()
            .map(this::alertSection)
            .collect(Collectors.joining("\n"));

        return """
            h2. %s

            *Annotations*
            %s

            *Common labels*
            %s

            h3. Alerts (%d)
            %s

            Alertmanager: %s
            alert_group_key: %s
            """.formatted(
                summary(group),
                bulletList(group.commonAnnotations()),
                bulletList(group.commonLabels()),
                group.alerts().size(),
                alerts.isEmpty() ? "_none_" : alerts,
                StringUtils.hasText(group.externalUrl()) ? "[" + group.externalUrl() + "]" : "_unknown_",
                fingerprint.label()
            );
    }

    private String alertSection(Alert alert) {
        StringBuilder section = new StringBuilder("----\n");
        section.append("*").append(String.valueOf(alert.status()).toUpperCase(Locale.ROOT)).append("*");
        if (StringUtils.hasText(alert.startsAt())) {
            section.append(" since ").append(alert.startsAt());
        }
        if (StringUtils.hasText(alert.endsAt()) && !UNSET_TIME.equals(alert.endsAt())) {
            section.append(", ended ").append(alert.endsAt());
        }
        section.append("\nLabels: ").append(inline(alert.labels()));
        if (!alert.annotations().isEmpty()) {
            section.append("\nAnnotations: ").append(inline(alert.annotations()));
        }
        if (StringUtils.hasText(alert.generatorUrl())) {
            section.append("\n[Source|").append(alert.generatorUrl()).append("]");
        }
        return section.toString();
    }

    private static String bulletList(Map<String, String> values) {
        if (values.isEmpty()) {
            return "_none_";
        }
        return new TreeMap<>(values).entrySet().stream()
            .map(e -> "* " + e.getKey() + ": " + e.getValue())
            .collect(Collectors.joining("\n"));
    }

    private static String inline(Map<String, String> values) {
        return new TreeMap<>(values).entrySet().stream()
            .map(e -> e.getKey() + "=" + e.getValue())
            .collect(Collectors.joining(", "));
    }

    // Jira labels cannot contain whitespace
    private static String sanitize(String label) {
        return label.replaceAll("\\s+", "_");
    }
}
