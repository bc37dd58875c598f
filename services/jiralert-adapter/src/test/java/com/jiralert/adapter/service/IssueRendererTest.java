package com.jiralert.adapter.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.jiralert.adapter.AlertGroupFixtures;
import com.jiralert.adapter.domain.AlertGroup;
import com.jiralert.adapter.integration.props.JiralertProperties;

@DisplayName("Issue renderer")
class IssueRendererTest {

    private IssueRenderer renderer;

    @BeforeEach
    void setUp() {
        renderer = new IssueRenderer(new JiralertProperties());
    }

    @Test
    @DisplayName("summarises status, firing count and group label values")
    void shouldRenderSummary() {
        assertThat(renderer.summary(AlertGroupFixtures.firing())).isEqualTo("[FIRING:1] Foo_Bar foo");
        assertThat(renderer.summary(AlertGroupFixtures.resolved())).isEqualTo("[RESOLVED] Foo_Bar foo");
    }

    @Test
    @DisplayName("falls back to alertname when the group has no labels")
    void shouldFallBackToAlertname() {
        AlertGroup group = AlertGroupFixtures.group("firing", Map.of(), Map.of("alertname", "DiskFull"));

        assertThat(renderer.summary(group)).isEqualTo("[FIRING:1] DiskFull");
    }

    @Test
    void summaryIsCappedForJira() {
        AlertGroup group = AlertGroupFixtures.group("firing", Map.of("alertname", "x".repeat(400)), Map.of());

        assertThat(renderer.summary(group)).hasSize(IssueRenderer.MAX_SUMMARY_LENGTH);
    }

    @Test
    @DisplayName("builds labels from the whitelist, tags and fingerprint")
    void shouldRenderLabels() {
        AlertGroup group = AlertGroupFixtures.group("firing", AlertGroupFixtures.GROUP_LABELS, Map.of(
            "alertname", "Foo_Bar",
            "severity", "critical",
            "team", "storage ops",
            "tags", "db, paging,,"));

        List<String> labels = renderer.labels(group);

        assertThat(labels).containsExactly(
            "alert",
            "severity:critical",
            "db",
            "paging",
            "team:storage_ops",
            group.fingerprint().label());
    }

    @Test
    @DisplayName("starts a new description with the edit boundary")
    void shouldRenderNewDescription() {
        AlertGroup group = AlertGroupFixtures.firing();

        String description = renderer.newDescription(group);

        assertThat(description).startsWith(IssueRenderer.DESCRIPTION_BOUNDARY);
        assertThat(description)
            .contains("h2. [FIRING:1] Foo_Bar foo")
            .contains("* summary: Alert summary")
            .contains("*FIRING* since 2017-02-02T16:51:13.507955756Z")
            .contains("Labels: alertname=Foo_Bar, instance=foo")
            .contains("[Source|https://example.com]")
            .contains("alert_group_key: " + group.fingerprint().label())
            .doesNotContain("0001-01-01");
    }

    @Test
    @DisplayName("keeps human edits above the boundary")
    void shouldPreserveCustomDescription() {
        String current = "Runbook: restart foo\n\n" + IssueRenderer.DESCRIPTION_BOUNDARY + "\nold generated text";

        String merged = renderer.mergedDescription(current, AlertGroupFixtures.resolved());

        assertThat(merged).startsWith("Runbook: restart foo\n\n" + IssueRenderer.DESCRIPTION_BOUNDARY + "\n");
        assertThat(merged).doesNotContain("old generated text").contains("[RESOLVED] Foo_Bar foo");
    }

    @Test
    void mergedLabelsKeepExistingOnes() {
        AlertGroup group = AlertGroupFixtures.firing();

        List<String> merged = renderer.mergedLabels(List.of("triaged", "alert"), group);

        assertThat(merged).containsExactly("triaged", "alert", group.fingerprint().label());
    }
}
