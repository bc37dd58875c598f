package com.jiralert.adapter.service;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.jiralert.adapter.domain.AlertGroup;
import com.jiralert.adapter.domain.Fingerprint;
import com.jiralert.adapter.integration.jira.IssueTracker;
import com.jiralert.adapter.integration.jira.IssueUpdate;
import com.jiralert.adapter.integration.jira.NewIssue;
import com.jiralert.adapter.integration.jira.TrackedIssue;
import com.jiralert.adapter.integration.props.JiralertProperties;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import reactor.core.publisher.Mono;

/**
 * Maps one alert group onto the Jira issue that tracks it.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Find the issue carrying the group's fingerprint label</li>
 *   <li>Open an issue for a firing group that has none</li>
 *   <li>Close the issue when the group resolves and reopen it when it fires again</li>
 * </ul>
 * Workflows differ between Jira installations, so closing and reopening go
 * through ranked {@link TransitionCandidates}. A workflow offering none of them
 * is logged and otherwise ignored.</p>
 */
@Service
public class AlertReconciler {

    private static final Logger log = LoggerFactory.getLogger(AlertReconciler.class);

    private final IssueTracker tracker;
    private final IssueRenderer renderer;
    private final TransitionCandidates resolveTransitions;
    private final TransitionCandidates reopenTransitions;
    private final Set<String> resolvedStatuses;
    private final boolean updateExistingIssues;
    private final Counter errors;

    public AlertReconciler(
        IssueTracker tracker,
        IssueRenderer renderer,
        JiralertProperties properties,
        MeterRegistry meterRegistry
    ) {
        this.tracker = tracker;
        this.renderer = renderer;
        this.resolveTransitions = TransitionCandidates.of(properties.getResolveTransitions());
        this.reopenTransitions = TransitionCandidates.of(properties.getReopenTransitions());
        this.resolvedStatuses = properties.getResolvedStatuses().stream()
            .map(status -> status.trim().toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
        this.updateExistingIssues = properties.isUpdateExistingIssues();
        this.errors = Counter.builder("jiralert.reconcile.errors")
            .description("Alert groups that could not be reconciled")
            .register(meterRegistry);
    }

    public Mono<IssueActions> reconcile(String project, String issueType, AlertGroup group) {
        Fingerprint fingerprint = group.fingerprint();
        log.info("issue ({}, {}): alert group {} is {}", project, issueType, fingerprint, group.status());

        return tracker.searchByFingerprint(project, fingerprint.label())
            .collectList()
            .flatMap(found -> found.isEmpty()
                ? fileIssue(project, issueType, group, fingerprint)
                : followUp(project, issueType, group, found))
            .doOnError(error -> {
                errors.increment();
                log.error("issue ({}, {}): failed to reconcile alert group {}: {}",
                    project, issueType, fingerprint, error.getMessage());
            });
    }

    private Mono<IssueActions> fileIssue(String project, String issueType, AlertGroup group, Fingerprint fingerprint) {
        // A resolved group that was never filed has nothing to close.
        if (group.isResolved()) {
            log.debug("issue ({}, {}): no issue for resolved alert group {}", project, issueType, fingerprint);
            return Mono.just(IssueActions.none());
        }

        NewIssue issue = new NewIssue(
            project,
            issueType,
            renderer.summary(group),
            renderer.newDescription(group),
            renderer.labels(group)
        );
        return tracker.createIssue(issue)
            .map(created -> {
                log.info("issue ({}, {}): new issue created ({})", project, issueType, created.key());
                return IssueActions.none().withCreated(tracker.permalink(created.key()));
            });
    }

    private Mono<IssueActions> followUp(String project, String issueType, AlertGroup group, List<TrackedIssue> found) {
        List<TrackedIssue> newestFirst = found.stream().sorted(TrackedIssue.NEWEST_FIRST).toList();
        TrackedIssue issue = newestFirst.get(0);
        if (newestFirst.size() > 1) {
            log.warn("issue ({}, {}): {} issues carry this fingerprint, acting on the newest ({})",
                project, issueType, newestFirst.size(), issue.key());
        }
        log.debug("issue ({}, {}): jira issue found: {} ({})", project, issueType, issue.key(), issue.status());

        String link = tracker.permalink(issue.key());
        IssueActions report = IssueActions.none()
            .withFound(newestFirst.stream().map(i -> tracker.permalink(i.key())).toList());

        Mono<IssueActions> transitioned;
        if (group.isResolved()) {
            transitioned = isClosed(issue)
                ? Mono.just(report)
                : applyFirstValid(issue, resolveTransitions, "close")
                    .map(applied -> applied ? report.withResolved(link) : report);
        } else {
            // Still open: the issue already tracks the firing group.
            transitioned = !isClosed(issue)
                ? Mono.just(report)
                : applyFirstValid(issue, reopenTransitions, "reopen")
                    .map(applied -> applied ? report.withReopened(link) : report);
        }

        if (!updateExistingIssues) {
            return transitioned;
        }
        return transitioned.flatMap(actions -> tracker.updateIssue(issue.key(), new IssueUpdate(
                renderer.summary(group),
                renderer.mergedDescription(issue.description(), group),
                renderer.mergedLabels(issue.labels(), group)))
            .thenReturn(actions.withUpdated(link))
            .doOnSuccess(ignored -> log.info("issue ({}, {}): {} updated", project, issueType, issue.key())));
    }

    /**
     * Executes the first candidate the tracker reports as valid for the issue.
     * Emits {@code false} when none is.
     */
    private Mono<Boolean> applyFirstValid(TrackedIssue issue, TransitionCandidates candidates, String purpose) {
        return tracker.transitionCheck(issue.key())
            .flatMap(check -> candidates.firstValid(check)
                .map(transition -> tracker.executeTransition(issue.key(), transition).thenReturn(true))
                .orElseGet(() -> {
                    log.warn("Unable to find transition to {} {} (status '{}'), tried {}",
                        purpose, issue.key(), issue.status(), candidates);
                    return Mono.just(false);
                }));
    }

    private boolean isClosed(TrackedIssue issue) {
        return issue.status() != null && resolvedStatuses.contains(issue.status().trim().toLowerCase(Locale.ROOT));
    }
}
