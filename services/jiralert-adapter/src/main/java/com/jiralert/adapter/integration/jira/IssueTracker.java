package com.jiralert.adapter.integration.jira;

import java.util.List;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Operations the reconciler needs from an issue tracker. Implementations signal
 * {@link TrackerUnreachableException} when the tracker cannot be reached and
 * {@link TrackerRejectedException} when it answers with an error.
 */
public interface IssueTracker {

    /**
     * Issues of the project carrying the given fingerprint label, in any workflow
     * status, most recently created first.
     */
    Flux<TrackedIssue> searchByFingerprint(String project, String fingerprintLabel);

    Mono<TrackedIssue> createIssue(NewIssue issue);

    Mono<Void> updateIssue(String issueKey, IssueUpdate update);

    Mono<List<IssueTransition>> listTransitions(String issueKey);

    Mono<Void> executeTransition(String issueKey, IssueTransition transition);

    /**
     * Browser link to the issue, reported back to the webhook caller.
     */
    String permalink(String issueKey);

    default Mono<TransitionCheck> transitionCheck(String issueKey) {
        return listTransitions(issueKey).map(TransitionCheck::of);
    }
}
