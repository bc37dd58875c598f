package com.jiralert.adapter.service;

import java.util.List;
import java.util.Optional;

import com.jiralert.adapter.integration.jira.IssueTransition;
import com.jiralert.adapter.integration.jira.TransitionCheck;

/**
 * Ranked list of transition names that achieve the same outcome ("close",
 * "reopen") on differently configured Jira workflows.
 */
public final class TransitionCandidates {

    private final List<String> names;

    private TransitionCandidates(List<String> names) {
        this.names = names;
    }

    public static TransitionCandidates of(List<String> names) {
        return new TransitionCandidates(names.stream()
            .filter(name -> name != null && !name.isBlank())
            .map(String::trim)
            .toList());
    }

    /**
     * Asks {@code check} about each candidate in rank order and returns the first
     * valid transition. Candidates after it are not checked.
     */
    public Optional<IssueTransition> firstValid(TransitionCheck check) {
        for (String name : names) {
            Optional<IssueTransition> transition = check.lookup(name);
            if (transition.isPresent()) {
                return transition;
            }
        }
        return Optional.empty();
    }

    public List<String> names() {
        return names;
    }

    @Override
    public String toString() {
        return names.toString();
    }
}
