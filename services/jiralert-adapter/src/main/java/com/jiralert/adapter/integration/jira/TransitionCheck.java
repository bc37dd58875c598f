package com.jiralert.adapter.integration.jira;

import java.util.List;
import java.util.Optional;

/**
 * Answers whether a named transition is valid for an issue in its current
 * workflow state, and if so which transition to execute.
 */
@FunctionalInterface
public interface TransitionCheck {

    Optional<IssueTransition> lookup(String name);

    default boolean isTransitionValid(String name) {
        return lookup(name).isPresent();
    }

    /**
     * Case-insensitive check over a list of transitions fetched once from the tracker.
     */
    static TransitionCheck of(List<IssueTransition> available) {
        List<IssueTransition> transitions = List.copyOf(available);
        return name -> transitions.stream()
            .filter(transition -> transition.name() != null)
            .filter(transition -> transition.name().trim().equalsIgnoreCase(name.trim()))
            .findFirst();
    }
}
