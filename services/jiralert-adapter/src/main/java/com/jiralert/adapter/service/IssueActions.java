package com.jiralert.adapter.service;

import java.util.ArrayList;
import java.util.List;

/**
 * What one webhook delivery did to Jira, as lists of issue links.
 */
public record IssueActions(
    List<String> created,
    List<String> found,
    List<String> updated,
    List<String> resolved,
    List<String> reopened
) {

    public IssueActions {
        created = List.copyOf(created);
        found = List.copyOf(found);
        updated = List.copyOf(updated);
        resolved = List.copyOf(resolved);
        reopened = List.copyOf(reopened);
    }

    public static IssueActions none() {
        return new IssueActions(List.of(), List.of(), List.of(), List.of(), List.of());
    }

    public IssueActions withCreated(String link) {
        return new IssueActions(append(created, link), found, updated, resolved, reopened);
    }

    public IssueActions withFound(List<String> links) {
        List<String> all = new ArrayList<>(found);
        all.addAll(links);
        return new IssueActions(created, all, updated, resolved, reopened);
    }

    public IssueActions withUpdated(String link) {
        return new IssueActions(created, found, append(updated, link), resolved, reopened);
    }

    public IssueActions withResolved(String link) {
        return new IssueActions(created, found, updated, append(resolved, link), reopened);
    }

    public IssueActions withReopened(String link) {
        return new IssueActions(created, found, updated, resolved, append(reopened, link));
    }

    private static List<String> append(List<String> links, String link) {
        List<String> all = new ArrayList<>(links);
        all.add(link);
        return all;
    }
}
