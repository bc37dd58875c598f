package com.jiralert.adapter.integration.jira;

/**
 * A workflow transition currently available on an issue.
 *
 * @param id       Jira transition id, used to execute it
 * @param name     display name, e.g. "Close Issue"
 * @param toStatus name of the status the transition leads to
 */
public record IssueTransition(String id, String name, String toStatus) {
}
