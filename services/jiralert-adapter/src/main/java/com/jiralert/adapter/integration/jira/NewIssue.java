package com.jiralert.adapter.integration.jira;

import java.util.List;

public record NewIssue(
    String project,
    String issueType,
    String summary,
    String description,
    List<String> labels
) {
}
