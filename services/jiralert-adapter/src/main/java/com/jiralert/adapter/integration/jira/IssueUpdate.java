package com.jiralert.adapter.integration.jira;

import java.util.List;

public record IssueUpdate(String summary, String description, List<String> labels) {
}
