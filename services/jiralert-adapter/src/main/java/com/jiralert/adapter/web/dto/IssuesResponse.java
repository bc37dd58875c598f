package com.jiralert.adapter.web.dto;

import com.jiralert.adapter.service.IssueActions;

/**
 * Body of every response from the issues endpoints. {@code issues} is
 * {@code null} when the request failed.
 */
public record IssuesResponse(String status, IssueActions issues) {

    public static IssuesResponse ok(IssueActions issues) {
        return new IssuesResponse("OK", issues);
    }

    public static IssuesResponse error(String message) {
        return new IssuesResponse(message, null);
    }
}
