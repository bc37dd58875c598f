/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/jiralert-adapter/src/main/java/com/jiralert/adapter/web/IssueController.java
 * Project: Jiralert Adapter
 * Description: Alertmanager webhook receiver. Creates, closes and reopens Jira issues
 *              for alert groups.
 * Since: 2026-10-19
 *
 * Notes:
 *  - Alertmanager webhook_configs point at /issues/{project}/{issueType}.
 *  - Validation: Jakarta Bean Validation on the payload record, errors rendered by ApiExceptionHandler.
 *  - Delivery is answered only after Jira has been updated; Alertmanager retries failed deliveries.
 */

package com.jiralert.adapter.web;

import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.jiralert.adapter.domain.AlertGroup;
import com.jiralert.adapter.service.AlertReconciler;
import com.jiralert.adapter.service.MalformedAlertException;
import com.jiralert.adapter.web.dto.IssuesResponse;

import jakarta.validation.Valid;
import reactor.core.publisher.Mono;

/**
 * Receives Alertmanager notifications and reconciles them with Jira.
 */
@RestController
@RequestMapping(path = "/issues", produces = MediaType.APPLICATION_JSON_VALUE)
public class IssueController {

    static final String PROJECT_LABEL = "project";
    static final String ISSUE_TYPE_LABEL = "issue_type";

    private final AlertReconciler reconciler;

    public IssueController(AlertReconciler reconciler) {
        this.reconciler = reconciler;
    }

    /**
     * Files the alert group in the given project as an issue of the given type.
     *
     * @param project   Jira project key
     * @param issueType Jira issue type name
     * @param group     Alertmanager notification
     * @return what was created, found, closed or reopened
     */
    @PostMapping(path = "/{project}/{issueType}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<IssuesResponse> fileIssue(
        @PathVariable String project,
        @PathVariable String issueType,
        @Valid @RequestBody AlertGroup group
    ) {
        return reconciler.reconcile(project, issueType, group)
            .map(IssuesResponse::ok);
    }

    /**
     * Same as {@link #fileIssue}, with project and issue type taken from the
     * {@code project} and {@code issue_type} common labels.
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<IssuesResponse> fileIssueFromLabels(@Valid @RequestBody AlertGroup group) {
        String project = group.commonLabels().get(PROJECT_LABEL);
        String issueType = group.commonLabels().get(ISSUE_TYPE_LABEL);
        if (!StringUtils.hasText(project) || !StringUtils.hasText(issueType)) {
            return Mono.error(new MalformedAlertException(
                "Required commonLabels not found: " + ISSUE_TYPE_LABEL + " or " + PROJECT_LABEL));
        }
        return fileIssue(project, issueType, group);
    }
}
