package com.jiralert.adapter.integration.props;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

/**
 * Configuration properties describing how the adapter talks to Jira and which
 * workflow names it tries when alerts resolve or fire again.
 *
 * <p>The structure mirrors {@code application.yml}. Validation ensures missing
 * credentials are caught at startup instead of failing on the first webhook.</p>
 */
@Validated
@ConfigurationProperties(prefix = "jiralert")
public class JiralertProperties {

    @Valid
    @NestedConfigurationProperty
    private final JiraProperties jira = new JiraProperties();

    @Valid
    @NestedConfigurationProperty
    private final WebhookProperties webhook = new WebhookProperties();

    /**
     * Transition names tried, in order, to close an issue whose alert group resolved.
     */
    @NotEmpty
    private List<String> resolveTransitions = new ArrayList<>(
        List.of("resolve issue", "close issue", "resolve", "close", "done"));

    /**
     * Transition names tried, in order, to reopen an issue whose alert group fires again.
     */
    @NotEmpty
    private List<String> reopenTransitions = new ArrayList<>(
        List.of("reopen issue", "reopen", "to do", "in progress"));

    /**
     * Workflow statuses considered closed.
     */
    @NotEmpty
    private List<String> resolvedStatuses = new ArrayList<>(
        List.of("resolved", "closed", "done", "complete"));

    /**
     * Common labels copied onto the Jira issue as {@code key:value} labels.
     */
    private List<String> labelWhitelist = new ArrayList<>(
        List.of("severity", "dc", "env", "perimeter", "team", "jiralert"));

    /**
     * Refresh summary, description and labels of a matched issue on every delivery.
     */
    private boolean updateExistingIssues = false;

    public JiraProperties getJira() {
        return jira;
    }

    public WebhookProperties getWebhook() {
        return webhook;
    }

    public List<String> getResolveTransitions() {
        return resolveTransitions;
    }

    public void setResolveTransitions(List<String> resolveTransitions) {
        this.resolveTransitions = resolveTransitions;
    }

    public List<String> getReopenTransitions() {
        return reopenTransitions;
    }

    public void setReopenTransitions(List<String> reopenTransitions) {
        this.reopenTransitions = reopenTransitions;
    }

    public List<String> getResolvedStatuses() {
        return resolvedStatuses;
    }

    public void setResolvedStatuses(List<String> resolvedStatuses) {
        this.resolvedStatuses = resolvedStatuses;
    }

    public List<String> getLabelWhitelist() {
        return labelWhitelist;
    }

    public void setLabelWhitelist(List<String> labelWhitelist) {
        this.labelWhitelist = labelWhitelist;
    }

    public boolean isUpdateExistingIssues() {
        return updateExistingIssues;
    }

    public void setUpdateExistingIssues(boolean updateExistingIssues) {
        this.updateExistingIssues = updateExistingIssues;
    }

    public static class JiraProperties {

        /**
         * Root URL of the Jira server, e.g. {@code https://jira.example.com}.
         */
        @NotBlank
        private String baseUrl;

        @NotBlank
        private String username;

        @NotBlank
        private String password;

        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(5);

        /**
         * Upper bound for a single Jira response.
         */
        @NotNull
        private Duration timeout = Duration.ofSeconds(10);

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class WebhookProperties {

        @Valid
        @NestedConfigurationProperty
        private final BasicAuthProperties basicAuth = new BasicAuthProperties();

        public BasicAuthProperties getBasicAuth() {
            return basicAuth;
        }
    }

    public static class BasicAuthProperties {

        /**
         * Require HTTP Basic credentials on the webhook endpoints.
         */
        private boolean enabled = false;

        private String username = "alertmanager";

        private String password = "";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        @AssertTrue(message = "password must be set when basic auth is enabled")
        public boolean isPasswordSetWhenEnabled() {
            return !enabled || (password != null && !password.isBlank());
        }
    }
}
