package com.jiralert.adapter.integration.props;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

@DisplayName("Jiralert properties")
class JiralertPropertiesTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withUserConfiguration(PropertiesConfig.class)
        .withPropertyValues(
            "jiralert.jira.base-url=http://jira.test",
            "jiralert.jira.username=jira-bot",
            "jiralert.jira.password=secret");

    @Test
    @DisplayName("refuses to start with webhook basic auth enabled and no password")
    void shouldRejectBasicAuthWithoutPassword() {
        contextRunner
            .withPropertyValues("jiralert.webhook.basic-auth.enabled=true")
            .run(context -> {
                assertThat(context).hasFailed();
                assertThat(context.getStartupFailure())
                    .rootCause()
                    .hasMessageContaining("password must be set when basic auth is enabled");
            });
    }

    @Test
    @DisplayName("refuses a blank webhook password")
    void shouldRejectBlankPassword() {
        contextRunner
            .withPropertyValues(
                "jiralert.webhook.basic-auth.enabled=true",
                "jiralert.webhook.basic-auth.password=   ")
            .run(context -> assertThat(context).hasFailed());
    }

    @Test
    @DisplayName("starts with webhook basic auth enabled and a password")
    void shouldAcceptBasicAuthWithPassword() {
        contextRunner
            .withPropertyValues(
                "jiralert.webhook.basic-auth.enabled=true",
                "jiralert.webhook.basic-auth.password=hunter2")
            .run(context -> {
                assertThat(context).hasNotFailed();
                assertThat(context.getBean(JiralertProperties.class).getWebhook().getBasicAuth().getPassword())
                    .isEqualTo("hunter2");
            });
    }

    @Test
    @DisplayName("needs no webhook password while basic auth is off")
    void shouldStartWithoutWebhookAuth() {
        contextRunner.run(context -> assertThat(context).hasNotFailed());
    }

    @Test
    @DisplayName("refuses to start without a Jira URL")
    void shouldRejectMissingJiraUrl() {
        contextRunner
            .withPropertyValues("jiralert.jira.base-url=")
            .run(context -> assertThat(context).hasFailed());
    }

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties(JiralertProperties.class)
    static class PropertiesConfig {
    }
}
