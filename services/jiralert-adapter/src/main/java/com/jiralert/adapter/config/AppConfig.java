package com.jiralert.adapter.config;

import org.springframework.boot.web.reactive.function.client.WebClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;

import com.jiralert.adapter.integration.props.JiralertProperties;

import io.netty.channel.ChannelOption;
import reactor.netty.http.client.HttpClient;

/**
 * Application-wide infrastructure beans that don't belong to a single feature.
 */
@Configuration
public class AppConfig {

    /**
     * Connect and response timeouts for every outbound WebClient call.
     */
    @Bean
    public WebClientCustomizer boundedTimeouts(JiralertProperties properties) {
        JiralertProperties.JiraProperties jira = properties.getJira();
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, Math.toIntExact(jira.getConnectTimeout().toMillis()))
            .responseTimeout(jira.getTimeout());
        return builder -> builder.clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
