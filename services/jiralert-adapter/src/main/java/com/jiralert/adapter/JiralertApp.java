package com.jiralert.adapter;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import com.jiralert.adapter.integration.props.JiralertProperties;

/**
 * Spring Boot entry point for the Jiralert adapter.
 *
 * <p>The application receives Alertmanager webhooks and keeps one Jira issue per
 * alert group: opened while the group fires, closed once it resolves.</p>
 *
 * <p>Usage: {@code java -jar jiralert.jar [options] <jira-base-url>} with
 * {@code JIRA_USERNAME} and {@code JIRA_PASSWORD} set in the environment.</p>
 */
@SpringBootApplication
@EnableConfigurationProperties(JiralertProperties.class)
public class JiralertApp {

    private static final Logger log = LoggerFactory.getLogger(JiralertApp.class);

    static final String BASE_URL_PROPERTY = "jiralert.jira.base-url";

    public static void main(String[] args) {
        SpringApplication.run(JiralertApp.class, withServerArgument(args));
    }

    /**
     * Turns the first positional argument into {@code --jiralert.jira.base-url}.
     * Option arguments pass through unchanged.
     */
    static String[] withServerArgument(String[] args) {
        List<String> result = new ArrayList<>(args.length);
        boolean serverSeen = false;
        for (String arg : args) {
            if (!serverSeen && !arg.startsWith("-")) {
                result.add("--" + BASE_URL_PROPERTY + "=" + arg);
                serverSeen = true;
            } else {
                result.add(arg);
            }
        }
        return result.toArray(String[]::new);
    }

    /**
     * Logs where the adapter sends issues so operators can spot a wrong target
     * before the first alert arrives.
     */
    @Bean
    public ApplicationRunner startupSummary(JiralertProperties properties) {
        return args -> log.info("Jiralert adapter started. Jira: {} (user {}), close transitions {}, reopen transitions {}",
            properties.getJira().getBaseUrl(),
            properties.getJira().getUsername(),
            properties.getResolveTransitions(),
            properties.getReopenTransitions());
    }
}
