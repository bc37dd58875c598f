package com.jiralert.adapter.integration.jira;

import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Base64;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import com.jiralert.adapter.integration.props.JiralertProperties;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Minimal Jira REST API (v2) client. Only implements the operations the
 * reconciler needs: fingerprint search, issue creation and update, and
 * transition listing and execution.
 */
@Component
public class JiraClient implements IssueTracker {

    private static final Logger log = LoggerFactory.getLogger(JiraClient.class);

    static final String ALERT_LABEL = "alert";

    private static final String SEARCH_FIELDS = "summary,description,status,labels,created";

    // Jira renders timestamps as 2017-02-02T16:51:13.507+0000
    private static final DateTimeFormatter JIRA_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSZ");

    private final WebClient webClient;
    private final JiralertProperties.JiraProperties properties;
    private final MeterRegistry meterRegistry;

    public JiraClient(WebClient.Builder builder, JiralertProperties properties, MeterRegistry meterRegistry) {
        this.properties = properties.getJira();
        this.meterRegistry = meterRegistry;
        this.webClient = builder
            .baseUrl(stripTrailingSlash(this.properties.getBaseUrl()))
            .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .defaultHeader(HttpHeaders.AUTHORIZATION, basicAuthHeader(this.properties.getUsername(), this.properties.getPassword()))
            .build();
    }

    @Override
    public Flux<TrackedIssue> searchByFingerprint(String project, String fingerprintLabel) {
        String jql = searchQuery(project, fingerprintLabel);
        log.debug("Searching Jira: {}", jql);

        Mono<SearchResponse> response = webClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/rest/api/2/search")
                .queryParam("jql", "{jql}")
                .queryParam("fields", "{fields}")
                .build(jql, SEARCH_FIELDS))
            .retrieve()
            .bodyToMono(SearchResponse.class);

        return instrument("search", response)
            .flatMapIterable(result -> result.issues() == null ? List.<IssueResponse>of() : result.issues())
            .map(this::toTrackedIssue);
    }

    @Override
    public Mono<TrackedIssue> createIssue(NewIssue issue) {
        Map<String, Object> payload = Map.of(
            "fields", Map.of(
                "project", Map.of("key", issue.project()),
                "summary", issue.summary(),
                "description", issue.description(),
                "issuetype", Map.of("name", issue.issueType()),
                "labels", issue.labels()
            )
        );

        Mono<TrackedIssue> created = webClient.post()
            .uri("/rest/api/2/issue")
            .bodyValue(payload)
            .retrieve()
            .bodyToMono(CreatedIssueResponse.class)
            .map(response -> TrackedIssue.ofCreated(response.id(), response.key(), response.self()));

        return instrument("create", created)
            .doOnSuccess(result -> log.info("Created Jira issue {} in project {}", result.key(), issue.project()));
    }

    @Override
    public Mono<Void> updateIssue(String issueKey, IssueUpdate update) {
        Map<String, Object> payload = Map.of(
            "fields", Map.of(
                "summary", update.summary(),
                "description", update.description(),
                "labels", update.labels()
            )
        );

        Mono<Void> updated = webClient.put()
            .uri("/rest/api/2/issue/{key}", issueKey)
            .bodyValue(payload)
            .retrieve()
            .toBodilessEntity()
            .then();

        return instrument("update", updated);
    }

    @Override
    public Mono<List<IssueTransition>> listTransitions(String issueKey) {
        Mono<List<IssueTransition>> transitions = webClient.get()
            .uri("/rest/api/2/issue/{key}/transitions", issueKey)
            .retrieve()
            .bodyToMono(TransitionsResponse.class)
            .map(response -> response.transitions() == null
                ? List.<IssueTransition>of()
                : response.transitions().stream()
                    .map(t -> new IssueTransition(t.id(), t.name(), t.to() == null ? null : t.to().name()))
                    .toList());

        return instrument("transitions", transitions);
    }

    @Override
    public Mono<Void> executeTransition(String issueKey, IssueTransition transition) {
        Mono<Void> executed = webClient.post()
            .uri("/rest/api/2/issue/{key}/transitions", issueKey)
            .bodyValue(Map.of("transition", Map.of("id", transition.id())))
            .retrieve()
            .toBodilessEntity()
            .then();

        return instrument("transition", executed)
            .doOnSuccess(ignored -> log.info("Applied transition '{}' to Jira issue {}", transition.name(), issueKey));
    }

    @Override
    public String permalink(String issueKey) {
        return "%s/browse/%s".formatted(stripTrailingSlash(properties.getBaseUrl()), issueKey);
    }

    static String searchQuery(String project, String fingerprintLabel) {
        return "project = \"%s\" and labels = \"%s\" and labels = \"%s\" order by created DESC"
            .formatted(escapeJql(project), ALERT_LABEL, escapeJql(fingerprintLabel));
    }

    /**
     * Times the call, counts failures and translates WebClient errors into the
     * tracker exceptions the web layer knows how to report.
     */
    private <T> Mono<T> instrument(String action, Mono<T> call) {
        return Mono.defer(() -> {
            Timer.Sample sample = Timer.start(meterRegistry);
            return call
                .onErrorMap(WebClientResponseException.class, e -> new TrackerRejectedException(
                    action, e.getStatusCode().value(), e.getResponseBodyAsString(), e))
                .onErrorMap(WebClientRequestException.class, e -> new TrackerUnreachableException(action, e))
                .doOnError(error -> errors(action).increment())
                .doFinally(signal -> sample.stop(requests(action)));
        });
    }

    private Timer requests(String action) {
        return Timer.builder("jiralert.jira.requests")
            .description("Latency when querying the Jira API")
            .tag("action", action)
            .register(meterRegistry);
    }

    private Counter errors(String action) {
        return Counter.builder("jiralert.jira.errors")
            .description("Number of failed Jira calls")
            .tag("action", action)
            .register(meterRegistry);
    }

    private TrackedIssue toTrackedIssue(IssueResponse response) {
        IssueFields fields = response.fields();
        if (fields == null) {
            return new TrackedIssue(response.id(), response.key(), response.self(), null, null, null, List.of(), null);
        }
        return new TrackedIssue(
            response.id(),
            response.key(),
            response.self(),
            fields.summary(),
            fields.description(),
            fields.status() == null ? null : fields.status().name(),
            fields.labels(),
            parseTimestamp(fields.created())
        );
    }

    static OffsetDateTime parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value, JIRA_TIMESTAMP);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(value);
            } catch (DateTimeParseException ignored) {
                log.debug("Unparseable Jira timestamp '{}'", value);
                return null;
            }
        }
    }

    private static String escapeJql(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private String basicAuthHeader(String username, String password) {
        String token = Base64.getEncoder()
            .encodeToString((username + ":" + password).getBytes(StandardCharsets.UTF_8));
        return "Basic " + token;
    }

    private record SearchResponse(List<IssueResponse> issues) {
    }

    private record IssueResponse(String id, String key, String self, IssueFields fields) {
    }

    private record IssueFields(String summary, String description, NamedField status, List<String> labels, String created) {
    }

    private record NamedField(String name) {
    }

    private record TransitionsResponse(List<TransitionResponse> transitions) {
    }

    private record TransitionResponse(String id, String name, NamedField to) {
    }

    private record CreatedIssueResponse(String id, String key, String self) {
    }
}
