package com.jiralert.adapter.integration.jira;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import com.jiralert.adapter.integration.props.JiralertProperties;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import reactor.test.StepVerifier;

@DisplayName("Jira client")
class JiraClientTest {

    private MockWebServer jira;
    private SimpleMeterRegistry meterRegistry;
    private JiraClient client;

    @BeforeEach
    void setUp() throws IOException {
        jira = new MockWebServer();
        jira.start();

        JiralertProperties properties = new JiralertProperties();
        properties.getJira().setBaseUrl(jira.url("/").toString());
        properties.getJira().setUsername("jira-bot");
        properties.getJira().setPassword("secret");

        meterRegistry = new SimpleMeterRegistry();
        client = new JiraClient(WebClient.builder(), properties, meterRegistry);
    }

    @AfterEach
    void tearDown() throws IOException {
        jira.shutdown();
    }

    private static MockResponse json(int status, String body) {
        return new MockResponse()
            .setResponseCode(status)
            .setHeader("Content-Type", "application/json")
            .setBody(body);
    }

    @Test
    @DisplayName("searches by project and fingerprint label with basic auth")
    void shouldSearchByFingerprint() throws InterruptedException {
        jira.enqueue(json(200, """
            {"issues": [{
              "id": "10001",
              "key": "ABC-12",
              "self": "http://jira/rest/api/2/issue/10001",
              "fields": {
                "summary": "[FIRING:1] Foo_Bar foo",
                "status": {"name": "In Progress"},
                "labels": ["alert", "jiralert:abc"],
                "created": "2017-02-02T16:51:13.507+0000"
              }
            }]}
            """));

        StepVerifier.create(client.searchByFingerprint("ABC", "jiralert:abc"))
            .assertNext(issue -> {
                assertThat(issue.key()).isEqualTo("ABC-12");
                assertThat(issue.status()).isEqualTo("In Progress");
                assertThat(issue.labels()).containsExactly("alert", "jiralert:abc");
                assertThat(issue.created()).isEqualTo(OffsetDateTime.of(2017, 2, 2, 16, 51, 13, 507_000_000, ZoneOffset.UTC));
            })
            .verifyComplete();

        RecordedRequest request = jira.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getMethod()).isEqualTo("GET");
        assertThat(request.getRequestUrl().encodedPath()).isEqualTo("/rest/api/2/search");
        assertThat(request.getRequestUrl().queryParameter("jql"))
            .isEqualTo("project = \"ABC\" and labels = \"alert\" and labels = \"jiralert:abc\" order by created DESC");
        assertThat(request.getHeader("Authorization")).isEqualTo("Basic amlyYS1ib3Q6c2VjcmV0");
    }

    @Test
    void searchWithoutResultsIsEmpty() {
        jira.enqueue(json(200, "{\"issues\": []}"));

        StepVerifier.create(client.searchByFingerprint("ABC", "jiralert:abc"))
            .verifyComplete();
    }

    @Test
    @DisplayName("creates an issue with project, type, summary and labels")
    void shouldCreateIssue() throws InterruptedException {
        jira.enqueue(json(201, "{\"id\": \"10002\", \"key\": \"ABC-13\", \"self\": \"http://jira/rest/api/2/issue/10002\"}"));

        NewIssue issue = new NewIssue("ABC", "Story", "[FIRING:1] Foo_Bar", "details", List.of("alert", "jiralert:abc"));

        StepVerifier.create(client.createIssue(issue))
            .assertNext(created -> assertThat(created.key()).isEqualTo("ABC-13"))
            .verifyComplete();

        RecordedRequest request = jira.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/rest/api/2/issue");
        String body = request.getBody().readUtf8();
        assertThat(body)
            .contains("\"project\":{\"key\":\"ABC\"}")
            .contains("\"issuetype\":{\"name\":\"Story\"}")
            .contains("\"labels\":[\"alert\",\"jiralert:abc\"]");
    }

    @Test
    @DisplayName("lists transitions and executes one by id")
    void shouldListAndExecuteTransitions() throws InterruptedException {
        jira.enqueue(json(200, """
            {"transitions": [
              {"id": "21", "name": "Start Progress", "to": {"name": "In Progress"}},
              {"id": "31", "name": "Close Issue", "to": {"name": "Closed"}}
            ]}
            """));
        jira.enqueue(new MockResponse().setResponseCode(204));

        StepVerifier.create(client.transitionCheck("ABC-12"))
            .assertNext(check -> {
                assertThat(check.isTransitionValid("close issue")).isTrue();
                assertThat(check.lookup("Start Progress")).map(IssueTransition::toStatus).contains("In Progress");
            })
            .verifyComplete();

        StepVerifier.create(client.executeTransition("ABC-12", new IssueTransition("31", "Close Issue", "Closed")))
            .verifyComplete();

        assertThat(jira.takeRequest(1, TimeUnit.SECONDS).getPath()).isEqualTo("/rest/api/2/issue/ABC-12/transitions");
        RecordedRequest execute = jira.takeRequest(1, TimeUnit.SECONDS);
        assertThat(execute.getMethod()).isEqualTo("POST");
        assertThat(execute.getBody().readUtf8()).isEqualTo("{\"transition\":{\"id\":\"31\"}}");
    }

    @Test
    @DisplayName("keeps Jira's error body when a call is rejected")
    void shouldReportRejection() {
        jira.enqueue(json(400, "{\"errorMessages\":[],\"errors\":{\"issuetype\":\"issue type is required\"}}"));

        NewIssue issue = new NewIssue("ABC", "Nope", "summary", "details", List.of("alert"));

        StepVerifier.create(client.createIssue(issue))
            .expectErrorSatisfies(error -> {
                assertThat(error).isInstanceOf(TrackerRejectedException.class);
                TrackerRejectedException rejected = (TrackerRejectedException) error;
                assertThat(rejected.getAction()).isEqualTo("create");
                assertThat(rejected.getStatusCode()).isEqualTo(400);
                assertThat(rejected.getResponseBody()).contains("issue type is required");
            })
            .verify();

        assertThat(meterRegistry.counter("jiralert.jira.errors", "action", "create").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("reports an unreachable Jira")
    void shouldReportUnreachable() throws IOException {
        MockWebServer gone = new MockWebServer();
        gone.start();
        String baseUrl = gone.url("/").toString();
        gone.shutdown();

        JiralertProperties properties = new JiralertProperties();
        properties.getJira().setBaseUrl(baseUrl);
        properties.getJira().setUsername("jira-bot");
        properties.getJira().setPassword("secret");
        JiraClient offline = new JiraClient(WebClient.builder(), properties, meterRegistry);

        StepVerifier.create(offline.listTransitions("ABC-1"))
            .expectError(TrackerUnreachableException.class)
            .verify();
    }

    @Test
    void permalinkPointsAtBrowsePage() {
        assertThat(client.permalink("ABC-12")).isEqualTo(jira.url("/browse/ABC-12").toString());
    }

    @Test
    void parsesJiraAndIsoTimestamps() {
        assertThat(JiraClient.parseTimestamp("2026-10-18T09:00:00.000+0200"))
            .isEqualTo(OffsetDateTime.parse("2026-10-18T09:00:00+02:00"));
        assertThat(JiraClient.parseTimestamp("2026-10-18T09:00:00Z"))
            .isEqualTo(OffsetDateTime.parse("2026-10-18T09:00:00Z"));
        assertThat(JiraClient.parseTimestamp("yesterday")).isNull();
    }

    @Test
    void searchQueryEscapesQuotes() {
        assertThat(JiraClient.searchQuery("A\"B", "jiralert:x"))
            .isEqualTo("project = \"A\\\"B\" and labels = \"alert\" and labels = \"jiralert:x\" order by created DESC");
    }
}
