package com.serge.scheduler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.*;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT, properties = {
        "scheduler.jwt.secret=integration-test-secret-integration-test-secret",
        "scheduler.bcrypt.strength=4"
})
@Testcontainers(disabledWithoutDocker = true)
class SchedulerIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer("mongo:7");

    @DynamicPropertySource
    static void configure(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", () -> mongo.getReplicaSetUrl("scheduler-it"));
    }

    @LocalServerPort
    int port;
    @Autowired
    TestRestTemplate rest;
    @Autowired
    ObjectMapper om;

    private static final String PASSWORD = "Abcdef1!";
    private static final AtomicInteger STEP = new AtomicInteger(0);

    private static void logStep(String message) {
        System.out.println("\n>>> [STEP " + STEP.incrementAndGet() + "] " + message + " <<<");
    }

    private String baseUrl() {
        return "http://localhost:" + port;
    }

    private JsonNode gql(String token, String query, Map<String, Object> variables) throws Exception {
        HttpHeaders h = new HttpHeaders();
        h.setContentType(MediaType.APPLICATION_JSON);
        h.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (token != null) h.setBearerAuth(token);
        Map<String, Object> body = new HashMap<>();
        body.put("query", query);
        body.put("variables", variables);
        ResponseEntity<String> resp = rest.exchange(baseUrl() + "/graphql", HttpMethod.POST,
                new HttpEntity<>(om.writeValueAsString(body), h), String.class);
        assertThat(resp.getStatusCode().is2xxSuccessful()).isTrue();
        return om.readTree(resp.getBody());
    }

    private static String uniqueEmail(String name) {
        return (name + "+" + UUID.randomUUID() + "@example.com").toLowerCase();
    }

    private String registerAndLogin(String name, String email) throws Exception {
        JsonNode reg = gql(null, "mutation($i: RegisterInput!) { register(input: $i) { id name email } }",
                Map.of("i", Map.of("name", name, "email", email, "password", PASSWORD)));
        assertThat(reg.path("errors").isMissingNode()).as(reg.toString()).isTrue();
        JsonNode login = gql(null, "mutation($i: LoginInput!) { login(input: $i) { token tokenExpiration user { id email } } }",
                Map.of("i", Map.of("email", email, "password", PASSWORD)));
        assertThat(login.path("data").path("login").path("tokenExpiration").asLong()).isEqualTo(7L * 24 * 3600);
        return login.path("data").path("login").path("token").asText();
    }

    private static String code(JsonNode response) {
        return response.path("errors").get(0).path("extensions").path("code").asText();
    }

    @Test
    void healthEndpointAnswersWithoutAuth() throws Exception {
        ResponseEntity<String> resp = rest.getForEntity(baseUrl() + "/", String.class);
        assertThat(resp.getStatusCode().value()).isEqualTo(200);
        JsonNode body = om.readTree(resp.getBody());
        assertThat(body.path("status").asText()).isEqualTo("ok");
        assertThat(body.path("service").asText()).isEqualTo("meeting-scheduler-server");
        assertThat(resp.getHeaders().getFirst("X-Request-Id")).isNotBlank();
    }

    @Test
    void meetingOwnershipScenario() throws Exception {
        logStep("Register and log in Alice");
        String alice = registerAndLogin("Alice", uniqueEmail("alice"));

        logStep("Alice creates a standup");
        JsonNode created = gql(alice,
                "mutation($i: CreateMeetingInput!) { createMeeting(input: $i) { id title startTime endTime createdBy { name } } }",
                Map.of("i", Map.of("title", "Standup", "startTime", "2025-01-06T09:00:00Z",
                        "endTime", "2025-01-06T09:30:00Z", "attendeeIds", List.of())));
        JsonNode meeting = created.path("data").path("createMeeting");
        assertThat(meeting.path("title").asText()).isEqualTo("Standup");
        assertThat(meeting.path("startTime").asText()).isEqualTo("2025-01-06T09:00:00Z");
        assertThat(meeting.path("endTime").asText()).isEqualTo("2025-01-06T09:30:00Z");
        assertThat(meeting.path("createdBy").path("name").asText()).isEqualTo("Alice");
        String meetingId = meeting.path("id").asText();

        logStep("Bob tries to delete Alice's meeting");
        String bob = registerAndLogin("Bob", uniqueEmail("bob"));
        JsonNode denied = gql(bob, "mutation($id: ID!) { deleteMeeting(id: $id) }", Map.of("id", meetingId));
        assertThat(code(denied)).isEqualTo("FORBIDDEN");
        assertThat(denied.path("errors").get(0).path("extensions").path("requestId").asText()).isNotBlank();

        logStep("The meeting is still there");
        JsonNode still = gql(alice, "query($id: ID!) { meeting(id: $id) { id title } }", Map.of("id", meetingId));
        assertThat(still.path("data").path("meeting").path("title").asText()).isEqualTo("Standup");

        logStep("Alice deletes it, twice");
        JsonNode first = gql(alice, "mutation($id: ID!) { deleteMeeting(id: $id) }", Map.of("id", meetingId));
        JsonNode second = gql(alice, "mutation($id: ID!) { deleteMeeting(id: $id) }", Map.of("id", meetingId));
        assertThat(first.path("data").path("deleteMeeting").asBoolean()).isTrue();
        assertThat(second.path("data").path("deleteMeeting").asBoolean()).isFalse();
        assertThat(second.path("errors").isMissingNode()).isTrue();
    }

    @Test
    void invalidMeetingReportsFieldDetails() throws Exception {
        String alice = registerAndLogin("Alice", uniqueEmail("alice"));

        JsonNode resp = gql(alice,
                "mutation($i: CreateMeetingInput!) { createMeeting(input: $i) { id } }",
                Map.of("i", Map.of("title", "Backwards", "startTime", "2025-01-06T10:00:00Z",
                        "endTime", "2025-01-06T09:00:00Z")));

        assertThat(code(resp)).isEqualTo("BAD_USER_INPUT");
        JsonNode details = resp.path("errors").get(0).path("extensions").path("details");
        assertThat(details.isArray()).isTrue();
        assertThat(details.get(0).path("field").asText()).isEqualTo("endTime");
        assertThat(details.get(0).path("message").asText()).isEqualTo("startTime must be before endTime");
    }

    @Test
    void duplicateRegistrationIsAConflict() throws Exception {
        String email = uniqueEmail("carol");
        registerAndLogin("Carol", email);

        JsonNode again = gql(null, "mutation($i: RegisterInput!) { register(input: $i) { id } }",
                Map.of("i", Map.of("name", "Carol", "email", email.toUpperCase(), "password", PASSWORD)));

        assertThat(code(again)).isEqualTo("CONFLICT");
        assertThat(again.path("errors").get(0).path("message").asText()).isEqualTo("Email already in use");
    }

    @Test
    void operationsWithoutTokenAreUnauthenticated() throws Exception {
        JsonNode resp = gql(null, "{ meetings { id } }", Map.of());
        assertThat(code(resp)).isEqualTo("UNAUTHENTICATED");

        JsonNode bogus = gql("not-a-token", "{ me { id } }", Map.of());
        assertThat(code(bogus)).isEqualTo("UNAUTHENTICATED");
    }

    @Test
    void eventBookingLifecycle() throws Exception {
        String alice = registerAndLogin("Alice", uniqueEmail("alice"));
        String bob = registerAndLogin("Bob", uniqueEmail("bob"));

        logStep("Alice creates an event; it shows up in her createdEvents");
        JsonNode created = gql(alice, "mutation($e: EventInput!) { createEvent(eventInput: $e) { id title price } }",
                Map.of("e", Map.of("title", "Concert", "date", "2025-03-01T19:00:00Z", "price", 20.5)));
        String eventId = created.path("data").path("createEvent").path("id").asText();
        JsonNode profile = gql(alice, "{ myProfile { createdEvents { id } } }", Map.of());
        assertThat(profile.path("data").path("myProfile").path("createdEvents").get(0).path("id").asText()).isEqualTo(eventId);

        logStep("Bob cannot edit it");
        JsonNode denied = gql(bob, "mutation($id: ID!, $e: EventInput) { updateEvent(id: $id, eventInput: $e) { id } }",
                Map.of("id", eventId, "e", Map.of("title", "Mine", "date", "2025-03-01", "price", 0)));
        assertThat(code(denied)).isEqualTo("FORBIDDEN");

        logStep("Bob books it once; a second booking conflicts");
        JsonNode booked = gql(bob, "mutation($id: ID!) { bookEvent(eventId: $id) { id event { id title } user { name } } }",
                Map.of("id", eventId));
        String bookingId = booked.path("data").path("bookEvent").path("id").asText();
        assertThat(booked.path("data").path("bookEvent").path("event").path("title").asText()).isEqualTo("Concert");
        JsonNode twice = gql(bob, "mutation($id: ID!) { bookEvent(eventId: $id) { id } }", Map.of("id", eventId));
        assertThat(code(twice)).isEqualTo("CONFLICT");

        logStep("Booking a missing event is bad input");
        JsonNode missing = gql(bob, "mutation($id: ID!) { bookEvent(eventId: $id) { id } }",
                Map.of("id", "65a1b2c3d4e5f60718293a4b"));
        assertThat(code(missing)).isEqualTo("BAD_USER_INPUT");

        logStep("Alice cannot cancel Bob's booking; Bob can");
        JsonNode notHers = gql(alice, "mutation($id: ID!) { cancelBooking(bookingId: $id) { id } }", Map.of("id", bookingId));
        assertThat(code(notHers)).isEqualTo("FORBIDDEN");
        JsonNode cancelled = gql(bob, "mutation($id: ID!) { cancelBooking(bookingId: $id) { id title } }", Map.of("id", bookingId));
        assertThat(cancelled.path("data").path("cancelBooking").path("id").asText()).isEqualTo(eventId);

        logStep("Alice deletes the event; the back-reference goes with it");
        JsonNode deleted = gql(alice, "mutation($id: ID!) { deleteEvent(id: $id) }", Map.of("id", eventId));
        assertThat(deleted.path("data").path("deleteEvent").asBoolean()).isTrue();
        JsonNode after = gql(alice, "{ myProfile { createdEvents { id } } }", Map.of());
        assertThat(after.path("data").path("myProfile").path("createdEvents").size()).isZero();
    }

    @Test
    void malformedQueriesGetTheSameEnvelope() throws Exception {
        JsonNode resp = gql(null, "{ nope }", Map.of());
        assertThat(code(resp)).isEqualTo("BAD_USER_INPUT");
        assertThat(resp.path("errors").get(0).path("extensions").path("requestId").asText()).isNotBlank();
    }
}
