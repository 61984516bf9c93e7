package votetally.api.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;
import votetally.api.domain.TallyResult;
import votetally.api.dto.VoteResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;
import static org.springframework.test.web.client.ExpectedCount.once;
import static org.springframework.test.web.client.ExpectedCount.times;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("VoteApiClient Tests")
class VoteApiClientTest {

    private static final String BASE_URL = "http://votes.test";

    private MockRestServiceServer server;
    private VoteApiClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
        server = MockRestServiceServer.bindTo(builder).build();
        RetryingClient retryingClient = new RetryingClient(builder.build(), RetrySettings.defaults(), period -> { });
        client = new VoteApiClient(retryingClient, new ObjectMapper());
    }

    @Test
    @DisplayName("Should post the choice as a form field and decode the receipt")
    void shouldSubmitVote() {
        // Given
        server.expect(once(), requestTo(BASE_URL + "/api/vote"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().string("vote=Dogs"))
                .andRespond(withSuccess("{\"voterId\":\"00ff00ff00ff00ff\",\"choice\":\"Dogs\"}",
                        MediaType.APPLICATION_JSON));

        // When
        VoteResponse response = client.submitVote("Dogs");

        // Then
        server.verify();
        assertThat(response.voterId()).isEqualTo("00ff00ff00ff00ff");
        assertThat(response.choice()).isEqualTo("Dogs");
    }

    @Test
    @DisplayName("Should still read the string-encoded receipt older servers returned")
    void shouldReadDoubleEncodedReceipt() {
        // Given: historical inconsistency, the object arrives wrapped in a JSON string
        server.expect(once(), requestTo(BASE_URL + "/api/vote"))
                .andRespond(withSuccess("\"{\\\"voterId\\\": \\\"abcdef0123456789\\\", \\\"choice\\\": \\\"Cats\\\"}\"",
                        MediaType.APPLICATION_JSON));

        // When
        VoteResponse response = client.submitVote("Cats");

        // Then
        assertThat(response.voterId()).isEqualTo("abcdef0123456789");
        assertThat(response.choice()).isEqualTo("Cats");
    }

    @Test
    @DisplayName("Should decode [choice, count] pairs into a tally")
    void shouldReadTally() {
        // Given
        server.expect(once(), requestTo(BASE_URL + "/api/vote"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("[[\"Cats\",3],[\"Dogs\",1]]", MediaType.APPLICATION_JSON));

        // When
        TallyResult tally = client.getTally();

        // Then
        assertThat(tally.asMap()).containsOnly(entry("Cats", 3L), entry("Dogs", 1L));
        assertThat(tally.total()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should raise the decoded error for a 400")
    void shouldRaiseApiErrorOnBadRequest() {
        // Given
        server.expect(once(), requestTo(BASE_URL + "/api/vote"))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"error\":\"invalid_request\",\"message\":\"Missing required field: vote\"}"));

        // When/Then
        assertThatThrownBy(() -> client.submitVote("Cats"))
                .isInstanceOfSatisfying(VoteApiException.class, e -> {
                    assertThat(e.getStatus()).isEqualTo(400);
                    assertThat(e.getError()).isNotNull();
                    assertThat(e.getError().error()).isEqualTo("invalid_request");
                });
    }

    @Test
    @DisplayName("Should tolerate an empty error body from older servers")
    void shouldHandleEmptyErrorObject() {
        // Given
        server.expect(once(), requestTo(BASE_URL + "/api/vote"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{}"));

        // When/Then
        assertThatThrownBy(() -> client.getTally())
                .isInstanceOfSatisfying(VoteApiException.class, e -> {
                    assertThat(e.getStatus()).isEqualTo(404);
                    assertThat(e.getError()).isNull();
                });
    }

    @Test
    @DisplayName("Should surface exhaustion when the server keeps failing")
    void shouldSurfaceExhaustion() {
        // Given
        server.expect(times(10), requestTo(BASE_URL + "/api/vote")).andRespond(withServerError());

        // When/Then
        assertThatThrownBy(() -> client.submitVote("Cats"))
                .isInstanceOf(RetriesExhaustedException.class);
        server.verify();
    }

    @Test
    @DisplayName("Should return the greeting from GET /api")
    void shouldPing() {
        server.expect(once(), requestTo(BASE_URL + "/api"))
                .andRespond(withSuccess("Hello from the vote API!", MediaType.TEXT_PLAIN));

        assertThat(client.ping()).isEqualTo("Hello from the vote API!");
    }
}
