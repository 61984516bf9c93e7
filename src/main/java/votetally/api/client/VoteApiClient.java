package votetally.api.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import votetally.api.domain.TallyEntry;
import votetally.api.domain.TallyResult;
import votetally.api.dto.ApiError;
import votetally.api.dto.VoteResponse;

import java.util.ArrayList;
import java.util.List;

/**
 * Typed calls against the vote API, all routed through a {@link RetryingClient}.
 */
public class VoteApiClient {

    private static final Logger log = LoggerFactory.getLogger(VoteApiClient.class);

    private static final String GREETING_PATH = "/api";
    private static final String VOTE_PATH = "/api/vote";

    private final RetryingClient client;
    private final ObjectMapper objectMapper;

    public VoteApiClient(RetryingClient client, ObjectMapper objectMapper) {
        this.client = client;
        this.objectMapper = objectMapper;
    }

    public String ping() {
        return requireSuccess(client.get(GREETING_PATH));
    }

    public VoteResponse submitVote(String choice) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("vote", choice);

        String body = requireSuccess(client.postForm(VOTE_PATH, form));
        try {
            JsonNode node = objectMapper.readTree(body);
            // Older queue-backed servers sent the object as a JSON-encoded string.
            if (node.isTextual()) {
                node = objectMapper.readTree(node.asText());
            }
            return objectMapper.treeToValue(node, VoteResponse.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unexpected vote response: " + body, e);
        }
    }

    public TallyResult getTally() {
        String body = requireSuccess(client.get(VOTE_PATH));
        try {
            JsonNode rows = objectMapper.readTree(body);
            List<TallyEntry> entries = new ArrayList<>();
            for (JsonNode row : rows) {
                entries.add(new TallyEntry(row.get(0).asText(), row.get(1).asLong()));
            }
            return new TallyResult(entries);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unexpected tally response: " + body, e);
        }
    }

    private String requireSuccess(ResponseEntity<String> response) {
        int status = response.getStatusCode().value();
        if (response.getStatusCode().is2xxSuccessful()) {
            return response.getBody();
        }

        ApiError error = decodeError(response.getBody());
        String detail = error != null ? error.error() + ": " + error.message() : String.valueOf(response.getBody());
        throw new VoteApiException(status, error, "Vote API returned " + status + " (" + detail + ")");
    }

    private ApiError decodeError(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            ApiError error = objectMapper.readValue(body, ApiError.class);
            return error.error() != null ? error : null;
        } catch (JsonProcessingException e) {
            log.debug("Error body is not an ApiError: {}", body);
            return null;
        }
    }
}
