package votetally.api.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import votetally.api.domain.TallyEntry;
import votetally.api.domain.VoteRecord;
import votetally.api.dto.ApiError;
import votetally.api.dto.VoteResponse;
import votetally.api.service.VoteService;

import java.util.List;

@RestController
@RequestMapping("/api")
public class VoteController {

    private static final Logger log = LoggerFactory.getLogger(VoteController.class);

    static final String GREETING = "Hello from the vote API!";

    private final VoteService voteService;

    public VoteController(VoteService voteService) {
        this.voteService = voteService;
    }

    @GetMapping(produces = MediaType.TEXT_PLAIN_VALUE)
    public String greeting() {
        return GREETING;
    }

    @PostMapping(value = "/vote", produces = MediaType.APPLICATION_JSON_VALUE)
    public VoteResponse vote(@RequestParam(name = "vote", required = false) String vote) {
        log.debug("Vote received: {}", vote);
        VoteRecord record = voteService.submitVote(vote);
        return VoteResponse.from(record);
    }

    @GetMapping(value = "/vote", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<TallyEntry> tally() {
        return voteService.getTally().entries();
    }

    @RequestMapping(value = "/vote", method = {RequestMethod.PUT, RequestMethod.PATCH, RequestMethod.DELETE})
    public ResponseEntity<ApiError> unsupportedMethod() {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .contentType(MediaType.APPLICATION_JSON)
                .body(ApiError.notFound("Only GET and POST are served on /api/vote"));
    }
}
