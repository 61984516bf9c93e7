package votetally.api.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import votetally.api.dto.ApiError;
import votetally.api.repository.StorageException;
import votetally.api.service.InvalidVoteException;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidVoteException.class)
    public ResponseEntity<ApiError> handleInvalidVote(InvalidVoteException e) {
        return ResponseEntity.badRequest().body(ApiError.invalidRequest(e.getMessage()));
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<ApiError> handleStorage(StorageException e) {
        log.warn("Request failed on storage: {}", e.getMessage());
        // Conflicts stay 5xx: a retry gets a fresh voter id and can succeed.
        return switch (e.getKind()) {
            case UNAVAILABLE -> ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(ApiError.storageUnavailable(e.getMessage()));
            case CONFLICT -> ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(ApiError.storageConflict(e.getMessage()));
        };
    }
}
