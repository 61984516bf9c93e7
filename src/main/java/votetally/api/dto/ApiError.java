package votetally.api.dto;

public record ApiError(
        String error,
        String message
) {
    public static ApiError invalidRequest(String message) {
        return new ApiError("invalid_request", message);
    }

    public static ApiError storageUnavailable(String message) {
        return new ApiError("storage_unavailable", message);
    }

    public static ApiError storageConflict(String message) {
        return new ApiError("storage_conflict", message);
    }

    public static ApiError notFound(String message) {
        return new ApiError("not_found", message);
    }
}
