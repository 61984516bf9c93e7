package votetally.api.service;

/**
 * A submission the service refuses before touching storage.
 */
public class InvalidVoteException extends RuntimeException {

    public InvalidVoteException(String message) {
        super(message);
    }
}
