package se.artisan_be.exception;

/**
 * Rejected request parameter, raised before any datastore access.
 */
public class BadRequestException extends RuntimeException {

    public BadRequestException(String message) {
        super(message);
    }
}
