package info.isaksson.erland.uast.model;

/**
 * Raised when an operation receives input it cannot work with at all, such as a missing CST root
 * or a missing tree to format. Everything else (unmapped kinds, null children, absent index
 * entries) is absorbed without an error.
 */
public class InvalidInputException extends IllegalArgumentException {

    public InvalidInputException(String message) {
        super(message);
    }
}
