package quest.gekko.bidopt.exception;

/** Bad caller input, e.g. a non-positive bid or a missing account id. */
public class ValidationException extends OptimizerException {
    public ValidationException(String message) {
        super(message, ErrorCategory.VALIDATION, 0, null);
    }
    public ValidationException(String message, Object details) {
        super(message, ErrorCategory.VALIDATION, 0, details);
    }
}
