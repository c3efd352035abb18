package quest.gekko.bidopt.exception;

/** Missing credential, or the ads platform answered 401/403. Never retried. */
public class AuthException extends OptimizerException {
    public AuthException(String message) {
        super(message, ErrorCategory.AUTH, 0, null);
    }
    public AuthException(String message, int upstreamStatus, Object details) {
        super(message, ErrorCategory.AUTH, upstreamStatus, details);
    }
}
