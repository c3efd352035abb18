package quest.gekko.bidopt.exception;

/** The ads platform rejected the request with a 4xx other than 401/403. */
public class UpstreamRejectedException extends OptimizerException {
    public UpstreamRejectedException(String message, int upstreamStatus, Object details) {
        super(message, ErrorCategory.UPSTREAM_REJECTED, upstreamStatus, details);
    }
}
