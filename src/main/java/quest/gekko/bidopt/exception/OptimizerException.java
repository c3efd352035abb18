package quest.gekko.bidopt.exception;

/**
 * Base exception for every failure the optimizer reports to its callers.
 */
public class OptimizerException extends RuntimeException {
    private final ErrorCategory category;
    private final int upstreamStatus;
    private final Object details;

    public OptimizerException(String message, ErrorCategory category, int upstreamStatus, Object details) {
        super(message);
        this.category = category;
        this.upstreamStatus = upstreamStatus;
        this.details = details;
    }

    public OptimizerException(String message, Throwable cause, ErrorCategory category, int upstreamStatus, Object details) {
        super(message, cause);
        this.category = category;
        this.upstreamStatus = upstreamStatus;
        this.details = details;
    }

    public ErrorCategory getCategory() { return category; }

    /** HTTP status returned by the ads platform, or 0 when the failure did not come from a response. */
    public int getUpstreamStatus() { return upstreamStatus; }

    public Object getDetails() { return details; }
}
