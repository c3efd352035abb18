package quest.gekko.bidopt.exception;

/** Timeout, I/O failure or 5xx from the ads platform. */
public class UpstreamTransientException extends OptimizerException {
    private final boolean timeout;

    public UpstreamTransientException(String message, int upstreamStatus, Object details) {
        super(message, ErrorCategory.UPSTREAM_TRANSIENT, upstreamStatus, details);
        this.timeout = false;
    }
    public UpstreamTransientException(String message, Throwable cause, boolean timeout) {
        super(message, cause, ErrorCategory.UPSTREAM_TRANSIENT, 0, null);
        this.timeout = timeout;
    }

    public boolean isTimeout() { return timeout; }
}
