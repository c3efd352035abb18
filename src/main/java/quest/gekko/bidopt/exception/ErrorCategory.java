package quest.gekko.bidopt.exception;

/** Machine-checkable error category surfaced to callers. */
public enum ErrorCategory {
    AUTH,
    VALIDATION,
    UPSTREAM_TRANSIENT,
    UPSTREAM_REJECTED,
    STORAGE
}
