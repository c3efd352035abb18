package quest.gekko.bidopt.domain;

/**
 * Outcome of one best-effort sub-call inside a batch: either a value or the reason it is missing.
 */
public record LookupResult<T>(String campaignId, T value, String failureReason) {

    public static <T> LookupResult<T> ok(String campaignId, T value) {
        return new LookupResult<>(campaignId, value, null);
    }

    public static <T> LookupResult<T> failed(String campaignId, String reason) {
        return new LookupResult<>(campaignId, null, reason != null ? reason : "unknown");
    }

    public boolean isPresent() {
        return failureReason == null && value != null;
    }
}
