package quest.gekko.bidopt.web.dto;

/** {@code selectedIds} is kept untyped so a non-array payload can be rejected with a clear message. */
public record SelectedAccountsRequest(Object selectedIds) {}
