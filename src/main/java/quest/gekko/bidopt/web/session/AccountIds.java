package quest.gekko.bidopt.web.session;

import quest.gekko.bidopt.exception.ValidationException;
import quest.gekko.bidopt.util.PlatformIds;

/**
 * Resolves the ad account a request targets. Checked in order: query parameter, request body,
 * {@code X-Ad-Account-Id} header. URNs are reduced to the plain id here and nowhere else.
 */
public final class AccountIds {
    public static final String ACCOUNT_HEADER = "X-Ad-Account-Id";

    private AccountIds() {}

    public static String require(Object fromQuery, Object fromBody, Object fromHeader) {
        String id = PlatformIds.normalize(fromQuery);
        if (id == null) id = PlatformIds.normalize(fromBody);
        if (id == null) id = PlatformIds.normalize(fromHeader);
        if (id == null) {
            throw new ValidationException("adAccountId required (query, body, or header " + ACCOUNT_HEADER + ")");
        }
        return id;
    }

    public static String require(Object fromQuery, Object fromHeader) {
        return require(fromQuery, null, fromHeader);
    }
}
