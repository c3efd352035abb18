package quest.gekko.bidopt.util;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Single place where ads platform identifiers are normalized. The platform returns ids either as
 * bare numbers or as URNs such as {@code urn:li:sponsoredCampaign:123}; everything downstream
 * works with the plain string tail.
 */
public final class PlatformIds {
    public static final String ACCOUNT_URN_PREFIX = "urn:li:sponsoredAccount:";
    public static final String CAMPAIGN_URN_PREFIX = "urn:li:sponsoredCampaign:";

    private PlatformIds() {}

    /** Normalize a raw id value (number, numeric string or URN). Returns null for null or blank input. */
    public static String normalize(Object raw) {
        if (raw == null) return null;
        if (raw instanceof Number n) {
            return (n instanceof Double || n instanceof Float) ? String.valueOf(n.longValue()) : n.toString();
        }
        String s = raw.toString().trim();
        if (s.isEmpty()) return null;
        return s.startsWith("urn:") ? s.substring(s.lastIndexOf(':') + 1) : s;
    }

    public static String accountUrn(String accountId) {
        return ACCOUNT_URN_PREFIX + accountId;
    }

    public static String campaignUrn(String campaignId) {
        return CAMPAIGN_URN_PREFIX + campaignId;
    }

    /** Rest.li list of a single URN, with the URN percent-encoded as the platform expects. */
    public static String encodedUrnList(String urn) {
        return "List(" + URLEncoder.encode(urn, StandardCharsets.UTF_8) + ")";
    }

    public static String pathSegment(String id) {
        return URLEncoder.encode(id, StandardCharsets.UTF_8);
    }
}
