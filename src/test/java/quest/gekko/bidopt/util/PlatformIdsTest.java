package quest.gekko.bidopt.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PlatformIdsTest {

    @Test
    void bareNumberAndUrnNormalizeToSameKey() {
        assertEquals("123456", PlatformIds.normalize(123456L));
        assertEquals("123456", PlatformIds.normalize("123456"));
        assertEquals("123456", PlatformIds.normalize("urn:li:sponsoredCampaign:123456"));
        assertEquals("123456", PlatformIds.normalize("urn:li:sponsoredAccount:123456"));
    }

    @Test
    void jsonDoublesLoseTheirFraction() {
        assertEquals("42", PlatformIds.normalize(42.0d));
    }

    @Test
    void blankAndNullAreAbsent() {
        assertNull(PlatformIds.normalize(null));
        assertNull(PlatformIds.normalize("   "));
    }

    @Test
    void urnListIsPercentEncoded() {
        assertEquals("List(urn%3Ali%3AsponsoredCampaign%3A7)",
                PlatformIds.encodedUrnList(PlatformIds.campaignUrn("7")));
    }
}
