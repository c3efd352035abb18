package quest.gekko.bidopt.web.dto;

import java.math.BigDecimal;

public record BidUpdateRequest(
        BigDecimal newBid,
        BigDecimal previousBid,
        Boolean revert,
        Object adAccountId
) {

    public boolean isRevert() {
        return Boolean.TRUE.equals(revert);
    }
}
