package quest.gekko.bidopt.service.core;

import org.junit.jupiter.api.Test;
import quest.gekko.bidopt.domain.Recommendation;
import quest.gekko.bidopt.domain.RecommendationAction;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class BidRecommendationEngineTest {

    private final BidRecommendationEngine engine = new BidRecommendationEngine();

    @Test
    void underspendingRaisesBid() {
        // budget 100, trailing spend 20+25+15 over three days
        Recommendation r = engine.recommend(bd("100"), bd("2.00"), bd("20"), 5).orElseThrow();

        assertEquals(RecommendationAction.INCREASE, r.action());
        assertEquals(bd("2.10"), r.recommendedBid());
        assertEquals(5, r.changePercent());
        assertEquals("Only spending 20.0% of daily budget", r.reason());
    }

    @Test
    void overspendingLowersBid() {
        Recommendation r = engine.recommend(bd("50"), bd("1.00"), bd("60"), 10).orElseThrow();

        assertEquals(RecommendationAction.DECREASE, r.action());
        assertEquals(bd("0.90"), r.recommendedBid());
        assertEquals(-10, r.changePercent());
        assertEquals("Overspending at 120.0% of daily budget", r.reason());
    }

    @Test
    void targetBandIsLeftAlone() {
        assertTrue(engine.recommend(bd("100"), bd("2.00"), bd("90"), 5).isEmpty());
        assertTrue(engine.recommend(bd("100"), bd("2.00"), bd("95.5"), 5).isEmpty());
        assertTrue(engine.recommend(bd("100"), bd("2.00"), bd("100"), 5).isEmpty());
    }

    @Test
    void justOutsideTheBandTriggers() {
        assertEquals(RecommendationAction.INCREASE,
                engine.recommend(bd("100"), bd("2.00"), bd("89.99"), 2).orElseThrow().action());
        assertEquals(RecommendationAction.DECREASE,
                engine.recommend(bd("100"), bd("2.00"), bd("100.01"), 2).orElseThrow().action());
    }

    @Test
    void noBidMeansNoRecommendation() {
        assertTrue(engine.recommend(bd("100"), BigDecimal.ZERO, bd("10"), 5).isEmpty());
        assertTrue(engine.recommend(bd("100"), null, bd("10"), 5).isEmpty());
    }

    @Test
    void noBudgetMeansNoRecommendation() {
        assertTrue(engine.recommend(BigDecimal.ZERO, bd("2.00"), bd("10"), 5).isEmpty());
        assertTrue(engine.recommend(bd("-5"), bd("2.00"), bd("10"), 5).isEmpty());
        assertTrue(engine.recommend(null, bd("2.00"), bd("10"), 5).isEmpty());
        assertEquals(0, BigDecimal.ZERO.compareTo(BidRecommendationEngine.spendPercentage(bd("-5"), bd("10"))));
    }

    @Test
    void fractionalSpendNextToThresholdsIsNotRoundedAway() {
        // (90 + 90 + 89.9999) / 3 and (100 + 100 + 100.00012) / 3
        assertEquals(RecommendationAction.INCREASE,
                engine.recommend(bd("100"), bd("2.00"), bd("89.99996666666667"), 5).orElseThrow().action());
        assertEquals(RecommendationAction.DECREASE,
                engine.recommend(bd("100"), bd("2.00"), bd("100.00004"), 5).orElseThrow().action());
    }

    @Test
    void unsupportedPercentFallsBackToTwo() {
        Recommendation r = engine.recommend(bd("100"), bd("1.00"), bd("10"), 7).orElseThrow();
        assertEquals(bd("1.02"), r.recommendedBid());
        assertEquals(2, r.changePercent());
        assertEquals(2, BidRecommendationEngine.normalizePercent(null));
        assertEquals(10, BidRecommendationEngine.normalizePercent(10));
    }

    @Test
    void recommendedBidRoundsHalfUpToCents() {
        // 1.25 * 1.02 = 1.275
        assertEquals(bd("1.28"), engine.recommend(bd("100"), bd("1.25"), bd("0"), 2).orElseThrow().recommendedBid());
    }

    private static BigDecimal bd(String v) {
        return new BigDecimal(v);
    }
}
