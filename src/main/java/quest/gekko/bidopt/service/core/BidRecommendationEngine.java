package quest.gekko.bidopt.service.core;

import org.springframework.stereotype.Component;
import quest.gekko.bidopt.domain.Recommendation;
import quest.gekko.bidopt.domain.RecommendationAction;
import quest.gekko.bidopt.util.MoneyUtils;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Maps budget, bid and trailing spend to a bid change. Spend under 90% of budget raises the bid,
 * spend over 100% lowers it, anything in between is left alone. No bid or no budget means no change.
 */
@Component
public class BidRecommendationEngine {
    static final Set<Integer> ALLOWED_PERCENTS = Set.of(2, 5, 10);
    static final int FALLBACK_PERCENT = 2;

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal UNDERSPEND_THRESHOLD = BigDecimal.valueOf(90);

    public static int normalizePercent(Integer requested) {
        return requested != null && ALLOWED_PERCENTS.contains(requested) ? requested : FALLBACK_PERCENT;
    }

    /** Spend as a percentage of budget; zero when the budget is not positive. */
    public static BigDecimal spendPercentage(BigDecimal dailyBudget, BigDecimal dailySpend) {
        if (dailyBudget == null || dailyBudget.signum() <= 0 || dailySpend == null) return BigDecimal.ZERO;
        return dailySpend.multiply(HUNDRED).divide(dailyBudget, MathContext.DECIMAL64);
    }

    public Optional<Recommendation> recommend(BigDecimal dailyBudget, BigDecimal currentBid,
                                              BigDecimal dailySpend, Integer adjustmentPercent) {
        if (currentBid == null || currentBid.signum() <= 0) return Optional.empty();
        if (dailyBudget == null || dailyBudget.signum() <= 0) return Optional.empty();

        int percent = normalizePercent(adjustmentPercent);
        BigDecimal spendPct = spendPercentage(dailyBudget, dailySpend);
        BigDecimal factor = BigDecimal.valueOf(percent).divide(HUNDRED);

        if (spendPct.compareTo(UNDERSPEND_THRESHOLD) < 0) {
            BigDecimal target = MoneyUtils.toMinorUnits(currentBid.multiply(BigDecimal.ONE.add(factor)));
            return Optional.of(new Recommendation(RecommendationAction.INCREASE, currentBid, target, percent,
                    "Only spending " + oneDecimal(spendPct) + "% of daily budget"));
        }
        if (spendPct.compareTo(HUNDRED) > 0) {
            BigDecimal target = MoneyUtils.toMinorUnits(currentBid.multiply(BigDecimal.ONE.subtract(factor)));
            return Optional.of(new Recommendation(RecommendationAction.DECREASE, currentBid, target, -percent,
                    "Overspending at " + oneDecimal(spendPct) + "% of daily budget"));
        }
        return Optional.empty();
    }

    static String oneDecimal(BigDecimal value) {
        return String.format(Locale.ROOT, "%.1f", value.setScale(1, RoundingMode.HALF_UP));
    }
}
