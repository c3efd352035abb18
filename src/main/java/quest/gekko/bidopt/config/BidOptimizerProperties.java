package quest.gekko.bidopt.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Configuration properties for the ads platform integration and the optimizer itself.
 */
@Configuration
@EnableConfigurationProperties({
        BidOptimizerProperties.Platform.class,
        BidOptimizerProperties.Optimizer.class,
        BidOptimizerProperties.Storage.class,
        BidOptimizerProperties.Tenancy.class
})
public class BidOptimizerProperties {

    @ConfigurationProperties("bidopt.platform")
    public record Platform(
            @DefaultValue("https://api.linkedin.com/rest") String baseUrl,
            @DefaultValue("202504") String apiVersion,
            @DefaultValue("15s") Duration requestTimeout,
            @DefaultValue("10s") Duration analyticsTimeout,
            @DefaultValue("USD") String defaultCurrency) {}

    @ConfigurationProperties("bidopt.optimizer")
    public record Optimizer(
            @DefaultValue("500") int searchPageSize,
            @DefaultValue("50") int maxSearchPages,
            @DefaultValue("10") int groupLookupBatchSize,
            @DefaultValue("10") int analyticsBatchSize,
            @DefaultValue("3") int trailingDays,
            @DefaultValue("48h") Duration cooldownWindow,
            @DefaultValue("4") int summaryConcurrency,
            @DefaultValue("2") int defaultAdjustmentPercent,
            @DefaultValue("UTC") ZoneId zone) {}

    /** Which backend holds settings and the cooldown ledger. Chosen once at startup. */
    @ConfigurationProperties("bidopt.storage")
    public record Storage(
            @DefaultValue("file") StorageType type,
            @DefaultValue("selected-accounts.json") String settingsFile) {}

    @ConfigurationProperties("bidopt.tenancy")
    public record Tenancy(
            @DefaultValue("false") boolean multiTenant,
            @DefaultValue("default") String defaultTenant,
            String staticAccessToken) {}

    public enum StorageType { FILE, DATABASE }
}
