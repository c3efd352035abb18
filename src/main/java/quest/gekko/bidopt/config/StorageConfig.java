package quest.gekko.bidopt.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import quest.gekko.bidopt.repository.AccountSelectionRepository;
import quest.gekko.bidopt.repository.RecentlyOptimizedRepository;
import quest.gekko.bidopt.service.cooldown.CooldownLedger;
import quest.gekko.bidopt.service.cooldown.DisabledCooldownLedger;
import quest.gekko.bidopt.service.cooldown.JpaCooldownLedger;
import quest.gekko.bidopt.service.settings.FileSettingsStore;
import quest.gekko.bidopt.service.settings.JpaSettingsStore;
import quest.gekko.bidopt.service.settings.SettingsStore;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Picks the settings store and cooldown ledger from {@code bidopt.storage.type}. Nothing else
 * branches on the storage mode.
 */
@Configuration
public class StorageConfig {

    @Slf4j
    @Configuration
    @ConditionalOnProperty(name = "bidopt.storage.type", havingValue = "database")
    static class DatabaseStorage {

        @Bean
        SettingsStore settingsStore(AccountSelectionRepository repo, Clock clock) {
            log.info("Settings and cooldown ledger backed by the database");
            return new JpaSettingsStore(repo, clock);
        }

        @Bean
        CooldownLedger cooldownLedger(RecentlyOptimizedRepository repo,
                                      BidOptimizerProperties.Optimizer optimizer, Clock clock) {
            return new JpaCooldownLedger(repo, optimizer, clock);
        }
    }

    @Slf4j
    @Configuration
    @ConditionalOnProperty(name = "bidopt.storage.type", havingValue = "file", matchIfMissing = true)
    static class FileStorage {

        @Bean
        SettingsStore settingsStore(BidOptimizerProperties.Storage storage, ObjectMapper mapper) {
            log.info("Settings stored in {}; cooldown tracking disabled", storage.settingsFile());
            return new FileSettingsStore(Path.of(storage.settingsFile()), mapper);
        }

        @Bean
        CooldownLedger cooldownLedger() {
            return new DisabledCooldownLedger();
        }
    }
}
