package quest.gekko.bidopt.service.analytics;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import quest.gekko.bidopt.config.BidOptimizerProperties;
import quest.gekko.bidopt.domain.Campaign;
import quest.gekko.bidopt.domain.DateWindow;
import quest.gekko.bidopt.domain.PlatformSession;
import quest.gekko.bidopt.domain.SpendSample;
import quest.gekko.bidopt.exception.UpstreamTransientException;
import quest.gekko.bidopt.service.integration.connector.AdsPlatformConnector;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SpendAnalyticsServiceTest {
    private static final PlatformSession SESSION = new PlatformSession("default", "tok");
    private static final String ACCOUNT = "123";
    private static final DateWindow WINDOW = new DateWindow(LocalDate.of(2025, 3, 7), LocalDate.of(2025, 3, 9));

    @Mock private AdsPlatformConnector connector;

    private SpendAnalyticsService service;

    @BeforeEach
    void setUp() {
        BidOptimizerProperties.Optimizer optimizer = new BidOptimizerProperties.Optimizer(
                500, 50, 10, 2, 3, Duration.ofHours(48), 4, 2, ZoneOffset.UTC);
        Clock clock = Clock.fixed(Instant.parse("2025-03-10T08:30:00Z"), ZoneOffset.UTC);
        service = new SpendAnalyticsService(connector, optimizer, clock);
    }

    @Test
    void trailingWindowExcludesToday() {
        assertEquals(WINDOW, service.trailingWindow());
        assertEquals(3, service.trailingWindow().days());
    }

    @Test
    void averagesOverFullWindowEvenWhenDaysAreMissing() {
        when(connector.fetchDailyCosts(SESSION, ACCOUNT, "1", WINDOW))
                .thenReturn(List.of(new BigDecimal("20"), new BigDecimal("25"), new BigDecimal("15")));
        when(connector.fetchDailyCosts(SESSION, ACCOUNT, "2", WINDOW))
                .thenReturn(List.of(new BigDecimal("30")));

        Map<String, SpendSample> samples = service.averageDailySpend(SESSION, ACCOUNT,
                List.of(campaign("1"), campaign("2")));

        assertEquals(0, new BigDecimal("20").compareTo(samples.get("1").averageDailyCost()));
        assertEquals(0, new BigDecimal("10").compareTo(samples.get("2").averageDailyCost()));
        assertEquals(3, samples.get("1").windowDays());
    }

    @Test
    void failedCampaignBecomesZeroWithoutFailingBatch() {
        when(connector.fetchDailyCosts(SESSION, ACCOUNT, "1", WINDOW))
                .thenReturn(List.of(new BigDecimal("180")));
        when(connector.fetchDailyCosts(SESSION, ACCOUNT, "2", WINDOW))
                .thenThrow(new UpstreamTransientException("timed out", null, true));
        when(connector.fetchDailyCosts(SESSION, ACCOUNT, "3", WINDOW))
                .thenReturn(List.of());

        Map<String, SpendSample> samples = service.averageDailySpend(SESSION, ACCOUNT,
                List.of(campaign("1"), campaign("2"), campaign("3")));

        assertEquals(3, samples.size());
        assertEquals(0, new BigDecimal("60").compareTo(samples.get("1").averageDailyCost()));
        assertEquals(0, BigDecimal.ZERO.compareTo(samples.get("2").averageDailyCost()));
        assertEquals(0, BigDecimal.ZERO.compareTo(samples.get("3").averageDailyCost()));
    }

    @Test
    void averageKeepsPrecisionBelowThreshold() {
        when(connector.fetchDailyCosts(SESSION, ACCOUNT, "1", WINDOW))
                .thenReturn(List.of(new BigDecimal("90"), new BigDecimal("90"), new BigDecimal("89.9999")));
        when(connector.fetchDailyCosts(SESSION, ACCOUNT, "2", WINDOW))
                .thenReturn(List.of(new BigDecimal("100"), new BigDecimal("100"), new BigDecimal("100.00012")));

        Map<String, SpendSample> samples = service.averageDailySpend(SESSION, ACCOUNT,
                List.of(campaign("1"), campaign("2")));

        assertTrue(samples.get("1").averageDailyCost().compareTo(new BigDecimal("90")) < 0);
        assertTrue(samples.get("2").averageDailyCost().compareTo(new BigDecimal("100")) > 0);
    }

    @Test
    void noCampaignsMeansNoCalls() {
        assertTrue(service.averageDailySpend(SESSION, ACCOUNT, List.of()).isEmpty());
        verifyNoInteractions(connector);
    }

    @Test
    void todayCostSumsRowsOfTheCurrentDay() {
        DateWindow today = DateWindow.singleDay(LocalDate.of(2025, 3, 10));
        when(connector.fetchDailyCosts(SESSION, ACCOUNT, "1", today))
                .thenReturn(List.of(new BigDecimal("4.25"), new BigDecimal("1.75")));

        assertEquals(0, new BigDecimal("6").compareTo(service.todayCost(SESSION, ACCOUNT, "1")));
    }

    private static Campaign campaign(String id) {
        return new Campaign(id, "Campaign " + id, "ACTIVE", "USD", new BigDecimal("100"), new BigDecimal("2.00"));
    }
}
