package quest.gekko.bidopt.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

@Configuration
public class HttpClientConfig {

    /** Shared client for every ads platform call. Auth headers are added per request. */
    @Bean
    public WebClient adsPlatformWebClient(WebClient.Builder builder, BidOptimizerProperties.Platform platform) {
        return builder
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader("X-Restli-Protocol-Version", "2.0.0")
                .defaultHeader("LinkedIn-Version", platform.apiVersion())
                .codecs(c -> c.defaultCodecs().maxInMemorySize(8 * 1024 * 1024))
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
