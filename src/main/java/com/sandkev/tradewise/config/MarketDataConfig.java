package com.sandkev.tradewise.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.netty.http.client.HttpClient;
import reactor.util.retry.Retry;

import java.time.Duration;

@Configuration
@EnableConfigurationProperties(MarketDataProperties.class)
public class MarketDataConfig {

    @Bean
    WebClient marketDataWebClient(MarketDataProperties p) {
        var http = HttpClient.create()
                .responseTimeout(Duration.ofMillis(p.timeoutMs()))
                .compress(true);

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(http))
                .baseUrl(p.baseUrl())
                .defaultHeader("User-Agent", p.userAgent())
                // full history responses for old listings run to several MB
                .codecs(c -> c.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                .build();
    }

    @Bean
    Retry marketDataRetry(MarketDataProperties p) {
        // 429/5xx backoff with jitter
        return Retry.backoff(p.maxRetries(), Duration.ofMillis(p.backoffMs()))
                .filter(th -> th instanceof WebClientResponseException ex
                        && (ex.getStatusCode().is5xxServerError() || ex.getStatusCode().value() == 429))
                .transientErrors(true)
                .jitter(0.25);
    }
}
