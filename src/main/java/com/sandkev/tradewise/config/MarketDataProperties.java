package com.sandkev.tradewise.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties("marketdata")
public record MarketDataProperties(
        String baseUrl,     // e.g. https://push2his.eastmoney.com
        String userAgent,
        int timeoutMs,
        String cacheTtl,    // ISO-8601, e.g. PT10M
        int maxRetries,
        int backoffMs
) {}
