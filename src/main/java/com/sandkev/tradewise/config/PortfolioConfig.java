package com.sandkev.tradewise.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(PortfolioProperties.class)
public class PortfolioConfig {

    /** Single source of "today" for valuation, equity curve and sync watermarks. */
    @Bean
    Clock portfolioClock(PortfolioProperties p) {
        return Clock.system(p.zoneId());
    }
}
