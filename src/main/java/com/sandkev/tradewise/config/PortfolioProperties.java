package com.sandkev.tradewise.config;

import com.sandkev.tradewise.price.PriceBasis;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.LocalDate;
import java.time.ZoneId;

@ConfigurationProperties("portfolio")
public record PortfolioProperties(
        String zone,              // zone "today" is evaluated in, e.g. Asia/Shanghai
        PriceBasis valuationBasis,
        String defaultSyncStart   // ISO date used when an instrument has no stored prices yet
) {

    public PortfolioProperties {
        if (zone == null || zone.isBlank()) zone = "Asia/Shanghai";
        if (valuationBasis == null) valuationBasis = PriceBasis.QFQ;
        if (defaultSyncStart == null || defaultSyncStart.isBlank()) defaultSyncStart = "2000-01-01";
    }

    public ZoneId zoneId() {
        return ZoneId.of(zone);
    }

    public LocalDate defaultSyncStartDate() {
        return LocalDate.parse(defaultSyncStart);
    }
}
