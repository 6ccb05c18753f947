package com.sandkev.tradewise.marketdata;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.sandkev.tradewise.config.MarketDataProperties;
import com.sandkev.tradewise.instrument.InstrumentCategory;
import com.sandkev.tradewise.price.PriceBasis;
import com.sandkev.tradewise.shared.FiniteNumbers;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Daily klines from East Money's {@code push2his} history API. The same endpoint serves
 * A-shares and exchange-traded funds; futures are not covered.
 */
@Slf4j
@Service
public class EastMoneyKlineProvider implements MarketDataProvider {

    private static final DateTimeFormatter BEG = DateTimeFormatter.BASIC_ISO_DATE;
    private static final String END = "20500101";

    private final WebClient http;
    private final Retry retry;
    private final ObjectMapper json;
    private final Cache<String, KlineSeries> cache;

    public EastMoneyKlineProvider(WebClient marketDataWebClient, Retry marketDataRetry,
                                  ObjectMapper objectMapper, MarketDataProperties props) {
        this.http = marketDataWebClient;
        this.retry = marketDataRetry;
        this.json = objectMapper;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(Duration.parse(props.cacheTtl()))
                .maximumSize(1_000)
                .build();
    }

    @Override
    public KlineSeries dailyBars(String symbol, InstrumentCategory category, PriceBasis basis, LocalDate start) {
        if (category == InstrumentCategory.FUTURE) {
            throw new MarketDataException("Futures are not supported by the kline provider: " + symbol);
        }
        String key = symbol + "|" + basis + "|" + start;
        return cache.get(key, k -> fetch(symbol, basis, start));
    }

    /** 1 = Shanghai (6xxxxx shares, 5xxxxx funds, 9xxxxx B shares); everything else Shenzhen/Beijing. */
    static int market(String symbol) {
        char c = symbol.charAt(0);
        return (c == '5' || c == '6' || c == '9') ? 1 : 0;
    }

    static int fqt(PriceBasis basis) {
        return switch (basis) {
            case RAW -> 0;
            case QFQ -> 1;
            case HFQ -> 2;
        };
    }

    // ---- HTTP call ----

    private KlineSeries fetch(String symbol, PriceBasis basis, LocalDate start) {
        String body;
        try {
            body = http.get()
                    .uri(uri -> uri.path("/api/qt/stock/kline/get")
                            .queryParam("secid", market(symbol) + "." + symbol)
                            .queryParam("fields1", "f1,f2,f3,f4,f5,f6")
                            .queryParam("fields2", "f51,f52,f53,f54,f55,f56")
                            .queryParam("klt", 101)
                            .queryParam("fqt", fqt(basis))
                            .queryParam("beg", BEG.format(start))
                            .queryParam("end", END)
                            .build())
                    .retrieve()
                    .bodyToMono(String.class)
                    .retryWhen(retry)
                    .block();
        } catch (RuntimeException e) {
            throw new MarketDataException("Kline request failed for " + symbol + " (" + basis + "): " + e.getMessage(), e);
        }
        if (body == null || body.isBlank()) {
            throw new MarketDataException("Empty kline response for " + symbol + " (" + basis + ")");
        }
        KlineSeries series = parse(symbol, body);
        log.debug("Fetched {} {} bars for {} from {}", series.bars().size(), basis, symbol, start);
        return series;
    }

    // ---- parsing ----

    KlineSeries parse(String symbol, String body) {
        JsonNode root;
        try {
            root = json.readTree(body);
        } catch (IOException e) {
            throw new MarketDataException("Unreadable kline payload for " + symbol, e);
        }
        JsonNode data = root.path("data");
        if (data.isMissingNode() || data.isNull()) {
            throw new MarketDataException("Unknown symbol at provider: " + symbol);
        }

        String name = data.path("name").isTextual() ? data.path("name").asText().trim() : null;
        List<DailyBar> bars = new ArrayList<>();
        for (JsonNode line : data.path("klines")) {
            DailyBar bar = bar(line.asText());
            if (bar == null) {
                log.warn("Dropping unreadable kline row for {}: {}", symbol, line.asText());
                continue;
            }
            bars.add(bar);
        }
        return new KlineSeries(symbol, (name == null || name.isEmpty()) ? null : name, bars);
    }

    /** {@code yyyy-MM-dd,open,close,high,low,volume[,...]}; null when the date is unusable. */
    private static DailyBar bar(String line) {
        String[] f = line.split(",");
        if (f.length < 6) return null;
        LocalDate date;
        try {
            date = LocalDate.parse(f[0].trim());
        } catch (DateTimeParseException e) {
            return null;
        }
        return new DailyBar(date, num(f[1]), num(f[3]), num(f[4]), num(f[2]), num(f[5]));
    }

    private static BigDecimal num(String s) {
        return FiniteNumbers.parse(s).orElse(null);
    }
}
