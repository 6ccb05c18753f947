package com.sandkev.tradewise.portfolio;

import com.sandkev.tradewise.config.PortfolioProperties;
import com.sandkev.tradewise.ledger.TradeLedger;
import com.sandkev.tradewise.testsupport.InMemoryPriceStore;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

import static com.sandkev.tradewise.testsupport.Fixtures.buy;
import static com.sandkev.tradewise.testsupport.Fixtures.close;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class EquityCurveServiceTest {

    private final ZoneId zone = ZoneId.of("Asia/Shanghai");
    private final Clock clock = Clock.fixed(LocalDate.parse("2024-01-10").atStartOfDay(zone).toInstant(), zone);

    @Test
    void calendarStartsAtFirstTradeAndStopsAtToday() {
        var ledger = mock(TradeLedger.class);
        when(ledger.all()).thenReturn(List.of(buy(1, "A", "2024-01-03", "2", "10")));
        var prices = new InMemoryPriceStore().with(
                close("A", "2024-01-02", "10"),
                close("A", "2024-01-04", "11"),
                close("B", "2024-01-05", "99"),
                close("A", "2024-01-11", "12"));

        var svc = new EquityCurveService(ledger, prices, new PortfolioProperties(null, null, null), clock);
        var curve = svc.equityCurve();

        assertThat(curve).extracting(EquityPoint::time)
                .containsExactly(LocalDate.parse("2024-01-04"), LocalDate.parse("2024-01-05"));
        assertThat(curve.get(0).value()).isEqualByComparingTo("22");
        assertThat(curve.get(1).value()).isEqualByComparingTo("22");
    }

    @Test
    void emptyLedgerGivesEmptyCurve() {
        var ledger = mock(TradeLedger.class);
        when(ledger.all()).thenReturn(List.of());
        var prices = new InMemoryPriceStore().with(close("A", "2024-01-02", "10"));

        var svc = new EquityCurveService(ledger, prices, new PortfolioProperties(null, null, null), clock);

        assertThat(svc.equityCurve()).isEmpty();
    }
}
