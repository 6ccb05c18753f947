package com.sandkev.tradewise.portfolio;

import com.sandkev.tradewise.ledger.Trade;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static com.sandkev.tradewise.testsupport.Fixtures.buy;
import static com.sandkev.tradewise.testsupport.Fixtures.sell;
import static org.assertj.core.api.Assertions.assertThat;

class HoldingsCalculatorTest {

    private final HoldingsCalculator calc = new HoldingsCalculator();

    private final List<Trade> moutai = List.of(
            buy(1, "600519", "2024-01-02", "100", "1650"),
            buy(2, "600519", "2024-01-15", "50", "1600"),
            sell(3, "600519", "2024-06-01", "100", "1800")
    );

    @Test
    void holdingsAsOf_appliesBuysAndSellsUpToTheDate() {
        var h = calc.holdingsAsOf(moutai, LocalDate.parse("2024-06-02"));
        assertThat(h.get("600519")).isEqualByComparingTo("50");
    }

    @Test
    void holdingsAsOf_ignoresTradesAfterTheDate() {
        assertThat(calc.holdingsAsOf(moutai, LocalDate.parse("2024-01-10")).get("600519")).isEqualByComparingTo("100");
        assertThat(calc.holdingsAsOf(moutai, LocalDate.parse("2024-05-31")).get("600519")).isEqualByComparingTo("150");
        assertThat(calc.holdingsAsOf(moutai, LocalDate.parse("2024-01-01"))).isEmpty();
    }

    @Test
    void holdingsAsOf_doesNotDependOnInputOrder() {
        var trades = new ArrayList<Trade>(moutai);
        trades.add(buy(4, "000001", "2024-02-01", "300", "9.5"));
        trades.add(sell(5, "000001", "2024-03-01", "100", "10.1"));
        var asOf = LocalDate.parse("2024-12-31");
        var expected = calc.holdingsAsOf(trades, asOf);

        var rnd = new Random(42);
        for (int i = 0; i < 10; i++) {
            Collections.shuffle(trades, rnd);
            assertThat(calc.holdingsAsOf(trades, asOf)).isEqualTo(expected);
        }
        Collections.reverse(trades);
        assertThat(calc.holdingsAsOf(trades, asOf)).isEqualTo(expected);
    }

    @Test
    void oversellIsKeptAsNegativeAndReported() {
        var trades = List.of(
                buy(1, "510300", "2024-01-02", "10", "3.5"),
                sell(2, "510300", "2024-01-03", "15", "3.6"),
                buy(3, "600000", "2024-01-02", "5", "7"),
                sell(4, "600000", "2024-01-05", "5", "7.2")
        );
        var asOf = LocalDate.parse("2024-01-31");

        var raw = calc.holdingsAsOf(trades, asOf);
        assertThat(raw.get("510300")).isEqualByComparingTo("-5");
        assertThat(raw.get("600000")).isEqualByComparingTo(BigDecimal.ZERO);

        assertThat(calc.currentHoldings(trades, asOf)).isEmpty();
        assertThat(calc.oversold(trades, asOf)).containsExactly("510300");
    }
}
