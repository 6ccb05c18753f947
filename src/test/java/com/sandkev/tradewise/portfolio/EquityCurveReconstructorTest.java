package com.sandkev.tradewise.portfolio;

import com.sandkev.tradewise.price.PriceBasis;
import com.sandkev.tradewise.price.PriceCursor;
import com.sandkev.tradewise.price.PricePoint;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static com.sandkev.tradewise.testsupport.Fixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

class EquityCurveReconstructorTest {

    private static List<LocalDate> dates(String... ds) {
        return Arrays.stream(ds).map(LocalDate::parse).toList();
    }

    private static PriceCursor cursor(Map<String, List<PricePoint>> series) {
        return PriceCursor.over(series);
    }

    @Test
    void emptyLedgerGivesEmptyCurve() {
        var curve = EquityCurveReconstructor.reconstruct(List.of(), dates("2024-01-02"),
                cursor(Map.of("A", List.of(close("A", "2024-01-02", "10")))), PriceBasis.RAW);
        assertThat(curve).isEmpty();
    }

    @Test
    void carriesForwardLastKnownClose() {
        var trades = List.of(buy(1, "A", "2024-01-01", "10", "9"));
        var prices = Map.of(
                "A", List.of(close("A", "2024-01-01", "10"), close("A", "2024-01-03", "12")),
                "B", List.of(close("B", "2024-01-02", "5")));

        var curve = EquityCurveReconstructor.reconstruct(trades,
                dates("2024-01-01", "2024-01-02", "2024-01-03"), cursor(prices), PriceBasis.RAW);

        assertThat(curve).extracting(EquityPoint::time).containsExactlyElementsOf(dates("2024-01-01", "2024-01-02", "2024-01-03"));
        assertThat(curve).extracting(EquityPoint::value)
                .usingElementComparator(BigDecimal::compareTo)
                .containsExactly(new BigDecimal("100"), new BigDecimal("100"), new BigDecimal("120"));
    }

    @Test
    void unpricedPositionContributesZeroAndDateIsStillEmitted() {
        var trades = List.of(
                buy(1, "A", "2024-01-01", "10", "9"),
                buy(2, "B", "2024-01-01", "4", "5"));
        var prices = Map.of(
                "A", List.of(close("A", "2024-01-03", "10")),
                "B", List.of(close("B", "2024-01-02", "5")));

        var curve = EquityCurveReconstructor.reconstruct(trades,
                dates("2024-01-02", "2024-01-03"), cursor(prices), PriceBasis.RAW);

        assertThat(curve).hasSize(2);
        assertThat(curve.get(0).value()).isEqualByComparingTo("20");   // only B priced
        assertThat(curve.get(1).value()).isEqualByComparingTo("120");  // 10*10 + 4*5
    }

    @Test
    void tradesApplyFromTheirOwnDateOnly() {
        var trades = List.of(
                buy(1, "A", "2024-01-02", "10", "9"),
                sell(2, "A", "2024-01-03", "10", "11"),
                buy(3, "A", "2024-01-04", "1", "11"));
        var prices = Map.of("A", List.of(
                close("A", "2024-01-01", "10"), close("A", "2024-01-02", "10"),
                close("A", "2024-01-03", "11"), close("A", "2024-01-04", "11")));

        var curve = EquityCurveReconstructor.reconstruct(trades,
                dates("2024-01-01", "2024-01-02", "2024-01-03", "2024-01-04"), cursor(prices), PriceBasis.RAW);

        assertThat(curve).extracting(p -> p.value().stripTrailingZeros().toPlainString())
                .containsExactly("0", "100", "0", "11");
    }

    @Test
    void valuesOnRequestedBasisFallingBackToRaw() {
        var trades = List.of(buy(1, "A", "2024-01-01", "2", "9"));
        var prices = Map.of("A", List.of(
                closes("A", "2024-01-01", "10", "8"),
                close("A", "2024-01-02", "11")));   // no adjusted data

        var curve = EquityCurveReconstructor.reconstruct(trades,
                dates("2024-01-01", "2024-01-02"), cursor(prices), PriceBasis.QFQ);

        assertThat(curve.get(0).value()).isEqualByComparingTo("16");
        assertThat(curve.get(1).value()).isEqualByComparingTo("22");
    }
}
