package com.sandkev.tradewise.price;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static com.sandkev.tradewise.testsupport.Fixtures.close;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PriceCursorTest {

    private final PriceCursor cursor = PriceCursor.over(Map.of("A", List.of(
            close("A", "2024-01-05", "12"),     // deliberately unsorted
            close("A", "2024-01-02", "10"),
            close("A", "2024-01-03", "11"))));

    private static LocalDate d(String s) { return LocalDate.parse(s); }

    @Test
    void returnsLatestPointAtOrBeforeDate() {
        assertThat(cursor.latestAtOrBefore("A", d("2024-01-01"))).isEmpty();
        assertThat(cursor.latestAtOrBefore("A", d("2024-01-02")).orElseThrow().raw().close()).isEqualByComparingTo("10");
        assertThat(cursor.latestAtOrBefore("A", d("2024-01-04")).orElseThrow().raw().close()).isEqualByComparingTo("11");
        assertThat(cursor.latestAtOrBefore("A", d("2024-02-01")).orElseThrow().raw().close()).isEqualByComparingTo("12");
    }

    @Test
    void repeatedDateIsAllowed() {
        cursor.latestAtOrBefore("A", d("2024-01-03"));
        assertThat(cursor.latestAtOrBefore("A", d("2024-01-03"))).isPresent();
    }

    @Test
    void rejectsGoingBackInTime() {
        cursor.latestAtOrBefore("A", d("2024-01-05"));
        assertThatThrownBy(() -> cursor.latestAtOrBefore("A", d("2024-01-02")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("rewind");
    }

    @Test
    void unknownSymbolHasNoPrice() {
        assertThat(cursor.latestAtOrBefore("ZZZ", d("2024-01-05"))).isEmpty();
    }
}
