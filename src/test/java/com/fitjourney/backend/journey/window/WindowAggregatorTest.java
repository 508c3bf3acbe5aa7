package com.fitjourney.backend.journey.window;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class WindowAggregatorTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 3, 10);

    @Test
    void sums_same_day_and_keeps_sparse_dates() {
        List<DailyValue> records = List.of(
                new DailyValue(TODAY, 500),
                new DailyValue(TODAY, 700),
                new DailyValue(TODAY.minusDays(2), 1800)
        );

        Map<LocalDate, Double> totals = WindowAggregator.aggregate(records, 6, TODAY);

        assertThat(totals).hasSize(2);
        assertThat(totals.get(TODAY)).isEqualTo(1200.0);
        assertThat(totals.get(TODAY.minusDays(2))).isEqualTo(1800.0);
        assertThat(totals).doesNotContainKey(TODAY.minusDays(1));
    }

    @Test
    void excludes_records_older_than_lookback_and_after_today() {
        List<DailyValue> records = List.of(
                new DailyValue(TODAY.minusDays(7), 1000),
                new DailyValue(TODAY.minusDays(8), 1000),
                new DailyValue(TODAY.plusDays(1), 1000)
        );

        Map<LocalDate, Double> totals = WindowAggregator.aggregate(records, 7, TODAY);

        assertThat(totals).containsOnlyKeys(TODAY.minusDays(7));
    }

    @Test
    void result_does_not_depend_on_input_order() {
        List<DailyValue> records = new ArrayList<>();
        for (int i = 0; i < 10; i++) records.add(new DailyValue(TODAY.minusDays(i % 4), 100 + i));
        List<DailyValue> shuffled = new ArrayList<>(records);
        Collections.reverse(shuffled);

        assertThat(WindowAggregator.aggregate(shuffled, 7, TODAY))
                .isEqualTo(WindowAggregator.aggregate(records, 7, TODAY));
    }

    @Test
    void empty_input_gives_empty_map() {
        assertThat(WindowAggregator.aggregate(List.of(), 7, TODAY)).isEmpty();
        assertThat(WindowAggregator.aggregate(null, 7, TODAY)).isEmpty();
    }

    @Test
    void window_start_treats_negative_lookback_as_zero() {
        assertThat(WindowAggregator.windowStart(TODAY, -3)).isEqualTo(TODAY);
        assertThat(WindowAggregator.windowStart(TODAY, 6)).isEqualTo(LocalDate.of(2026, 3, 4));
    }
}
