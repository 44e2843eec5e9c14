package com.quakesignal.engine.infra.store;

import com.quakesignal.engine.domain.model.CanonicalRecord;
import com.quakesignal.engine.domain.model.PartitionKey;
import com.quakesignal.engine.domain.model.SourceType;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static com.quakesignal.engine.support.Records.HOUR_MS;
import static com.quakesignal.engine.support.Records.at;
import static com.quakesignal.engine.support.Records.record;
import static com.quakesignal.engine.support.Records.series;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryStandardizedStoreTest {

    private static final long DAY1 = at("2023-01-01T00:00:00Z");
    private static final PartitionKey KAK_DAY1 = new PartitionKey(SourceType.GEOMAG, "KAK", LocalDate.of(2023, 1, 1));
    private static final PartitionKey KAK_DAY2 = new PartitionKey(SourceType.GEOMAG, "KAK", LocalDate.of(2023, 1, 2));

    private final InMemoryStandardizedStore store = new InMemoryStandardizedStore();

    @Test
    void rewritingPartitionReplacesRowsInsteadOfDuplicating() {
        List<CanonicalRecord> rows = series(SourceType.GEOMAG, "KAK", "X", DAY1, HOUR_MS, 24, i -> i);

        store.writePartition(KAK_DAY1, rows);
        store.writePartition(KAK_DAY1, rows);

        assertThat(store.rowCount(KAK_DAY1)).isEqualTo(24);
        assertThat(store.partitions()).containsExactly(KAK_DAY1);
    }

    @Test
    void queryScansAcrossDailyPartitionsInTimeOrder() {
        List<CanonicalRecord> day1 = new ArrayList<>(series(SourceType.GEOMAG, "KAK", "Y", DAY1, HOUR_MS, 24, i -> i));
        day1.addAll(series(SourceType.GEOMAG, "KAK", "X", DAY1, HOUR_MS, 24, i -> i));
        store.writePartition(KAK_DAY1, day1);
        store.writePartition(KAK_DAY2, series(SourceType.GEOMAG, "KAK", "X", DAY1 + 24 * HOUR_MS, HOUR_MS, 24, i -> 100 + i));

        List<CanonicalRecord> result = store.query(SourceType.GEOMAG, "KAK", DAY1 + 22 * HOUR_MS, DAY1 + 25 * HOUR_MS);

        assertThat(result).extracting(CanonicalRecord::getChannel)
                .containsExactly("X", "Y", "X", "Y", "X", "X");
        assertThat(result).extracting(CanonicalRecord::getTsMs).isSorted();
        assertThat(store.query(SourceType.GEOMAG, "KAK", DAY1 + 25 * HOUR_MS, DAY1)).isEmpty();
        assertThat(store.query(SourceType.AEF, "KAK", DAY1, DAY1 + 25 * HOUR_MS)).isEmpty();
    }

    @Test
    void recordsOutsidePartitionAreRejected() {
        CanonicalRecord foreign = record(SourceType.GEOMAG, "MMB", "X", DAY1, 1.0);

        assertThatThrownBy(() -> store.writePartition(KAK_DAY1, List.of(foreign)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void stationsAreListedPerSource() {
        store.writePartition(KAK_DAY1, List.of(record(SourceType.GEOMAG, "KAK", "X", DAY1, 1.0)));
        store.writePartition(new PartitionKey(SourceType.GEOMAG, "MMB", LocalDate.of(2023, 1, 1)),
                List.of(record(SourceType.GEOMAG, "MMB", "X", DAY1, 1.0)));

        assertThat(store.stations(SourceType.GEOMAG)).containsExactly("KAK", "MMB");
        assertThat(store.stations(SourceType.VLF)).isEmpty();
        assertThat(store.isDurable()).isFalse();
    }
}
