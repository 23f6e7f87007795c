package com.sysmon.storage;

import com.sysmon.dto.MetricSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static com.sysmon.TestSnapshots.fs;
import static com.sysmon.TestSnapshots.snapshot;
import static com.sysmon.TestSnapshots.withDisks;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TimeSeriesStorageBackendTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private TimeSeriesStorageBackend backend;

    @Mock
    private PointStore failingStore;

    @BeforeEach
    void setUp() {
        backend = new TimeSeriesStorageBackend("memory", new InMemoryPointStore());
    }

    private static SnapshotQuery all() {
        return new SnapshotQuery(null, Instant.EPOCH, Instant.parse("2100-01-01T00:00:00Z"));
    }

    @Test
    void write_thenQuery_returnsSnapshot() {
        MetricSnapshot s = snapshot("h1", T0, 42.5, 30.0);

        assertThat(backend.write(s)).isEqualTo(WriteOutcome.STORED);

        assertThat(backend.query(all())).containsExactly(s);
    }

    @Test
    void write_sameHostAndTimestamp_isDeduplicated() {
        backend.write(snapshot("h1", T0, 10, 10));

        assertThat(backend.write(snapshot("h1", T0, 99, 99))).isEqualTo(WriteOutcome.DUPLICATE);

        assertThat(backend.query(all())).singleElement()
            .extracting(s -> s.cpu().overallPercent()).isEqualTo(10.0);
    }

    @Test
    void query_orderedByTimestampThenHostname() {
        backend.write(snapshot("h2", T0.plusSeconds(30), 1, 1));
        backend.write(snapshot("h2", T0, 1, 1));
        backend.write(snapshot("h1", T0.plusSeconds(30), 1, 1));
        backend.write(snapshot("h1", T0, 1, 1));

        assertThat(backend.query(all()))
            .extracting(MetricSnapshot::hostname, MetricSnapshot::timestamp)
            .containsExactly(
                tuple("h1", T0), tuple("h2", T0),
                tuple("h1", T0.plusSeconds(30)), tuple("h2", T0.plusSeconds(30)));
    }

    @Test
    void query_hostFilterAndInclusiveRange() {
        for (int i = 0; i < 5; i++) {
            backend.write(snapshot("h1", T0.plusSeconds(i * 30L), i, 1));
            backend.write(snapshot("h2", T0.plusSeconds(i * 30L), i, 1));
        }

        List<MetricSnapshot> result = backend.query(new SnapshotQuery("h1", T0.plusSeconds(30), T0.plusSeconds(90)));

        assertThat(result).extracting(MetricSnapshot::timestamp)
            .containsExactly(T0.plusSeconds(30), T0.plusSeconds(60), T0.plusSeconds(90));
        assertThat(result).allMatch(s -> s.hostname().equals("h1"));
    }

    @Test
    void write_snapshotWithoutMetricGroups_isStillQueryable() {
        MetricSnapshot empty = new MetricSnapshot("h1", T0, null, null, null, null, null, null);

        backend.write(empty);

        assertThat(backend.query(all())).containsExactly(empty);
    }

    @Test
    void write_emptyDiskListIsDistinctFromMissingDisk() {
        MetricSnapshot noFilesystems = withDisks("h1", T0);

        backend.write(noFilesystems);

        assertThat(backend.query(all())).singleElement()
            .satisfies(s -> assertThat(s.disk()).isNotNull())
            .satisfies(s -> assertThat(s.disk().filesystems()).isEmpty());
    }

    @Test
    void write_filesystemsReturnedSortedByMountPoint() {
        backend.write(withDisks("h1", T0, fs("/var", 50), fs("/", 20), fs("/data", 70)));

        assertThat(backend.query(all()).get(0).disk().filesystems())
            .extracting(f -> f.mountPoint()).containsExactly("/", "/data", "/var");
    }

    @Test
    void write_concurrentDuplicates_storeOnce() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Future<WriteOutcome>> outcomes = new ArrayList<>();
        try {
            for (int i = 0; i < 16; i++) {
                outcomes.add(pool.submit(() -> backend.write(snapshot("h1", T0, 50, 50))));
            }
            List<WriteOutcome> results = new ArrayList<>();
            for (Future<WriteOutcome> f : outcomes) results.add(f.get());

            assertThat(results).filteredOn(o -> o == WriteOutcome.STORED).hasSize(1);
        } finally {
            pool.shutdownNow();
        }
        assertThat(backend.query(all())).hasSize(1);
    }

    @Test
    void write_storeFailure_raisesStorageException() {
        when(failingStore.exists(anyString(), anyString(), any())).thenReturn(false);
        doThrow(new IllegalStateException("disk full")).when(failingStore).write(anyList());
        TimeSeriesStorageBackend failing = new TimeSeriesStorageBackend("influxdb", failingStore);

        assertThatThrownBy(() -> failing.write(snapshot("h1", T0, 1, 1)))
            .isInstanceOf(StorageException.class)
            .hasMessageContaining("h1");
    }

    @Test
    void ping_storeFailure_returnsFalse() {
        when(failingStore.ping()).thenThrow(new IllegalStateException("down"));

        assertThat(new TimeSeriesStorageBackend("influxdb", failingStore).ping()).isFalse();
    }

    @Test
    void snapshotQuery_sinceAfterUntil_isRejected() {
        assertThatThrownBy(() -> new SnapshotQuery(null, T0.plusSeconds(1), T0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
