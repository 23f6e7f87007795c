package com.sysmon.storage;

import com.influxdb.client.InfluxDBClient;
import com.influxdb.client.domain.WritePrecision;
import com.influxdb.client.write.Point;
import com.influxdb.exceptions.InfluxException;
import com.influxdb.query.FluxRecord;
import com.influxdb.query.FluxTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class InfluxPointStore implements PointStore {

    private static final Logger log = LoggerFactory.getLogger(InfluxPointStore.class);

    private static final Set<String> TAG_KEYS = Set.of(
        SnapshotPointMapper.TAG_HOST, SnapshotPointMapper.TAG_TYPE, SnapshotPointMapper.TAG_CORE,
        SnapshotPointMapper.TAG_MOUNT, SnapshotPointMapper.TAG_DEVICE, SnapshotPointMapper.TAG_FS_TYPE);
    private static final Set<String> RESERVED_COLUMNS = Set.of("result", "table");

    private final InfluxDBClient client;
    private final String org;
    private final String bucket;

    public InfluxPointStore(InfluxDBClient client, String org, String bucket) {
        this.client = client;
        this.org = org;
        this.bucket = bucket;
    }

    @Override
    public void write(List<TaggedPoint> points) {
        List<Point> batch = new ArrayList<>(points.size());
        for (TaggedPoint p : points) {
            batch.add(Point.measurement(p.measurement())
                .addTags(p.tags())
                .addFields(p.fields())
                .time(p.time(), WritePrecision.MS));
        }
        try {
            client.getWriteApiBlocking().writePoints(bucket, org, batch);
        } catch (InfluxException e) {
            throw new StorageException("InfluxDB write failed (status " + e.status() + "): " + e.getMessage(), e);
        }
    }

    @Override
    public boolean exists(String measurement, String hostname, Instant time) {
        String flux = "from(bucket: \"" + escape(bucket) + "\")"
            + " |> range(start: " + time + ", stop: " + time.plus(1, ChronoUnit.MILLIS) + ")"
            + " |> filter(fn: (r) => r._measurement == \"" + escape(measurement) + "\""
            + " and r." + SnapshotPointMapper.TAG_HOST + " == \"" + escape(hostname) + "\")"
            + " |> limit(n: 1)";
        return runQuery(flux).stream().anyMatch(table -> !table.getRecords().isEmpty());
    }

    @Override
    public List<TaggedPoint> read(String hostname, Instant since, Instant until) {
        StringBuilder flux = new StringBuilder()
            .append("from(bucket: \"").append(escape(bucket)).append("\")")
            .append(" |> range(start: ").append(since)
            .append(", stop: ").append(until.plus(1, ChronoUnit.MILLIS)).append(")");
        if (hostname != null) {
            flux.append(" |> filter(fn: (r) => r.").append(SnapshotPointMapper.TAG_HOST)
                .append(" == \"").append(escape(hostname)).append("\")");
        }
        flux.append(" |> pivot(rowKey: [\"_time\"], columnKey: [\"_field\"], valueColumn: \"_value\")");

        List<TaggedPoint> points = new ArrayList<>();
        for (FluxTable table : runQuery(flux.toString())) {
            for (FluxRecord record : table.getRecords()) {
                points.add(toPoint(record));
            }
        }
        return points;
    }

    @Override
    public boolean ping() {
        try {
            return Boolean.TRUE.equals(client.ping());
        } catch (InfluxException e) {
            log.warn("InfluxDB ping failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        client.close();
        log.info("InfluxDB connection closed");
    }

    static TaggedPoint toPoint(FluxRecord record) {
        Map<String, String> tags = new LinkedHashMap<>();
        Map<String, Object> fields = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : record.getValues().entrySet()) {
            String column = e.getKey();
            Object value = e.getValue();
            if (column.startsWith("_") || RESERVED_COLUMNS.contains(column) || value == null) {
                continue;
            }
            if (TAG_KEYS.contains(column)) {
                tags.put(column, value.toString());
            } else {
                fields.put(column, value);
            }
        }
        return new TaggedPoint(record.getMeasurement(), tags, fields, record.getTime());
    }

    private List<FluxTable> runQuery(String flux) {
        try {
            return client.getQueryApi().query(flux, org);
        } catch (InfluxException e) {
            throw new StorageException("InfluxDB query failed (status " + e.status() + "): " + e.getMessage(), e);
        }
    }

    private static String escape(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
