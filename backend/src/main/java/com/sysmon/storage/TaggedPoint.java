package com.sysmon.storage;

import java.time.Instant;
import java.util.Map;

public record TaggedPoint(
    String measurement,
    Map<String, String> tags,
    Map<String, Object> fields,
    Instant time
) {
    public TaggedPoint {
        tags = Map.copyOf(tags);
        fields = Map.copyOf(fields);
    }

    public String tag(String key) {
        return tags.get(key);
    }

    public String seriesKey() {
        StringBuilder sb = new StringBuilder(measurement);
        tags.entrySet().stream()
            .sorted(Map.Entry.comparingByKey())
            .forEach(e -> sb.append(',').append(e.getKey()).append('=').append(e.getValue()));
        return sb.toString();
    }
}
