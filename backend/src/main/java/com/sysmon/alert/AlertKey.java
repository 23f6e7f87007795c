package com.sysmon.alert;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Objects;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AlertKey(String hostname, String metric, String subResource) {

    public AlertKey {
        Objects.requireNonNull(hostname, "hostname");
        Objects.requireNonNull(metric, "metric");
    }

    public static AlertKey of(String hostname, String metric) {
        return new AlertKey(hostname, metric, null);
    }

    @Override
    public String toString() {
        return subResource == null
            ? hostname + "/" + metric
            : hostname + "/" + metric + ":" + subResource;
    }
}
