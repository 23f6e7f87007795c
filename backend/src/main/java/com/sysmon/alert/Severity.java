package com.sysmon.alert;

public enum Severity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL;

    static final double CRITICAL_PERCENT = 95.0;
    static final double ERROR_MARGIN = 10.0;

    public static Severity forBreach(double value, double threshold) {
        if (value >= CRITICAL_PERCENT) return CRITICAL;
        if (value >= threshold + ERROR_MARGIN) return ERROR;
        return WARNING;
    }
}
