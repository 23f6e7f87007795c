package com.sysmon.storage;

public enum WriteOutcome {
    STORED,
    DUPLICATE
}
