package com.sysmon.alert;

public enum AlertPhase {
    NORMAL,
    FIRING,
    COOLDOWN
}
