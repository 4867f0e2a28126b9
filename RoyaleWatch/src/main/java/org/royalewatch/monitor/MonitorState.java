package org.royalewatch.monitor;

public enum MonitorState {
    IDLE,
    POLLING,
    BACKOFF,
    PAUSED
}
