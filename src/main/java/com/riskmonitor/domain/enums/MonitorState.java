package com.riskmonitor.domain.enums;

/**
 * Lifecycle state of a {@link com.riskmonitor.monitor.MonitorEngine}.
 *
 * <p>STOPPED is the initial state. start() moves to RUNNING, stop() back to STOPPED.
 * Repeating either call in its target state is a no-op.
 */
public enum MonitorState {
    STOPPED,
    RUNNING
}
