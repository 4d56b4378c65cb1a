package com.trading.adaptive.core;

/**
 * Adaptation cycle scheduler state. A trigger observed while RUNNING is dropped.
 */
public enum CycleState {
    IDLE,
    RUNNING
}
