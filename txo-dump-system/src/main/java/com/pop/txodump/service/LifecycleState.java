package com.pop.txodump.service;

/**
 * IDLE → STARTED → RUNNING → COMPLETED
 */
public enum LifecycleState {
    IDLE,
    STARTED,
    RUNNING,
    COMPLETED
}
