package com.minipivot.backend.session;

/**
 * 透视会话的计算状态。
 * <pre>
 * IDLE -> ESTIMATING -> {AWAITING_APPROVAL | COMPUTING} -> {READY | ERROR}
 * </pre>
 */
public enum ComputationState {
    IDLE,
    ESTIMATING,
    AWAITING_APPROVAL,
    COMPUTING,
    READY,
    ERROR;

    /** 不会再自行变化的状态 */
    public boolean isSettled() {
        return this == IDLE || this == AWAITING_APPROVAL || this == READY || this == ERROR;
    }
}
