package com.minipivot.backend.session;

import com.minipivot.backend.engine.PivotRequest;
import com.minipivot.backend.engine.PivotResult;
import com.minipivot.backend.estimate.PivotEstimation;

/**
 * 会话在某一时刻的一致快照，供上层展示。
 */
public final class SessionStatus {

    private final ComputationState state;
    private final PivotRequest request;
    private final PivotEstimation estimation;
    private final PivotResult result;
    private final String error;

    SessionStatus(ComputationState state, PivotRequest request, PivotEstimation estimation,
                  PivotResult result, String error) {
        this.state = state;
        this.request = request;
        this.estimation = estimation;
        this.result = result;
        this.error = error;
    }

    public ComputationState getState() {
        return state;
    }

    public PivotRequest getRequest() {
        return request;
    }

    public PivotEstimation getEstimation() {
        return estimation;
    }

    /** 仅 READY 时非空 */
    public PivotResult getResult() {
        return result;
    }

    /** 仅 ERROR 时非空 */
    public String getError() {
        return error;
    }
}
