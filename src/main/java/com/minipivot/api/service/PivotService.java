package com.minipivot.api.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.minipivot.api.config.PivotConfig;
import com.minipivot.api.entity.request.PivotSubmitRequest;
import com.minipivot.api.entity.request.ValueItem;
import com.minipivot.api.entity.response.FieldInfo;
import com.minipivot.api.entity.response.PivotResponse;
import com.minipivot.api.entity.response.SessionCreateResponse;
import com.minipivot.api.session.SessionManager;
import com.minipivot.backend.aggregator.AggregationSpec;
import com.minipivot.backend.engine.PivotRequest;
import com.minipivot.backend.field.FieldInspector;
import com.minipivot.backend.field.FieldRole;
import com.minipivot.backend.record.Dataset;
import com.minipivot.backend.record.Record;
import com.minipivot.backend.session.ComputationState;
import com.minipivot.backend.session.Decision;
import com.minipivot.backend.session.PivotSession;
import com.minipivot.backend.session.SessionStatus;

@Service
public class PivotService {

    private static final Logger LOGGER = LoggerFactory.getLogger(PivotService.class);

    private final SessionManager sessionManager;
    private final FieldInspector inspector = new FieldInspector();
    private final long waitMillis;

    public PivotService(SessionManager sessionManager, PivotConfig config) {
        this.sessionManager = sessionManager;
        this.waitMillis = config.getWaitMillis();
    }

    public PivotResponse<SessionCreateResponse> createSession(List<Map<String, Object>> rows) {
        try {
            List<Record> records = new ArrayList<>(rows.size());
            for (Map<String, Object> row : rows) {
                records.add(Record.of(row));
            }
            Dataset dataset = Dataset.of(records);
            Map<String, FieldRole> roles = inspector.inspect(dataset);
            Map<String, FieldInfo> fieldInfos = new LinkedHashMap<>();
            roles.forEach((field, role) -> fieldInfos.put(field, new FieldInfo(role,
                    new ArrayList<>(FieldInspector.allowedAggregates(role)),
                    FieldInspector.defaultAggregate(role))));
            String sessionId = sessionManager.createSession(dataset);
            return PivotResponse.success(new SessionCreateResponse(
                    sessionId,
                    System.currentTimeMillis(),
                    dataset.fields(),
                    FieldInspector.fieldsOf(roles, FieldRole.NUMERIC),
                    FieldInspector.fieldsOf(roles, FieldRole.DATE),
                    fieldInfos));
        } catch (Exception ex) {
            LOGGER.error("创建 session 失败", ex);
            return PivotResponse.failure(ex.getMessage());
        }
    }

    /**
     * 提交透视配置，在 waitMillis 内等待计算完成；超时则返回当前状态由客户端轮询。
     */
    public PivotResponse<SessionStatus> submit(String sessionId, PivotSubmitRequest body) {
        PivotSession session = sessionManager.getRequiredSession(sessionId);
        try {
            PivotRequest request = toRequest(body);
            return PivotResponse.success(await(session, session.submit(request)));
        } catch (Exception ex) {
            LOGGER.error("提交透视配置失败: {}", sessionId, ex);
            return PivotResponse.failure(ex.getMessage());
        }
    }

    public PivotResponse<SessionStatus> decide(String sessionId, boolean proceed) {
        PivotSession session = sessionManager.getRequiredSession(sessionId);
        try {
            return PivotResponse.success(await(session, session.decide(Decision.of(proceed))));
        } catch (Exception ex) {
            LOGGER.warn("处理告警决定失败: {}", sessionId, ex);
            return PivotResponse.failure(ex.getMessage());
        }
    }

    public PivotResponse<SessionStatus> status(String sessionId) {
        PivotSession session = sessionManager.getRequiredSession(sessionId);
        return PivotResponse.success(session.status());
    }

    private SessionStatus await(PivotSession session, CompletableFuture<ComputationState> future)
            throws InterruptedException, ExecutionException {
        try {
            future.get(waitMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            LOGGER.debug("[session={}] 计算仍在进行，返回当前状态", session.getSessionId());
        }
        return session.status();
    }

    static PivotRequest toRequest(PivotSubmitRequest body) throws Exception {
        List<AggregationSpec> values = new ArrayList<>();
        if (body.getValues() != null) {
            for (ValueItem item : body.getValues()) {
                values.add(AggregationSpec.parse(item.getField(), item.getAggregator()));
            }
        }
        PivotRequest request = PivotRequest.of(
                body.getRowFields() == null ? List.of() : body.getRowFields(),
                body.getColumnFields() == null ? List.of() : body.getColumnFields(),
                values);
        request.validate();
        return request;
    }
}
