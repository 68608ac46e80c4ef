package com.minipivot.api.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.minipivot.api.config.PivotConfig;
import com.minipivot.api.entity.request.PivotSubmitRequest;
import com.minipivot.api.entity.request.ValueItem;
import com.minipivot.api.entity.response.FieldInfo;
import com.minipivot.api.entity.response.PivotResponse;
import com.minipivot.api.entity.response.SessionCreateResponse;
import com.minipivot.api.exception.SessionNotFoundException;
import com.minipivot.api.session.SessionManager;
import com.minipivot.backend.aggregator.AggregateFunc;
import com.minipivot.backend.engine.PivotRequest;
import com.minipivot.backend.field.FieldRole;
import com.minipivot.backend.session.ComputationState;
import com.minipivot.backend.session.SessionStatus;

import static org.junit.jupiter.api.Assertions.*;

public class PivotServiceTest {

    private SessionManager manager;
    private PivotService service;

    @BeforeEach
    public void setUp() {
        PivotConfig config = new PivotConfig();
        config.setWarningThreshold(5);
        config.setMaxColumns(10);
        manager = new SessionManager(config);
        service = new PivotService(manager, config);
    }

    @AfterEach
    public void tearDown() {
        manager.destroy();
    }

    private static Map<String, Object> row(String region, String product, Object sales) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("region", region);
        row.put("product", product);
        row.put("sales", sales);
        return row;
    }

    private static List<Map<String, Object>> rows() {
        List<Map<String, Object>> rows = new ArrayList<>();
        rows.add(row("East", "A", 10));
        rows.add(row("East", "B", 20));
        rows.add(row("West", "A", 5));
        return rows;
    }

    private static PivotSubmitRequest body(List<String> rowFields, List<String> colFields, ValueItem... values) {
        PivotSubmitRequest body = new PivotSubmitRequest();
        body.setRowFields(rowFields);
        body.setColumnFields(colFields);
        body.setValues(List.of(values));
        return body;
    }

    private String createSession(List<Map<String, Object>> rows) {
        PivotResponse<SessionCreateResponse> created = service.createSession(rows);
        assertTrue(created.isSuccess(), created.getError());
        return created.getData().getSessionId();
    }

    @Test
    public void testCreateSession() {
        PivotResponse<SessionCreateResponse> created = service.createSession(rows());
        assertTrue(created.isSuccess());
        assertEquals(List.of("region", "product", "sales"), created.getData().getFields());
        assertEquals(List.of("sales"), created.getData().getNumericFields());
        assertTrue(created.getData().getDateFields().isEmpty());

        FieldInfo sales = created.getData().getFieldInfos().get("sales");
        assertEquals(FieldRole.NUMERIC, sales.getRole());
        assertEquals(List.of(AggregateFunc.values()), sales.getAllowedAggregators());
        assertEquals(AggregateFunc.SUM, sales.getDefaultAggregator());

        FieldInfo region = created.getData().getFieldInfos().get("region");
        assertEquals(FieldRole.TEXT, region.getRole());
        assertEquals(List.of(AggregateFunc.COUNT), region.getAllowedAggregators());
        assertEquals(AggregateFunc.COUNT, region.getDefaultAggregator());
        assertEquals(List.of("region", "product", "sales"), List.copyOf(created.getData().getFieldInfos().keySet()));
    }

    @Test
    public void testCreateSessionRejectsUnsupportedValue() {
        List<Map<String, Object>> rows = rows();
        rows.get(0).put("sales", List.of(1, 2));
        PivotResponse<SessionCreateResponse> created = service.createSession(rows);
        assertFalse(created.isSuccess());
        assertNotNull(created.getError());
        assertEquals(0, manager.size());
    }

    @Test
    public void testSubmitAndPoll() {
        String id = createSession(rows());
        PivotResponse<SessionStatus> submitted = service.submit(id,
                body(List.of("region"), List.of("product"), new ValueItem("sales", "sum")));

        assertTrue(submitted.isSuccess());
        assertEquals(ComputationState.READY, submitted.getData().getState());
        assertEquals(2, submitted.getData().getResult().getTable().size());

        SessionStatus polled = service.status(id).getData();
        assertEquals(ComputationState.READY, polled.getState());
    }

    @Test
    public void testSubmitInvalidAggregator() {
        String id = createSession(rows());
        PivotResponse<SessionStatus> submitted = service.submit(id,
                body(List.of("region"), List.of(), new ValueItem("sales", "median")));
        assertFalse(submitted.isSuccess());
        assertEquals(ComputationState.IDLE, service.status(id).getData().getState());
    }

    @Test
    public void testWarningAndDecision() {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            rows.add(row("r" + i, "p" + i, i));
        }
        String id = createSession(rows);

        PivotResponse<SessionStatus> submitted = service.submit(id,
                body(List.of(), List.of("region"), new ValueItem("sales", "sum")));
        assertEquals(ComputationState.AWAITING_APPROVAL, submitted.getData().getState());
        assertEquals(20, submitted.getData().getEstimation().getEstimatedColumns());

        SessionStatus decided = service.decide(id, true).getData();
        assertEquals(ComputationState.READY, decided.getState());
        assertTrue(decided.getResult().getColumnLimitInfo().isColumnsLimited());
        assertEquals(10, decided.getResult().getLeafCols().size());

        // 已不在等待审批状态
        assertFalse(service.decide(id, false).isSuccess());
    }

    @Test
    public void testCancelDecision() {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            rows.add(row("r" + i, "p" + i, i));
        }
        String id = createSession(rows);
        service.submit(id, body(List.of(), List.of("region"), new ValueItem("sales", "count")));

        SessionStatus decided = service.decide(id, false).getData();
        assertEquals(ComputationState.IDLE, decided.getState());
        assertEquals(PivotRequest.EMPTY, decided.getRequest());
    }

    @Test
    public void testUnknownSession() {
        assertThrows(SessionNotFoundException.class, () -> service.status("nope"));
        assertThrows(SessionNotFoundException.class,
                () -> service.submit("nope", body(List.of("region"), List.of())));
    }

    @Test
    public void testToRequest() throws Exception {
        PivotSubmitRequest body = new PivotSubmitRequest();
        body.setValues(List.of(new ValueItem("sales", "AVG")));
        PivotRequest request = PivotService.toRequest(body);

        assertTrue(request.getRowFields().isEmpty());
        assertTrue(request.getColumnFields().isEmpty());
        assertEquals(AggregateFunc.AVG, request.getValues().get(0).getFunc());

        assertThrows(RuntimeException.class,
                () -> PivotService.toRequest(body(List.of("region", "region"), List.of())));
    }
}
