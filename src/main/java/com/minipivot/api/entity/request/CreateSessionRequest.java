package com.minipivot.api.entity.request;

import java.util.List;
import java.util.Map;

import javax.validation.constraints.NotNull;

public class CreateSessionRequest {

    /**
     * 已解析的记录，值只允许字符串、数值、布尔或 null
     */
    @NotNull(message = "records 不能为空")
    private List<Map<String, Object>> records;

    public List<Map<String, Object>> getRecords() {
        return records;
    }

    public void setRecords(List<Map<String, Object>> records) {
        this.records = records;
    }
}
