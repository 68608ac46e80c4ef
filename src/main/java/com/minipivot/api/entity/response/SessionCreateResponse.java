package com.minipivot.api.entity.response;

import java.util.List;
import java.util.Map;

/**
 * 新建 session 的结果，附带字段列表与推断出的字段角色。
 */
public class SessionCreateResponse {

    private final String sessionId;
    private final long createdAt;
    private final List<String> fields;
    private final List<String> numericFields;
    private final List<String> dateFields;
    /** 字段 -> 角色与可用聚合，顺序与 fields 一致 */
    private final Map<String, FieldInfo> fieldInfos;

    public SessionCreateResponse(String sessionId, long createdAt, List<String> fields,
                                 List<String> numericFields, List<String> dateFields,
                                 Map<String, FieldInfo> fieldInfos) {
        this.sessionId = sessionId;
        this.createdAt = createdAt;
        this.fields = fields;
        this.numericFields = numericFields;
        this.dateFields = dateFields;
        this.fieldInfos = fieldInfos;
    }

    public String getSessionId() {
        return sessionId;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public List<String> getFields() {
        return fields;
    }

    public List<String> getNumericFields() {
        return numericFields;
    }

    public List<String> getDateFields() {
        return dateFields;
    }

    public Map<String, FieldInfo> getFieldInfos() {
        return fieldInfos;
    }
}
