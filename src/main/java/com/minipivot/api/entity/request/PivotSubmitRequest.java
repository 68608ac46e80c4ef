package com.minipivot.api.entity.request;

import java.util.ArrayList;
import java.util.List;

import javax.validation.Valid;

/**
 * 透视配置：行分组、列分组与值项，缺省均为空列表。
 */
public class PivotSubmitRequest {

    private List<String> rowFields = new ArrayList<>();

    private List<String> columnFields = new ArrayList<>();

    @Valid
    private List<ValueItem> values = new ArrayList<>();

    public List<String> getRowFields() {
        return rowFields;
    }

    public void setRowFields(List<String> rowFields) {
        this.rowFields = rowFields;
    }

    public List<String> getColumnFields() {
        return columnFields;
    }

    public void setColumnFields(List<String> columnFields) {
        this.columnFields = columnFields;
    }

    public List<ValueItem> getValues() {
        return values;
    }

    public void setValues(List<ValueItem> values) {
        this.values = values;
    }
}
