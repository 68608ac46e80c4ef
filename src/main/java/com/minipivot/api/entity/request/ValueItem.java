package com.minipivot.api.entity.request;

import javax.validation.constraints.NotBlank;

public class ValueItem {

    @NotBlank(message = "field 不能为空")
    private String field;

    /**
     * sum / avg / count / min / max
     */
    @NotBlank(message = "aggregator 不能为空")
    private String aggregator;

    public ValueItem() {
    }

    public ValueItem(String field, String aggregator) {
        this.field = field;
        this.aggregator = aggregator;
    }

    public String getField() {
        return field;
    }

    public void setField(String field) {
        this.field = field;
    }

    public String getAggregator() {
        return aggregator;
    }

    public void setAggregator(String aggregator) {
        this.aggregator = aggregator;
    }
}
