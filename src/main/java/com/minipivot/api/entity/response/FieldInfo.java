package com.minipivot.api.entity.response;

import java.util.List;

import com.minipivot.backend.aggregator.AggregateFunc;
import com.minipivot.backend.field.FieldRole;

/**
 * 单个字段的角色及其在值区域可用的聚合方式。
 */
public class FieldInfo {

    private final FieldRole role;
    private final List<AggregateFunc> allowedAggregators;
    private final AggregateFunc defaultAggregator;

    public FieldInfo(FieldRole role, List<AggregateFunc> allowedAggregators, AggregateFunc defaultAggregator) {
        this.role = role;
        this.allowedAggregators = allowedAggregators;
        this.defaultAggregator = defaultAggregator;
    }

    public FieldRole getRole() {
        return role;
    }

    public List<AggregateFunc> getAllowedAggregators() {
        return allowedAggregators;
    }

    public AggregateFunc getDefaultAggregator() {
        return defaultAggregator;
    }
}
