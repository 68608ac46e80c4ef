package com.minipivot.backend.estimate;

import java.util.List;

import com.minipivot.backend.record.Record;

/**
 * 裁剪后的记录集与裁剪摘要。
 */
public final class LimitedData {

    private final List<Record> records;
    private final ColumnLimitInfo info;

    public LimitedData(List<Record> records, ColumnLimitInfo info) {
        this.records = records;
        this.info = info;
    }

    public List<Record> getRecords() {
        return records;
    }

    public ColumnLimitInfo getInfo() {
        return info;
    }
}
