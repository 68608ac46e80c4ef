package com.minipivot.backend.record;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import com.google.common.collect.ImmutableList;

/**
 * 不可变的记录快照。
 * <p>
 * 每个 Dataset 拥有进程内唯一的 id，作为缓存与会话判断“数据是否变化”的身份标识，
 * 内容相同的两次上传也视为不同的数据集。
 */
public final class Dataset {

    private static final AtomicLong NEXT_ID = new AtomicLong(1);

    private final long id;
    private final ImmutableList<Record> records;
    private final ImmutableList<String> fields;

    private Dataset(ImmutableList<Record> records) {
        this.id = NEXT_ID.getAndIncrement();
        this.records = records;
        this.fields = records.isEmpty()
                ? ImmutableList.of()
                : ImmutableList.copyOf(records.get(0).fields());
    }

    public static Dataset of(List<Record> records) {
        return new Dataset(ImmutableList.copyOf(records));
    }

    public static Dataset empty() {
        return new Dataset(ImmutableList.of());
    }

    public long id() {
        return id;
    }

    public List<Record> records() {
        return records;
    }

    /** 字段列表取自第一条记录 */
    public List<String> fields() {
        return fields;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    @Override
    public String toString() {
        return "Dataset{id=" + id + ", size=" + records.size() + "}";
    }
}
