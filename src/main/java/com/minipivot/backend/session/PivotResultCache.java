package com.minipivot.backend.session;

import java.util.Objects;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.minipivot.backend.engine.PivotRequest;
import com.minipivot.backend.engine.PivotResult;
import com.minipivot.backend.record.Dataset;

/**
 * 透视结果缓存，避免在相同配置间来回切换时重复计算。
 * <p>
 * 键严格由 (数据集身份, 请求, 是否裁剪列) 组成；结果不可变，可在多个会话间共享。
 */
public class PivotResultCache {

    private final Cache<Key, PivotResult> cache;

    public PivotResultCache(long maximumSize) {
        this.cache = CacheBuilder.newBuilder()
                .maximumSize(maximumSize)
                .recordStats()
                .build();
    }

    public PivotResult get(Dataset dataset, PivotRequest request, boolean limitColumns) {
        return cache.getIfPresent(new Key(dataset.id(), request, limitColumns));
    }

    public void put(Dataset dataset, PivotRequest request, boolean limitColumns, PivotResult result) {
        cache.put(new Key(dataset.id(), request, limitColumns), result);
    }

    /** 数据集被替换或会话关闭时清除其全部条目 */
    public void invalidate(Dataset dataset) {
        cache.asMap().keySet().removeIf(k -> k.datasetId == dataset.id());
    }

    public long size() {
        return cache.size();
    }

    public long hitCount() {
        return cache.stats().hitCount();
    }

    private static final class Key {
        private final long datasetId;
        private final PivotRequest request;
        private final boolean limitColumns;

        private Key(long datasetId, PivotRequest request, boolean limitColumns) {
            this.datasetId = datasetId;
            this.request = request;
            this.limitColumns = limitColumns;
        }

        @Override
        public boolean equals(Object o) {
            if(this == o) {
                return true;
            }
            if(!(o instanceof Key)) {
                return false;
            }
            Key that = (Key) o;
            return datasetId == that.datasetId
                    && limitColumns == that.limitColumns
                    && request.equals(that.request);
        }

        @Override
        public int hashCode() {
            return Objects.hash(datasetId, request, limitColumns);
        }
    }
}
