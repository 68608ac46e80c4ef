package com.minipivot.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.minipivot.backend.engine.EngineOptions;
import com.minipivot.backend.estimate.CardinalityEstimator;
import com.minipivot.backend.estimate.ColumnLimiter;

@ConfigurationProperties(prefix = "minipivot.engine")
public class PivotConfig {

    /**
     * 预估列数超过该值时需要用户确认
     */
    private int warningThreshold = CardinalityEstimator.DEFAULT_WARNING_THRESHOLD;

    /**
     * 列数估算的采样记录数
     */
    private int sampleSize = CardinalityEstimator.DEFAULT_SAMPLE_SIZE;

    /**
     * 列裁剪后保留的最大列数
     */
    private int maxColumns = ColumnLimiter.DEFAULT_MAX_COLUMNS;

    /**
     * 列裁剪至少保留的列组合数
     */
    private int minCombinations = ColumnLimiter.DEFAULT_MIN_COMBINATIONS;

    /**
     * 后台计算线程数
     */
    private int workerThreads = 2;

    /**
     * 结果缓存条目上限
     */
    private long cacheSize = 32;

    /**
     * 提交配置后同步等待计算完成的最长时间，超时则返回 COMPUTING 状态由客户端轮询
     */
    private long waitMillis = 5000;

    /**
     * session 空闲超过该时长后被回收
     */
    private long sessionTtlMillis = 30 * 60 * 1000L;

    public EngineOptions toEngineOptions() {
        return new EngineOptions(warningThreshold, sampleSize, maxColumns, minCombinations);
    }

    public int getWarningThreshold() {
        return warningThreshold;
    }

    public void setWarningThreshold(int warningThreshold) {
        this.warningThreshold = warningThreshold;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public void setSampleSize(int sampleSize) {
        this.sampleSize = sampleSize;
    }

    public int getMaxColumns() {
        return maxColumns;
    }

    public void setMaxColumns(int maxColumns) {
        this.maxColumns = maxColumns;
    }

    public int getMinCombinations() {
        return minCombinations;
    }

    public void setMinCombinations(int minCombinations) {
        this.minCombinations = minCombinations;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public long getCacheSize() {
        return cacheSize;
    }

    public void setCacheSize(long cacheSize) {
        this.cacheSize = cacheSize;
    }

    public long getWaitMillis() {
        return waitMillis;
    }

    public void setWaitMillis(long waitMillis) {
        this.waitMillis = waitMillis;
    }

    public long getSessionTtlMillis() {
        return sessionTtlMillis;
    }

    public void setSessionTtlMillis(long sessionTtlMillis) {
        this.sessionTtlMillis = sessionTtlMillis;
    }
}
