package com.minipivot.backend.engine;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.minipivot.backend.estimate.CardinalityEstimator;
import com.minipivot.backend.estimate.ColumnLimitInfo;
import com.minipivot.backend.estimate.ColumnLimiter;
import com.minipivot.backend.estimate.LimitedData;
import com.minipivot.backend.estimate.PivotEstimation;
import com.minipivot.backend.layout.HeaderCell;
import com.minipivot.backend.layout.HeaderTreeBuilder;
import com.minipivot.backend.layout.RowSpanCalculator;
import com.minipivot.backend.layout.RowSpanInfo;
import com.minipivot.backend.pivot.AggregateResult;
import com.minipivot.backend.pivot.Aggregator;
import com.minipivot.backend.pivot.GrandTotalCalculator;
import com.minipivot.backend.pivot.PivotRow;
import com.minipivot.backend.pivot.SubtotalBuilder;
import com.minipivot.backend.record.Dataset;
import com.minipivot.backend.record.Record;

/**
 * 透视计算流水线：(记录, 请求) -> 结果，无共享可变状态。
 * <p>
 * 流程：
 * <ol>
 *     <li>可选的列裁剪 {@link ColumnLimiter}</li>
 *     <li>分桶聚合 {@link Aggregator}</li>
 *     <li>插入小计 {@link SubtotalBuilder} 与总计 {@link GrandTotalCalculator}（仅有值字段时）</li>
 *     <li>列表头 {@link HeaderTreeBuilder} 与行合并 {@link RowSpanCalculator}</li>
 * </ol>
 */
public class PivotEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(PivotEngine.class);

    private final CardinalityEstimator estimator;
    private final ColumnLimiter limiter;

    public PivotEngine() {
        this(EngineOptions.defaults());
    }

    public PivotEngine(EngineOptions options) {
        this.estimator = new CardinalityEstimator(options.getWarningThreshold(), options.getSampleSize());
        this.limiter = new ColumnLimiter(options.getMaxColumns(), options.getMinCombinations());
    }

    public PivotEstimation estimate(Dataset dataset, PivotRequest request) {
        PivotEstimation estimation = estimator.estimate(dataset.records(), request.getColumnFields(), request.getValues());
        LOGGER.debug("[dataset={}] Estimate {}: {}", dataset.id(), request, estimation);
        return estimation;
    }

    /**
     * 执行完整透视计算。
     *
     * @param limitColumns 是否先按 {@link ColumnLimiter} 裁剪列组合
     */
    public PivotResult compute(Dataset dataset, PivotRequest request, boolean limitColumns) {
        long start = System.nanoTime();
        List<String> rowFields = request.getRowFields();
        List<String> colFields = request.getColumnFields();

        List<Record> records = dataset.records();
        ColumnLimitInfo limitInfo = null;
        if(limitColumns) {
            LimitedData limited = limiter.limit(records, colFields, request.getValues());
            records = limited.getRecords();
            limitInfo = limited.getInfo();
        }

        AggregateResult aggregated = Aggregator.aggregate(records, rowFields, colFields, request.getValues());
        List<PivotRow> table = aggregated.getTable();
        PivotRow grandTotal = null;
        if(request.hasValues()) {
            table = SubtotalBuilder.insertSubtotals(table, rowFields, aggregated.getColKeys());
            grandTotal = GrandTotalCalculator.compute(table, rowFields, aggregated.getColKeys());
        }

        List<List<HeaderCell>> headerRows = HeaderTreeBuilder.build(aggregated.getColKeys(), colFields, request.hasValues());
        List<List<RowSpanInfo>> rowSpans = RowSpanCalculator.compute(table, rowFields);

        long elapsed = System.nanoTime() - start;
        LOGGER.info("[dataset={}] Pivot {} -> {} rows x {} columns in {} ms",
                dataset.id(), request, table.size(), aggregated.getColKeys().size(), elapsed / 1_000_000);
        return new PivotResult(table, grandTotal, rowFields, colFields, aggregated.getColKeys(),
                headerRows, rowSpans, aggregated.getColAggInfo(), limitInfo, elapsed);
    }
}
