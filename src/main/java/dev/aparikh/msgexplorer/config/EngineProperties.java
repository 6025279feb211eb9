package dev.aparikh.msgexplorer.config;

import dev.aparikh.msgexplorer.dimension.TimeGranularity;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Tunables of the aggregation engine and the exploration endpoints.
 */
@Validated
@ConfigurationProperties(prefix = "msgvis.engine")
public class EngineProperties {

    @Positive
    private int defaultPageSize = 100;

    @NotNull
    private TimeGranularity timeGranularity = TimeGranularity.DAY;

    @Positive
    private int maxBins = 50;

    private boolean fastPathEnabled = true;

    @Positive
    private int parallelThreshold = 10_000; // working-set size above which accumulation runs in parallel

    @Positive
    private int exampleMessageLimit = 10;

    @Positive
    private int keywordLimit = 20;

    @Positive
    private int searchMessageLimit = 100;

    public int getDefaultPageSize() {
        return defaultPageSize;
    }

    public void setDefaultPageSize(int defaultPageSize) {
        this.defaultPageSize = defaultPageSize;
    }

    public TimeGranularity getTimeGranularity() {
        return timeGranularity;
    }

    public void setTimeGranularity(TimeGranularity timeGranularity) {
        this.timeGranularity = timeGranularity;
    }

    public int getMaxBins() {
        return maxBins;
    }

    public void setMaxBins(int maxBins) {
        this.maxBins = maxBins;
    }

    public boolean isFastPathEnabled() {
        return fastPathEnabled;
    }

    public void setFastPathEnabled(boolean fastPathEnabled) {
        this.fastPathEnabled = fastPathEnabled;
    }

    public int getParallelThreshold() {
        return parallelThreshold;
    }

    public void setParallelThreshold(int parallelThreshold) {
        this.parallelThreshold = parallelThreshold;
    }

    public int getExampleMessageLimit() {
        return exampleMessageLimit;
    }

    public void setExampleMessageLimit(int exampleMessageLimit) {
        this.exampleMessageLimit = exampleMessageLimit;
    }

    public int getKeywordLimit() {
        return keywordLimit;
    }

    public void setKeywordLimit(int keywordLimit) {
        this.keywordLimit = keywordLimit;
    }

    public int getSearchMessageLimit() {
        return searchMessageLimit;
    }

    public void setSearchMessageLimit(int searchMessageLimit) {
        this.searchMessageLimit = searchMessageLimit;
    }
}
