package org.yafin.histogram;

import java.util.List;

/**
 * Everything a renderer needs: the value range {@code [rangeLow, rangeHigh)} split into
 * equal-width bins, one or more series of counts, and the labels.
 */
public record HistogramData(String title, String xLabel, String yLabel, double rangeLow, double rangeHigh,
                            PlotStyle style, List<HistogramSeries> series) {

    public HistogramData {
        series = List.copyOf(series);
    }

    public int binCount() {
        return series.isEmpty() ? 0 : series.get(0).counts().length;
    }

    public double binWidth() {
        return (rangeHigh - rangeLow) / binCount();
    }
}
