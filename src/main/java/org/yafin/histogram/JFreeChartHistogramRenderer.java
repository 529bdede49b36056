package org.yafin.histogram;

import org.jfree.chart.ChartFactory;
import org.jfree.chart.ChartUtils;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.plot.PlotOrientation;
import org.jfree.chart.plot.XYPlot;
import org.jfree.chart.renderer.xy.StandardXYBarPainter;
import org.jfree.chart.renderer.xy.XYBarRenderer;
import org.jfree.chart.renderer.xy.XYLineAndShapeRenderer;
import org.jfree.data.xy.XYBarDataset;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;
import org.yafin.plugin.HistogramRenderer;

import java.awt.BasicStroke;
import java.awt.Color;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renders histograms to PNG with JFreeChart: a bar chart for {@link PlotStyle#BARS}, one line per
 * series with a legend for {@link PlotStyle#LINES}.
 */
public class JFreeChartHistogramRenderer implements HistogramRenderer {

    private final int width;
    private final int height;

    public JFreeChartHistogramRenderer() {
        this(800, 600);
    }

    public JFreeChartHistogramRenderer(int width, int height) {
        this.width = width;
        this.height = height;
    }

    @Override
    public void render(HistogramData histogram, Path target) throws IOException {
        JFreeChart chart = createChart(histogram);
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        ChartUtils.saveChartAsPNG(target.toFile(), chart, width, height);
    }

    JFreeChart createChart(HistogramData histogram) {
        final XYSeriesCollection dataset = toDataset(histogram);
        final JFreeChart chart;
        if (histogram.style() == PlotStyle.BARS) {
            chart = ChartFactory.createXYBarChart(histogram.title(), histogram.xLabel(), false, histogram.yLabel(),
                    new XYBarDataset(dataset, histogram.binWidth()), PlotOrientation.VERTICAL, false, false, false);
            XYBarRenderer renderer = (XYBarRenderer) chart.getXYPlot().getRenderer();
            renderer.setBarPainter(new StandardXYBarPainter());
            renderer.setShadowVisible(false);
            renderer.setDrawBarOutline(false);
            for (int i = 0; i < histogram.series().size(); i++) {
                renderer.setSeriesPaint(i, histogram.series().get(i).color());
            }
        } else {
            chart = ChartFactory.createXYLineChart(histogram.title(), histogram.xLabel(), histogram.yLabel(),
                    dataset, PlotOrientation.VERTICAL, true, false, false);
            XYLineAndShapeRenderer renderer = new XYLineAndShapeRenderer(true, false);
            renderer.setAutoPopulateSeriesStroke(false);
            renderer.setDefaultStroke(new BasicStroke(1.5f));
            for (int i = 0; i < histogram.series().size(); i++) {
                renderer.setSeriesPaint(i, histogram.series().get(i).color());
            }
            chart.getXYPlot().setRenderer(renderer);
        }
        XYPlot plot = chart.getXYPlot();
        plot.setBackgroundPaint(Color.WHITE);
        plot.setDomainGridlinePaint(Color.LIGHT_GRAY);
        plot.setRangeGridlinePaint(Color.LIGHT_GRAY);
        plot.getDomainAxis().setRange(histogram.rangeLow(), histogram.rangeHigh());
        return chart;
    }

    /**
     * One XY series per histogram series, x at the bin centers.
     */
    static XYSeriesCollection toDataset(HistogramData histogram) {
        final XYSeriesCollection dataset = new XYSeriesCollection();
        final double binWidth = histogram.binWidth();
        for (HistogramSeries s : histogram.series()) {
            XYSeries series = new XYSeries(s.label(), false, true);
            long[] counts = s.counts();
            for (int b = 0; b < counts.length; b++) {
                series.add(histogram.rangeLow() + (b + 0.5) * binWidth, counts[b]);
            }
            dataset.addSeries(series);
        }
        return dataset;
    }
}
