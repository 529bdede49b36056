package org.yafin.histogram;

import org.jfree.chart.JFreeChart;
import org.jfree.chart.plot.XYPlot;
import org.jfree.chart.renderer.xy.XYBarRenderer;
import org.jfree.chart.renderer.xy.XYLineAndShapeRenderer;
import org.jfree.data.xy.XYSeriesCollection;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.yafin.image.PixelBuffer;
import org.yafin.image.PixelType;
import org.yafin.util.TestImageGenerator;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.GraphicsEnvironment;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class JFreeChartHistogramRendererTest {

    @TempDir
    Path tempDir;

    private final JFreeChartHistogramRenderer renderer = new JFreeChartHistogramRenderer(400, 300);

    @Test
    void testToDataset_pointsAtBinCenters() {
        HistogramData data = HistogramReporter.compute(
                TestImageGenerator.gray(PixelType.UINT8, 1, 3, 0, 0, 255), "Image Histogram");

        XYSeriesCollection dataset = JFreeChartHistogramRenderer.toDataset(data);
        assertEquals(1, dataset.getSeriesCount());
        assertEquals(256, dataset.getItemCount(0));
        assertEquals(0.5, dataset.getXValue(0, 0));
        assertEquals(2.0, dataset.getYValue(0, 0));
        assertEquals(255.5, dataset.getXValue(0, 255));
        assertEquals(1.0, dataset.getYValue(0, 255));
    }

    @Test
    void testCreateChart_barsForSingleDistribution() {
        HistogramData data = HistogramReporter.compute(
                TestImageGenerator.gray(PixelType.UINT16, 2, 2, 0, 1000, 1000, 65535), "Input Histogram (Original)");

        JFreeChart chart = renderer.createChart(data);
        XYPlot plot = chart.getXYPlot();
        assertEquals("Input Histogram (Original)", chart.getTitle().getText());
        assertEquals("Pixel Value (16-bit)", plot.getDomainAxis().getLabel());
        assertEquals("Frequency", plot.getRangeAxis().getLabel());
        assertTrue(plot.getRenderer() instanceof XYBarRenderer);
        assertEquals(0.0, plot.getDomainAxis().getLowerBound());
        assertEquals(65536.0, plot.getDomainAxis().getUpperBound());
        assertNull(chart.getLegend(), "A single distribution needs no legend.");
    }

    @Test
    void testCreateChart_linesPerChannelWithLegend() {
        HistogramData data = HistogramReporter.compute(
                TestImageGenerator.multi(PixelType.UINT8, 1, 2, 3, 255, 0, 0, 255, 0, 0), "Output Histogram (Normalized)");

        JFreeChart chart = renderer.createChart(data);
        XYPlot plot = chart.getXYPlot();
        assertTrue(plot.getRenderer() instanceof XYLineAndShapeRenderer);
        assertEquals(3, plot.getDataset().getSeriesCount());
        assertEquals("Channel 0", plot.getDataset().getSeriesKey(0));
        assertEquals(Color.RED, plot.getRenderer().getSeriesPaint(0));
        assertEquals(Color.BLUE, plot.getRenderer().getSeriesPaint(2));
        assertNotNull(chart.getLegend());
    }

    @Test
    void testCreateChart_floatWithInfinitiesHasFiniteAxis() {
        PixelBuffer f = PixelBuffer.of(PixelType.FLOAT32, 1, 3,
                new double[]{Double.NEGATIVE_INFINITY, 1.0, 3.0});

        JFreeChart chart = renderer.createChart(HistogramReporter.compute(f, "Image Histogram"));
        assertEquals(1.0, chart.getXYPlot().getDomainAxis().getLowerBound());
        assertEquals(4.0, chart.getXYPlot().getDomainAxis().getUpperBound());
    }

    @Test
    void testRender_writesPng() throws IOException {
        assumeTrue(fontsAvailable(), "Text rendering needs at least one installed font");
        HistogramData data = HistogramReporter.compute(
                TestImageGenerator.gray(PixelType.UINT16, 2, 2, 0, 1000, 1000, 65535), "Image Histogram");
        Path target = tempDir.resolve("hist/img_histogram.png");

        renderer.render(data, target);

        assertTrue(Files.exists(target), "Histogram file should be created with its parent directory.");
        BufferedImage image = ImageIO.read(target.toFile());
        assertEquals(400, image.getWidth());
        assertEquals(300, image.getHeight());
    }

    private static boolean fontsAvailable() {
        try {
            return GraphicsEnvironment.getLocalGraphicsEnvironment().getAvailableFontFamilyNames().length > 0;
        } catch (Throwable t) {
            return false;
        }
    }
}
