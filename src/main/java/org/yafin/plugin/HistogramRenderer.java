package org.yafin.plugin;

import org.yafin.histogram.HistogramData;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Rasterizes a computed histogram into an image file.
 */
public interface HistogramRenderer {

    void render(HistogramData histogram, Path target) throws IOException;
}
