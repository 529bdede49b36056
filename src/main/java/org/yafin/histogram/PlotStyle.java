package org.yafin.histogram;

/**
 * How a histogram is drawn.
 */
public enum PlotStyle {
    /** One line per channel. */
    LINES,
    /** Binned-count bars for a single distribution. */
    BARS
}
