package org.yafin.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;

/**
 * Settings of one batch run, bound from the YAML/JSON config keys.
 */
public record AppConfig(@JsonProperty("input_folder") Path inputFolder,
                        @JsonProperty("output_folder") Path outputFolder,
                        @JsonProperty("output_format") String outputFormat,
                        @JsonProperty("downsample_percentile_low") Double downsamplePercentileLow,
                        @JsonProperty("downsample_percentile_high") Double downsamplePercentileHigh,
                        @JsonProperty("save_input_histogram") Boolean saveInputHistogram,
                        @JsonProperty("save_output_histogram") Boolean saveOutputHistogram,
                        @JsonProperty("degenerate_policy") String degeneratePolicy) {

    public static final String DEFAULT_OUTPUT_FORMAT = "tif";
    public static final double DEFAULT_PERCENTILE_LOW = 1;
    public static final double DEFAULT_PERCENTILE_HIGH = 99;

    public AppConfig {
        if (outputFormat == null) outputFormat = DEFAULT_OUTPUT_FORMAT;
        if (downsamplePercentileLow == null) downsamplePercentileLow = DEFAULT_PERCENTILE_LOW;
        if (downsamplePercentileHigh == null) downsamplePercentileHigh = DEFAULT_PERCENTILE_HIGH;
        if (saveInputHistogram == null) saveInputHistogram = true;
        if (saveOutputHistogram == null) saveOutputHistogram = true;
        if (degeneratePolicy == null) degeneratePolicy = "zero";
    }

    public AppConfig(Path inputFolder, Path outputFolder, String outputFormat) {
        this(inputFolder, outputFolder, outputFormat, null, null, null, null, null);
    }

    /**
     * @throws IllegalArgumentException if the configured name is not a supported format
     */
    public OutputFormat format() {
        return OutputFormat.fromName(outputFormat);
    }

    /**
     * @throws IllegalArgumentException if the configured name is unknown
     */
    public DegeneratePolicy policy() {
        return DegeneratePolicy.fromName(degeneratePolicy);
    }
}
