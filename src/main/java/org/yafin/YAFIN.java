package org.yafin;

import org.yafin.config.AppConfig;
import org.yafin.config.ConfigException;
import org.yafin.config.ConfigManager;
import org.yafin.metrics.BatchReport;
import org.yafin.metrics.SummaryPrinter;
import org.yafin.processing.BatchPipeline;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line entry point: converts every supported image under the configured input folder to
 * 8-bit, writing results and histograms under the output folder, then prints a summary.
 */
@Command(name = "yafin", mixinStandardHelpOptions = true, version = "yafin 1.0.0",
        description = "Percentile-based bit-depth normalization of image folders to 8-bit.")
public class YAFIN implements Callable<Integer> {

    private static final Logger LOGGER = Logger.getLogger(YAFIN.class.getName());

    @Option(names = "--config", defaultValue = "config.yaml", paramLabel = "<path>",
            description = "Config file path (yaml/yml/json). Default: ${DEFAULT-VALUE}")
    Path configPath;

    private final PrintStream out;
    private final PrintStream err;

    public YAFIN() {
        this(System.out, System.err);
    }

    YAFIN(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(final String[] args) {
        System.exit(new CommandLine(new YAFIN()).execute(args));
    }

    @Override
    public Integer call() {
        final AppConfig appConfig;
        try {
            appConfig = ConfigManager.load(configPath);
        } catch (ConfigException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        out.println("========================================================");
        out.println(" Starting normalization of " + appConfig.inputFolder());
        out.println("========================================================");

        final BatchReport report;
        try {
            report = new BatchPipeline(appConfig).run();
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Run aborted", e);
            err.println("Error: " + e.getMessage());
            return 1;
        }

        SummaryPrinter.print(report, out);
        return 0;
    }
}
