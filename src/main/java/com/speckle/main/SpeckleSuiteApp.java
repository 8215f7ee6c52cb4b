package com.speckle.main;

import com.speckle.error.CalibrationException;
import com.speckle.error.ConfigurationException;
import com.speckle.model.PipelineReport;
import com.speckle.model.RunConfig;
import com.speckle.service.CalibrationPipeline;
import com.speckle.service.ExternalToolService;
import com.speckle.service.RunConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SpeckleSuiteApp {

    public static final String LOG_FILE_PROPERTY = "speckle.logFile";

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_DEGRADED = 2;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        if (args.length != 2) {
            System.err.println("Usage: SpeckleSuiteApp <instrument> <config file>");
            System.err.println("  instrument : ROSA_3500, ROSA_4170, ROSA_CAK, ROSA_GBAND or ZYLA");
            return EXIT_FATAL;
        }

        RunConfig config;
        try {
            config = new RunConfigLoader().load(Paths.get(args[1]), args[0]);
        } catch (ConfigurationException e) {
            System.err.println("Configuration error: " + e.getMessage());
            return EXIT_FATAL;
        }

        Path logFile = config.logFile();
        try {
            Files.createDirectories(config.workBase);
        } catch (IOException e) {
            System.err.println("Could not create work directory " + config.workBase + ": " + e.getMessage());
            return EXIT_FATAL;
        }
        // Must be set before the first logger is created; logback.xml reads it once.
        System.setProperty(LOG_FILE_PROPERTY, logFile.toString());
        Logger log = LoggerFactory.getLogger(SpeckleSuiteApp.class);

        log.info("This is the speckle calibration suite for ROSA and Zyla data.");
        log.info("Instrument: {} Configuration: {}", config.instrument, args[1]);
        log.info("Log file: {}", logFile);

        try {
            PipelineReport report = new CalibrationPipeline(config, new ExternalToolService()).run();
            if (report.isDegraded()) {
                log.warn("Calibration finished with problems. Failed batches: {}", report.failedBatches());
                return EXIT_DEGRADED;
            }
            log.info("Calibration finished.");
            return EXIT_OK;
        } catch (CalibrationException | IOException e) {
            log.error("Calibration aborted: {}", e.getMessage(), e);
            return EXIT_FATAL;
        } catch (RuntimeException e) {
            log.error("Unexpected failure", e);
            return EXIT_FATAL;
        }
    }
}
