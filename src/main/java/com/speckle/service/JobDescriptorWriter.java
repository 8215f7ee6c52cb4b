package com.speckle.service;

import com.speckle.model.ImageGeometry;
import com.speckle.model.JobDescriptor;
import com.speckle.model.KisipMethod;
import com.speckle.model.KisipProps;
import com.speckle.model.RunConfig;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * KISIP init files. One value per line, in the exact order the entry binary reads them;
 * any change here breaks the reconstruction run.
 */
public class JobDescriptorWriter {

    private static final Logger log = LoggerFactory.getLogger(JobDescriptorWriter.class);

    public static final String FILE_DESCRIPTOR = "init_file.dat";
    public static final String METHOD_DESCRIPTOR = "init_method.dat";
    public static final String PROPS_DESCRIPTOR = "init_props.dat";

    private final RunConfig config;
    private final ImageGeometry geometry;

    public JobDescriptorWriter(RunConfig config, ImageGeometry geometry) {
        this.config = config;
        this.geometry = geometry;
    }

    public JobDescriptor write(int batch, int startIndex, int endIndex) throws IOException {
        log.info("Preparing to write KISIP init files.");
        Path dir = config.workBase;
        Path files = writeLines(dir.resolve(FILE_DESCRIPTOR), fileLines(batch, startIndex, endIndex));
        Path method = writeLines(dir.resolve(METHOD_DESCRIPTOR), methodLines());
        Path props = writeLines(dir.resolve(PROPS_DESCRIPTOR), propsLines());
        log.info("Successfully wrote KISIP init files.");
        return new JobDescriptor(batch, startIndex, endIndex, files, method, props);
    }

    List<String> fileLines(int batch, int startIndex, int endIndex) {
        List<String> l = new ArrayList<>();
        l.add(BurstNaming.burstStem(config, batch).toString());
        l.add(String.format(Locale.ROOT, "%03d", startIndex));
        l.add(String.format(Locale.ROOT, "%03d", endIndex));
        l.add(BurstNaming.speckledStem(config, batch).toString());
        l.add(config.noisePath().toString());
        return l;
    }

    List<String> methodLines() {
        KisipMethod m = config.method;
        return List.of(
                m.method(),
                m.subfieldArcsec(),
                m.phaseRecLimit(),
                m.ux(),
                m.uv(),
                m.maxIterations(),
                m.snThreshold(),
                m.weightExponent(),
                m.phaseRecApodization(),
                m.noiseFilter());
    }

    List<String> propsLines() {
        KisipProps p = config.props;
        return List.of(
                Integer.toString(geometry.imageShape().cols()),
                Integer.toString(geometry.imageShape().rows()),
                Integer.toString(config.burstNumber),
                p.headerOffset(),
                config.arcsecPerPixX,
                config.arcsecPerPixY,
                p.telescopeDiameterMm(),
                config.wavelengthNm,
                p.aoLockX(),
                p.aoLockY(),
                p.aoUsed());
    }

    private static Path writeLines(Path file, List<String> lines) throws IOException {
        log.info("Writing KISIP config file: {}", file);
        StringBuilder sb = new StringBuilder();
        for (String line : lines) sb.append(line).append('\n');
        try {
            Files.write(file, sb.toString().getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.error("Could not write KISIP config file {}: {}", file, e.getMessage());
            throw e;
        }
        return file;
    }
}
