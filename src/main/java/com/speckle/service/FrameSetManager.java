package com.speckle.service;

import com.speckle.error.CalibrationException;
import com.speckle.error.ConfigurationException;
import com.speckle.error.DiscoveryException;
import com.speckle.model.FrameRole;
import com.speckle.model.FrameSet;
import com.speckle.model.RunConfig;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class FrameSetManager {

    private static final Logger log = LoggerFactory.getLogger(FrameSetManager.class);

    private final FrameSource source;

    public FrameSetManager(FrameSource source) {
        this.source = source;
    }

    public static void requireDirectory(Path dir, FrameRole role) throws ConfigurationException {
        if (dir == null || !Files.isDirectory(dir)) {
            throw new ConfigurationException("Directory does not exist: " + dir + " (" + role.name().toLowerCase() + ")");
        }
    }

    // Plain glob matching inside one directory; unsorted.
    public static List<Path> discover(Path baseDir, String glob, FrameRole role) throws CalibrationException {
        requireDirectory(baseDir, role);
        log.info("Searching for {} image files: {} in {}", role.name().toLowerCase(), glob, baseDir);
        List<Path> found = new ArrayList<>();
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(baseDir, glob)) {
            for (Path p : ds) if (Files.isRegularFile(p)) found.add(p);
        } catch (IOException e) {
            throw new ConfigurationException("Could not list " + baseDir + " with pattern " + glob, e);
        }
        if (found.isEmpty()) {
            throw new DiscoveryException(role.label() + ": List contains no matches for " + baseDir.resolve(glob));
        }
        log.info("Files in {}: {}", role.label(), found.size());
        return found;
    }

    public FrameSet load(Path baseDir, String glob, FrameRole role) throws CalibrationException {
        List<Path> found = discover(baseDir, glob, role);
        log.info("Sorting {}.", role.label());
        return new FrameSet(role, source.orderFiles(found));
    }

    public Map<FrameRole, FrameSet> loadAll(RunConfig config) throws CalibrationException {
        Map<FrameRole, FrameSet> sets = new EnumMap<>(FrameRole.class);
        for (FrameRole role : FrameRole.values()) {
            sets.put(role, load(config.baseDir(role), config.basePattern(role), role));
        }
        return sets;
    }
}
