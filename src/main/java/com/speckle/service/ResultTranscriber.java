package com.speckle.service;

import com.speckle.error.DiscoveryException;
import com.speckle.model.FrameShape;
import com.speckle.model.ImageGeometry;
import com.speckle.model.InstrumentFamily;
import com.speckle.model.RunConfig;
import ij.process.FloatProcessor;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Header;
import nom.tam.fits.HeaderCardException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ResultTranscriber {

    private static final Logger log = LoggerFactory.getLogger(ResultTranscriber.class);

    static final String RECONSTRUCTED_WARNING = "WARNING: Timestamps were reconstructed during the data reduction.";
    static final String RECONSTRUCTED_FORMULA = "Timestamp = start time + burst number * time exposure * file number";

    // Written by the FITS library itself
    private static final Set<String> STRUCTURAL = Set.of(
            "SIMPLE", "BITPIX", "NAXIS", "NAXIS1", "NAXIS2", "NAXIS3", "EXTEND", "XTENSION",
            "PCOUNT", "GCOUNT", "END", "BZERO", "BSCALE");

    private final RunConfig config;
    private final ImageGeometry geometry;
    private final FitsImageStore store;

    public ResultTranscriber(RunConfig config, ImageGeometry geometry, FitsImageStore store) {
        this.config = config;
        this.geometry = geometry;
        this.store = store;
    }

    public int transcribeAll() throws IOException, DiscoveryException {
        log.info("Saving despeckled binary image files to FITS.");
        List<Path> finals = discover();
        log.info("Found {} files.", finals.size());
        Files.createDirectories(config.postSpeckleBase());

        int written = 0;
        for (Path f : finals) {
            if (transcribe(f)) written++;
        }
        log.info("Finished saving despeckled images as FITS in directory: {}", config.postSpeckleBase());
        return written;
    }

    List<Path> discover() throws IOException, DiscoveryException {
        String glob = BurstNaming.speckledGlob(config);
        log.info("Searching for files: {}", config.speckleBase().resolve(glob));
        List<Path> found = new ArrayList<>();
        if (Files.isDirectory(config.speckleBase())) {
            try (DirectoryStream<Path> ds = Files.newDirectoryStream(config.speckleBase(), glob)) {
                for (Path p : ds) found.add(p);
            }
        }
        if (found.isEmpty()) {
            throw new DiscoveryException("No reconstructed files found: " + config.speckleBase().resolve(glob));
        }
        Collections.sort(found);
        return found;
    }

    boolean transcribe(Path finalFile) throws IOException {
        FrameShape shape = geometry.imageShape();
        float[] px = RawImageIO.readFloat32(finalFile, shape.pixelCount());
        BasicHDU<?> hdu = store.toHdu(new FloatProcessor(shape.cols(), shape.rows(), px));

        String name = finalFile.getFileName().toString();
        int[] id = BurstNaming.parseFinalName(name);
        List<String> cards = Collections.emptyList();
        if (id == null) {
            log.warn("Could not recover batch and burst index from {}; writing without header cards.", name);
        } else {
            Path sidecar = BurstNaming.sidecarFile(config, id[0], id[1]);
            if (Files.exists(sidecar)) {
                cards = Files.readAllLines(sidecar, StandardCharsets.UTF_8);
            } else {
                log.warn("No header record {} for {}; writing without header cards.", sidecar.getFileName(), name);
            }
        }

        Path target = config.postSpeckleBase().resolve(name + ".fits");
        try {
            applyCards(hdu.getHeader(), cards);
            if (config.family == InstrumentFamily.RAW_BUFFER) {
                hdu.getHeader().insertComment(RECONSTRUCTED_WARNING);
                hdu.getHeader().insertComment(RECONSTRUCTED_FORMULA);
            }
        } catch (HeaderCardException e) {
            log.warn("Could not build FITS header for {}: {}", name, e.getMessage());
        }

        try {
            Files.deleteIfExists(target);
            store.write(target, hdu);
            return true;
        } catch (IOException e) {
            log.warn("Could not write FITS file: {} ({})", target, e.getMessage());
            log.warn("FITS write warning: continuing, but this could cause problems later.");
            return false;
        }
    }

    // --- HEADER CARDS ---

    // "KEY     = value / comment" lines; later cards replace earlier ones with the same key.
    static void applyCards(Header header, List<String> lines) throws HeaderCardException {
        for (String line : lines) {
            int eq = line.indexOf('=');
            if (line.isBlank() || eq < 0) continue;
            String key = line.substring(0, eq).trim();
            if (key.isEmpty() || key.length() > 8 || STRUCTURAL.contains(key)) continue;

            String[] vc = splitValue(line.substring(eq + 1));
            String raw = vc[0];
            String comment = vc[1];
            if (vc[2] != null) {
                header.addValue(key, vc[2], comment);
            } else if ("T".equals(raw) || "F".equals(raw)) {
                header.addValue(key, "T".equals(raw), comment);
            } else if (raw.matches("[+-]?\\d+")) {
                try {
                    header.addValue(key, Integer.parseInt(raw), comment);
                } catch (NumberFormatException e) {
                    header.addValue(key, Long.parseLong(raw), comment);
                }
            } else if (raw.matches("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eEdD][+-]?\\d+)?")) {
                header.addValue(key, Double.parseDouble(raw.replace('D', 'E').replace('d', 'e')), comment);
            } else if (!raw.isEmpty()) {
                header.addValue(key, raw, comment);
            }
        }
    }

    // {raw value, comment, quoted string value or null}
    private static String[] splitValue(String s) {
        String t = s.trim();
        if (t.startsWith("'")) {
            StringBuilder v = new StringBuilder();
            int i = 1;
            while (i < t.length()) {
                char c = t.charAt(i);
                if (c == '\'') {
                    if (i + 1 < t.length() && t.charAt(i + 1) == '\'') { v.append('\''); i += 2; continue; }
                    break;
                }
                v.append(c);
                i++;
            }
            String rest = i + 1 < t.length() ? t.substring(i + 1) : "";
            int slash = rest.indexOf('/');
            String comment = slash < 0 ? null : rest.substring(slash + 1).trim();
            return new String[] { t, comment, v.toString().stripTrailing() };
        }
        int slash = t.indexOf('/');
        if (slash < 0) return new String[] { t, null, null };
        return new String[] { t.substring(0, slash).trim(), t.substring(slash + 1).trim(), null };
    }
}
