package com.speckle.service;

import com.speckle.error.GeometryDetectionException;
import com.speckle.error.OrderingException;
import com.speckle.model.ImageGeometry;
import com.speckle.model.InstrumentFamily;
import com.speckle.model.RunConfig;
import com.speckle.model.SubFrame;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Everything that differs between the raw-dump camera and the FITS cameras:
 * how geometry is found, how files are ordered, how image planes are read and
 * what gets recorded next to each burst cube.
 */
public interface FrameSource {

    ImageGeometry detectGeometry(Path sample) throws IOException, GeometryDetectionException;

    // Cheap layout check of another frame set's file against the detected geometry.
    void checkLayout(Path file, ImageGeometry geometry) throws IOException, GeometryDetectionException;

    List<Path> orderFiles(List<Path> files) throws OrderingException;

    // Acquisition order, cropped to the usable region
    List<SubFrame> readSubFrames(Path file, ImageGeometry geometry) throws IOException;

    List<String> sidecarLines(RunConfig config, int burstIndex, SubFrame lastFrame);

    static FrameSource forFamily(InstrumentFamily family) {
        switch (family) {
            case RAW_BUFFER: return new RawBufferFrameSource();
            case STRUCTURED_HEADER: return new FitsFrameSource();
            default: throw new IllegalArgumentException("No frame source for " + family);
        }
    }
}
