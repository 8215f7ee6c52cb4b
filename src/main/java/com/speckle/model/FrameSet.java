package com.speckle.model;

import java.nio.file.Path;
import java.util.List;

// Ordered, non-empty file list for one role.
public record FrameSet(FrameRole role, List<Path> files) {

    public FrameSet {
        files = List.copyOf(files);
    }

    public Path first() { return files.get(0); }

    public int size() { return files.size(); }
}
