package com.speckle.model;

import java.nio.file.Path;

public record JobDescriptor(int batchId, int startIndex, int endIndex,
                            Path fileDescriptor, Path methodDescriptor, Path propsDescriptor) {
}
