package com.speckle.model;

import java.nio.file.Path;

public record KisipEnv(Path binDir, Path libDir, int mpiProcesses, String mpirun, String executable) {

    public Path mpirunPath() { return binDir.resolve(mpirun); }

    public Path executablePath() { return binDir.resolve(executable); }
}
