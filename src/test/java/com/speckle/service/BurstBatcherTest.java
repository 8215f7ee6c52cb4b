package com.speckle.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.speckle.model.BurstPlan;
import com.speckle.model.FrameRole;
import com.speckle.model.FrameSet;
import com.speckle.model.FrameShape;
import com.speckle.model.ImageGeometry;
import com.speckle.model.ReferenceFrames;
import com.speckle.model.RunConfig;
import ij.process.FloatProcessor;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BurstBatcherTest {

    private static final ImageGeometry GEOMETRY = new ImageGeometry(new FrameShape(6, 8), new FrameShape(4, 5));

    @TempDir
    Path tmp;

    private static ReferenceFrames unitRefs() {
        float[] dark = new float[20];
        float[] flat = new float[20];
        Arrays.fill(dark, 100f);
        Arrays.fill(flat, 200f);
        return ReferenceFrameBuilder.computeGain(new FloatProcessor(5, 4, dark), new FloatProcessor(5, 4, flat));
    }

    private FrameSet dataFrames(RunConfig config, int n) throws Exception {
        List<Path> files = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            Path f = config.dataBase.resolve(Fixtures.spoolName(i));
            files.add(Fixtures.writeRaw16(f, Fixtures.paddedFrame(6, 8, 4, 5, 101 + i)));
        }
        return new FrameSet(FrameRole.DATA, files);
    }

    @Test
    void twentyFiveFramesMakeTwoBurstsOfTen() throws Exception {
        RunConfig config = Fixtures.config(tmp, "ZYLA", 10).build();
        BurstBatcher batcher = new BurstBatcher(config, new RawBufferFrameSource(), GEOMETRY);

        BurstPlan plan = batcher.writeBursts(dataFrames(config, 25), unitRefs());

        assertEquals(List.of(0), plan.batchIds);
        assertEquals(2, plan.burstCount);
        assertEquals(5, plan.framesDropped);

        Path first = config.preSpeckleBase().resolve("20180619_140100_halpha_kisip.raw.batch.00.000");
        Path second = config.preSpeckleBase().resolve("20180619_140100_halpha_kisip.raw.batch.00.001");
        assertTrue(Files.exists(first));
        assertTrue(Files.exists(second));
        assertFalse(Files.exists(config.preSpeckleBase().resolve("20180619_140100_halpha_kisip.raw.batch.00.002")));

        float[] cube = Fixtures.readFloatsLE(first);
        assertEquals(10 * 20, cube.length);
        // gain 1, dark 100: frame i holds i + 1
        assertEquals(1f, cube[0], 0f);
        assertEquals(10f, cube[9 * 20 + 19], 0f);
        assertEquals(11f, Fixtures.readFloatsLE(second)[0], 0f);
    }

    @Test
    void sidecarsCarryReconstructedTimestamps() throws Exception {
        RunConfig config = Fixtures.config(tmp, "ZYLA", 10).build();
        new BurstBatcher(config, new RawBufferFrameSource(), GEOMETRY).writeBursts(dataFrames(config, 20), unitRefs());

        List<String> first = Files.readAllLines(BurstNaming.sidecarFile(config, 0, 0), StandardCharsets.UTF_8);
        List<String> second = Files.readAllLines(BurstNaming.sidecarFile(config, 0, 1), StandardCharsets.UTF_8);

        assertEquals(List.of("DATE    =2018-06-19T14:01:00.000", "EXPOSURE=20"), first);
        // 10 frames * 20 ms later
        assertEquals("DATE    =2018-06-19T14:01:00.200", second.get(0));
    }

    @Test
    void burstThousandOpensSecondBatch() throws Exception {
        RunConfig config = Fixtures.config(tmp, "ZYLA", 1).build();

        BurstPlan plan = new BurstBatcher(config, new RawBufferFrameSource(), GEOMETRY)
                .writeBursts(dataFrames(config, 1001), unitRefs());

        assertEquals(List.of(0, 1), plan.batchIds);
        assertEquals(1001, plan.burstCount);
        assertEquals(0, plan.framesDropped);
        assertTrue(Files.exists(config.preSpeckleBase().resolve("20180619_140100_halpha_kisip.raw.batch.00.999")));
        assertTrue(Files.exists(config.preSpeckleBase().resolve("20180619_140100_halpha_kisip.raw.batch.01.000")));
        assertFalse(Files.exists(config.preSpeckleBase().resolve("20180619_140100_halpha_kisip.raw.batch.01.001")));

        // 1000 bursts * 1 frame * 20 ms
        List<String> sidecar = Files.readAllLines(BurstNaming.sidecarFile(config, 1, 0), StandardCharsets.UTF_8);
        assertEquals("DATE    =2018-06-19T14:01:20.000", sidecar.get(0));
        assertEquals(1001f, Fixtures.readFloatsLE(BurstNaming.burstFile(config, 1, 0))[0], 0f);
    }

    @Test
    void existingBurstsAreFoundWithoutRewriting() throws Exception {
        RunConfig config = Fixtures.config(tmp, "ZYLA", 10).build();
        new BurstBatcher(config, new RawBufferFrameSource(), GEOMETRY).writeBursts(dataFrames(config, 10), unitRefs());

        List<Integer> batches = new BurstBatcher(config, new RawBufferFrameSource(), GEOMETRY).findExistingBatches();

        assertEquals(List.of(0), batches);
    }

    @Test
    void flatFieldSubtractsDarkThenScales() {
        float[] cube = new float[6];
        BurstBatcher.flatField(new float[] { 10, 20, 30 }, new float[] { 1, 2, 3 }, new float[] { 2, 0.5f, 1 }, cube, 3);
        assertEquals(18f, cube[3], 0f);
        assertEquals(9f, cube[4], 0f);
        assertEquals(27f, cube[5], 0f);
    }
}
