package com.speckle.service;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.speckle.model.FrameShape;
import com.speckle.model.ImageGeometry;
import com.speckle.model.JobDescriptor;
import com.speckle.model.KisipProps;
import com.speckle.model.RunConfig;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JobDescriptorWriterTest {

    @TempDir
    Path tmp;

    private RunConfig config;
    private JobDescriptorWriter writer;

    @BeforeEach
    void setUp() throws Exception {
        config = Fixtures.config(tmp, "ZYLA", 10).build();
        Files.createDirectories(config.workBase);
        writer = new JobDescriptorWriter(config, new ImageGeometry(new FrameShape(6, 8), new FrameShape(4, 5)));
    }

    @Test
    void fileDescriptorNamesStemsIndicesAndNoise() throws Exception {
        JobDescriptor d = writer.write(0, 0, 9);

        List<String> lines = Files.readAllLines(d.fileDescriptor(), StandardCharsets.UTF_8);
        assertEquals(List.of(
                config.preSpeckleBase().resolve("20180619_140100_halpha_kisip.raw.batch.00").toString(),
                "000",
                "009",
                config.speckleBase().resolve("20180619_140100_halpha_kisip.speckle.batch.00").toString(),
                config.noisePath().toString()), lines);
        assertEquals(config.workBase.resolve("init_file.dat"), d.fileDescriptor());
    }

    @Test
    void methodDescriptorKeepsReadOrder() throws Exception {
        JobDescriptor d = writer.write(0, 0, 9);
        assertEquals(List.of("1", "5", "95", "10", "10", "30", "80", "1.2", "15", "1"),
                Files.readAllLines(d.methodDescriptor(), StandardCharsets.UTF_8));
    }

    @Test
    void propsDescriptorStartsWithWidthThenHeight() throws Exception {
        JobDescriptor d = writer.write(0, 0, 9);
        assertEquals(List.of("5", "4", "10", "0", "0.109", "0.109", "760", "656.3", "-1", "-1", "1"),
                Files.readAllLines(d.propsDescriptor(), StandardCharsets.UTF_8));
    }

    @Test
    void sameInputsGiveIdenticalBytes() throws Exception {
        JobDescriptor d = writer.write(3, 0, 41);
        byte[] files = Files.readAllBytes(d.fileDescriptor());
        byte[] method = Files.readAllBytes(d.methodDescriptor());
        byte[] props = Files.readAllBytes(d.propsDescriptor());

        writer.write(3, 0, 41);

        assertArrayEquals(files, Files.readAllBytes(d.fileDescriptor()));
        assertArrayEquals(method, Files.readAllBytes(d.methodDescriptor()));
        assertArrayEquals(props, Files.readAllBytes(d.propsDescriptor()));
        String text = new String(files, StandardCharsets.UTF_8);
        assertEquals(5, text.split("\n", -1).length - 1);
    }

    @Test
    void emptyBatchWritesNegativeEndIndex() {
        assertEquals("-01", writer.fileLines(0, 0, -1).get(2));
    }

    @Test
    void configuredNumbersAreWrittenAsGiven() throws Exception {
        RunConfig exact = config.toBuilder()
                .arcsecPerPix("0.060", "0.060")
                .wavelengthNm("350.0")
                .props(new KisipProps("0", "760.0", "-1", "-1", "1"))
                .build();
        JobDescriptorWriter w = new JobDescriptorWriter(exact, new ImageGeometry(new FrameShape(6, 8), new FrameShape(4, 5)));

        List<String> lines = w.propsLines();

        assertEquals("0.060", lines.get(4));
        assertEquals("0.060", lines.get(5));
        assertEquals("760.0", lines.get(6));
        assertEquals("350.0", lines.get(7));
    }
}
