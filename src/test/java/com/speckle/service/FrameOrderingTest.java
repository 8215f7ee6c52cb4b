package com.speckle.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.speckle.error.OrderingException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class FrameOrderingTest {

    private static List<Path> spools(int n) {
        List<Path> files = new ArrayList<>();
        for (int i = 0; i < n; i++) files.add(Paths.get("/data", Fixtures.spoolName(i)));
        return files;
    }

    @Test
    void reversedCountersRestoreAcquisitionOrder() throws Exception {
        List<Path> expected = spools(37);
        List<Path> shuffled = new ArrayList<>(expected);
        Collections.shuffle(shuffled, new Random(42));

        assertEquals(expected, FrameOrdering.orderByEmbeddedIndex(shuffled));
    }

    @Test
    void reversedDigitsConstant() {
        assertEquals("0000000012", FrameOrdering.REVERSED_DIGITS.apply("2100000000"));
    }

    @Test
    void customTransformIsApplied() throws Exception {
        List<Path> files = List.of(Paths.get("2_b.dat"), Paths.get("0_a.dat"), Paths.get("1_c.dat"));
        List<Path> ordered = FrameOrdering.orderByEmbeddedIndex(files, s -> s);
        assertEquals(List.of(Paths.get("0_a.dat"), Paths.get("1_c.dat"), Paths.get("2_b.dat")), ordered);
    }

    @Test
    void nameWithoutCounterLeavesGapAndFails() {
        List<Path> files = spools(3);
        files.set(1, Paths.get("/data/spool.dat"));
        assertThrows(OrderingException.class, () -> FrameOrdering.orderByEmbeddedIndex(files));
    }

    @Test
    void duplicateIndexFails() {
        List<Path> files = List.of(
                Paths.get("/a", Fixtures.spoolName(0)),
                Paths.get("/b", Fixtures.spoolName(0)));
        assertThrows(OrderingException.class, () -> FrameOrdering.orderByEmbeddedIndex(files));
    }

    @Test
    void indexBeyondListFails() {
        List<Path> files = List.of(Paths.get(Fixtures.spoolName(0)), Paths.get(Fixtures.spoolName(5)));
        assertThrows(OrderingException.class, () -> FrameOrdering.orderByEmbeddedIndex(files));
    }

    @Test
    void fitsNamesSortByFileName() {
        List<Path> files = List.of(
                Paths.get("/z/das1_rosa_2018-06-18_14.02.10_0002.fit"),
                Paths.get("/a/das1_rosa_2018-06-18_14.02.10_0000.fit"),
                Paths.get("/m/das1_rosa_2018-06-18_14.02.10_0001.fit"));
        List<Path> sorted = FrameOrdering.orderLexicographically(files);
        assertEquals("das1_rosa_2018-06-18_14.02.10_0000.fit", sorted.get(0).getFileName().toString());
        assertEquals("das1_rosa_2018-06-18_14.02.10_0002.fit", sorted.get(2).getFileName().toString());
    }
}
