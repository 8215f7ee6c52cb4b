package com.speckle.service;

import com.speckle.error.OrderingException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class FrameOrdering {

    private static final Logger log = LoggerFactory.getLogger(FrameOrdering.class);

    // Leading run counter of a spool file name, e.g. "2100000000spool.dat".
    private static final Pattern LEADING_DIGITS = Pattern.compile("^[0-9]+");

    // Zyla writes its counter least-significant digit first
    public static final UnaryOperator<String> REVERSED_DIGITS = s -> new StringBuilder(s).reverse().toString();

    private FrameOrdering() {}

    /**
     * Places every file at the index encoded in the leading digits of its name.
     * Names without a leading number are logged and leave a gap; any gap, duplicate or
     * out-of-range index fails the whole list.
     */
    public static List<Path> orderByEmbeddedIndex(List<Path> files) throws OrderingException {
        return orderByEmbeddedIndex(files, REVERSED_DIGITS);
    }

    public static List<Path> orderByEmbeddedIndex(List<Path> files, UnaryOperator<String> digitTransform)
            throws OrderingException {
        Path[] slots = new Path[files.size()];
        for (Path f : files) {
            String name = f.getFileName().toString();
            Matcher m = LEADING_DIGITS.matcher(name);
            if (!m.find()) {
                log.error("Unexpected filename format: {}", f);
                continue;
            }
            long index;
            try {
                index = Long.parseLong(digitTransform.apply(m.group()));
            } catch (NumberFormatException e) {
                throw new OrderingException("Index token too large in " + f, e);
            }
            if (index >= slots.length) {
                throw new OrderingException("Index " + index + " of " + f + " is outside 0.." + (slots.length - 1));
            }
            int i = (int) index;
            if (slots[i] != null) {
                throw new OrderingException("Duplicate index " + i + ": " + slots[i] + " and " + f);
            }
            slots[i] = f;
        }
        int missing = 0;
        for (Path p : slots) if (p == null) missing++;
        if (missing > 0) {
            throw new OrderingException("List could not be ordered: " + missing + " of " + slots.length + " positions unfilled");
        }
        return Collections.unmodifiableList(Arrays.asList(slots));
    }

    // ROSA names carry a zero-padded, most-significant-first counter.
    public static List<Path> orderLexicographically(List<Path> files) {
        List<Path> sorted = new ArrayList<>(files);
        sorted.sort((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()));
        return Collections.unmodifiableList(sorted);
    }
}
