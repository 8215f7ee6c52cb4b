package com.speckle.service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;

/**
 * Moves a child process's output into a bounded queue on a daemon thread while the caller
 * drains it line by line. A final line without a terminator is delivered as an ordinary
 * line once the stream closes. A full queue blocks the reader, which in turn applies
 * back-pressure to the child process.
 */
public class ProcessOutputPump {

    public static final int DEFAULT_CAPACITY = 256;

    private static final Object END = new Object();

    private final int capacity;

    public ProcessOutputPump() {
        this(DEFAULT_CAPACITY);
    }

    public ProcessOutputPump(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be positive: " + capacity);
        this.capacity = capacity;
    }

    public long drain(InputStream in, Consumer<String> sink) throws IOException, InterruptedException {
        BlockingQueue<Object> queue = new ArrayBlockingQueue<>(capacity);
        ExecutorService reader = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "process-output");
            t.setDaemon(true);
            return t;
        });
        try {
            reader.submit(() -> {
                try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                    String line;
                    while ((line = br.readLine()) != null) queue.put(line);
                } catch (IOException e) {
                    queue.put(e);
                } finally {
                    queue.put(END);
                }
                return null;
            });

            long lines = 0;
            IOException failure = null;
            while (true) {
                Object item = queue.take();
                if (item == END) break;
                if (item instanceof IOException) {
                    failure = (IOException) item;
                    continue;
                }
                sink.accept((String) item);
                lines++;
            }
            if (failure != null) throw failure;
            return lines;
        } finally {
            reader.shutdownNow();
        }
    }
}
