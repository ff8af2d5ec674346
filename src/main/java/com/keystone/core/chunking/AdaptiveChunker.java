package com.keystone.core.chunking;

import com.keystone.core.metrics.KeystoneMetrics;
import com.keystone.core.resources.ResourceMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Splits large text into line-aligned, overlapping chunks whose size follows memory pressure.
 * <p>
 * The chunk size is stateful: each {@link #calculateChunkSize()} call starts from the size
 * the previous call settled on. A chunk boundary is always the first line end at or after
 * the size offset, so no boundary falls inside a line.
 */
public class AdaptiveChunker {

    private static final Logger log = LoggerFactory.getLogger(AdaptiveChunker.class);

    private final ResourceMonitor monitor;
    private final ChunkingSettings settings;
    private final KeystoneMetrics metrics;
    private int currentSize;

    public AdaptiveChunker(ResourceMonitor monitor, ChunkingSettings settings) {
        this(monitor, settings, null);
    }

    public AdaptiveChunker(ResourceMonitor monitor, ChunkingSettings settings, KeystoneMetrics metrics) {
        this.monitor = monitor;
        this.settings = settings;
        this.metrics = metrics;
        this.currentSize = settings.initialSize();
    }

    /**
     * Recomputes the chunk size from current memory usage: shrink above the target,
     * grow below half of it, keep otherwise.
     */
    public synchronized int calculateChunkSize() {
        monitor.update();
        double usage = monitor.memoryPercentage();
        double target = settings.targetUsagePercent();
        int previous = currentSize;

        if (usage > target) {
            currentSize = Math.max(settings.minSize(), (int) (currentSize * settings.adjustmentFactor()));
        } else if (usage < target / 2.0) {
            currentSize = Math.min(settings.maxSize(), (int) Math.ceil(currentSize / settings.adjustmentFactor()));
        }

        if (currentSize != previous) {
            log.debug("Chunk size adjusted {} -> {} (memory {}%, target {}%)",
                    previous, currentSize, String.format("%.1f", usage), target);
        }
        if (metrics != null) {
            metrics.recordChunkSize(currentSize);
        }
        return currentSize;
    }

    public synchronized int currentChunkSize() {
        return currentSize;
    }

    /**
     * Splits {@code content} at the size computed for this call.
     */
    public List<Chunk> chunk(String content) {
        int size = calculateChunkSize();
        var chunks = new ArrayList<Chunk>();
        if (content.length() <= size) {
            chunks.add(new Chunk(0, content, 0, content.length(), 0));
            return chunks;
        }

        int start = 0;
        String previous = null;
        while (start < content.length()) {
            int end = boundary(content, start, size);
            int overlap = previous == null ? 0 : Math.min(settings.overlap(), previous.length());
            String prefix = overlap == 0 ? "" : previous.substring(previous.length() - overlap);
            String text = prefix + content.substring(start, end);
            chunks.add(new Chunk(chunks.size(), text, start, end, overlap));
            previous = text;
            start = end;
        }
        return chunks;
    }

    /**
     * Streaming variant: reads {@code source} through a bounded buffer and hands each chunk
     * to {@code sink} as soon as it is complete. Returns the number of chunks emitted.
     */
    public int stream(Reader source, Consumer<Chunk> sink) {
        var buffer = new StringBuilder();
        char[] readBuffer = new char[settings.readBufferSize()];
        long consumed = 0;
        int index = 0;
        String previous = null;
        int size = calculateChunkSize();

        try {
            int read;
            while ((read = source.read(readBuffer)) != -1) {
                buffer.append(readBuffer, 0, read);
                while (buffer.length() >= size) {
                    int end = lineEndAtOrAfter(buffer, size);
                    if (end < 0) {
                        break; // current line not finished yet
                    }
                    previous = emit(buffer, end, previous, consumed, index++, sink);
                    consumed += end;
                    size = calculateChunkSize();
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read chunk source", e);
        }

        if (buffer.length() > 0 || index == 0) {
            emit(buffer, buffer.length(), previous, consumed, index++, sink);
        }
        return index;
    }

    private String emit(StringBuilder buffer, int end, String previous, long consumed, int index,
                        Consumer<Chunk> sink) {
        int overlap = previous == null ? 0 : Math.min(settings.overlap(), previous.length());
        String prefix = overlap == 0 ? "" : previous.substring(previous.length() - overlap);
        String text = prefix + buffer.substring(0, end);
        buffer.delete(0, end);
        sink.accept(new Chunk(index, text, consumed, consumed + end, overlap));
        return text;
    }

    private static int boundary(String content, int start, int size) {
        int target = start + size;
        if (target >= content.length()) {
            return content.length();
        }
        int newline = content.indexOf('\n', target - 1);
        return newline < 0 ? content.length() : newline + 1;
    }

    private static int lineEndAtOrAfter(CharSequence buffer, int size) {
        for (int i = size - 1; i < buffer.length(); i++) {
            if (buffer.charAt(i) == '\n') {
                return i + 1;
            }
        }
        return -1;
    }
}
