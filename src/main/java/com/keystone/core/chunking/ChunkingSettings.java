package com.keystone.core.chunking;

/**
 * Bounds and feedback parameters for adaptive chunk sizing.
 *
 * @param initialSize        starting chunk size in characters
 * @param minSize            lower clamp for shrinking
 * @param maxSize            upper clamp for growing
 * @param overlap            characters repeated at the start of each following chunk
 * @param adjustmentFactor   multiplier in (0, 1) applied when shrinking; its inverse when growing
 * @param targetUsagePercent memory usage percentage the chunker steers towards
 * @param readBufferSize     characters read per call in streaming mode
 */
public record ChunkingSettings(
    int initialSize,
    int minSize,
    int maxSize,
    int overlap,
    double adjustmentFactor,
    double targetUsagePercent,
    int readBufferSize
) {

    public ChunkingSettings {
        if (minSize <= 0 || maxSize < minSize) {
            throw new IllegalArgumentException(
                    "Chunk bounds invalid (min: " + minSize + ", max: " + maxSize + ")");
        }
        if (initialSize < minSize || initialSize > maxSize) {
            throw new IllegalArgumentException(
                    "initialSize must be within [" + minSize + ", " + maxSize + "] (current: " + initialSize + ")");
        }
        if (overlap < 0) {
            throw new IllegalArgumentException("overlap must not be negative (current: " + overlap + ")");
        }
        if (adjustmentFactor <= 0.0 || adjustmentFactor >= 1.0) {
            throw new IllegalArgumentException(
                    "adjustmentFactor must be within (0, 1) (current: " + adjustmentFactor + ")");
        }
        if (readBufferSize <= 0) {
            throw new IllegalArgumentException("readBufferSize must be positive");
        }
    }
}
