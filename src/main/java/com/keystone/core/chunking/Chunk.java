package com.keystone.core.chunking;

/**
 * One piece of a chunked input.
 *
 * @param index         position in the chunk sequence
 * @param content       chunk text, starting with {@code overlapLength} characters repeated from the previous chunk
 * @param startOffset   offset in the source of the first character after the overlap
 * @param endOffset     offset in the source just past the last character (always a line end or end of input)
 * @param overlapLength number of leading characters shared with the previous chunk
 */
public record Chunk(int index, String content, long startOffset, long endOffset, int overlapLength) {

    /** The part of the chunk that is new relative to the previous chunk. */
    public String freshContent() {
        return content.substring(overlapLength);
    }
}
