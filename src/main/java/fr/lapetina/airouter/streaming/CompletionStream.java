package fr.lapetina.airouter.streaming;

import java.util.Iterator;

/**
 * Lazy, finite, non-restartable sequence of text deltas followed by a summary.
 *
 * <p>Consumers pull chunks with {@link #hasNext()}/{@link #next()}; once {@code hasNext()}
 * returns false the {@link #summary()} is available. Closing early cancels the underlying
 * network read. Not safe for concurrent iteration, but {@link #close()} may be called from
 * another thread to abort a blocked read.
 */
public interface CompletionStream extends Iterator<StreamChunk>, AutoCloseable {

    /**
     * Final summary of the stream.
     *
     * @throws IllegalStateException if {@link #hasNext()} has not yet returned false
     */
    StreamSummary summary();

    /**
     * Whether at least one non-empty chunk has been handed to the consumer.
     */
    boolean hasDeliveredContent();

    @Override
    void close();
}
