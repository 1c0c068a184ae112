package fr.lapetina.airouter.support;

import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Response body that never sends a byte: reads block until the stream is closed, then fail
 * the way an aborted HTTP body does.
 */
public class StallingInputStream extends InputStream {

    private final CountDownLatch closed = new CountDownLatch(1);

    @Override
    public int read() throws IOException {
        try {
            if (!closed.await(30, TimeUnit.SECONDS)) {
                throw new IOException("stalled read never released");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("interrupted", e);
        }
        throw new IOException("closed");
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        return read();
    }

    @Override
    public void close() {
        closed.countDown();
    }

    public boolean isClosed() {
        return closed.getCount() == 0;
    }
}
