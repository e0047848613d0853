package fr.lapetina.streamflow.flow;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Synchronous, unbuffered in-memory pipe connecting two flow stages.
 *
 * A write blocks until the reader has consumed every byte of it, so a slow
 * consumer throttles its producer. Closing the writer signals end-of-stream.
 * Either side can be closed with an error, which the opposite side then observes
 * as an {@link IOException} whose cause is that error.
 *
 * Intended for exactly one writer thread and one reader thread.
 */
public final class Pipe {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition dataAvailable = lock.newCondition();
    private final Condition dataConsumed = lock.newCondition();

    // Chunk handed over by the blocked writer, read in place
    private byte[] chunk;
    private int chunkOffset;
    private int chunkRemaining;

    private boolean writerClosed;
    private Throwable writerError;
    private boolean readerClosed;
    private Throwable readerError;

    private final Reader reader = new Reader();
    private final Writer writer = new Writer();

    public Reader reader() {
        return reader;
    }

    public Writer writer() {
        return writer;
    }

    /**
     * Closes both sides with the given error. Blocked reads and writes fail immediately.
     */
    public void abort(Throwable error) {
        writer.closeWithError(error);
        reader.closeWithError(error);
    }

    private int read(byte[] b, int off, int len) throws IOException {
        Objects.checkFromIndexSize(off, len, b.length);
        lock.lock();
        try {
            if (readerClosed) {
                throw closedPipe("read on closed pipe", readerError);
            }
            if (len == 0) {
                return 0;
            }
            while (chunkRemaining == 0) {
                if (writerClosed) {
                    if (writerError != null) {
                        throw closedPipe("pipe closed by writer", writerError);
                    }
                    return -1;
                }
                await(dataAvailable);
                if (readerClosed) {
                    throw closedPipe("read on closed pipe", readerError);
                }
            }
            int n = Math.min(len, chunkRemaining);
            System.arraycopy(chunk, chunkOffset, b, off, n);
            chunkOffset += n;
            chunkRemaining -= n;
            if (chunkRemaining == 0) {
                chunk = null;
                dataConsumed.signalAll();
            }
            return n;
        } finally {
            lock.unlock();
        }
    }

    private void write(byte[] b, int off, int len) throws IOException {
        Objects.checkFromIndexSize(off, len, b.length);
        if (len == 0) {
            return;
        }
        lock.lock();
        try {
            // Another write still in flight; wait for our turn
            while (chunkRemaining > 0 && !writerClosed && !readerClosed) {
                await(dataConsumed);
            }
            ensureWritable();

            chunk = b;
            chunkOffset = off;
            chunkRemaining = len;
            dataAvailable.signalAll();

            while (chunkRemaining > 0) {
                if (readerClosed || writerClosed) {
                    chunk = null;
                    chunkRemaining = 0;
                    ensureWritable();
                }
                await(dataConsumed);
            }
        } finally {
            lock.unlock();
        }
    }

    private void ensureWritable() throws IOException {
        if (writerClosed) {
            throw closedPipe("write on closed pipe", writerError);
        }
        if (readerClosed) {
            throw closedPipe("pipe closed by reader", readerError);
        }
    }

    private void closeWriter(Throwable error) {
        lock.lock();
        try {
            if (!writerClosed) {
                writerClosed = true;
                writerError = error;
            }
            dataAvailable.signalAll();
            dataConsumed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private void closeReader(Throwable error) {
        lock.lock();
        try {
            if (!readerClosed) {
                readerClosed = true;
                readerError = error;
            }
            dataAvailable.signalAll();
            dataConsumed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    // Interrupts surface as I/O failures so stage threads can be released
    private void await(Condition condition) throws InterruptedIOException {
        try {
            condition.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted while waiting on pipe");
        }
    }

    private static IOException closedPipe(String message, Throwable cause) {
        if (cause instanceof IOException io) {
            return io;
        }
        return cause != null ? new IOException(message + ": " + cause.getMessage(), cause) : new IOException(message);
    }

    /**
     * Read side of the pipe.
     */
    public final class Reader extends InputStream {

        @Override
        public int read() throws IOException {
            byte[] single = new byte[1];
            int n = Pipe.this.read(single, 0, 1);
            return n == -1 ? -1 : single[0] & 0xFF;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            return Pipe.this.read(b, off, len);
        }

        /**
         * Closes the read side. Pending and later writes fail.
         */
        @Override
        public void close() {
            closeReader(null);
        }

        public void closeWithError(Throwable error) {
            closeReader(error);
        }
    }

    /**
     * Write side of the pipe.
     */
    public final class Writer extends OutputStream {

        @Override
        public void write(int b) throws IOException {
            Pipe.this.write(new byte[]{(byte) b}, 0, 1);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            Pipe.this.write(b, off, len);
        }

        /**
         * Closes the write side. The reader sees end-of-stream after the last written byte.
         */
        @Override
        public void close() {
            closeWriter(null);
        }

        public void closeWithError(Throwable error) {
            closeWriter(error);
        }
    }
}
