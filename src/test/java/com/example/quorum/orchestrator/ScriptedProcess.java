package com.example.quorum.orchestrator;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A reasoning process driven by the test: output is written fragment by
 * fragment, and the process exits when told to or when terminated.
 */
class ScriptedProcess implements ReasoningProcess {

    private static final byte[] EOF = new byte[0];

    private final BlockingQueue<byte[]> chunks = new LinkedBlockingQueue<>();
    private final CountDownLatch exited = new CountDownLatch(1);
    private final AtomicInteger exitCode = new AtomicInteger();
    private volatile boolean terminated;

    private final InputStream output = new InputStream() {
        private byte[] current;
        private int pos;
        private boolean eof;

        @Override
        public int read() throws IOException {
            byte[] one = new byte[1];
            int n = read(one, 0, 1);
            return n == -1 ? -1 : one[0] & 0xff;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            if (len == 0) return 0;
            while (current == null || pos >= current.length) {
                if (eof) return -1;
                try {
                    current = chunks.take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IOException("interrupted", e);
                }
                pos = 0;
                if (current == EOF) {
                    eof = true;
                    return -1;
                }
            }
            int n = Math.min(len, current.length - pos);
            System.arraycopy(current, pos, b, off, n);
            pos += n;
            return n;
        }

        @Override
        public int available() {
            return current == null || current == EOF ? 0 : current.length - pos;
        }
    };

    static ScriptedProcess finished(String output, int exitCode) {
        ScriptedProcess process = new ScriptedProcess();
        if (!output.isEmpty()) process.write(output);
        process.exit(exitCode);
        return process;
    }

    void write(String fragment) {
        chunks.add(fragment.getBytes(StandardCharsets.UTF_8));
    }

    /** Close stdout and exit with the given status. */
    void exit(int code) {
        exitCode.set(code);
        chunks.add(EOF);
        exited.countDown();
    }

    boolean isTerminated() {
        return terminated;
    }

    @Override
    public InputStream output() {
        return output;
    }

    @Override
    public InputStream diagnostics() {
        return new ByteArrayInputStream("warming up\n".getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public int waitFor() throws InterruptedException {
        exited.await();
        return exitCode.get();
    }

    @Override
    public void terminate() {
        if (terminated) return;
        terminated = true;
        exit(143);
    }

    @Override
    public boolean isAlive() {
        return exited.getCount() > 0;
    }
}
