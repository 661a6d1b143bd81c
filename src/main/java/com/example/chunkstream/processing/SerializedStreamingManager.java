package com.example.chunkstream.processing;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Lets at most one line be in flight towards the wrapped manager, whatever the number of chunk
 * workers. Waiting callers are served in arrival order.
 */
public final class SerializedStreamingManager implements StreamingManager {
    private final StreamingManager delegate;
    private final ReentrantLock sendLock = new ReentrantLock(true);

    public SerializedStreamingManager(StreamingManager delegate) {
        this.delegate = delegate;
    }

    @Override
    public Object sendLine(String line, LineContext context) throws Exception {
        sendLock.lockInterruptibly();
        try {
            return delegate.sendLine(line, context);
        } finally {
            sendLock.unlock();
        }
    }
}
