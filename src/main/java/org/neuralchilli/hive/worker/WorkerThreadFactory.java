package org.neuralchilli.hive.worker;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Names worker threads {@code <workerId>-thread-N}.
 */
public class WorkerThreadFactory implements ThreadFactory {

    private final AtomicInteger counter = new AtomicInteger(0);
    private final String workerId;

    public WorkerThreadFactory(String workerId) {
        this.workerId = workerId;
    }

    @Override
    public Thread newThread(Runnable r) {
        Thread t = new Thread(r);
        t.setName(workerId + "-thread-" + counter.incrementAndGet());
        t.setDaemon(false); // Keep JVM alive until the scheduler is closed
        return t;
    }
}
