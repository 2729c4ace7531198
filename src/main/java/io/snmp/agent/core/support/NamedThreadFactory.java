package io.snmp.agent.core.support;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Named thread ThreadFactory.
 *
 * <p>Threads are numbered per factory: {@code prefix-1, prefix-2, ...}.</p>
 *
 * @author ssp
 * @since 1.0
 */
public class NamedThreadFactory implements ThreadFactory {

    private final AtomicInteger threadId = new AtomicInteger(1);

    private final String prefix;

    private final boolean daemon;

    public NamedThreadFactory(String prefix, boolean daemon) {
        this.prefix = prefix;
        this.daemon = daemon;
    }

    @Override
    public Thread newThread(Runnable r) {
        final Thread thread = new Thread(r, prefix + "-" + threadId.getAndIncrement());
        thread.setDaemon(daemon);
        return thread;
    }
}
