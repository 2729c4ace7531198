package io.snmp.agent.core.support;

import lombok.Data;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * snmp请求处理线程池，基于JDK {@link ThreadPoolExecutor}.
 *
 * <p>队列满时由提交线程(listener)执行，相当于对收包做背压.</p>
 *
 * @author ssp
 * @since 1.0
 */
public class JdkThreadPool {

    private final ThreadPoolExecutor executor;

    public JdkThreadPool(String poolName, int corePoolSize,
                         int maximumPoolSize,
                         long keepAliveTime,
                         TimeUnit unit,
                         int queueCapacity) {

        executor = new ThreadPoolExecutor(
                corePoolSize, maximumPoolSize,
                keepAliveTime, unit,
                createQueue(queueCapacity),
                new NamedThreadFactory(poolName, true),
                new ThreadPoolExecutor.CallerRunsPolicy()
        );
    }

    public JdkThreadPool(WorkerPoolConfig poolConfig) {
        this(poolConfig.poolName,
                poolConfig.coreSize, poolConfig.maxSize,
                poolConfig.keepAlive, poolConfig.unit,
                poolConfig.queueCapacity
        );
    }

    public void execute(Runnable task) {
        executor.execute(task);
    }

    public void stop() {
        executor.shutdown();
    }

    protected BlockingQueue<Runnable> createQueue(int queueCapacity) {
        if (queueCapacity > 0) {
            return new LinkedBlockingQueue<>(queueCapacity);
        } else {
            return new SynchronousQueue<>();
        }
    }

    @Data
    public static class WorkerPoolConfig {

        /**
         * 线程池名称.
         */
        private String poolName;
        /**
         * 核心线程数量.
         */
        private int coreSize;
        /**
         * 最大线程数量.
         */
        private int maxSize;
        private long keepAlive;
        private TimeUnit unit;
        private int queueCapacity;


        public WorkerPoolConfig(String poolName,
                                int coreSize, int maxSize,
                                Duration keepAliveDuration,
                                int queueCapacity) {
            this.poolName = poolName;
            this.coreSize = coreSize;
            this.maxSize = maxSize;
            this.keepAlive = keepAliveDuration.getSeconds();
            this.unit = TimeUnit.SECONDS;
            this.queueCapacity = queueCapacity;
        }

    }

}
