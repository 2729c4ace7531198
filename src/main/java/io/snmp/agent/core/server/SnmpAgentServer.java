package io.snmp.agent.core.server;

import io.snmp.agent.core.SnmpAgent;
import io.snmp.agent.core.support.Assert;
import io.snmp.agent.core.support.JdkThreadPool;
import io.snmp.agent.core.support.NamedThreadFactory;
import io.snmp.agent.core.support.exception.SnmpDiscardException;
import io.snmp.agent.core.support.exception.SnmpRuntimeException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedSelectorException;
import java.nio.channels.DatagramChannel;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.time.Duration;
import java.util.Iterator;
import java.util.Set;

/**
 * snmp agent udp服务.
 *
 * <p>单个listener线程通过多路复用器收包，每个数据报提交到workerPool，
 * 由{@link SnmpAgent#processDatagram(byte[])}处理后回包到来源地址；报文被丢弃时不回包.</p>
 *
 * @author ssp
 * @since 1.0
 */
@Slf4j
public class SnmpAgentServer {

    private final SnmpAgent agent;

    private final InetSocketAddress bindAddress;

    private final int maxInboundMessageSize;

    private final JdkThreadPool.WorkerPoolConfig workerPoolConfig;

    private DatagramChannel channel;

    private Selector selector;

    private JdkThreadPool workerPool;

    private Thread listener;

    private volatile boolean running;

    public SnmpAgentServer(SnmpAgentServerBuilder builder) {
        Assert.nonNull(builder.agent, "SnmpAgentServer init failed! agent not config!");
        Assert.isTrue(builder.maxInboundMessageSize > 0, "args error: 'maxInboundMessageSize' %s.", builder.maxInboundMessageSize);

        this.agent = builder.agent;
        this.bindAddress = new InetSocketAddress(builder.bindIp, builder.listenPort);
        this.maxInboundMessageSize = builder.maxInboundMessageSize;
        this.workerPoolConfig = builder.workerPoolConfig;
    }

    /**
     * 绑定端口并拉起listener线程.
     */
    public synchronized SnmpAgentServer start() {
        if (running) {
            throw new SnmpRuntimeException("SnmpAgentServer already started: %s", bindAddress);
        }

        try {
            channel = DatagramChannel.open();
            channel.configureBlocking(false);
            channel.socket().setReuseAddress(true);
            channel.bind(bindAddress);

            selector = Selector.open();
            channel.register(selector, SelectionKey.OP_READ);
        } catch (IOException e) {
            log.error("snmp agent server start exception! bindAddress={}.", bindAddress, e);
            closeQuietly();
            throw new SnmpRuntimeException(e);
        }

        workerPool = new JdkThreadPool(workerPoolConfig);
        running = true;

        listener = new NamedThreadFactory("snmp-agent-listener", true).newThread(this::listen);
        listener.start();

        log.info("snmp agent server started: {}.", getLocalAddress());
        return this;
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        selector.wakeup();

        try {
            listener.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        workerPool.stop();
        closeQuietly();
        log.info("snmp agent server stopped: {}.", bindAddress);
    }

    public boolean isRunning() {
        return running;
    }

    public InetSocketAddress getLocalAddress() {
        try {
            return (InetSocketAddress) channel.getLocalAddress();
        } catch (IOException e) {
            throw new SnmpRuntimeException(e);
        }
    }

    private void listen() {
        while (running) {
            try {
                selector.select(100);
                final Set<SelectionKey> keys = selector.selectedKeys();

                Iterator<SelectionKey> itr = keys.iterator();
                while (itr.hasNext()) {
                    SelectionKey fd = itr.next();
                    itr.remove();

                    if (fd.isValid() && fd.isReadable()) {
                        receive();
                    }
                }
            } catch (ClosedSelectorException e) {
                break;
            } catch (IOException e) {
                log.error("snmp agent listen exception!", e);
            }
        }
    }

    private void receive() throws IOException {
        final ByteBuffer buffer = ByteBuffer.allocate(maxInboundMessageSize);
        final SocketAddress source = channel.receive(buffer);
        if (source == null) {
            return;
        }
        buffer.flip();

        final byte[] request = new byte[buffer.remaining()];
        buffer.get(request);

        workerPool.execute(() -> respond(source, request));
    }

    private void respond(SocketAddress source, byte[] request) {
        final byte[] response;
        try {
            response = agent.processDatagram(request);
        } catch (SnmpDiscardException e) {
            log.warn("snmp request discarded: source={}, reason={}.", source, e.getMessage());
            return;
        }

        try {
            channel.send(ByteBuffer.wrap(response), source);
        } catch (IOException e) {
            log.error("snmp response send exception! target={}.", source, e);
        }
    }

    private void closeQuietly() {
        try {
            if (selector != null) {
                selector.close();
            }
            if (channel != null) {
                channel.close();
            }
        } catch (IOException e) {
            log.warn("snmp agent server close exception!", e);
        }
    }

    /*---------builder----------*/

    public static SnmpAgentServerBuilder builder() {
        return new SnmpAgentServerBuilder();
    }

    public static class SnmpAgentServerBuilder {

        private SnmpAgent agent;

        private String bindIp = "0.0.0.0";
        private int listenPort = 161;

        private int maxInboundMessageSize = 65535;

        private JdkThreadPool.WorkerPoolConfig workerPoolConfig = new JdkThreadPool.WorkerPoolConfig(
                "snmp-agent-worker", 1, Runtime.getRuntime().availableProcessors(),
                Duration.ofSeconds(60), 1024);

        public SnmpAgentServerBuilder agent(SnmpAgent agent) {
            this.agent = agent;
            return this;
        }

        public SnmpAgentServerBuilder bindIp(String bindIp) {
            this.bindIp = bindIp;
            return this;
        }

        public SnmpAgentServerBuilder listenPort(int listenPort) {
            this.listenPort = listenPort;
            return this;
        }

        public SnmpAgentServerBuilder maxInboundMessageSize(int maxInboundMessageSize) {
            this.maxInboundMessageSize = maxInboundMessageSize;
            return this;
        }

        public SnmpAgentServerBuilder workerPool(String poolName,
                                                 int corePoolSize, int maximumPoolSize,
                                                 Duration keepAliveTime,
                                                 int queueCapacity) {
            this.workerPoolConfig = new JdkThreadPool.WorkerPoolConfig(poolName,
                    corePoolSize, maximumPoolSize,
                    keepAliveTime,
                    queueCapacity);
            return this;
        }

        public SnmpAgentServer build() {
            return new SnmpAgentServer(this);
        }
    }
}
