package io.snmp.agent.core.server;

import io.snmp.agent.core.SnmpAgent;
import io.snmp.agent.core.SnmpFixtures;
import io.snmp.agent.core.protocol.SnmpMessage;
import io.snmp.agent.core.protocol.SnmpMessageCodec;
import lombok.extern.slf4j.Slf4j;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.snmp4j.PDU;
import org.snmp4j.smi.Integer32;

import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetSocketAddress;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Arrays;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

@Slf4j
public class SnmpAgentServerTest {

    private SnmpAgentServer server;

    private DatagramSocket client;

    @Before
    public void before() throws Exception {
        final SnmpAgent agent = SnmpAgent.builder()
                .readCommunity("publ")
                .writeCommunity("priv")
                .build();
        agent.registerReadOnly(SnmpFixtures.SYS_UP_TIME, oid -> new Integer32(123));

        server = SnmpAgentServer.builder()
                .agent(agent)
                .bindIp("127.0.0.1")
                .listenPort(0)
                .workerPool("snmp-agent-test-pool",
                        1, 2,
                        Duration.ofSeconds(60),
                        16
                )
                .build()
                .start();

        client = new DatagramSocket();
        client.setSoTimeout(2000);
    }

    @After
    public void after() {
        client.close();
        server.stop();
        assertFalse(server.isRunning());
    }

    @Test
    public void testRequestResponse() throws Exception {
        final byte[] response = exchange(SnmpFixtures.getSysUpTimeRequest());

        final SnmpMessage message = new SnmpMessageCodec().decode(response);
        log.info("response = {}", message);

        final PDU pdu = message.getPdu();
        assertEquals(PDU.RESPONSE, pdu.getType());
        assertEquals(PDU.noError, pdu.getErrorStatus());
        assertEquals(new Integer32(123), pdu.get(0).getVariable());
    }

    @Test
    public void testDiscardedRequestGetsNoResponse() throws Exception {
        final byte[] request = SnmpFixtures.getSysUpTimeRequest();
        // community "publ" -> "pubx"
        request[10] = 'x';

        try {
            client.setSoTimeout(500);
            exchange(request);
            fail("unauthorized request should not be answered");
        } catch (SocketTimeoutException e) {
            // expected
        }

        // the server keeps serving after a discarded datagram
        client.setSoTimeout(2000);
        assertTrue(exchange(SnmpFixtures.getSysUpTimeRequest()).length > 0);
    }

    private byte[] exchange(byte[] request) throws Exception {
        final InetSocketAddress target = server.getLocalAddress();
        client.send(new DatagramPacket(request, request.length, target));

        final byte[] buffer = new byte[65535];
        final DatagramPacket packet = new DatagramPacket(buffer, buffer.length);
        client.receive(packet);
        return Arrays.copyOf(packet.getData(), packet.getLength());
    }
}
