package io.snmp.agent.core.protocol;

import io.snmp.agent.core.SnmpFixtures;
import io.snmp.agent.core.support.exception.SnmpCodecException;
import org.junit.Test;
import org.snmp4j.PDU;
import org.snmp4j.smi.Integer32;
import org.snmp4j.smi.Null;
import org.snmp4j.smi.OctetString;
import org.snmp4j.smi.VariableBinding;

import java.util.Arrays;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

public class SnmpMessageCodecTest {

    private final SnmpMessageCodec codec = new SnmpMessageCodec();

    @Test
    public void testDecodeGetRequest() throws SnmpCodecException {
        final SnmpMessage message = codec.decode(SnmpFixtures.getSysUpTimeRequest());

        assertEquals(0, message.getVersion());
        assertEquals(new OctetString("publ"), message.getCommunity());
        assertEquals(PduKind.GET, message.getPduKind());
        assertEquals(0x7425436c, message.getPdu().getRequestID().getValue());
        assertEquals(1, message.getPdu().size());
        assertEquals(SnmpFixtures.SYS_UP_TIME, message.getPdu().get(0).getOid());
        assertEquals(new Null(), message.getPdu().get(0).getVariable());
    }

    @Test
    public void testEncodeIsInverseOfDecode() throws SnmpCodecException {
        final byte[] data = SnmpFixtures.getSysUpTimeRequest();
        assertArrayEquals(data, codec.encode(codec.decode(data)));
    }

    @Test
    public void testResponseSurvivesEncoding() throws SnmpCodecException {
        final PDU pdu = new PDU();
        pdu.setType(PDU.RESPONSE);
        pdu.setRequestID(new Integer32(99));
        pdu.setErrorStatus(ErrorStatus.NOT_WRITABLE.code());
        pdu.setErrorIndex(1);
        pdu.add(new VariableBinding(SnmpFixtures.SYS_NAME, new OctetString("example")));

        final SnmpMessage decoded = codec.decode(codec.encode(new SnmpMessage("priv", pdu)));

        assertEquals(PduKind.RESPONSE, decoded.getPduKind());
        assertEquals(new OctetString("priv"), decoded.getCommunity());
        assertEquals(99, decoded.getPdu().getRequestID().getValue());
        assertEquals(ErrorStatus.NOT_WRITABLE, ErrorStatus.find(decoded.getPdu().getErrorStatus()));
        assertEquals(1, decoded.getPdu().getErrorIndex());
        assertEquals(new VariableBinding(SnmpFixtures.SYS_NAME, new OctetString("example")), decoded.getPdu().get(0));
    }

    @Test
    public void testDecodeGetBulkKind() throws SnmpCodecException {
        final SnmpMessage request = SnmpFixtures.request("publ", PDU.GETBULK, SnmpFixtures.SYS_UP_TIME);

        assertEquals(PduKind.GET_BULK, codec.decode(codec.encode(request)).getPduKind());
    }

    @Test(expected = SnmpCodecException.class)
    public void testTrailingBytesRejected() throws SnmpCodecException {
        final byte[] data = SnmpFixtures.getSysUpTimeRequest();
        codec.decode(Arrays.copyOf(data, data.length + 1));
    }

    @Test(expected = SnmpCodecException.class)
    public void testTruncatedMessageRejected() throws SnmpCodecException {
        final byte[] data = SnmpFixtures.getSysUpTimeRequest();
        codec.decode(Arrays.copyOf(data, data.length - 3));
    }

    @Test(expected = SnmpCodecException.class)
    public void testNonSequenceRejected() throws SnmpCodecException {
        codec.decode(SnmpFixtures.bytes(0x02, 0x01, 0x00));
    }

    @Test(expected = SnmpCodecException.class)
    public void testUnknownPduTagRejected() throws SnmpCodecException {
        final byte[] data = SnmpFixtures.getSysUpTimeRequest();
        // GetRequest tag 0xa0 -> 0xa9
        data[11] = (byte) 0xa9;
        codec.decode(data);
    }

    @Test(expected = SnmpCodecException.class)
    public void testEmptyDatagramRejected() throws SnmpCodecException {
        codec.decode(new byte[0]);
    }
}
