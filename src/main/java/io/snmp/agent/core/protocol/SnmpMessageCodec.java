package io.snmp.agent.core.protocol;

import io.snmp.agent.core.support.Assert;
import io.snmp.agent.core.support.exception.SnmpCodecException;
import org.snmp4j.PDU;
import org.snmp4j.PDUv1;
import org.snmp4j.asn1.BER;
import org.snmp4j.asn1.BERInputStream;
import org.snmp4j.smi.Integer32;
import org.snmp4j.smi.OctetString;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * snmp(v1/v2c community)消息BER编解码.
 *
 * <p>消息头{@code SEQUENCE { INTEGER version, OCTET STRING community, pdu }}在此处理，
 * pdu及变量绑定的编解码委托给snmp4j.</p>
 *
 * <li>decode: 外层非SEQUENCE、BER格式错误、未知pdu类型、存在多余尾部字节均视为报文非法.
 * <li>encode: 输出完整消息字节.
 *
 * @author ssp
 * @since 1.0
 */
public class SnmpMessageCodec {

    public SnmpMessage decode(byte[] data) throws SnmpCodecException {
        Assert.nonNull(data, "snmp decode failed! data is null.");

        try {
            final BERInputStream inputStream = new BERInputStream(ByteBuffer.wrap(data));

            final BER.MutableByte type = new BER.MutableByte();
            BER.decodeHeader(inputStream, type);
            if (type.getValue() != BER.SEQUENCE) {
                throw new SnmpCodecException("Encountered invalid tag, SEQUENCE expected: %d", type.getValue());
            }

            final Integer32 version = new Integer32();
            version.decodeBER(inputStream);

            final OctetString community = new OctetString();
            community.decodeBER(inputStream);

            if (inputStream.available() <= 0) {
                throw new SnmpCodecException("snmp message is missing pdu.");
            }
            final int pduType = data[(int) inputStream.getPosition()];
            if (PduKind.find(pduType) == null) {
                throw new SnmpCodecException("Unsupported PDU type: %d", pduType);
            }

            final PDU pdu = pduType == PDU.V1TRAP ? new PDUv1() : new PDU();
            pdu.decodeBER(inputStream);

            final int remaining = inputStream.available();
            if (remaining > 0) {
                throw new SnmpCodecException("%d remaining bytes.", remaining);
            }

            return new SnmpMessage(version.getValue(), community, pdu);
        } catch (IOException | RuntimeException e) {
            throw new SnmpCodecException(e, "snmp decode failed: %s", e.getMessage());
        }
    }

    public byte[] encode(SnmpMessage message) throws SnmpCodecException {
        Assert.nonNull(message, "snmp encode failed! message is null.");
        Assert.nonNull(message.getCommunity(), "snmp encode failed! community is null.");
        Assert.nonNull(message.getPdu(), "snmp encode failed! pdu is null.");

        final Integer32 version = new Integer32(message.getVersion());
        final OctetString community = message.getCommunity();
        final PDU pdu = message.getPdu();

        try {
            final int length = version.getBERLength() + community.getBERLength() + pdu.getBERLength();

            final ByteArrayOutputStream outputStream =
                    new ByteArrayOutputStream(length + BER.getBERLengthOfLength(length) + 1);
            BER.encodeHeader(outputStream, BER.SEQUENCE, length);
            version.encodeBER(outputStream);
            community.encodeBER(outputStream);
            pdu.encodeBER(outputStream);

            return outputStream.toByteArray();
        } catch (IOException | RuntimeException e) {
            throw new SnmpCodecException(e, "snmp encode failed: %s", e.getMessage());
        }
    }

}
