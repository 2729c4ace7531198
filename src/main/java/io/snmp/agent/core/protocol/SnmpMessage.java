package io.snmp.agent.core.protocol;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.snmp4j.PDU;
import org.snmp4j.mp.SnmpConstants;
import org.snmp4j.smi.OctetString;

/**
 * snmp(v1)消息封装: {@code SEQUENCE { version, community, pdu }}.
 *
 * <p>每个数据报创建一个实例，编码后即丢弃.</p>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SnmpMessage {

    /**
     * 协议版本，SNMPv1为{@link SnmpConstants#version1}(0).
     */
    private int version;
    /**
     * community字符串.
     */
    private OctetString community;
    /**
     * pdu，v1 trap为{@link org.snmp4j.PDUv1}.
     */
    private PDU pdu;

    public SnmpMessage(String community, PDU pdu) {
        this(SnmpConstants.version1, new OctetString(community), pdu);
    }

    public PduKind getPduKind() {
        return pdu == null ? null : PduKind.find(pdu.getType());
    }
}
