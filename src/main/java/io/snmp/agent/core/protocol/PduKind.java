package io.snmp.agent.core.protocol;

import org.snmp4j.PDU;

/**
 * snmp消息中pdu的全部类型.
 *
 * <p>协议的pdu集合是固定的，{@link io.snmp.agent.core.SnmpAgent}对其做穷举分派；
 * 仅GET、GET_NEXT、SET被处理，其余类型的请求被丢弃.</p>
 */
public enum PduKind {

    GET(PDU.GET),
    GET_NEXT(PDU.GETNEXT),
    RESPONSE(PDU.RESPONSE),
    SET(PDU.SET),
    V1_TRAP(PDU.V1TRAP),
    GET_BULK(PDU.GETBULK),
    INFORM(PDU.INFORM),
    V2_TRAP(PDU.TRAP);

    private final int type;

    PduKind(int type) {
        this.type = type;
    }

    /**
     * snmp4j的pdu类型值，即BER上下文tag(0xA0~0xA7).
     */
    public int type() {
        return type;
    }

    public static PduKind find(int type) {
        for (PduKind value : PduKind.values()) {
            if (value.type == type) {
                return value;
            }
        }
        return null;
    }
}
