package io.snmp.agent.core.support.exception;

/**
 * pdu类型不支持异常(trap、SNMPv2 pdu等).
 */
public class UnsupportedPduException extends SnmpDiscardException {

    public UnsupportedPduException(String format, Object... args) {
        super(format, args);
    }

}
