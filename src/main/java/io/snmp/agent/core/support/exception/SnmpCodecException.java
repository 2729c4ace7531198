package io.snmp.agent.core.support.exception;

/**
 * snmp报文编解码异常.
 */
public class SnmpCodecException extends SnmpDiscardException {

    public SnmpCodecException(String format, Object... args) {
        super(format, args);
    }

    public SnmpCodecException(Throwable e, String format, Object... args) {
        super(e, format, args);
    }

}
