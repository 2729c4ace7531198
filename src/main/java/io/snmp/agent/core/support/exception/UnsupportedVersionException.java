package io.snmp.agent.core.support.exception;

/**
 * snmp协议版本不支持异常.
 */
public class UnsupportedVersionException extends SnmpDiscardException {

    public UnsupportedVersionException(String format, Object... args) {
        super(format, args);
    }

}
