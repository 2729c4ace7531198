package io.snmp.agent.core.support.exception;

public class SnmpRuntimeException extends RuntimeException {

    public SnmpRuntimeException(Throwable cause) {
        super(cause);
    }

    public SnmpRuntimeException(String format, Object... args) {
        super(String.format(format, args));
    }
}
