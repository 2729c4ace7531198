package io.snmp.agent.core.support.exception;

import io.snmp.agent.core.protocol.ErrorStatus;

/**
 * 管理对象读写异常，由getter/setter抛出.
 *
 * <p>{@link #getStatus()}将作为响应pdu的error-status，error-index为出错变量的位置(从1开始).
 * getter/setter抛出的其它异常一律视为{@link ErrorStatus#GEN_ERR}.</p>
 *
 * @author ssp
 * @since 1.0
 */
public class SnmpVariableException extends Exception {

    private final ErrorStatus status;

    public SnmpVariableException(ErrorStatus status, String message) {
        super(String.format("%s (status: %d)", message, status.code()));
        this.status = status;
    }

    public static SnmpVariableException of(ErrorStatus status, String format, Object... args) {
        return new SnmpVariableException(status, args.length > 0 ? String.format(format, args) : format);
    }

    public ErrorStatus getStatus() {
        return status;
    }
}
