package io.snmp.agent.core.support.exception;

/**
 * 请求报文被丢弃异常.
 *
 * <p>抛出该异常时不产生任何响应报文，transport层不得向对端回包.</p>
 *
 * @author ssp
 * @since 1.0
 */
public class SnmpDiscardException extends Exception {

    public SnmpDiscardException(String format, Object... args) {
        super(String.format(format, args));
    }

    public SnmpDiscardException(Throwable e, String format, Object... args) {
        super(String.format(format, args), e);
    }

}
