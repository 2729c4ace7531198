package io.snmp.agent.core.support.exception;

/**
 * community认证失败异常.
 *
 * <p>与解码失败一样静默丢弃，不向对端暴露community是否"接近"正确.</p>
 */
public class UnauthorizedCommunityException extends SnmpDiscardException {

    public UnauthorizedCommunityException(String format, Object... args) {
        super(format, args);
    }

}
