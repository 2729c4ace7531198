package io.snmp.agent.core.support.exception;

/**
 * 管理对象重复注册异常.
 *
 * @author ssp
 * @since 1.0
 */
public class ManagedObjectAlreadyRegisteredException extends RuntimeException {

    public ManagedObjectAlreadyRegisteredException(String format, Object... args) {
        super(String.format(format, args));
    }

}
