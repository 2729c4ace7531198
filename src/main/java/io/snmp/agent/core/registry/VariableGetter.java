package io.snmp.agent.core.registry;

import org.snmp4j.smi.OID;
import org.snmp4j.smi.Variable;

/**
 * 管理对象取值回调.
 *
 * <p>抛出{@link io.snmp.agent.core.support.exception.SnmpVariableException}时以其status响应，
 * 其它异常按genErr响应.</p>
 */
@FunctionalInterface
public interface VariableGetter {

    /**
     * @param oid 已注册的管理对象oid
     * @return 当前值，不可为null
     */
    Variable get(OID oid) throws Exception;
}
