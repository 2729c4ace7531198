package io.snmp.agent.core.registry;

import org.snmp4j.smi.OID;
import org.snmp4j.smi.Variable;

/**
 * 管理对象赋值回调.
 */
@FunctionalInterface
public interface VariableSetter {

    void set(OID oid, Variable value) throws Exception;
}
