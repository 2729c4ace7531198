package io.snmp.agent.core.registry;

import io.snmp.agent.core.protocol.ErrorStatus;
import io.snmp.agent.core.support.exception.SnmpVariableException;
import org.snmp4j.smi.OID;
import org.snmp4j.smi.Variable;

/**
 * 已注册的管理对象，注册后不可变.
 *
 * <p>oid同时是注册表的排序键，对外(包括getter/setter回调)只交出副本.</p>
 */
public class ManagedObjectEntry {

    private final OID oid;

    private final VariableGetter getter;

    private final VariableSetter setter;

    ManagedObjectEntry(OID oid, VariableGetter getter, VariableSetter setter) {
        this.oid = oid;
        this.getter = getter;
        this.setter = setter != null ? setter : ManagedObjectEntry::notWritable;
    }

    public OID getOid() {
        return new OID(oid.getValue());
    }

    public Variable get() throws Exception {
        return getter.get(getOid());
    }

    public void set(Variable value) throws Exception {
        setter.set(getOid(), value);
    }

    private static void notWritable(OID oid, Variable value) throws SnmpVariableException {
        throw SnmpVariableException.of(ErrorStatus.NOT_WRITABLE, "OID %s is not writable", oid);
    }

    @Override
    public String toString() {
        return "ManagedObjectEntry{oid=" + oid + '}';
    }
}
