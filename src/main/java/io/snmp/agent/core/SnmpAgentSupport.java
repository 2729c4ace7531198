package io.snmp.agent.core;

import io.snmp.agent.core.protocol.ErrorStatus;
import io.snmp.agent.core.support.exception.SnmpVariableException;
import lombok.extern.slf4j.Slf4j;
import org.snmp4j.smi.Counter32;
import org.snmp4j.smi.Counter64;
import org.snmp4j.smi.Integer32;
import org.snmp4j.smi.OID;
import org.snmp4j.smi.OctetString;
import org.snmp4j.smi.TimeTicks;
import org.snmp4j.smi.Variable;

import java.util.function.Consumer;
import java.util.function.IntSupplier;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * SnmpAgentSupport.
 *
 * <p>以java类型注册标量管理对象的便捷方法.</p>
 *
 * @author ssp
 * @since 1.0
 */
@Slf4j
public class SnmpAgentSupport {

    private final SnmpAgent snmpAgent;

    public SnmpAgentSupport(SnmpAgent snmpAgent) {
        this.snmpAgent = snmpAgent;
    }

    /**
     * 注册只读常量，String->OctetString，Integer->Integer32，Long->Counter64.
     */
    public SnmpAgentSupport registerConstant(String oid, Object value) {
        final Variable variable = toVariable(value);
        snmpAgent.registerReadOnly(new OID(oid), o -> variable);
        return this;
    }

    public SnmpAgentSupport registerString(String oid, Supplier<String> supplier) {
        snmpAgent.registerReadOnly(new OID(oid), o -> new OctetString(supplier.get()));
        return this;
    }

    public SnmpAgentSupport registerInteger(String oid, IntSupplier supplier) {
        snmpAgent.registerReadOnly(new OID(oid), o -> new Integer32(supplier.getAsInt()));
        return this;
    }

    public SnmpAgentSupport registerCounter32(String oid, LongSupplier supplier) {
        snmpAgent.registerReadOnly(new OID(oid), o -> new Counter32(supplier.getAsLong()));
        return this;
    }

    public SnmpAgentSupport registerCounter64(String oid, LongSupplier supplier) {
        snmpAgent.registerReadOnly(new OID(oid), o -> new Counter64(supplier.getAsLong()));
        return this;
    }

    /**
     * 注册时间戳对象，单位1/100秒，如sysUpTime.
     */
    public SnmpAgentSupport registerTimeTicks(String oid, LongSupplier hundredthsSupplier) {
        snmpAgent.registerReadOnly(new OID(oid), o -> new TimeTicks(hundredthsSupplier.getAsLong()));
        return this;
    }

    /**
     * 注册可读写字符串对象，如sysName；写入非OctetString值时返回badValue.
     */
    public SnmpAgentSupport registerWritableString(String oid, Supplier<String> supplier, Consumer<String> consumer) {
        snmpAgent.registerReadWrite(new OID(oid),
                o -> new OctetString(supplier.get()),
                (o, value) -> {
                    if (!(value instanceof OctetString)) {
                        throw SnmpVariableException.of(ErrorStatus.BAD_VALUE, "invalid type %s for OID %s",
                                value == null ? null : value.getSyntaxString(), o);
                    }
                    consumer.accept(value.toString());
                    log.debug("snmp#set: oid={}, value={}.", o, value);
                });
        return this;
    }

    private static Variable toVariable(Object value) {
        if (value instanceof Variable) {
            return (Variable) value;
        } else if (value instanceof String) {
            return new OctetString((String) value);
        } else if (value instanceof Integer) {
            return new Integer32((Integer) value);
        } else if (value instanceof Long) {
            return new Counter64((Long) value);
        }
        throw new IllegalArgumentException("Unmanaged Type: " + (value == null ? null : value.getClass()));
    }
}
