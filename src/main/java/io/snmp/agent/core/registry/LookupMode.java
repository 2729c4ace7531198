package io.snmp.agent.core.registry;

/**
 * 注册表查找模式.
 */
public enum LookupMode {

    /**
     * oid完全相等.
     */
    EXACT,
    /**
     * 字典序严格大于查询oid的最小oid(get-next).
     */
    NEXT
}
