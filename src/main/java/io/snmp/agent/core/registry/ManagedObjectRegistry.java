package io.snmp.agent.core.registry;

import io.snmp.agent.core.support.Assert;
import io.snmp.agent.core.support.exception.ManagedObjectAlreadyRegisteredException;
import lombok.extern.slf4j.Slf4j;
import org.snmp4j.smi.OID;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 管理对象注册表.
 *
 * <p>按oid字典序升序维护，oid唯一；get-next即取严格大于查询oid的最小条目，
 * 管理端据此可在不了解树形结构的前提下遍历整棵树.</p>
 * <p>注册与查找通过读写锁互斥，服务开始后仍可安全注册.</p>
 *
 * @author ssp
 * @since 1.0
 */
@Slf4j
public class ManagedObjectRegistry {

    private final TreeMap<OID, ManagedObjectEntry> entries = new TreeMap<>();

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * 注册管理对象.
     *
     * @param oid    管理对象oid
     * @param getter 取值回调，必填
     * @param setter 赋值回调，为null时赋值返回notWritable
     * @throws ManagedObjectAlreadyRegisteredException oid已注册，注册表保持不变
     */
    public ManagedObjectEntry register(OID oid, VariableGetter getter, VariableSetter setter) {
        Assert.nonNull(oid, "register managed object failed! oid is null.");
        Assert.nonNull(getter, "A managed object should have at least a getter: %s", oid);

        final OID key = new OID(oid.getValue());

        lock.writeLock().lock();
        try {
            if (entries.containsKey(key)) {
                throw new ManagedObjectAlreadyRegisteredException("OID %s is already registered.", key);
            }
            final ManagedObjectEntry entry = new ManagedObjectEntry(key, getter, setter);
            entries.put(key, entry);
            log.debug("managed object registered: oid={}, writable={}.", key, setter != null);
            return entry;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 查找管理对象.
     *
     * @param oid  查询oid
     * @param mode {@link LookupMode#EXACT}完全匹配；{@link LookupMode#NEXT}后继
     * @return 管理对象，不存在时返回null
     */
    public ManagedObjectEntry lookup(OID oid, LookupMode mode) {
        Assert.nonNull(oid, "lookup managed object failed! oid is null.");

        lock.readLock().lock();
        try {
            switch (mode) {
                case EXACT:
                    return entries.get(oid);
                case NEXT:
                    final Map.Entry<OID, ManagedObjectEntry> next = entries.higherEntry(oid);
                    return next == null ? null : next.getValue();
                default:
                    throw new IllegalArgumentException("args error: 'mode'.");
            }
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return 已注册oid的升序快照
     */
    public List<OID> getRegisteredOids() {
        lock.readLock().lock();
        try {
            final List<OID> oids = new ArrayList<>(entries.size());
            for (OID oid : entries.keySet()) {
                oids.add(new OID(oid.getValue()));
            }
            return oids;
        } finally {
            lock.readLock().unlock();
        }
    }
}
