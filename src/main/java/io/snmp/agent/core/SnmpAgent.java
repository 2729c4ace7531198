package io.snmp.agent.core;

import io.snmp.agent.core.access.CommunityAccessControl;
import io.snmp.agent.core.processor.PduProcessor;
import io.snmp.agent.core.protocol.ErrorStatus;
import io.snmp.agent.core.protocol.PduKind;
import io.snmp.agent.core.protocol.SnmpMessage;
import io.snmp.agent.core.protocol.SnmpMessageCodec;
import io.snmp.agent.core.registry.ManagedObjectRegistry;
import io.snmp.agent.core.registry.VariableGetter;
import io.snmp.agent.core.registry.VariableSetter;
import io.snmp.agent.core.support.Assert;
import io.snmp.agent.core.support.exception.SnmpDiscardException;
import io.snmp.agent.core.support.exception.UnsupportedPduException;
import io.snmp.agent.core.support.exception.UnsupportedVersionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.snmp4j.PDU;
import org.snmp4j.mp.SnmpConstants;
import org.snmp4j.smi.OID;

/**
 * snmp(v1) agent引擎，与transport无关.
 *
 * <li>processDatagram: 请求字节 -> 响应字节，抛出{@link SnmpDiscardException}时不得回包.
 * <li>processMessage: 版本校验 -> community授权 -> 按pdu类型分派 -> 组装响应.
 *
 * <p>引擎本身无状态、无内部线程，可被多个transport线程并发调用.</p>
 *
 * @author ssp
 * @since 1.0
 */
public class SnmpAgent {

    private static final Logger log = LoggerFactory.getLogger(SnmpAgent.class);

    private final ManagedObjectRegistry registry;

    private final PduProcessor pduProcessor;

    private final SnmpMessageCodec codec;

    private volatile CommunityAccessControl accessControl;

    public SnmpAgent() {
        this(builder());
    }

    public SnmpAgent(SnmpAgentBuilder builder) {
        this.registry = new ManagedObjectRegistry();
        this.pduProcessor = new PduProcessor(registry);
        this.codec = new SnmpMessageCodec();
        this.accessControl = new CommunityAccessControl(builder.readCommunity, builder.writeCommunity);
    }

    /*---------managed object----------*/

    public SnmpAgent registerReadOnly(OID oid, VariableGetter getter) {
        registry.register(oid, getter, null);
        return this;
    }

    public SnmpAgent registerReadWrite(OID oid, VariableGetter getter, VariableSetter setter) {
        registry.register(oid, getter, setter);
        return this;
    }

    public ManagedObjectRegistry getRegistry() {
        return registry;
    }

    /**
     * 替换读、写community.
     */
    public void setCommunities(String readCommunity, String writeCommunity) {
        this.accessControl = new CommunityAccessControl(readCommunity, writeCommunity);
    }

    /*---------process----------*/

    public byte[] processDatagram(byte[] requestBytes) throws SnmpDiscardException {
        final SnmpMessage request = codec.decode(requestBytes);
        final SnmpMessage response = processMessage(request);
        return codec.encode(response);
    }

    public SnmpMessage processMessage(SnmpMessage request) throws SnmpDiscardException {
        Assert.nonNull(request, "snmp request is null.");

        if (request.getVersion() != SnmpConstants.version1) {
            throw new UnsupportedVersionException("invalid SNMP version %d", request.getVersion());
        }

        final boolean writable = accessControl.isWritable(request.getCommunity());

        final PDU pdu = request.getPdu();
        final PduKind kind = request.getPduKind();
        if (kind == null) {
            throw new UnsupportedPduException("PDU not supported: %s", pdu == null ? null : pdu.getType());
        }
        log.debug("---> snmp#request: community={}, kind={}, pdu={}.", request.getCommunity(), kind, pdu);

        final PDU result;
        switch (kind) {
            case GET:
                result = pduProcessor.process(pdu, false, false);
                break;
            case GET_NEXT:
                result = pduProcessor.process(pdu, true, false);
                break;
            case SET:
                if (writable) {
                    result = pduProcessor.process(pdu, false, true);
                } else {
                    result = pduProcessor.errorResponse(pdu, ErrorStatus.NO_SUCH_NAME, 1);
                }
                break;
            default:
                // RESPONSE, V1_TRAP, GET_BULK, INFORM, V2_TRAP
                throw new UnsupportedPduException("PDU not supported: %s", kind);
        }

        final SnmpMessage response = new SnmpMessage(request.getVersion(), request.getCommunity(), result);
        log.debug("<--- snmp#response: community={}, response={}.", response.getCommunity(), result);
        return response;
    }

    /*---------builder----------*/

    public static SnmpAgentBuilder builder() {
        return new SnmpAgentBuilder();
    }

    public static class SnmpAgentBuilder {

        private String readCommunity = CommunityAccessControl.DEFAULT_READ_COMMUNITY;
        private String writeCommunity = CommunityAccessControl.DEFAULT_WRITE_COMMUNITY;

        public SnmpAgentBuilder readCommunity(String readCommunity) {
            this.readCommunity = readCommunity;
            return this;
        }

        public SnmpAgentBuilder writeCommunity(String writeCommunity) {
            this.writeCommunity = writeCommunity;
            return this;
        }

        public SnmpAgent build() {
            return new SnmpAgent(this);
        }
    }

}
