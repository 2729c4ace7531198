package io.snmp.agent.core.processor;

import io.snmp.agent.core.protocol.ErrorStatus;
import io.snmp.agent.core.registry.LookupMode;
import io.snmp.agent.core.registry.ManagedObjectEntry;
import io.snmp.agent.core.registry.ManagedObjectRegistry;
import io.snmp.agent.core.support.Assert;
import io.snmp.agent.core.support.exception.SnmpVariableException;
import lombok.extern.slf4j.Slf4j;
import org.snmp4j.PDU;
import org.snmp4j.smi.Variable;
import org.snmp4j.smi.VariableBinding;

import java.util.ArrayList;
import java.util.List;

/**
 * get/get-next/set pdu处理器.
 *
 * <p>按请求顺序逐个处理变量绑定，遇到第一个失败即终止：
 * 响应携带该错误的status与从1开始的error-index，变量列表为请求原始列表，已取得的部分结果全部丢弃.</p>
 *
 * @author ssp
 * @since 1.0
 */
@Slf4j
public class PduProcessor {

    private final ManagedObjectRegistry registry;

    public PduProcessor(ManagedObjectRegistry registry) {
        Assert.nonNull(registry, "PduProcessor init failed! registry is null.");
        this.registry = registry;
    }

    /**
     * 处理一个pdu.
     *
     * @param request 请求pdu
     * @param next    true-get-next；false-精确匹配
     * @param mutate  true-set；false-get/get-next
     * @return response pdu
     */
    public PDU process(PDU request, boolean next, boolean mutate) {
        final List<? extends VariableBinding> requested = request.getVariableBindings();
        final LookupMode mode = next ? LookupMode.NEXT : LookupMode.EXACT;

        // get结果单独保存，出错时须返回原始列表
        final List<VariableBinding> variables = new ArrayList<>(requested.size());

        for (int i = 0; i < requested.size(); i++) {
            final VariableBinding binding = requested.get(i);
            final int errorIndex = i + 1;

            final ManagedObjectEntry entry = registry.lookup(binding.getOid(), mode);
            if (entry == null) {
                log.debug("pdu#process: no such name, oid={}, mode={}, index={}.", binding.getOid(), mode, errorIndex);
                return errorResponse(request, ErrorStatus.NO_SUCH_NAME, errorIndex);
            }

            try {
                if (mutate) {
                    entry.set(binding.getVariable());
                } else {
                    final Variable value = entry.get();
                    if (value == null) {
                        log.warn("pdu#process: getter returned null, oid={}.", entry.getOid());
                        return errorResponse(request, ErrorStatus.GEN_ERR, errorIndex);
                    }
                    variables.add(new VariableBinding(entry.getOid(), value));
                }
            } catch (SnmpVariableException e) {
                log.debug("pdu#process: oid={}, index={}, error={}.", entry.getOid(), errorIndex, e.getMessage());
                return errorResponse(request, e.getStatus(), errorIndex);
            } catch (Exception e) {
                log.warn("pdu#process: managed object exception! oid={}, index={}.", entry.getOid(), errorIndex, e);
                return errorResponse(request, ErrorStatus.GEN_ERR, errorIndex);
            }
        }

        return response(request, ErrorStatus.NO_ERROR, 0, mutate ? requested : variables);
    }

    /**
     * 以原始变量列表构造错误响应.
     */
    public PDU errorResponse(PDU request, ErrorStatus status, int errorIndex) {
        return response(request, status, errorIndex, request.getVariableBindings());
    }

    private PDU response(PDU request, ErrorStatus status, int errorIndex,
                         List<? extends VariableBinding> variables) {
        final PDU response = new PDU();
        response.setType(PDU.RESPONSE);
        response.setRequestID(request.getRequestID());
        response.setErrorStatus(status.code());
        response.setErrorIndex(errorIndex);
        for (VariableBinding variable : variables) {
            response.add(variable);
        }
        return response;
    }
}
