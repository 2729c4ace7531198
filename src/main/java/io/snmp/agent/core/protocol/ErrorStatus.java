package io.snmp.agent.core.protocol;

import org.snmp4j.PDU;

/**
 * snmp响应pdu的error-status取值.
 *
 * <p>code与协议线上取值严格一致(0~18).</p>
 */
public enum ErrorStatus {

    NO_ERROR(PDU.noError),
    TOO_BIG(PDU.tooBig),
    NO_SUCH_NAME(PDU.noSuchName),
    BAD_VALUE(PDU.badValue),
    READ_ONLY(PDU.readOnly),
    GEN_ERR(PDU.genErr),
    NO_ACCESS(PDU.noAccess),
    WRONG_TYPE(PDU.wrongType),
    WRONG_LENGTH(PDU.wrongLength),
    WRONG_ENCODING(PDU.wrongEncoding),
    WRONG_VALUE(PDU.wrongValue),
    NO_CREATION(PDU.noCreation),
    INCONSISTENT_VALUE(PDU.inconsistentValue),
    RESOURCE_UNAVAILABLE(PDU.resourceUnavailable),
    COMMIT_FAILED(PDU.commitFailed),
    UNDO_FAILED(PDU.undoFailed),
    AUTHORIZATION_ERROR(PDU.authorizationError),
    NOT_WRITABLE(PDU.notWritable),
    INCONSISTENT_NAME(PDU.inconsistentName);

    private final int code;

    ErrorStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static ErrorStatus find(int code) {
        for (ErrorStatus value : ErrorStatus.values()) {
            if (value.code == code) {
                return value;
            }
        }
        return null;
    }
}
