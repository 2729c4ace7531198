package io.snmp.agent.core.access;

import io.snmp.agent.core.support.Assert;
import io.snmp.agent.core.support.exception.UnauthorizedCommunityException;
import org.snmp4j.smi.OctetString;

/**
 * community读写授权.
 *
 * <li>与写community相等：可读写.
 * <li>仅与读community相等：只读.
 * <li>均不相等：认证失败，整个请求被丢弃.
 *
 * <p>逐字节精确比较，区分大小写，无前缀匹配，无按oid的细粒度acl.</p>
 *
 * @author ssp
 * @since 1.0
 */
public class CommunityAccessControl {

    public static final String DEFAULT_READ_COMMUNITY = "public";

    public static final String DEFAULT_WRITE_COMMUNITY = "private";

    private final OctetString readCommunity;

    private final OctetString writeCommunity;

    public CommunityAccessControl() {
        this(DEFAULT_READ_COMMUNITY, DEFAULT_WRITE_COMMUNITY);
    }

    public CommunityAccessControl(String readCommunity, String writeCommunity) {
        Assert.nonNull(readCommunity, "read community is null.");
        Assert.nonNull(writeCommunity, "write community is null.");
        this.readCommunity = new OctetString(readCommunity);
        this.writeCommunity = new OctetString(writeCommunity);
    }

    /**
     * 校验community.
     *
     * @param community 请求中的community
     * @return true-可写；false-只读
     * @throws UnauthorizedCommunityException community未配置
     */
    public boolean isWritable(OctetString community) throws UnauthorizedCommunityException {
        if (writeCommunity.equals(community)) {
            return true;
        }
        if (readCommunity.equals(community)) {
            return false;
        }
        throw new UnauthorizedCommunityException("invalid community \"%s\"", community);
    }

    public boolean isWritable(String community) throws UnauthorizedCommunityException {
        return isWritable(community == null ? null : new OctetString(community));
    }
}
