package com.groupcheck.api.security;

import java.util.List;

/**
 * 已校验的主体凭证
 * <p>
 * 每次判定都重新解析，不跨请求缓存。
 *
 * @param realUid           实际用户 ID
 * @param effectiveUid      有效用户 ID
 * @param primaryGid        主组 ID，不参与授权匹配
 * @param supplementaryGids 附加组 ID（保持内核返回的顺序）
 * @author groupcheck
 */
public record Credentials(long realUid, long effectiveUid, long primaryGid, List<Long> supplementaryGids) {

    public Credentials {
        supplementaryGids = supplementaryGids == null ? List.of() : List.copyOf(supplementaryGids);
    }

    /**
     * 实际用户与有效用户一致。
     * 不一致说明调用方可能 exec 了 setuid 程序，其有效身份不可信。
     */
    public boolean isUidConsistent() {
        return realUid == effectiveUid;
    }

    /**
     * 判断某个组是否为附加组成员身份。与主组相同的条目不计入。
     */
    public boolean hasSupplementaryGroup(long gid) {
        if (gid == primaryGid) {
            return false;
        }
        return supplementaryGids.contains(gid);
    }
}
