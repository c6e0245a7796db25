package com.weixiao.mgit.transport;

import lombok.Value;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * info/refs 的解析结果：HEAD 指向的默认分支（可能为 null）与广告的引用列表（含 HEAD 本身）。
 */
@Value
public class RefAdvertisement {

    String headTarget;
    List<AdvertisedRef> refs;

    /** 需要 want 的 oid，去重并保持广告顺序。 */
    public Set<String> wantedOids() {
        Set<String> oids = new LinkedHashSet<>();
        for (AdvertisedRef ref : refs) oids.add(ref.getOid());
        return oids;
    }

    /** HEAD 对应的 oid；未广告 HEAD 时返回 null。 */
    public String headOid() {
        for (AdvertisedRef ref : refs) {
            if ("HEAD".equals(ref.getName())) return ref.getOid();
        }
        return null;
    }

    public boolean isEmpty() {
        return refs.isEmpty();
    }
}
