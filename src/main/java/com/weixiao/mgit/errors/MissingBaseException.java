package com.weixiao.mgit.errors;

import java.io.IOException;

/**
 * ref-delta 引用的 base 对象在对象库中不存在，且队列中也无法再解析出它。
 */
public class MissingBaseException extends IOException {

    private static final long serialVersionUID = 1L;

    private final String baseOid;

    public MissingBaseException(String baseOid, int pending) {
        super("missing delta base " + baseOid + " (" + pending + " deltas unresolved)");
        this.baseOid = baseOid;
    }

    /** 第一个无法解析的 base oid（40 字符 hex）。 */
    public String getBaseOid() {
        return baseOid;
    }
}
