package com.weixiao.mgit.pack;

import com.weixiao.mgit.obj.ObjectType;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * pack 中解压后的一条记录：字面对象（commit/tree/blob/tag）或以 20 字节 oid 引用 base 的 ref-delta。
 * 只在一次 fetch 期间存在，随即转换为对象库中的对象。
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PackEntry {

    /** 字面对象的类型；ref-delta 为 null。 */
    ObjectType type;
    /** ref-delta 的 base oid（40 字符 hex）；字面对象为 null。 */
    String baseOid;
    /** 解压后的对象体或 delta 指令流。 */
    byte[] data;

    public static PackEntry literal(ObjectType type, byte[] data) {
        return new PackEntry(type, null, data);
    }

    public static PackEntry refDelta(String baseOid, byte[] delta) {
        return new PackEntry(null, baseOid, delta);
    }

    public boolean isDelta() {
        return baseOid != null;
    }
}
