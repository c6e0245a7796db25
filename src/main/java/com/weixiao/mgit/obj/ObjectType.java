package com.weixiao.mgit.obj;

import com.weixiao.mgit.errors.CorruptObjectException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Git 对象类型：名字用于对象头 "type size\0"，packCode 为 packfile 记录头中的 3 位类型码。
 */
@Getter
@RequiredArgsConstructor
public enum ObjectType {

    COMMIT("commit", 1),
    TREE("tree", 2),
    BLOB("blob", 3),
    TAG("tag", 4);

    private final String name;
    private final int packCode;

    /**
     * 按对象头中的类型名查找；未知类型视为对象损坏。
     */
    public static ObjectType fromName(String name) throws CorruptObjectException {
        for (ObjectType t : values()) {
            if (t.name.equals(name)) return t;
        }
        throw new CorruptObjectException("unknown object type: " + name);
    }

    /**
     * 按 pack 类型码查找非 delta 类型；6/7 等 delta 类型或未知码返回 null。
     */
    public static ObjectType fromPackCode(int code) {
        for (ObjectType t : values()) {
            if (t.packCode == code) return t;
        }
        return null;
    }

    @Override
    public String toString() {
        return name;
    }
}
