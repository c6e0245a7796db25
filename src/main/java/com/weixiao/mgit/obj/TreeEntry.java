package com.weixiao.mgit.obj;

import lombok.Value;

/**
 * Tree 中的一条记录：模式（八进制字符串）+ 名字 + blob/tree 的 oid。
 */
@Value
public class TreeEntry {

    public static final String MODE_REGULAR = "100644";
    public static final String MODE_EXECUTABLE = "100755";
    public static final String MODE_SYMLINK = "120000";
    public static final String MODE_DIRECTORY = "40000";
    public static final String MODE_GITLINK = "160000";

    private static final int TYPE_MASK = 0170000;
    private static final int TYPE_DIRECTORY = 0040000;
    private static final int TYPE_SYMLINK = 0120000;
    private static final int TYPE_GITLINK = 0160000;

    String mode;
    String name;
    String oid; // 40 字符 hex

    /** 构造一条普通文件条目：mode=100644，name 为文件名，oid 为 40 字符 hex。 */
    public static TreeEntry regularFile(String name, String oid) {
        return new TreeEntry(MODE_REGULAR, name, oid);
    }

    /** 构造一条子目录条目：mode=40000。 */
    public static TreeEntry directory(String name, String oid) {
        return new TreeEntry(MODE_DIRECTORY, name, oid);
    }

    /** mode 的数值形式；非法八进制视为 0。 */
    public int modeBits() {
        try {
            return Integer.parseInt(mode, 8);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    public boolean isDirectory() {
        return (modeBits() & TYPE_MASK) == TYPE_DIRECTORY;
    }

    public boolean isSymlink() {
        return (modeBits() & TYPE_MASK) == TYPE_SYMLINK;
    }

    public boolean isGitlink() {
        return (modeBits() & TYPE_MASK) == TYPE_GITLINK;
    }

    /** 文件权限位（mode 的低 9 位），如 100755 → 0755。 */
    public int permissionBits() {
        return modeBits() & 0777;
    }

    /** 条目引用的对象类型：目录为 tree，gitlink 为 commit，其余为 blob。 */
    public ObjectType objectType() {
        if (isDirectory()) return ObjectType.TREE;
        if (isGitlink()) return ObjectType.COMMIT;
        return ObjectType.BLOB;
    }
}
