package com.weixiao.mgit.obj;

import com.weixiao.mgit.errors.CorruptObjectException;
import com.weixiao.mgit.utils.HexUtils;

import java.nio.charset.StandardCharsets;

/**
 * Git commit 对象：tree、可选 parent、author、message。
 * 序列化格式与 Git 一致：tree &lt;oid&gt;\n[parent &lt;oid&gt;\n]author ...\ncommitter ...\n\nmessage
 */
public final class Commit implements GitObject {

    private static final byte[] TREE_MARKER = "tree ".getBytes(StandardCharsets.US_ASCII);

    private final String treeOid;
    private final String parentOid; // 可选，首次提交为 null
    private final Author author;
    private final String message;

    /**
     * parentOid 可为 null 表示首次提交；message 为 null 时当作空字符串，非空且不以换行结尾时补一个换行（与 git commit-tree -m 一致）。
     */
    public Commit(String treeOid, String parentOid, Author author, String message) {
        this.treeOid = treeOid;
        this.parentOid = parentOid;
        this.author = author;
        String msg = message != null ? message : "";
        this.message = msg.isEmpty() || msg.endsWith("\n") ? msg : msg + "\n";
    }

    @Override
    public ObjectType getType() {
        return ObjectType.COMMIT;
    }

    public String getTreeOid() {
        return treeOid;
    }

    public String getParentOid() {
        return parentOid;
    }

    /**
     * author 同时作为 committer 写出。
     */
    @Override
    public byte[] toBytes() {
        String identity = author.format();
        StringBuilder sb = new StringBuilder();
        sb.append("tree ").append(treeOid).append("\n");
        if (parentOid != null) sb.append("parent ").append(parentOid).append("\n");
        sb.append("author ").append(identity).append("\n");
        sb.append("committer ").append(identity).append("\n");
        sb.append("\n");
        sb.append(message);
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * 从原始 commit 对象体中找到 "tree " 标记并读出其后 40 个 hex 字符，clone 后检出工作区只需要这一步解析。
     */
    public static String readTreeOid(byte[] body) throws CorruptObjectException {
        int at = indexOf(body, TREE_MARKER);
        int start = at + TREE_MARKER.length;
        if (at < 0 || start + HexUtils.OID_HEX_LENGTH > body.length) {
            throw new CorruptObjectException("commit has no tree header");
        }
        String oid = new String(body, start, HexUtils.OID_HEX_LENGTH, StandardCharsets.US_ASCII);
        if (!HexUtils.isOid(oid)) {
            throw new CorruptObjectException("commit tree header is not a valid oid: " + oid);
        }
        return oid.toLowerCase();
    }

    private static int indexOf(byte[] haystack, byte[] needle) {
        outer:
        for (int i = 0; i + needle.length <= haystack.length; i++) {
            for (int j = 0; j < needle.length; j++) {
                if (haystack[i + j] != needle[j]) continue outer;
            }
            return i;
        }
        return -1;
    }
}
