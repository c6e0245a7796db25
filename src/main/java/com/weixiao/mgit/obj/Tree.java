package com.weixiao.mgit.obj;

import com.weixiao.mgit.errors.CorruptObjectException;
import com.weixiao.mgit.utils.HexUtils;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Git tree 对象：目录快照，条目按 name 的原始字节排序。
 * 序列化：每条 mode + " " + name + "\0" + 20 字节二进制 oid。
 * <p>
 * 排序键只是 name 本身，不带 mode 前缀，也不给目录名补 "/"，同样内容的目录得到同样的 tree 字节。
 */
public final class Tree implements GitObject {

    /** 按 UTF-8 字节无符号比较 name；name 总是合法 UTF-8（见 {@link #parse}），编码回去与原始字节一致。 */
    public static final Comparator<TreeEntry> BY_NAME_BYTES = (a, b) -> Arrays.compareUnsigned(
            a.getName().getBytes(StandardCharsets.UTF_8), b.getName().getBytes(StandardCharsets.UTF_8));

    private final List<TreeEntry> entries;

    /** 用给定条目构造 tree，内部按 name 排序；null 或空列表视为空 tree。 */
    public Tree(List<TreeEntry> entries) {
        this(entries, true);
    }

    private Tree(List<TreeEntry> entries, boolean sort) {
        this.entries = new ArrayList<>(entries != null ? entries : List.of());
        if (sort) this.entries.sort(BY_NAME_BYTES);
    }

    @Override
    public ObjectType getType() {
        return ObjectType.TREE;
    }

    /** 已排序的条目（只读）。 */
    public List<TreeEntry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    @Override
    public byte[] toBytes() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (TreeEntry e : entries) {
            byte[] header = (e.getMode() + " " + e.getName() + "\0").getBytes(StandardCharsets.UTF_8);
            out.write(header, 0, header.length);
            out.write(HexUtils.hexToBytes(e.getOid()), 0, HexUtils.OID_LENGTH);
        }
        return out.toByteArray();
    }

    /**
     * 解析 tree 对象体：反复查找下一个 NUL，前面的部分按第一个空格拆成 mode 与 name，随后恰好读 20 字节 oid。
     *
     * @param body 不含 "tree size\0" 头的对象体
     * @return 条目保持对象体中原有顺序的 tree
     * @throws CorruptObjectException 条目缺少空格、缺少 NUL、name 不是合法 UTF-8 或 oid 不足 20 字节
     */
    public static Tree parse(byte[] body) throws CorruptObjectException {
        List<TreeEntry> entries = new ArrayList<>();
        int pos = 0;
        while (pos < body.length) {
            int nul = indexOf(body, (byte) 0, pos);
            if (nul < 0) {
                throw new CorruptObjectException("tree entry at offset " + pos + " has no NUL terminator");
            }
            int space = indexOf(body, (byte) ' ', pos);
            if (space < 0 || space > nul) {
                throw new CorruptObjectException("tree entry at offset " + pos + " has no mode separator");
            }
            String mode = new String(body, pos, space - pos, StandardCharsets.US_ASCII);
            String name = decodeName(body, space + 1, nul - space - 1, pos);
            int oidStart = nul + 1;
            if (oidStart + HexUtils.OID_LENGTH > body.length) {
                throw new CorruptObjectException("tree entry '" + name + "' has truncated oid");
            }
            String oid = HexUtils.bytesToHex(body, oidStart, HexUtils.OID_LENGTH);
            entries.add(new TreeEntry(mode, name, oid));
            pos = oidStart + HexUtils.OID_LENGTH;
        }
        return new Tree(entries, false);
    }

    /**
     * name 按严格 UTF-8 解码；非法字节序列会在重新编码时改变 tree 字节与 oid，因此视为损坏而不是替换。
     */
    private static String decodeName(byte[] body, int offset, int length, int entryOffset)
            throws CorruptObjectException {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(body, offset, length))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new CorruptObjectException("tree entry at offset " + entryOffset + " has a name that is not UTF-8", e);
        }
    }

    private static int indexOf(byte[] a, byte b, int from) {
        for (int i = from; i < a.length; i++) if (a[i] == b) return i;
        return -1;
    }
}
