package com.weixiao.mgit.pack;

import com.weixiao.mgit.errors.CorruptPackException;
import com.weixiao.mgit.obj.ObjectType;
import com.weixiao.mgit.utils.HexUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

/**
 * packfile（版本 2）解析器。
 * <p>
 * 格式：4 字节 "PACK"、4 字节大端版本号、4 字节大端对象数，随后是首尾相接的记录。
 * 每条记录：变长头（首字节低 4 位为 size 低位、4-6 位为类型码，0x80 为续位，后续字节每个补 7 位），
 * ref-delta 另有 20 字节 base oid，然后是 zlib 流。记录之间没有长度前缀，
 * 因此用 {@link Inflater#getBytesRead()} 确定压缩流实际消耗的字节数，以此定位下一条记录。
 */
public final class PackParser {

    private static final Logger log = LoggerFactory.getLogger(PackParser.class);

    private static final byte[] MAGIC = "PACK".getBytes(StandardCharsets.US_ASCII);
    private static final int SUPPORTED_VERSION = 2;
    private static final int HEADER_LENGTH = 12;

    static final int OBJ_OFS_DELTA = 6;
    static final int OBJ_REF_DELTA = 7;

    private final byte[] pack;
    private int pos;

    private PackParser(byte[] pack) {
        this.pack = pack;
    }

    /**
     * 解析不含尾部校验和的 pack，返回全部记录（保持 pack 中的顺序）。
     *
     * @throws CorruptPackException magic 或版本错误、记录截断或损坏、记录数与声明不符、声明的记录之后还有多余字节
     */
    public static List<PackEntry> parse(byte[] pack) throws CorruptPackException {
        return new PackParser(pack).parseAll();
    }

    private List<PackEntry> parseAll() throws CorruptPackException {
        if (pack.length < HEADER_LENGTH) {
            throw new CorruptPackException("pack too short for header: " + pack.length + " bytes");
        }
        for (int i = 0; i < MAGIC.length; i++) {
            if (pack[i] != MAGIC[i]) throw new CorruptPackException("bad pack signature");
        }
        long version = readUInt32(4);
        if (version != SUPPORTED_VERSION) {
            throw new CorruptPackException("unsupported pack version " + version);
        }
        long count = readUInt32(8);
        pos = HEADER_LENGTH;
        log.debug("pack version={} objects={}", version, count);

        List<PackEntry> entries = new ArrayList<>();
        Inflater inflater = new Inflater();
        try {
            for (long i = 0; i < count; i++) {
                if (pos >= pack.length) {
                    throw new CorruptPackException("pack truncated: parsed " + i + " of " + count + " objects");
                }
                entries.add(readEntry(inflater));
                inflater.reset();
            }
        } finally {
            inflater.end();
        }
        if (pos != pack.length) {
            throw new CorruptPackException("pack has " + (pack.length - pos) + " bytes after " + count + " objects");
        }
        return entries;
    }

    private PackEntry readEntry(Inflater inflater) throws CorruptPackException {
        int recordStart = pos;
        int c = pack[pos++] & 0xff;
        int typeCode = (c >> 4) & 0x07;
        long size = c & 0x0f;
        int shift = 4;
        while ((c & 0x80) != 0) {
            if (pos >= pack.length) {
                throw new CorruptPackException("truncated object header at offset " + recordStart);
            }
            if (shift > 56) {
                throw new CorruptPackException("object size overflow at offset " + recordStart);
            }
            c = pack[pos++] & 0xff;
            size |= (long) (c & 0x7f) << shift;
            shift += 7;
        }

        if (typeCode == OBJ_REF_DELTA) {
            if (pos + HexUtils.OID_LENGTH > pack.length) {
                throw new CorruptPackException("truncated delta base at offset " + recordStart);
            }
            String baseOid = HexUtils.bytesToHex(pack, pos, HexUtils.OID_LENGTH);
            pos += HexUtils.OID_LENGTH;
            byte[] delta = inflate(inflater, size, recordStart);
            log.debug("ref-delta at {} base={} size={}", recordStart, baseOid, size);
            return PackEntry.refDelta(baseOid, delta);
        }
        if (typeCode == OBJ_OFS_DELTA) {
            throw new CorruptPackException("ofs-delta at offset " + recordStart + " not supported");
        }
        ObjectType type = ObjectType.fromPackCode(typeCode);
        if (type == null) {
            throw new CorruptPackException("invalid object type " + typeCode + " at offset " + recordStart);
        }
        byte[] data = inflate(inflater, size, recordStart);
        log.debug("{} at {} size={}", type, recordStart, size);
        return PackEntry.literal(type, data);
    }

    /**
     * 从当前位置解压一个 zlib 流，并把 pos 前移实际消耗的输入字节数。
     */
    private byte[] inflate(Inflater inflater, long declaredSize, int recordStart) throws CorruptPackException {
        if (declaredSize > Integer.MAX_VALUE - 8) {
            throw new CorruptPackException("object at offset " + recordStart + " too large: " + declaredSize);
        }
        inflater.setInput(pack, pos, pack.length - pos);
        ByteArrayOutputStream out = new ByteArrayOutputStream((int) Math.min(declaredSize, 1 << 16));
        byte[] buf = new byte[8192];
        try {
            while (!inflater.finished()) {
                int n = inflater.inflate(buf);
                // 最后一条记录的流恰好结束在缓冲区末尾时，needsInput 与 finished 同时为真
                if (n == 0 && !inflater.finished() && (inflater.needsInput() || inflater.needsDictionary())) {
                    throw new CorruptPackException("truncated zlib stream at offset " + recordStart);
                }
                out.write(buf, 0, n);
                if (out.size() > declaredSize) {
                    break;
                }
            }
        } catch (DataFormatException e) {
            throw new CorruptPackException("corrupt zlib stream at offset " + recordStart, e);
        }
        if (out.size() != declaredSize) {
            throw new CorruptPackException("object at offset " + recordStart + " inflated to " + out.size()
                    + " bytes, header declares " + declaredSize);
        }
        pos += (int) inflater.getBytesRead();
        return out.toByteArray();
    }

    private long readUInt32(int offset) {
        return ((long) (pack[offset] & 0xff) << 24)
                | ((pack[offset + 1] & 0xff) << 16)
                | ((pack[offset + 2] & 0xff) << 8)
                | (pack[offset + 3] & 0xff);
    }
}
