package com.weixiao.mgit.pack;

import com.weixiao.mgit.errors.DeltaRangeException;
import com.weixiao.mgit.errors.DeltaSizeMismatchException;
import com.weixiao.mgit.errors.MissingBaseException;
import com.weixiao.mgit.repo.ObjectDatabase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * ref-delta 解析：把 copy/insert 指令流重放到 base 对象内容上，得到目标对象并以 base 的类型写回对象库。
 * <p>
 * 队列按多轮处理：每轮按顺序解析 base 已在对象库中的 delta，base 尚不存在的留到下一轮；
 * 某一轮没有任何进展时抛出 {@link MissingBaseException}。delta 链（base 本身也是 delta）与乱序 base 因此都能解析。
 */
public final class DeltaResolver {

    private static final Logger log = LoggerFactory.getLogger(DeltaResolver.class);

    /** copy 指令 size 字段为 0 时的长度。 */
    static final int DEFAULT_COPY_SIZE = 0x10000;

    private final ObjectDatabase database;

    public DeltaResolver(ObjectDatabase database) {
        this.database = database;
    }

    /**
     * 解析全部 ref-delta，返回解析结果的 oid（按解析完成顺序）。
     *
     * @throws MissingBaseException 存在无法在对象库中找到 base 的 delta
     */
    public List<String> resolveAll(List<PackEntry> deltas) throws IOException {
        List<PackEntry> pending = new ArrayList<>(deltas);
        List<String> resolved = new ArrayList<>();
        int pass = 0;
        while (!pending.isEmpty()) {
            pass++;
            List<PackEntry> deferred = new ArrayList<>();
            for (PackEntry delta : pending) {
                if (!database.exists(delta.getBaseOid())) {
                    deferred.add(delta);
                    continue;
                }
                resolved.add(resolve(delta));
            }
            if (deferred.size() == pending.size()) {
                throw new MissingBaseException(deferred.get(0).getBaseOid(), deferred.size());
            }
            log.debug("delta pass {} resolved {}, deferred {}", pass, pending.size() - deferred.size(), deferred.size());
            pending = deferred;
        }
        return resolved;
    }

    /**
     * 解析单个 ref-delta：读取 base，重放指令，以 base 的类型存储结果并返回新 oid。
     */
    public String resolve(PackEntry delta) throws IOException {
        ObjectDatabase.RawObject base = database.load(delta.getBaseOid());
        byte[] target = apply(base.getBody(), delta.getData());
        String oid = database.put(base.getType(), target);
        log.debug("resolved delta base={} -> {} {} ({} bytes)", delta.getBaseOid(), base.getType(), oid, target.length);
        return oid;
    }

    /**
     * 将 delta 指令流应用到 base 上。
     * <p>
     * 指令流以两个变长整数（每字节低 7 位、高位为续位、小端序）开头：source size 与 target size。
     * 之后每条指令：高位为 1 是 copy，位 0-3 选择最多 4 个 offset 字节、位 4-6 选择最多 3 个 size 字节（小端，缺省字节为 0），
     * size 为 0 表示 0x10000；高位为 0 是 insert，低 7 位为随后原样拷贝的字节数。
     *
     * @throws DeltaSizeMismatchException source size 与 base 长度不符，或结果长度与 target size 不符
     * @throws DeltaRangeException        copy 区间超出 base、insert 或指令参数超出指令流、遇到保留指令 0
     */
    public static byte[] apply(byte[] base, byte[] delta) throws DeltaSizeMismatchException, DeltaRangeException {
        int[] pos = {0};
        long sourceSize = readVarint(delta, pos);
        long targetSize = readVarint(delta, pos);
        if (sourceSize != base.length) {
            throw new DeltaSizeMismatchException("delta source size " + sourceSize + " != base size " + base.length);
        }
        if (targetSize > Integer.MAX_VALUE - 8) {
            throw new DeltaSizeMismatchException("delta target size " + targetSize + " too large");
        }
        // 按实际产出增长，不信任 delta 自报的 target size
        ByteArrayOutputStream out = new ByteArrayOutputStream((int) Math.min(targetSize, 1 << 16));
        int p = pos[0];
        while (p < delta.length) {
            int cmd = delta[p++] & 0xff;
            if ((cmd & 0x80) != 0) {
                long offset = 0;
                int size = 0;
                for (int i = 0; i < 4; i++) {
                    if ((cmd & (1 << i)) != 0) {
                        if (p >= delta.length) throw new DeltaRangeException("truncated copy offset");
                        offset |= (long) (delta[p++] & 0xff) << (8 * i);
                    }
                }
                for (int i = 0; i < 3; i++) {
                    if ((cmd & (0x10 << i)) != 0) {
                        if (p >= delta.length) throw new DeltaRangeException("truncated copy size");
                        size |= (delta[p++] & 0xff) << (8 * i);
                    }
                }
                if (size == 0) size = DEFAULT_COPY_SIZE;
                if (offset + size > sourceSize) {
                    throw new DeltaRangeException("copy [" + offset + ", " + (offset + size)
                            + ") outside base of " + sourceSize + " bytes");
                }
                if (out.size() + (long) size > targetSize) {
                    throw new DeltaSizeMismatchException("delta output exceeds target size " + targetSize);
                }
                out.write(base, (int) offset, size);
            } else if (cmd != 0) {
                if (p + cmd > delta.length) {
                    throw new DeltaRangeException("insert of " + cmd + " bytes runs past end of delta");
                }
                if (out.size() + (long) cmd > targetSize) {
                    throw new DeltaSizeMismatchException("delta output exceeds target size " + targetSize);
                }
                out.write(delta, p, cmd);
                p += cmd;
            } else {
                throw new DeltaRangeException("reserved delta opcode 0 at offset " + (p - 1));
            }
        }
        if (out.size() != targetSize) {
            throw new DeltaSizeMismatchException("delta produced " + out.size() + " bytes, target size is " + targetSize);
        }
        return out.toByteArray();
    }

    private static long readVarint(byte[] delta, int[] pos) throws DeltaRangeException {
        long value = 0;
        int shift = 0;
        int c;
        do {
            if (pos[0] >= delta.length) throw new DeltaRangeException("truncated delta header");
            if (shift > 56) throw new DeltaRangeException("delta header size overflow");
            c = delta[pos[0]++] & 0xff;
            value |= (long) (c & 0x7f) << shift;
            shift += 7;
        } while ((c & 0x80) != 0);
        return value;
    }
}
