package com.weixiao.mgit.transport;

import com.weixiao.mgit.errors.PackProtocolException;
import lombok.experimental.UtilityClass;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * pkt-line 编解码：4 个十六进制字符给出整行长度（含这 4 个字符），随后是负载；"0000" 为 flush。
 */
@UtilityClass
public class PktLine {

    public static final byte[] FLUSH = "0000".getBytes(StandardCharsets.US_ASCII);

    private static final int HEADER_LENGTH = 4;
    private static final int MAX_LENGTH = 65520;

    /** 将文本负载编码为一条 pkt-line。 */
    public static byte[] encode(String payload) {
        byte[] data = payload.getBytes(StandardCharsets.UTF_8);
        if (data.length + HEADER_LENGTH > MAX_LENGTH) {
            throw new IllegalArgumentException("pkt-line payload too long: " + data.length);
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream(data.length + HEADER_LENGTH);
        byte[] header = String.format("%04x", data.length + HEADER_LENGTH).getBytes(StandardCharsets.US_ASCII);
        out.write(header, 0, header.length);
        out.write(data, 0, data.length);
        return out.toByteArray();
    }

    /**
     * 顺序读取字节数组中的 pkt-line。
     * {@link #next()} 返回负载字节，flush 行返回 null；{@link #position()} 为下一条的起始偏移，
     * 读完 NAK 后 pack 数据就从这里开始。
     */
    public static final class Reader {

        private final byte[] buf;
        private int pos;

        public Reader(byte[] buf) {
            this.buf = buf;
        }

        /** 还有未读字节时返回 true。 */
        public boolean hasMore() {
            return pos < buf.length;
        }

        public int position() {
            return pos;
        }

        /**
         * 读取下一条 pkt-line 的负载；flush（0000）返回 null。
         *
         * @throws PackProtocolException 长度前缀不是 4 位十六进制、取值为 1-3，或超出剩余字节
         */
        public byte[] next() throws PackProtocolException {
            if (pos + HEADER_LENGTH > buf.length) {
                throw new PackProtocolException("truncated pkt-line header at offset " + pos);
            }
            int len = 0;
            for (int i = 0; i < HEADER_LENGTH; i++) {
                int d = Character.digit(buf[pos + i], 16);
                if (d < 0) {
                    throw new PackProtocolException("invalid pkt-line length "
                            + new String(buf, pos, HEADER_LENGTH, StandardCharsets.US_ASCII) + " at offset " + pos);
                }
                len = (len << 4) | d;
            }
            if (len == 0) {
                pos += HEADER_LENGTH;
                return null;
            }
            if (len < HEADER_LENGTH || pos + len > buf.length) {
                throw new PackProtocolException("invalid pkt-line length " + len + " at offset " + pos);
            }
            byte[] payload = Arrays.copyOfRange(buf, pos + HEADER_LENGTH, pos + len);
            pos += len;
            return payload;
        }

        /** 读取下一条并按 UTF-8 解码、去掉行尾换行；flush 返回 null。 */
        public String nextString() throws PackProtocolException {
            byte[] payload = next();
            if (payload == null) return null;
            String s = new String(payload, StandardCharsets.UTF_8);
            return s.endsWith("\n") ? s.substring(0, s.length() - 1) : s;
        }
    }
}
