package com.weixiao.mgit.utils;

import lombok.experimental.UtilityClass;

/**
 * 十六进制与字节互转工具，用于 oid（40 字符 hex）与 20 字节二进制、SHA-1 输出等。
 */
@UtilityClass
public class HexUtils {

    /** oid 的二进制长度（SHA-1）。 */
    public static final int OID_LENGTH = 20;

    /** oid 的十六进制长度。 */
    public static final int OID_HEX_LENGTH = 40;

    /**
     * 将 40 字符十六进制字符串转为 20 字节（如 Git oid）。
     * 例："0b" + 38 个 hex → 20 字节。
     *
     * @param hex 40 字符 0-9a-f 字符串
     * @return 20 字节
     */
    public static byte[] hexToBytes(String hex) {
        if (!isOid(hex)) {
            throw new IllegalArgumentException("oid must be 40 hex chars, got: " + hex);
        }
        byte[] b = new byte[OID_LENGTH];
        for (int i = 0; i < OID_LENGTH; i++) {
            b[i] = (byte) ((Character.digit(hex.charAt(i * 2), 16) << 4) | Character.digit(hex.charAt(i * 2 + 1), 16));
        }
        return b;
    }

    /**
     * 将字节数组转为小写十六进制字符串（如 SHA-1 的 40 字符 oid）。
     *
     * @param bytes 任意长度
     * @return 小写 hex 字符串
     */
    public static String bytesToHex(byte[] bytes) {
        if (bytes == null) return "";
        return bytesToHex(bytes, 0, bytes.length);
    }

    /**
     * 将 bytes[offset, offset+length) 转为小写十六进制字符串，pack 与 tree 中内嵌的 20 字节 oid 用它直接转换。
     */
    public static String bytesToHex(byte[] bytes, int offset, int length) {
        StringBuilder sb = new StringBuilder(length * 2);
        for (int i = offset; i < offset + length; i++) {
            sb.append(Character.forDigit((bytes[i] >> 4) & 0xf, 16));
            sb.append(Character.forDigit(bytes[i] & 0xf, 16));
        }
        return sb.toString();
    }

    /** 判断字符串是否为 40 字符小写/大写十六进制 oid。 */
    public static boolean isOid(String s) {
        if (s == null || s.length() != OID_HEX_LENGTH) return false;
        for (int i = 0; i < s.length(); i++) {
            if (Character.digit(s.charAt(i), 16) < 0) return false;
        }
        return true;
    }
}
