package com.weixiao.mgit.utils;

import com.weixiao.mgit.obj.ObjectType;
import lombok.experimental.UtilityClass;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.zip.DeflaterOutputStream;
import java.util.zip.InflaterInputStream;

/**
 * 对象编码的叶子工具：SHA-1、"type size\0body" 组帧、zlib 压缩与解压。
 * ObjectDatabase、pack 校验和与 hash-object 共用这些方法。
 */
@UtilityClass
public class ObjectIds {

    /**
     * 计算输入字节的 SHA-1 摘要（20 字节）。
     */
    public static byte[] sha1(byte[] input) {
        return sha1(input, 0, input.length);
    }

    /** 计算 input[offset, offset+length) 的 SHA-1，用于校验 pack 尾部 20 字节。 */
    public static byte[] sha1(byte[] input, int offset, int length) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-1");
            md.update(input, offset, length);
            return md.digest();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }

    /**
     * 组帧：content = "type size\0body"，oid 与落盘字节都基于此。
     */
    public static byte[] frame(ObjectType type, byte[] body) {
        byte[] headerBytes = (type.getName() + " " + body.length + "\0").getBytes(StandardCharsets.US_ASCII);
        byte[] content = new byte[headerBytes.length + body.length];
        System.arraycopy(headerBytes, 0, content, 0, headerBytes.length);
        System.arraycopy(body, 0, content, headerBytes.length, body.length);
        return content;
    }

    /** 计算对象的 40 字符 hex oid：SHA1(type size\0body)。 */
    public static String hash(ObjectType type, byte[] body) {
        return HexUtils.bytesToHex(sha1(frame(type, body)));
    }

    /**
     * 使用 zlib deflate 压缩输入字节。
     */
    public static byte[] deflate(byte[] input) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (DeflaterOutputStream def = new DeflaterOutputStream(out)) {
            def.write(input);
        }
        return out.toByteArray();
    }

    /**
     * 使用 zlib inflate 解压输入字节。
     */
    public static byte[] inflate(byte[] input) throws IOException {
        try (InflaterInputStream inf = new InflaterInputStream(new ByteArrayInputStream(input));
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            byte[] buf = new byte[8192];
            int n;
            while ((n = inf.read(buf)) != -1) out.write(buf, 0, n);
            return out.toByteArray();
        }
    }
}
