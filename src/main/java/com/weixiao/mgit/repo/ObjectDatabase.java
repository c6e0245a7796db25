package com.weixiao.mgit.repo;

import com.weixiao.mgit.errors.CorruptObjectException;
import com.weixiao.mgit.obj.GitObject;
import com.weixiao.mgit.obj.ObjectType;
import com.weixiao.mgit.utils.HexUtils;
import com.weixiao.mgit.utils.ObjectIds;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.EOFException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.zip.ZipException;

/**
 * .git/objects 存储：按 oid 写入/读取对象，格式与 Git 一致（type size\0body，zlib 压缩）。
 * 对象只写一次、从不修改或删除；同一内容重复写入在第一次之后为空操作。
 */
public final class ObjectDatabase {

    private static final Logger log = LoggerFactory.getLogger(ObjectDatabase.class);

    private static final String OBJECTS_DIR = "objects";
    private final Path objectsDir;

    /**
     * 以 .git 目录为基准，对象存储路径为 .git/objects。
     */
    public ObjectDatabase(Path gitDir) {
        this.objectsDir = gitDir.resolve(OBJECTS_DIR);
    }

    /**
     * 存储对象，返回 40 字符 hex oid。
     */
    public String store(GitObject object) throws IOException {
        return put(object.getType(), object.toBytes());
    }

    /**
     * 按类型存储原始对象体，返回 40 字符 hex oid。
     * 格式：content = "type size\0body"，oid = SHA1(content)，写入 .git/objects/xx/yyyy...；
     * 压缩结果先完整生成在内存中，再写临时文件并移动到目标位置。
     */
    public String put(ObjectType type, byte[] body) throws IOException {
        byte[] content = ObjectIds.frame(type, body);
        String oid = HexUtils.bytesToHex(ObjectIds.sha1(content));
        Path objectPath = objectPath(oid);
        if (Files.exists(objectPath)) {
            log.debug("object {} already stored", oid);
            return oid;
        }
        Path dir = objectPath.getParent();
        if (!Files.exists(dir)) {
            Files.createDirectories(dir);
        }
        byte[] compressed = ObjectIds.deflate(content);
        Path temp = dir.resolve("tmp_obj_" + System.nanoTime());
        try {
            Files.write(temp, compressed);
            Files.move(temp, objectPath, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(temp);
        }
        log.debug("stored {} {} size={}", type, oid, body.length);
        return oid;
    }

    /**
     * 只计算 oid，不写入（hash-object 不带 -w）。
     */
    public String hash(ObjectType type, byte[] body) {
        return ObjectIds.hash(type, body);
    }

    /**
     * 读取对象，返回 (type, body)。
     *
     * @throws CorruptObjectException 对象不存在、头部非法、类型未知，或 body 长度与头部声明不符
     */
    public RawObject load(String oid) throws IOException {
        Path p = objectPath(oid);
        if (!Files.exists(p)) {
            throw new CorruptObjectException("object not found: " + oid);
        }
        byte[] content;
        try {
            content = ObjectIds.inflate(Files.readAllBytes(p));
        } catch (ZipException | EOFException e) {
            throw new CorruptObjectException("object " + oid + " is not a valid zlib stream", e);
        }
        int nul = indexOf(content, (byte) 0);
        if (nul < 0) throw new CorruptObjectException("invalid object: " + oid);
        String typeSize = new String(content, 0, nul, StandardCharsets.US_ASCII);
        int space = typeSize.indexOf(' ');
        if (space < 0) throw new CorruptObjectException("invalid object header: " + oid);
        ObjectType type = ObjectType.fromName(typeSize.substring(0, space));
        int declared;
        try {
            declared = Integer.parseInt(typeSize.substring(space + 1));
        } catch (NumberFormatException e) {
            throw new CorruptObjectException("invalid object size in header: " + oid, e);
        }
        int actual = content.length - nul - 1;
        if (declared != actual) {
            throw new CorruptObjectException("object " + oid + " declares " + declared + " bytes but has " + actual);
        }
        byte[] body = new byte[actual];
        System.arraycopy(content, nul + 1, body, 0, actual);
        return new RawObject(type, body);
    }

    /**
     * 判断给定 40 字符 hex oid 的对象文件是否存在于 .git/objects 中。
     */
    public boolean exists(String oid) {
        return Files.exists(objectPath(oid));
    }

    /**
     * 根据 40 字符 hex oid 得到 .git/objects/xx/yyyy... 路径（前 2 字符为子目录）。
     */
    Path objectPath(String oid) {
        if (!HexUtils.isOid(oid)) throw new IllegalArgumentException("invalid oid: " + oid);
        String lower = oid.toLowerCase();
        return objectsDir.resolve(lower.substring(0, 2)).resolve(lower.substring(2));
    }

    private static int indexOf(byte[] a, byte b) {
        for (int i = 0; i < a.length; i++) if (a[i] == b) return i;
        return -1;
    }

    /**
     * 从对象库 load 得到的原始对象：类型与解压后的 body 字节。
     */
    @Value
    public static class RawObject {
        ObjectType type;
        byte[] body;
    }
}
