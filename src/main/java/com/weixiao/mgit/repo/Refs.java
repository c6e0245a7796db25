package com.weixiao.mgit.repo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 引用：读写 HEAD 与 .git/refs 下的引用文件。
 * 引用名（如 refs/heads/main）直接相对 .git 目录解析。
 */
public final class Refs {

    private static final Logger log = LoggerFactory.getLogger(Refs.class);

    public static final String HEAD = "HEAD";
    private static final Pattern HEAD_REF = Pattern.compile("ref:\\s*(.+)");

    private final Path gitDir;

    /**
     * 以 .git 目录为基准，HEAD 与 refs 路径均相对于 gitDir。
     */
    public Refs(Path gitDir) {
        this.gitDir = gitDir;
    }

    /**
     * 解析 HEAD，返回当前分支上的 commit oid；若未设置或分支尚无提交则返回 null。
     */
    public String readHead() throws IOException {
        Path headFile = gitDir.resolve(HEAD);
        if (!Files.exists(headFile)) {
            log.debug("readHead: no HEAD file");
            return null;
        }
        String content = Files.readString(headFile, StandardCharsets.UTF_8).trim();
        Matcher m = HEAD_REF.matcher(content);
        if (!m.matches()) return content.isEmpty() ? null : content;
        String oid = readRef(m.group(1).trim());
        log.debug("readHead ref={} oid={}", m.group(1), oid);
        return oid;
    }

    /**
     * HEAD 指向的引用名（如 refs/heads/main）；HEAD 为游离 oid 或不存在时返回 null。
     */
    public String headTarget() throws IOException {
        Path headFile = gitDir.resolve(HEAD);
        if (!Files.exists(headFile)) return null;
        Matcher m = HEAD_REF.matcher(Files.readString(headFile, StandardCharsets.UTF_8).trim());
        return m.matches() ? m.group(1).trim() : null;
    }

    /**
     * 读取引用文件中的 oid；不存在返回 null。
     */
    public String readRef(String refName) throws IOException {
        Path refPath = refPath(refName);
        if (!Files.exists(refPath)) return null;
        return Files.readString(refPath, StandardCharsets.UTF_8).trim();
    }

    /**
     * 将 HEAD 设为符号引用："ref: &lt;refName&gt;\n"。
     */
    public void setHead(String refName) throws IOException {
        Files.createDirectories(gitDir);
        Files.writeString(gitDir.resolve(HEAD), "ref: " + refName + "\n", StandardCharsets.UTF_8);
        log.debug("HEAD -> {}", refName);
    }

    /**
     * 将引用 refName（如 refs/heads/main）更新为给定 oid，必要时创建父目录。
     */
    public void updateRef(String refName, String oid) throws IOException {
        Path refPath = refPath(refName);
        Path dir = refPath.getParent();
        if (dir != null && !Files.exists(dir)) {
            Files.createDirectories(dir);
        }
        Files.writeString(refPath, oid + "\n", StandardCharsets.UTF_8);
        log.debug("updateRef {} oid={}", refName, oid);
    }

    private Path refPath(String refName) {
        Path p = gitDir.resolve(refName).normalize();
        if (!p.startsWith(gitDir.normalize()) || HEAD.equals(refName)) {
            throw new IllegalArgumentException("invalid ref name: " + refName);
        }
        return p;
    }
}
