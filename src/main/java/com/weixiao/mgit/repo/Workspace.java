package com.weixiao.mgit.repo;

import com.weixiao.mgit.errors.CorruptObjectException;
import com.weixiao.mgit.obj.Blob;
import com.weixiao.mgit.obj.ObjectType;
import com.weixiao.mgit.obj.Tree;
import com.weixiao.mgit.obj.TreeEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * 工作区：把工作目录写成 tree 对象（write-tree），以及把 tree 对象检出为文件与目录（checkout）。
 * 两个方向都以显式路径递归，.git 目录始终跳过。
 */
public final class Workspace {

    private static final Logger log = LoggerFactory.getLogger(Workspace.class);

    private static final String GIT_DIR = ".git";

    private static final PosixFilePermission[] PERMISSION_BITS = {
            PosixFilePermission.OTHERS_EXECUTE, PosixFilePermission.OTHERS_WRITE, PosixFilePermission.OTHERS_READ,
            PosixFilePermission.GROUP_EXECUTE, PosixFilePermission.GROUP_WRITE, PosixFilePermission.GROUP_READ,
            PosixFilePermission.OWNER_EXECUTE, PosixFilePermission.OWNER_WRITE, PosixFilePermission.OWNER_READ,
    };

    private final Path root;
    private final ObjectDatabase database;

    /**
     * 以给定路径为工作区根目录，对象读写走 database。
     */
    public Workspace(Path root, ObjectDatabase database) {
        this.root = root.toAbsolutePath().normalize();
        this.database = database;
    }

    /**
     * 将整个工作区写入对象库，返回根 tree 的 oid。
     */
    public String writeTree() throws IOException {
        return writeTree(root);
    }

    /**
     * 递归写入 dir：文件存为 blob，子目录存为 tree；空目录不产生条目（与 Git 一致）。
     * 返回 dir 对应 tree 的 oid。
     */
    String writeTree(Path dir) throws IOException {
        List<TreeEntry> entries = new ArrayList<>();
        for (Path p : listEntries(dir)) {
            String name = p.getFileName().toString();
            if (Files.isSymbolicLink(p)) {
                byte[] target = Files.readSymbolicLink(p).toString().getBytes(StandardCharsets.UTF_8);
                entries.add(new TreeEntry(TreeEntry.MODE_SYMLINK, name, database.store(new Blob(target))));
            } else if (Files.isDirectory(p, LinkOption.NOFOLLOW_LINKS)) {
                if (isEmptyTree(p)) {
                    log.debug("skip empty directory {}", p);
                    continue;
                }
                entries.add(TreeEntry.directory(name, writeTree(p)));
            } else if (Files.isRegularFile(p, LinkOption.NOFOLLOW_LINKS)) {
                String oid = database.store(new Blob(Files.readAllBytes(p)));
                entries.add(new TreeEntry(getFileMode(p), name, oid));
            }
        }
        String treeOid = database.store(new Tree(entries));
        log.debug("stored tree {} oid={} entries={}", dir, treeOid, entries.size());
        return treeOid;
    }

    /**
     * 将 treeOid 检出到工作区根目录。
     */
    public void checkout(String treeOid) throws IOException {
        checkout(treeOid, root);
    }

    /**
     * 将 treeOid 检出到 target：目录条目创建目录并递归，文件条目写入 blob 内容并按 mode 低 9 位设置权限。
     * 对象缺失或损坏时抛出 CorruptObjectException，已写出的文件不回滚。
     */
    public void checkout(String treeOid, Path target) throws IOException {
        Files.createDirectories(target);
        Tree tree = Tree.parse(loadExpecting(treeOid, ObjectType.TREE));
        for (TreeEntry entry : tree.getEntries()) {
            Path path = target.resolve(checkedName(entry.getName()));
            if (entry.isDirectory()) {
                checkout(entry.getOid(), path);
            } else if (entry.isGitlink()) {
                log.warn("submodule {} not checked out", path);
                Files.createDirectories(path);
            } else if (entry.isSymlink()) {
                byte[] linkTarget = loadExpecting(entry.getOid(), ObjectType.BLOB);
                Files.deleteIfExists(path);
                Files.createSymbolicLink(path, Path.of(new String(linkTarget, StandardCharsets.UTF_8)));
            } else {
                Files.write(path, loadExpecting(entry.getOid(), ObjectType.BLOB));
                setPermissions(path, entry.permissionBits());
            }
            log.debug("checked out {} {} {}", entry.getMode(), entry.getOid(), path);
        }
    }

    /**
     * 列出指定目录下的所有条目（文件和子目录），排除 .git。
     */
    public List<Path> listEntries(Path basePath) throws IOException {
        List<Path> entries = new ArrayList<>();
        if (!Files.isDirectory(basePath)) {
            return entries;
        }
        try (Stream<Path> stream = Files.list(basePath)) {
            for (Path p : (Iterable<Path>) stream::iterator) {
                if (GIT_DIR.equals(p.getFileName().toString())) continue;
                entries.add(p);
            }
        }
        return entries;
    }

    /**
     * 获取文件的 Git mode 字符串：可执行为 "100755"，否则 "100644"。
     */
    public String getFileMode(Path filePath) {
        return Files.isExecutable(filePath) ? TreeEntry.MODE_EXECUTABLE : TreeEntry.MODE_REGULAR;
    }

    /**
     * 工作区根目录路径。
     */
    public Path getRoot() {
        return root;
    }

    private boolean isEmptyTree(Path dir) throws IOException {
        for (Path p : listEntries(dir)) {
            if (!Files.isDirectory(p, LinkOption.NOFOLLOW_LINKS) || !isEmptyTree(p)) return false;
        }
        return true;
    }

    private byte[] loadExpecting(String oid, ObjectType expected) throws IOException {
        ObjectDatabase.RawObject raw = database.load(oid);
        if (raw.getType() != expected) {
            throw new CorruptObjectException("object " + oid + " is a " + raw.getType() + ", expected " + expected);
        }
        return raw.getBody();
    }

    private static String checkedName(String name) throws CorruptObjectException {
        if (name.isEmpty() || name.equals(".") || name.equals("..") || name.equals(GIT_DIR)
                || name.indexOf('/') >= 0 || name.indexOf('\\') >= 0) {
            throw new CorruptObjectException("unsafe tree entry name: " + name);
        }
        return name;
    }

    /**
     * 将 0777 形式的权限位设置到文件上；文件系统不支持 POSIX 权限时只设置可执行位。
     */
    private static void setPermissions(Path path, int bits) throws IOException {
        Set<PosixFilePermission> perms = EnumSet.noneOf(PosixFilePermission.class);
        for (int i = 0; i < PERMISSION_BITS.length; i++) {
            if ((bits & (1 << i)) != 0) perms.add(PERMISSION_BITS[i]);
        }
        try {
            Files.setPosixFilePermissions(path, perms);
        } catch (UnsupportedOperationException e) {
            // Windows 或其他不支持 POSIX 权限的系统
            boolean executable = (bits & 0100) != 0;
            log.debug("posix permissions unsupported for {}, executable={}", path, executable);
            if (!path.toFile().setExecutable(executable)) {
                log.warn("could not set executable={} on {}", executable, path);
            }
        }
    }
}
