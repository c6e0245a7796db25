package com.weixiao.mgit.repo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * 仓库：定位 .git 目录，提供 ObjectDatabase、Refs、Workspace。
 * 代表整个git仓库的一个抽象，所有组件都以显式的仓库根为基准，不依赖进程当前目录。
 */
public final class Repository {

    private static final Logger log = LoggerFactory.getLogger(Repository.class);

    public static final String GIT_DIR = ".git";
    public static final String DEFAULT_BRANCH = "main";

    private static final List<String> LAYOUT = List.of("objects", "refs/heads", "refs/tags");

    private final Path root;   // 工作区根
    private final Path gitDir; // .git 目录
    private final ObjectDatabase database;
    private final Refs refs;
    private final Workspace workspace;

    /**
     * 以给定路径为仓库根（工作区根），.git 为 root/.git，并创建 ObjectDatabase、Refs、Workspace。
     */
    public Repository(Path root) {
        this.root = root.toAbsolutePath().normalize();
        this.gitDir = this.root.resolve(GIT_DIR);
        this.database = new ObjectDatabase(gitDir);
        this.refs = new Refs(gitDir);
        this.workspace = new Workspace(this.root, database);
    }

    /**
     * 在 root 下创建 .git、.git/objects、.git/refs/heads、.git/refs/tags；HEAD 不存在时写入 "ref: refs/heads/main"。
     * 重复执行不会报错，也不会覆盖已有 HEAD。
     */
    public static Repository init(Path root) throws IOException {
        Repository repo = new Repository(root);
        Files.createDirectories(repo.gitDir);
        for (String dir : LAYOUT) {
            Path sub = repo.gitDir.resolve(dir);
            Files.createDirectories(sub);
            log.debug("created dir {}", sub);
        }
        if (!Files.exists(repo.gitDir.resolve(Refs.HEAD))) {
            repo.refs.setHead("refs/heads/" + DEFAULT_BRANCH);
        }
        log.info("repository initialized at {}", repo.gitDir);
        return repo;
    }

    /**
     * 从 start 向上查找包含 .git 的目录作为仓库根；未找到返回 null。
     */
    public static Repository find(Path start) {
        Path current = start.toAbsolutePath().normalize();
        log.debug("find repo start={}", current);
        while (current != null) {
            if (Files.isDirectory(current.resolve(GIT_DIR))) {
                log.debug("found repo at {}", current);
                return new Repository(current);
            }
            current = current.getParent();
        }
        log.debug("no repo found");
        return null;
    }

    /**
     * 工作区根目录（即仓库根）。
     */
    public Path getRoot() {
        return root;
    }

    /**
     * .git 目录路径。
     */
    public Path getGitDir() {
        return gitDir;
    }

    /**
     * 对象库，用于 store/load blob、tree、commit。
     */
    public ObjectDatabase getDatabase() {
        return database;
    }

    public Refs getRefs() {
        return refs;
    }

    /**
     * 工作区，用于 write-tree 与 checkout。
     */
    public Workspace getWorkspace() {
        return workspace;
    }
}
