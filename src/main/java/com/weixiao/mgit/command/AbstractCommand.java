package com.weixiao.mgit.command;

import com.weixiao.mgit.MGit;
import com.weixiao.mgit.repo.Repository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.IExitCodeGenerator;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 子命令公共部分：取得起始路径、查找仓库、把 IOException 转换为 "fatal: ..." 与退出码 1。
 */
abstract class AbstractCommand implements Runnable, IExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(AbstractCommand.class);

    @ParentCommand
    private MGit parent;

    private int exitCode = 0;

    /** 命令主体；抛出的 IOException 作为致命错误报告。 */
    protected abstract void execute() throws IOException;

    @Override
    public void run() {
        exitCode = 0;
        try {
            execute();
        } catch (IOException e) {
            log.debug("{} failed", getClass().getSimpleName(), e);
            fail(e.getMessage());
        } catch (IllegalArgumentException e) {
            log.debug("{} rejected arguments", getClass().getSimpleName(), e);
            fail(e.getMessage());
        } finally {
            System.out.flush();
        }
    }

    /** 向 stderr 输出 "fatal: message" 并把退出码置为 1。 */
    protected void fail(String message) {
        System.err.println("fatal: " + message);
        exitCode = 1;
    }

    /**
     * 命令起始目录：mgit -C 指定的路径，默认当前目录。
     */
    protected Path startPath() {
        return parent != null ? parent.getStartPath() : Path.of("").toAbsolutePath().normalize();
    }

    /**
     * 从起始目录向上查找仓库；找不到时抛出 IOException。
     */
    protected Repository requireRepository() throws IOException {
        Repository repo = Repository.find(startPath());
        if (repo == null) {
            throw new IOException("not a git repository (or any of the parent directories): .git");
        }
        log.debug("repo root={}", repo.getRoot());
        return repo;
    }

    /** 返回本命令的退出码（0 成功，1 失败）。 */
    @Override
    public int getExitCode() {
        return exitCode;
    }
}
