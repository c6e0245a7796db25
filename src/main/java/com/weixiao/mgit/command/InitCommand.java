package com.weixiao.mgit.command;

import com.weixiao.mgit.repo.Repository;
import picocli.CommandLine.*;

import java.io.IOException;
import java.nio.file.Path;

/**
 * mgit init - 在当前目录或指定路径创建空的 .git 仓库结构。
 * 创建 .git、.git/objects、.git/refs/heads、.git/refs/tags，HEAD 指向 refs/heads/main。
 */
@Command(name = "init", mixinStandardHelpOptions = true, description = "创建空的 Git 仓库")
public class InitCommand extends AbstractCommand {

    @Parameters(index = "0", arity = "0..1", description = "仓库根路径，默认为当前目录")
    private Path path;

    @Override
    protected void execute() throws IOException {
        Path root = path != null ? startPath().resolve(path).normalize() : startPath();
        Repository repo = Repository.init(root);
        System.out.println("Initialized empty Git repository in " + repo.getGitDir() + "/");
    }
}
