package com.weixiao.mgit;

import com.weixiao.mgit.command.CatFileCommand;
import com.weixiao.mgit.command.CloneCommand;
import com.weixiao.mgit.command.CommitTreeCommand;
import com.weixiao.mgit.command.HashObjectCommand;
import com.weixiao.mgit.command.InitCommand;
import com.weixiao.mgit.command.LsTreeCommand;
import com.weixiao.mgit.command.WriteTreeCommand;
import picocli.CommandLine;
import picocli.CommandLine.*;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * mgit - 用 Java 实现的 Git 底层命令与 smart HTTP clone。
 * <p>
 * 所有 mgit 命令的执行都应通过此类作为唯一入口点。
 * 命令起始目录由本类的 -C 统一提供，子命令通过 {@link #getStartPath()} 获取。
 */
@Command(name = "mgit", mixinStandardHelpOptions = true, description = "mgit - Git 对象库与 clone")
public class MGit implements Runnable {

    @Option(names = {"-C", "--directory"}, paramLabel = "PATH",
            description = "以指定路径作为工作目录执行命令（默认为当前目录），子命令据此查找仓库根")
    private Path workingDirectory;

    /**
     * 未指定子命令时打印用法说明。
     */
    @Override
    public void run() {
        new CommandLine(this).usage(System.out);
    }

    /**
     * 返回命令的起始路径（工作目录）。
     *
     * @return 已规范化的绝对路径，不会为 null
     */
    public Path getStartPath() {
        Path base = workingDirectory != null ? workingDirectory : Paths.get("");
        return base.toAbsolutePath().normalize();
    }

    /**
     * 创建配置好的 CommandLine 实例，包含所有已注册的子命令。
     * 这是执行 mgit 命令的统一入口点，供 main() 和测试使用。
     */
    public static CommandLine createCommandLine() {
        return new CommandLine(new MGit())
                .addSubcommand("init", new InitCommand())
                .addSubcommand("hash-object", new HashObjectCommand())
                .addSubcommand("cat-file", new CatFileCommand())
                .addSubcommand("ls-tree", new LsTreeCommand())
                .addSubcommand("write-tree", new WriteTreeCommand())
                .addSubcommand("commit-tree", new CommitTreeCommand())
                .addSubcommand("clone", new CloneCommand());
    }

    /**
     * 主入口方法，执行 mgit 命令。
     * 若需调试日志：-Dmgit.debug=true 或环境变量 MGIT_DEBUG=true，或 -Dmgit.log.level=DEBUG。
     */
    public static void main(String[] args) {
        if ("true".equalsIgnoreCase(System.getProperty("mgit.debug"))
                || "true".equalsIgnoreCase(System.getenv("MGIT_DEBUG"))) {
            System.setProperty("mgit.log.level", "DEBUG");
        }
        CommandLine cli = createCommandLine();
        String[] runArgs = args != null && args.length > 0 ? args : new String[]{"--help"};
        int exitCode = cli.execute(runArgs);
        System.exit(exitCode);
    }
}
