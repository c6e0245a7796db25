package com.weixiao.mgit.command;

import picocli.CommandLine.*;

import java.io.IOException;

/**
 * mgit write-tree - 把工作区（跳过 .git）递归写成 tree 对象并输出根 tree oid。
 */
@Command(name = "write-tree", mixinStandardHelpOptions = true, description = "把工作区写成 tree 对象")
public class WriteTreeCommand extends AbstractCommand {

    @Override
    protected void execute() throws IOException {
        System.out.println(requireRepository().getWorkspace().writeTree());
    }
}
