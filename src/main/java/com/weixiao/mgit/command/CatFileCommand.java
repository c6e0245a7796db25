package com.weixiao.mgit.command;

import com.weixiao.mgit.obj.ObjectType;
import com.weixiao.mgit.obj.Tree;
import com.weixiao.mgit.obj.TreeEntry;
import com.weixiao.mgit.repo.ObjectDatabase;
import picocli.CommandLine.*;

import java.io.IOException;

/**
 * mgit cat-file - 输出对象内容（-p）、类型（-t）或大小（-s）。
 * blob 原样输出，不追加换行；tree 按 ls-tree 格式逐行输出。
 */
@Command(name = "cat-file", mixinStandardHelpOptions = true, description = "输出对象内容、类型或大小")
public class CatFileCommand extends AbstractCommand {

    @ArgGroup(exclusive = true, multiplicity = "1")
    private Mode mode;

    @Parameters(index = "0", paramLabel = "OBJECT", description = "对象 oid（40 字符 hex）")
    private String oid;

    static class Mode {
        @Option(names = "-p", description = "按类型美化输出对象内容")
        boolean pretty;

        @Option(names = "-t", description = "输出对象类型")
        boolean type;

        @Option(names = "-s", description = "输出对象大小")
        boolean size;
    }

    @Override
    protected void execute() throws IOException {
        ObjectDatabase.RawObject raw = requireRepository().getDatabase().load(oid);
        if (mode.type) {
            System.out.println(raw.getType());
        } else if (mode.size) {
            System.out.println(raw.getBody().length);
        } else if (raw.getType() == ObjectType.TREE) {
            for (TreeEntry entry : Tree.parse(raw.getBody()).getEntries()) {
                System.out.println(LsTreeCommand.format(entry));
            }
        } else {
            System.out.write(raw.getBody(), 0, raw.getBody().length);
        }
    }
}
