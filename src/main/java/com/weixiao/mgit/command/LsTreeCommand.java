package com.weixiao.mgit.command;

import com.weixiao.mgit.errors.CorruptObjectException;
import com.weixiao.mgit.obj.Commit;
import com.weixiao.mgit.obj.ObjectType;
import com.weixiao.mgit.obj.Tree;
import com.weixiao.mgit.obj.TreeEntry;
import com.weixiao.mgit.repo.ObjectDatabase;
import picocli.CommandLine.*;

import java.io.IOException;

/**
 * mgit ls-tree - 列出 tree 的条目；给出 commit 时列出其根 tree。
 * 每行格式："&lt;6 位 mode&gt; &lt;type&gt; &lt;oid&gt;\t&lt;name&gt;"，--name-only 时只输出 name。
 */
@Command(name = "ls-tree", mixinStandardHelpOptions = true, description = "列出 tree 对象的条目")
public class LsTreeCommand extends AbstractCommand {

    @Option(names = "--name-only", description = "只输出条目名")
    private boolean nameOnly;

    @Parameters(index = "0", paramLabel = "TREE", description = "tree 或 commit 的 oid")
    private String oid;

    @Override
    protected void execute() throws IOException {
        ObjectDatabase db = requireRepository().getDatabase();
        ObjectDatabase.RawObject raw = db.load(oid);
        if (raw.getType() == ObjectType.COMMIT) {
            raw = db.load(Commit.readTreeOid(raw.getBody()));
        }
        if (raw.getType() != ObjectType.TREE) {
            throw new CorruptObjectException("not a tree object: " + oid);
        }
        for (TreeEntry entry : Tree.parse(raw.getBody()).getEntries()) {
            System.out.println(nameOnly ? entry.getName() : format(entry));
        }
    }

    /** 与 git ls-tree 相同的单行格式，mode 补足 6 位（40000 → 040000）。 */
    static String format(TreeEntry entry) {
        return String.format("%06o %s %s\t%s", entry.modeBits(), entry.objectType(), entry.getOid(), entry.getName());
    }
}
