package com.weixiao.mgit.command;

import com.weixiao.mgit.errors.CorruptObjectException;
import com.weixiao.mgit.obj.Author;
import com.weixiao.mgit.obj.Commit;
import com.weixiao.mgit.obj.ObjectType;
import com.weixiao.mgit.repo.ObjectDatabase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * mgit commit-tree - 以给定 tree（及可选 parent）创建 commit 对象并输出其 oid。
 * 未给出 -m 时从标准输入读取提交信息。
 */
@Command(name = "commit-tree", mixinStandardHelpOptions = true, description = "创建 commit 对象")
public class CommitTreeCommand extends AbstractCommand {

    private static final Logger log = LoggerFactory.getLogger(CommitTreeCommand.class);

    @Parameters(index = "0", paramLabel = "TREE", description = "tree oid")
    private String treeOid;

    @Option(names = "-p", paramLabel = "PARENT", description = "父提交 oid")
    private String parentOid;

    @Option(names = {"-m", "--message"}, description = "提交信息")
    private String message;

    @Override
    protected void execute() throws IOException {
        ObjectDatabase db = requireRepository().getDatabase();
        requireType(db, treeOid, ObjectType.TREE);
        if (parentOid != null) {
            requireType(db, parentOid, ObjectType.COMMIT);
        }
        String msg = message != null ? message : new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
        Commit commit = new Commit(treeOid.toLowerCase(), parentOid != null ? parentOid.toLowerCase() : null,
                Author.current(), msg);
        String oid = db.store(commit);
        log.info("commit created oid={} tree={} parent={}", oid, treeOid, parentOid);
        System.out.println(oid);
    }

    private static void requireType(ObjectDatabase db, String oid, ObjectType expected) throws IOException {
        ObjectType actual = db.load(oid).getType();
        if (actual != expected) {
            throw new CorruptObjectException(oid + " is a " + actual + ", not a " + expected);
        }
    }
}
