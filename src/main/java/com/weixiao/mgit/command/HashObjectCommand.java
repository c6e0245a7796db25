package com.weixiao.mgit.command;

import com.weixiao.mgit.obj.ObjectType;
import com.weixiao.mgit.repo.ObjectDatabase;
import com.weixiao.mgit.utils.ObjectIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * mgit hash-object - 计算文件内容作为对象的 oid，-w 时同时写入对象库。
 */
@Command(name = "hash-object", mixinStandardHelpOptions = true, description = "计算对象 oid，可选写入对象库")
public class HashObjectCommand extends AbstractCommand {

    private static final Logger log = LoggerFactory.getLogger(HashObjectCommand.class);

    @Option(names = "-w", description = "将对象写入对象库")
    private boolean write;

    @Option(names = "-t", paramLabel = "TYPE", description = "对象类型：blob、tree、commit、tag，默认 blob")
    private String type = "blob";

    @Parameters(index = "0", paramLabel = "FILE", description = "要计算的文件")
    private Path file;

    @Override
    protected void execute() throws IOException {
        ObjectType objectType = ObjectType.fromName(type);
        byte[] data = Files.readAllBytes(startPath().resolve(file));
        String oid;
        if (write) {
            ObjectDatabase db = requireRepository().getDatabase();
            oid = db.put(objectType, data);
            log.debug("hash-object wrote {} {}", objectType, oid);
        } else {
            oid = ObjectIds.hash(objectType, data);
        }
        System.out.println(oid);
    }
}
