package com.weixiao.mgit.pack;

import com.weixiao.mgit.repo.ObjectDatabase;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * 把一个 pack 导入对象库的两阶段流水线：先存全部字面对象并把 ref-delta 排队，再交给 {@link DeltaResolver}。
 * 字面对象的 oid 由对象库根据解压后的内容重新计算。
 */
public final class PackIngest {

    private static final Logger log = LoggerFactory.getLogger(PackIngest.class);

    private final ObjectDatabase database;
    private final DeltaResolver resolver;

    public PackIngest(ObjectDatabase database) {
        this.database = database;
        this.resolver = new DeltaResolver(database);
    }

    /**
     * 解析并导入不含尾部校验和的 pack。
     */
    public Result ingest(byte[] pack) throws IOException {
        return ingest(PackParser.parse(pack));
    }

    /**
     * 导入已解析的记录。
     */
    public Result ingest(List<PackEntry> entries) throws IOException {
        List<PackEntry> deltas = new ArrayList<>();
        int literals = 0;
        for (PackEntry entry : entries) {
            if (entry.isDelta()) {
                deltas.add(entry);
            } else {
                database.put(entry.getType(), entry.getData());
                literals++;
            }
        }
        log.debug("stored {} literal objects, {} deltas queued", literals, deltas.size());
        List<String> resolved = resolver.resolveAll(deltas);
        log.info("unpacked {} objects ({} from deltas)", literals + resolved.size(), resolved.size());
        return new Result(literals, resolved.size());
    }

    /** 导入统计：字面对象数与由 delta 解析出的对象数。 */
    @Value
    public static class Result {
        int literals;
        int deltas;

        public int total() {
            return literals + deltas;
        }
    }
}
