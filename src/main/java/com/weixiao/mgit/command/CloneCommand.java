package com.weixiao.mgit.command;

import com.weixiao.mgit.errors.CorruptObjectException;
import com.weixiao.mgit.obj.Commit;
import com.weixiao.mgit.obj.ObjectType;
import com.weixiao.mgit.pack.PackIngest;
import com.weixiao.mgit.repo.ObjectDatabase;
import com.weixiao.mgit.repo.Refs;
import com.weixiao.mgit.repo.Repository;
import com.weixiao.mgit.transport.AdvertisedRef;
import com.weixiao.mgit.transport.RefAdvertisement;
import com.weixiao.mgit.transport.SmartHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

/**
 * mgit clone - 通过 smart HTTP 克隆远端仓库并检出 HEAD。
 * <p>
 * 流程：init 目标目录 → 引用广告 → 一次 want/done 拉取 pack → 校验、解析、导入字面对象 → 解析 ref-delta
 * → 写引用与 HEAD → 检出 HEAD 提交的 tree。任一步失败都以 fatal 结束，已创建的目录不回滚。
 */
@Command(name = "clone", mixinStandardHelpOptions = true, description = "克隆远端仓库")
public class CloneCommand extends AbstractCommand {

    private static final Logger log = LoggerFactory.getLogger(CloneCommand.class);

    @Parameters(index = "0", paramLabel = "URL", description = "远端仓库 URL（http/https）")
    private String url;

    @Parameters(index = "1", arity = "0..1", paramLabel = "DIR", description = "目标目录，默认取 URL 最后一段（去掉 .git）")
    private Path directory;

    @Override
    protected void execute() throws IOException {
        Path target = startPath().resolve(directory != null ? directory : Path.of(humanishName(url))).normalize();
        if (Files.exists(target) && !isEmptyDirectory(target)) {
            throw new IOException("destination path '" + target + "' already exists and is not an empty directory");
        }
        System.err.println("Cloning into '" + target.getFileName() + "'...");

        SmartHttpClient client = new SmartHttpClient();
        RefAdvertisement advertisement = client.discoverRefs(url);

        if (advertisement.isEmpty()) {
            Repository repo = Repository.init(target);
            if (advertisement.getHeadTarget() != null) {
                repo.getRefs().setHead(advertisement.getHeadTarget());
            }
            System.err.println("warning: You appear to have cloned an empty repository.");
            return;
        }

        // 协议层全部成功（含校验和）之后才创建仓库
        byte[] pack = client.fetchPack(url, advertisement.wantedOids());
        Repository repo = Repository.init(target);
        PackIngest.Result result = new PackIngest(repo.getDatabase()).ingest(pack);
        log.info("clone {} received {} objects", url, result.total());

        writeRefs(repo.getRefs(), advertisement);
        String headCommit = repo.getRefs().readHead();
        if (headCommit == null) {
            headCommit = advertisement.headOid();
        }
        if (headCommit == null) {
            log.warn("remote HEAD not advertised, nothing checked out");
            return;
        }
        checkoutCommit(repo, headCommit);
    }

    /**
     * 每个广告的引用写为 .git/&lt;refname&gt;；HEAD 只写成指向默认分支的符号引用。
     * 远端未声明 symref 时，选择与 HEAD oid 相同的第一个分支。
     */
    private static void writeRefs(Refs refs, RefAdvertisement advertisement) throws IOException {
        String headOid = advertisement.headOid();
        String headTarget = advertisement.getHeadTarget();
        for (AdvertisedRef ref : advertisement.getRefs()) {
            if (Refs.HEAD.equals(ref.getName())) continue;
            refs.updateRef(ref.getName(), ref.getOid());
            if (headTarget == null && ref.getName().startsWith("refs/heads/") && ref.getOid().equals(headOid)) {
                headTarget = ref.getName();
            }
        }
        if (headTarget != null) {
            refs.setHead(headTarget);
        }
    }

    private static void checkoutCommit(Repository repo, String commitOid) throws IOException {
        ObjectDatabase.RawObject commit = repo.getDatabase().load(commitOid);
        if (commit.getType() != ObjectType.COMMIT) {
            throw new CorruptObjectException("HEAD " + commitOid + " is a " + commit.getType() + ", not a commit");
        }
        String treeOid = Commit.readTreeOid(commit.getBody());
        log.debug("checkout commit={} tree={}", commitOid, treeOid);
        repo.getWorkspace().checkout(treeOid);
    }

    /** 由 URL 推出默认目录名：最后一段路径，去掉结尾的 "/" 与 ".git"。 */
    static String humanishName(String url) {
        String u = url;
        while (u.endsWith("/")) u = u.substring(0, u.length() - 1);
        if (u.endsWith(".git")) u = u.substring(0, u.length() - 4);
        int slash = u.lastIndexOf('/');
        String name = slash >= 0 ? u.substring(slash + 1) : u;
        if (name.isEmpty() || name.contains(":")) {
            throw new IllegalArgumentException("cannot guess directory name from " + url + ", please specify one");
        }
        return name;
    }

    private static boolean isEmptyDirectory(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) return false;
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.findAny().isEmpty();
        }
    }
}
