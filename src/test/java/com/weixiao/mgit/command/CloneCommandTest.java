package com.weixiao.mgit.command;

import com.weixiao.mgit.MGitTestUtil;
import com.weixiao.mgit.MGitTestUtil.ExecuteResult;
import com.weixiao.mgit.obj.Author;
import com.weixiao.mgit.obj.Commit;
import com.weixiao.mgit.obj.ObjectType;
import com.weixiao.mgit.obj.Tree;
import com.weixiao.mgit.obj.TreeEntry;
import com.weixiao.mgit.pack.PackFixture;
import com.weixiao.mgit.repo.ObjectDatabase;
import com.weixiao.mgit.transport.FixtureRemote;
import com.weixiao.mgit.utils.ObjectIds;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * clone 端到端测试：本地 smart HTTP 远端提供一个提交，其 tree 含一个字面 blob 和一个以它为 base 的 ref-delta blob。
 */
@DisplayName("CloneCommand 测试")
class CloneCommandTest {

    private static final String BASE_TEXT = "hello world\n";
    private static final String DELTA_TEXT = "hello mgit\n";

    @TempDir
    Path workDir;

    private String baseOid;
    private String deltaOid;
    private String commitOid;
    private byte[] pack;

    @BeforeEach
    void setUp() {
        baseOid = ObjectIds.hash(ObjectType.BLOB, BASE_TEXT.getBytes(StandardCharsets.UTF_8));
        deltaOid = ObjectIds.hash(ObjectType.BLOB, DELTA_TEXT.getBytes(StandardCharsets.UTF_8));
        Tree tree = new Tree(List.of(TreeEntry.regularFile("b.txt", deltaOid), TreeEntry.regularFile("a.txt", baseOid)));
        String treeOid = ObjectIds.hash(ObjectType.TREE, tree.toBytes());
        Commit commit = new Commit(treeOid, null, new Author("u", "u@local", 1700000000L, ZoneOffset.UTC), "init");
        commitOid = ObjectIds.hash(ObjectType.COMMIT, commit.toBytes());

        byte[] delta = PackFixture.delta(BASE_TEXT.length(), DELTA_TEXT.length())
                .copy(0, 6)
                .insert("mgit\n")
                .build();
        // delta 排在 base 之前
        pack = new PackFixture()
                .add(ObjectType.COMMIT, commit.toBytes())
                .add(ObjectType.TREE, tree.toBytes())
                .addRefDelta(baseOid, delta)
                .add(ObjectType.BLOB, BASE_TEXT)
                .build();
    }

    @Test
    @DisplayName("clone 导入对象、写引用与 HEAD，并检出工作区")
    void clone_checksOutHead() throws Exception {
        try (FixtureRemote remote = new FixtureRemote()
                .advertise("refs/heads/main", commitOid + " HEAD", commitOid + " refs/heads/main")
                .respondWithPack(PackFixture.withTrailer(pack))) {

            ExecuteResult result = MGitTestUtil.run("-C", workDir.toString(), "clone", remote.url(), "dest");
            assertThat(result.getExitCode()).as(result.getErr()).isEqualTo(0);
            assertThat(result.getErr()).contains("Cloning into 'dest'...");

            Path dest = workDir.resolve("dest");
            assertThat(Files.readString(dest.resolve("a.txt"))).isEqualTo(BASE_TEXT);
            assertThat(Files.readString(dest.resolve("b.txt"))).isEqualTo(DELTA_TEXT);
            assertThat(Files.readString(dest.resolve(".git/HEAD"))).isEqualTo("ref: refs/heads/main\n");
            assertThat(Files.readString(dest.resolve(".git/refs/heads/main"))).isEqualTo(commitOid + "\n");

            ObjectDatabase db = new ObjectDatabase(dest.resolve(".git"));
            ObjectDatabase.RawObject resolved = db.load(deltaOid);
            assertThat(resolved.getType()).isEqualTo(ObjectType.BLOB);
            assertThat(new String(resolved.getBody(), StandardCharsets.UTF_8)).isEqualTo(DELTA_TEXT);
            assertThat(deltaOid).isNotEqualTo(baseOid);

            String request = new String(remote.getUploadPackRequests().get(0), StandardCharsets.US_ASCII);
            assertThat(request).contains("want " + commitOid + "\n").endsWith("0009done\n");
        }
    }

    @Test
    @DisplayName("未给出目录时由 URL 推出目录名")
    void clone_defaultDirectoryName() throws Exception {
        try (FixtureRemote remote = new FixtureRemote()
                .advertise("refs/heads/main", commitOid + " HEAD", commitOid + " refs/heads/main")
                .respondWithPack(PackFixture.withTrailer(pack))) {

            ExecuteResult result = MGitTestUtil.run("-C", workDir.toString(), "clone", remote.url());
            assertThat(result.getExitCode()).as(result.getErr()).isEqualTo(0);
            assertThat(workDir.resolve("repo").resolve("a.txt")).isRegularFile();
        }
    }

    /**
     * 校验和错误在创建仓库之前被发现，目标目录中不留下 .git。
     */
    @Test
    @DisplayName("pack 校验和不匹配时失败且不创建仓库")
    void clone_checksumMismatch() throws Exception {
        byte[] response = PackFixture.withTrailer(pack);
        response[response.length - 1] ^= 0x01;
        try (FixtureRemote remote = new FixtureRemote()
                .advertise("refs/heads/main", commitOid + " HEAD", commitOid + " refs/heads/main")
                .respondWithPack(response)) {

            ExecuteResult result = MGitTestUtil.run("-C", workDir.toString(), "clone", remote.url(), "dest");
            assertThat(result.getExitCode()).isEqualTo(1);
            assertThat(result.getErr()).contains("fatal: pack checksum mismatch");
            assertThat(workDir.resolve("dest").resolve(".git")).doesNotExist();
        }
    }

    @Test
    @DisplayName("目标目录非空时拒绝 clone")
    void clone_nonEmptyTarget() throws Exception {
        Files.createDirectories(workDir.resolve("dest"));
        Files.writeString(workDir.resolve("dest").resolve("keep.txt"), "x");

        ExecuteResult result = MGitTestUtil.run("-C", workDir.toString(), "clone", "http://127.0.0.1:1/repo.git", "dest");
        assertThat(result.getExitCode()).isEqualTo(1);
        assertThat(result.getErr()).contains("already exists and is not an empty directory");
    }

    @Test
    @DisplayName("空远端仓库只初始化并给出警告")
    void clone_emptyRemote() throws Exception {
        try (FixtureRemote remote = new FixtureRemote()
                .advertise("refs/heads/trunk", "0".repeat(40) + " capabilities^{}")) {

            ExecuteResult result = MGitTestUtil.run("-C", workDir.toString(), "clone", remote.url(), "dest");
            assertThat(result.getExitCode()).isEqualTo(0);
            assertThat(result.getErr()).contains("cloned an empty repository");
            assertThat(Files.readString(workDir.resolve("dest/.git/HEAD"))).isEqualTo("ref: refs/heads/trunk\n");
            assertThat(remote.getUploadPackRequests()).isEmpty();
        }
    }

    @Test
    @DisplayName("由 URL 推出目录名")
    void humanishName() {
        assertThat(CloneCommand.humanishName("https://example.com/team/project.git")).isEqualTo("project");
        assertThat(CloneCommand.humanishName("https://example.com/team/project/")).isEqualTo("project");
        assertThatThrownBy(() -> CloneCommand.humanishName("https://"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
