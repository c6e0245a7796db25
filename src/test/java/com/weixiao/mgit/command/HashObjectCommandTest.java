package com.weixiao.mgit.command;

import com.weixiao.mgit.MGitTestUtil;
import com.weixiao.mgit.MGitTestUtil.ExecuteResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * hash-object 与 cat-file 测试：写入 "hello" 得到 Git 相同的 oid，再按 -p/-t/-s 读回。
 */
@DisplayName("HashObjectCommand / CatFileCommand 测试")
class HashObjectCommandTest {

    private static final String HELLO_OID = "b6fc4c620b67d95f953a5c1c1230aaab5db5a1b0";

    @TempDir
    Path repoDir;

    @BeforeEach
    void setUp() throws Exception {
        assertThat(MGitTestUtil.run("-C", repoDir.toString(), "init").getExitCode()).isEqualTo(0);
        Files.writeString(repoDir.resolve("hello.txt"), "hello");
    }

    @Test
    @DisplayName("不带 -w 只计算 oid，不写入对象库")
    void hashObject_withoutWrite() {
        ExecuteResult result = MGitTestUtil.run("-C", repoDir.toString(), "hash-object", "hello.txt");
        assertThat(result.getExitCode()).isEqualTo(0);
        assertThat(result.getOutput().trim()).isEqualTo(HELLO_OID);
        assertThat(repoDir.resolve(".git/objects/b6/fc4c620b67d95f953a5c1c1230aaab5db5a1b0")).doesNotExist();
    }

    @Test
    @DisplayName("-w 写入对象库，cat-file -p 原样输出内容")
    void hashObject_writeThenCatFile() {
        ExecuteResult hashed = MGitTestUtil.run("-C", repoDir.toString(), "hash-object", "-w", "hello.txt");
        assertThat(hashed.getOutput().trim()).isEqualTo(HELLO_OID);
        assertThat(repoDir.resolve(".git/objects/b6/fc4c620b67d95f953a5c1c1230aaab5db5a1b0")).isRegularFile();

        ExecuteResult pretty = MGitTestUtil.run("-C", repoDir.toString(), "cat-file", "-p", HELLO_OID);
        assertThat(pretty.getExitCode()).isEqualTo(0);
        assertThat(pretty.getOutput()).isEqualTo("hello");

        assertThat(MGitTestUtil.run("-C", repoDir.toString(), "cat-file", "-t", HELLO_OID).getOutput().trim())
                .isEqualTo("blob");
        assertThat(MGitTestUtil.run("-C", repoDir.toString(), "cat-file", "-s", HELLO_OID).getOutput().trim())
                .isEqualTo("5");
    }

    @Test
    @DisplayName("未知类型与不存在的对象返回退出码 1")
    void errors() {
        ExecuteResult badType = MGitTestUtil.run("-C", repoDir.toString(), "hash-object", "-t", "note", "hello.txt");
        assertThat(badType.getExitCode()).isEqualTo(1);
        assertThat(badType.getErr()).startsWith("fatal: ");

        ExecuteResult missing = MGitTestUtil.run("-C", repoDir.toString(), "cat-file", "-p", HELLO_OID);
        assertThat(missing.getExitCode()).isEqualTo(1);
        assertThat(missing.getErr()).startsWith("fatal: ");
    }
}
