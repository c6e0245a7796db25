package com.weixiao.mgit.obj;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Blob 测试")
class BlobTest {

    /**
     * Blob 的 getType 为 BLOB，toBytes() 返回与构造时传入的字节一致，且不受外部修改影响。
     */
    @Test
    @DisplayName("toBytes 返回与构造一致的字节")
    void toBytes_returnsSameData() {
        byte[] data = "hello world".getBytes(StandardCharsets.UTF_8);
        Blob blob = new Blob(data);
        data[0] = 'H';
        assertThat(blob.getType()).isEqualTo(ObjectType.BLOB);
        assertThat(blob.toBytes()).isEqualTo("hello world".getBytes(StandardCharsets.UTF_8));
    }
}
