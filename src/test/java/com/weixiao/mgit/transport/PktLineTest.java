package com.weixiao.mgit.transport;

import com.weixiao.mgit.errors.PackProtocolException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PktLine 测试")
class PktLineTest {

    /**
     * "want x\n" 共 7 字节，加 4 字节长度前缀 → "000bwant x\n"。
     */
    @Test
    @DisplayName("encode 写出十六进制总长度前缀")
    void encode_lengthPrefix() {
        assertThat(new String(PktLine.encode("want x\n"), StandardCharsets.US_ASCII)).isEqualTo("000bwant x\n");
        assertThat(new String(PktLine.encode("done\n"), StandardCharsets.US_ASCII)).isEqualTo("0009done\n");
    }

    @Test
    @DisplayName("Reader 依次读出负载与 flush，并记录位置")
    void reader_readsPayloadsAndFlush() throws Exception {
        byte[] data = "0008NAK\n0000PACK".getBytes(StandardCharsets.US_ASCII);
        PktLine.Reader reader = new PktLine.Reader(data);

        assertThat(reader.nextString()).isEqualTo("NAK");
        assertThat(reader.position()).isEqualTo(8);
        assertThat(reader.next()).isNull();
        assertThat(reader.position()).isEqualTo(12);
        assertThat(reader.hasMore()).isTrue();
    }

    @Test
    @DisplayName("非十六进制、过短或越界的长度前缀抛出 PackProtocolException")
    void reader_rejectsMalformedLength() {
        assertThatThrownBy(() -> new PktLine.Reader("zz12abc".getBytes(StandardCharsets.US_ASCII)).next())
                .isInstanceOf(PackProtocolException.class);
        assertThatThrownBy(() -> new PktLine.Reader("0003".getBytes(StandardCharsets.US_ASCII)).next())
                .isInstanceOf(PackProtocolException.class);
        assertThatThrownBy(() -> new PktLine.Reader("0010abc".getBytes(StandardCharsets.US_ASCII)).next())
                .isInstanceOf(PackProtocolException.class);
        assertThatThrownBy(() -> new PktLine.Reader("00".getBytes(StandardCharsets.US_ASCII)).next())
                .isInstanceOf(PackProtocolException.class);
    }
}
