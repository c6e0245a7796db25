package com.weixiao.mgit.transport;

import com.weixiao.mgit.errors.PackProtocolException;
import com.weixiao.mgit.obj.ObjectType;
import com.weixiao.mgit.pack.PackFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SmartHttpClient 测试")
class SmartHttpClientTest {

    private static final String C1 = "1111111111111111111111111111111111111111";
    private static final String C2 = "2222222222222222222222222222222222222222";

    /**
     * 广告：HEAD 与 refs/heads/main 指向同一 commit，另有一个分支和一个附注标签（含 peeled 行）。
     * HEAD 的默认分支来自第一行 NUL 后的 symref=HEAD:refs/heads/main。
     */
    @Test
    @DisplayName("解析引用广告与 symref")
    void parseAdvertisement() throws Exception {
        ByteArrayOutputStream body = new ByteArrayOutputStream();
        body.writeBytes(PktLine.encode("# service=git-upload-pack\n"));
        body.writeBytes(PktLine.FLUSH);
        body.writeBytes(PktLine.encode(C1 + " HEAD\0multi_ack symref=HEAD:refs/heads/main agent=git/2.40\n"));
        body.writeBytes(PktLine.encode(C2 + " refs/heads/dev\n"));
        body.writeBytes(PktLine.encode(C1 + " refs/heads/main\n"));
        body.writeBytes(PktLine.encode(C2 + " refs/tags/v1\n"));
        body.writeBytes(PktLine.encode(C1 + " refs/tags/v1^{}\n"));
        body.writeBytes(PktLine.FLUSH);

        RefAdvertisement adv = SmartHttpClient.parseAdvertisement(body.toByteArray());

        assertThat(adv.getHeadTarget()).isEqualTo("refs/heads/main");
        assertThat(adv.getRefs()).extracting(AdvertisedRef::getName)
                .containsExactly("HEAD", "refs/heads/dev", "refs/heads/main", "refs/tags/v1");
        assertThat(adv.headOid()).isEqualTo(C1);
        assertThat(adv.wantedOids()).containsExactly(C1, C2);
    }

    @Test
    @DisplayName("空仓库的 capabilities^{} 行不产生引用")
    void parseAdvertisement_emptyRepository() throws Exception {
        ByteArrayOutputStream body = new ByteArrayOutputStream();
        body.writeBytes(PktLine.encode("# service=git-upload-pack\n"));
        body.writeBytes(PktLine.FLUSH);
        body.writeBytes(PktLine.encode("0".repeat(40) + " capabilities^{}\0symref=HEAD:refs/heads/main\n"));
        body.writeBytes(PktLine.FLUSH);

        RefAdvertisement adv = SmartHttpClient.parseAdvertisement(body.toByteArray());

        assertThat(adv.isEmpty()).isTrue();
        assertThat(adv.getHeadTarget()).isEqualTo("refs/heads/main");
    }

    @Test
    @DisplayName("缺少 service 行后的 flush 时抛出 PackProtocolException")
    void parseAdvertisement_missingFlush() {
        ByteArrayOutputStream body = new ByteArrayOutputStream();
        body.writeBytes(PktLine.encode("# service=git-upload-pack\n"));
        body.writeBytes(PktLine.encode(C1 + " HEAD\n"));
        assertThatThrownBy(() -> SmartHttpClient.parseAdvertisement(body.toByteArray()))
                .isInstanceOf(PackProtocolException.class)
                .hasMessageContaining("flush");
    }

    @Test
    @DisplayName("want 请求体：每个 oid 一条 want，flush，done")
    void buildWantRequest() {
        byte[] body = SmartHttpClient.buildWantRequest(Set.of(C1));
        assertThat(new String(body, StandardCharsets.US_ASCII))
                .isEqualTo("0032want " + C1 + "\n0000" + "0009done\n");
    }

    /**
     * NAK 之后的 pack 校验和正确时返回去掉尾部 20 字节的 pack；改动一个字节后校验失败。
     */
    @Test
    @DisplayName("upload-pack 响应校验 pack 尾部 SHA-1")
    void parseUploadPackResponse_checksum() throws Exception {
        byte[] pack = new PackFixture().add(ObjectType.BLOB, "x").build();
        byte[] response = concat(PktLine.encode("NAK\n"), PackFixture.withTrailer(pack));

        assertThat(SmartHttpClient.parseUploadPackResponse(response)).isEqualTo(pack);

        byte[] tampered = response.clone();
        tampered[12] ^= 0x01;
        assertThatThrownBy(() -> SmartHttpClient.parseUploadPackResponse(tampered))
                .isInstanceOf(PackProtocolException.class)
                .hasMessageContaining("checksum mismatch");
    }

    @Test
    @DisplayName("响应不以 NAK 开头时抛出 PackProtocolException")
    void parseUploadPackResponse_requiresNak() {
        byte[] response = concat(PktLine.encode("ERR access denied\n"), new byte[0]);
        assertThatThrownBy(() -> SmartHttpClient.parseUploadPackResponse(response))
                .isInstanceOf(PackProtocolException.class)
                .hasMessageContaining("access denied");
    }

    /**
     * 通过本地 HTTP 远端完成广告与 fetch，请求体中包含 want 与 done。
     */
    @Test
    @DisplayName("对本地远端执行 discoverRefs 与 fetchPack")
    void discoverAndFetch() throws Exception {
        byte[] pack = new PackFixture().add(ObjectType.BLOB, "hello").build();
        try (FixtureRemote remote = new FixtureRemote()
                .advertise("refs/heads/main", C1 + " HEAD", C1 + " refs/heads/main")
                .respondWithPack(PackFixture.withTrailer(pack))) {
            SmartHttpClient client = new SmartHttpClient();

            RefAdvertisement adv = client.discoverRefs(remote.url());
            byte[] fetched = client.fetchPack(remote.url() + "/", adv.wantedOids());

            assertThat(adv.getHeadTarget()).isEqualTo("refs/heads/main");
            assertThat(fetched).isEqualTo(pack);
            List<byte[]> requests = remote.getUploadPackRequests();
            assertThat(requests).hasSize(1);
            assertThat(new String(requests.get(0), StandardCharsets.US_ASCII))
                    .contains("want " + C1 + "\n")
                    .endsWith("0009done\n");
        }
    }

    @Test
    @DisplayName("非 2xx 状态或非 smart 内容类型抛出 PackProtocolException")
    void discoverRefs_httpFailure() throws Exception {
        try (FixtureRemote remote = new FixtureRemote().advertise(null, C1 + " HEAD").status(404)) {
            assertThatThrownBy(() -> new SmartHttpClient().discoverRefs(remote.url()))
                    .isInstanceOf(PackProtocolException.class)
                    .hasMessageContaining("HTTP 404");
        }
        try (FixtureRemote remote = new FixtureRemote().advertise(null, C1 + " HEAD").advertisementType("text/plain")) {
            assertThatThrownBy(() -> new SmartHttpClient().discoverRefs(remote.url()))
                    .isInstanceOf(PackProtocolException.class)
                    .hasMessageContaining("not a smart HTTP server");
        }
    }

    private static byte[] concat(byte[] a, byte[] b) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(a);
        out.writeBytes(b);
        return out.toByteArray();
    }
}
