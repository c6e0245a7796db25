package com.weixiao.mgit.transport;

import com.weixiao.mgit.errors.PackProtocolException;
import com.weixiao.mgit.utils.HexUtils;
import com.weixiao.mgit.utils.ObjectIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Git smart HTTP 协议（v0）客户端：一次引用广告 GET，加一次 want/done 的 upload-pack POST。
 * 不做 have 协商，也不请求 side-band 与 ofs-delta，服务端在 NAK 之后直接返回裸 pack。
 */
public final class SmartHttpClient {

    private static final Logger log = LoggerFactory.getLogger(SmartHttpClient.class);

    private static final String SERVICE = "git-upload-pack";
    private static final String ADVERTISEMENT_TYPE = "application/x-" + SERVICE + "-advertisement";
    private static final String REQUEST_TYPE = "application/x-" + SERVICE + "-request";
    private static final String USER_AGENT = "git/2.0 (mgit)";
    private static final String SYMREF_HEAD = "symref=HEAD:";

    private final HttpClient http;

    public SmartHttpClient() {
        this(HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL).build());
    }

    public SmartHttpClient(HttpClient http) {
        this.http = http;
    }

    /**
     * GET &lt;url&gt;/info/refs?service=git-upload-pack 并解析引用广告。
     *
     * @throws PackProtocolException 非 2xx 状态、内容类型不是 smart 广告，或 pkt-line 格式错误
     */
    public RefAdvertisement discoverRefs(String url) throws IOException {
        URI uri = URI.create(baseUrl(url) + "/info/refs?service=" + SERVICE);
        log.debug("GET {}", uri);
        HttpRequest request = HttpRequest.newBuilder(uri)
                .header("User-Agent", USER_AGENT)
                .GET()
                .build();
        HttpResponse<byte[]> response = send(request);
        String contentType = response.headers().firstValue("Content-Type").orElse("");
        if (!contentType.startsWith(ADVERTISEMENT_TYPE)) {
            throw new PackProtocolException(uri + ": not a smart HTTP server (Content-Type " + contentType + ")");
        }
        RefAdvertisement advertisement = parseAdvertisement(response.body());
        log.info("remote advertised {} refs, HEAD -> {}", advertisement.getRefs().size(), advertisement.getHeadTarget());
        return advertisement;
    }

    /**
     * POST &lt;url&gt;/git-upload-pack，请求 wants 中的全部对象，返回去掉尾部 20 字节校验和后的 pack 字节。
     * 校验和在任何解析之前验证。
     *
     * @throws PackProtocolException 非 2xx 状态、缺少 NAK、pkt-line 格式错误或校验和不匹配
     */
    public byte[] fetchPack(String url, Collection<String> wants) throws IOException {
        if (wants.isEmpty()) {
            throw new IllegalArgumentException("nothing to fetch");
        }
        URI uri = URI.create(baseUrl(url) + "/" + SERVICE);
        byte[] body = buildWantRequest(wants);
        log.debug("POST {} wants={}", uri, wants.size());
        HttpRequest request = HttpRequest.newBuilder(uri)
                .header("User-Agent", USER_AGENT)
                .header("Content-Type", REQUEST_TYPE)
                .header("Accept", "application/x-" + SERVICE + "-result")
                .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                .build();
        byte[] pack = parseUploadPackResponse(send(request).body());
        log.info("received pack of {} bytes", pack.length);
        return pack;
    }

    /**
     * 解析引用广告：跳过首行 service 声明，要求紧随一个 flush，然后逐行读取 "&lt;oid&gt; &lt;refname&gt;" 直到下一个 flush。
     * 第一行引用在 NUL 之后携带能力列表，从 symref=HEAD:&lt;ref&gt; 得到默认分支。
     */
    static RefAdvertisement parseAdvertisement(byte[] body) throws PackProtocolException {
        PktLine.Reader reader = new PktLine.Reader(body);
        String service = reader.nextString();
        if (service == null || !service.startsWith("# service=")) {
            throw new PackProtocolException("missing service announcement in ref advertisement");
        }
        if (reader.next() != null) {
            throw new PackProtocolException("expected flush after service announcement");
        }
        String headTarget = null;
        List<AdvertisedRef> refs = new ArrayList<>();
        boolean first = true;
        String line;
        while ((line = reader.nextString()) != null) {
            if (first) {
                int nul = line.indexOf('\0');
                if (nul >= 0) {
                    headTarget = symrefHead(line.substring(nul + 1));
                    line = line.substring(0, nul);
                }
                first = false;
            }
            int space = line.indexOf(' ');
            if (space != HexUtils.OID_HEX_LENGTH || !HexUtils.isOid(line.substring(0, space))) {
                throw new PackProtocolException("malformed ref line: " + line);
            }
            String oid = line.substring(0, space).toLowerCase();
            String name = line.substring(space + 1);
            if (name.endsWith("^{}")) {
                // 空仓库的 capabilities^{} 占位行与附注标签的 peeled 行都不是真正的引用
                continue;
            }
            refs.add(new AdvertisedRef(oid, name));
        }
        return new RefAdvertisement(headTarget, refs);
    }

    /**
     * upload-pack 请求体：每个 oid 一条 "want &lt;oid&gt;\n"，随后 flush 与 "done\n"。
     */
    static byte[] buildWantRequest(Collection<String> wants) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (String oid : wants) {
            out.writeBytes(PktLine.encode("want " + oid + "\n"));
        }
        out.writeBytes(PktLine.FLUSH);
        out.writeBytes(PktLine.encode("done\n"));
        return out.toByteArray();
    }

    /**
     * 解析 upload-pack 响应：第一条 pkt-line 必须是 NAK，其后为 pack，最后 20 字节是前面 pack 字节的 SHA-1。
     */
    static byte[] parseUploadPackResponse(byte[] body) throws PackProtocolException {
        PktLine.Reader reader = new PktLine.Reader(body);
        String first = reader.nextString();
        if (first == null || !first.equals("NAK")) {
            if (first != null && first.startsWith("ERR ")) {
                throw new PackProtocolException("remote error: " + first.substring(4));
            }
            throw new PackProtocolException("expected NAK, got: " + first);
        }
        int start = reader.position();
        int packLength = body.length - start - HexUtils.OID_LENGTH;
        if (packLength < 0) {
            throw new PackProtocolException("response too short to hold a pack checksum");
        }
        byte[] expected = Arrays.copyOfRange(body, start + packLength, body.length);
        byte[] actual = ObjectIds.sha1(body, start, packLength);
        if (!Arrays.equals(expected, actual)) {
            throw new PackProtocolException("pack checksum mismatch: expected " + HexUtils.bytesToHex(expected)
                    + ", computed " + HexUtils.bytesToHex(actual));
        }
        return Arrays.copyOfRange(body, start, start + packLength);
    }

    private static String symrefHead(String capabilities) {
        for (String cap : capabilities.split(" ")) {
            if (cap.startsWith(SYMREF_HEAD)) return cap.substring(SYMREF_HEAD.length());
        }
        return null;
    }

    private static String baseUrl(String url) {
        String u = url;
        while (u.endsWith("/")) u = u.substring(0, u.length() - 1);
        return u;
    }

    private HttpResponse<byte[]> send(HttpRequest request) throws IOException {
        HttpResponse<byte[]> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted while requesting " + request.uri());
        }
        int status = response.statusCode();
        log.debug("{} {} -> {}", request.method(), request.uri(), status);
        if (status / 100 != 2) {
            throw new PackProtocolException(request.method() + " " + request.uri() + " failed with HTTP " + status);
        }
        return response;
    }
}
