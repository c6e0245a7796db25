package com.weixiao.mgit.errors;

import java.io.IOException;

/**
 * smart HTTP 协议错误：非成功状态码、pkt-line 长度前缀非法、缺少 NAK 或 pack 校验和不匹配。
 */
public class PackProtocolException extends IOException {

    private static final long serialVersionUID = 1L;

    public PackProtocolException(String message) {
        super(message);
    }

    public PackProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
