package com.weixiao.mgit.errors;

import java.io.IOException;

/**
 * delta 指令越界：copy 区间超出 base，insert 超出指令流末尾，或遇到保留的 0 号指令。
 */
public class DeltaRangeException extends IOException {

    private static final long serialVersionUID = 1L;

    public DeltaRangeException(String message) {
        super(message);
    }

    public DeltaRangeException(String message, Throwable cause) {
        super(message, cause);
    }
}
