package com.weixiao.mgit.errors;

import java.io.IOException;

/**
 * 对象库中的字节与其声明的格式不一致（头部损坏、长度不符、对象缺失或 tree 条目截断）。
 */
public class CorruptObjectException extends IOException {

    private static final long serialVersionUID = 1L;

    public CorruptObjectException(String message) {
        super(message);
    }

    public CorruptObjectException(String message, Throwable cause) {
        super(message, cause);
    }
}
