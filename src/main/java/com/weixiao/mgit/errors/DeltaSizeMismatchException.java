package com.weixiao.mgit.errors;

import java.io.IOException;

/**
 * delta 声明的 source size 与 base 实际长度不符，或重放结果长度与声明的 target size 不符。
 */
public class DeltaSizeMismatchException extends IOException {

    private static final long serialVersionUID = 1L;

    public DeltaSizeMismatchException(String message) {
        super(message);
    }

    public DeltaSizeMismatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
