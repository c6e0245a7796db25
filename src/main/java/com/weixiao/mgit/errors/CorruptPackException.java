package com.weixiao.mgit.errors;

import java.io.IOException;

/**
 * packfile 头部或记录序列不合法：magic/版本错误、记录截断、解压失败、记录数与声明不符。
 */
public class CorruptPackException extends IOException {

    private static final long serialVersionUID = 1L;

    public CorruptPackException(String message) {
        super(message);
    }

    public CorruptPackException(String message, Throwable cause) {
        super(message, cause);
    }
}
