package com.ginindex.storage;

import java.io.IOException;

/**
 * 索引文件格式错误：未知编码标记、截断数据、FST 解析失败等。
 *
 * 读取过程中遇到此异常必须向上抛出，不能以空结果代替，否则查询会产生漏检。
 */
public class CorruptIndexException extends IOException {

    public CorruptIndexException(String message) {
        super(message);
    }

    public CorruptIndexException(String message, Throwable cause) {
        super(message, cause);
    }
}
