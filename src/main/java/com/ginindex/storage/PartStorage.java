package com.ginindex.storage;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.util.List;

/**
 * 数据分片存储抽象：在分片目录下按文件名提供追加写入与定位读取。
 *
 * 索引存储只追加写入已有文件，从不改写已写出的字节；
 * 唯一例外是段ID计数文件，通过 {@link #replaceFile(String, byte[])} 整体替换。
 */
public interface PartStorage {

    /**
     * 分片的完整路径，作为存储注册表的键，不同分片之间不得冲突。
     */
    String getFullPath();

    boolean exists(String fileName);

    /**
     * 获取文件长度，文件不存在时返回 0。
     */
    long getFileSize(String fileName) throws IOException;

    /**
     * 打开文件用于追加写入，文件不存在时创建，返回的句柄已定位到文件末尾。
     *
     * @param fileName 文件名
     * @return 可写随机访问文件
     * @throws IOException 打开失败时抛出
     */
    RandomAccessFile openForAppend(String fileName) throws IOException;

    /**
     * 以只读方式打开文件用于定位读取。
     *
     * @param fileName 文件名
     * @return 只读随机访问文件
     * @throws IOException 文件不存在或打开失败时抛出
     */
    RandomAccessFile openForRead(String fileName) throws IOException;

    /**
     * 以原子方式用给定内容替换整个文件。
     *
     * @param fileName 文件名
     * @param content 新内容
     * @throws IOException 写入失败时抛出
     */
    void replaceFile(String fileName, byte[] content) throws IOException;

    /**
     * 列出分片目录下的全部文件名。
     */
    List<String> listFiles() throws IOException;
}
