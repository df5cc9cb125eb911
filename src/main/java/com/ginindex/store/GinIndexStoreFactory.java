package com.ginindex.store;

import com.ginindex.compress.CompressionCodec;
import com.ginindex.compress.Lz4CompressionCodec;
import com.ginindex.config.Constants;
import com.ginindex.storage.PartStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * GIN 索引存储注册表：按 (分片路径, 索引名) 缓存只读存储，保证同一分片的索引只有一个存储实例。
 *
 * 由宿主进程或测试显式创建并注入，关闭时清空注册表。
 */
public final class GinIndexStoreFactory implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(GinIndexStoreFactory.class);

    private static final List<String> GIN_FILE_TYPES = List.of(
        Constants.GIN_SEGMENT_ID_FILE_TYPE,
        Constants.GIN_SEGMENT_METADATA_FILE_TYPE,
        Constants.GIN_DICTIONARY_FILE_TYPE,
        Constants.GIN_POSTINGS_FILE_TYPE
    );

    private record StoreKey(String partPath, String name) {
    }

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<StoreKey, GinIndexStore> stores = new HashMap<>();
    private final CompressionCodec compressionCodec;

    public GinIndexStoreFactory() {
        this(Lz4CompressionCodec.INSTANCE);
    }

    public GinIndexStoreFactory(CompressionCodec compressionCodec) {
        if (compressionCodec == null) {
            throw new IllegalArgumentException("压缩编解码器不能为空");
        }
        this.compressionCodec = compressionCodec;
    }

    /**
     * 获取分片上的索引存储，首次访问时创建并预加载段描述符与全部段词典。
     *
     * 创建过程在锁内完成，并发调用方得到同一个实例。
     *
     * @param name 索引名
     * @param storage 分片存储
     * @return 存储；分片上没有该索引时为空
     * @throws IOException 读取索引失败时抛出
     */
    public Optional<GinIndexStore> get(String name, PartStorage storage) throws IOException {
        if (name == null || storage == null) {
            throw new IllegalArgumentException("索引名与分片存储不能为空");
        }
        StoreKey key = new StoreKey(storage.getFullPath(), name);
        lock.lock();
        try {
            GinIndexStore existing = stores.get(key);
            if (existing != null) {
                return Optional.of(existing);
            }
            GinIndexStore store = new GinIndexStore(name, storage, compressionCodec);
            if (!store.exists()) {
                return Optional.empty();
            }
            try (GinIndexStoreDeserializer deserializer = new GinIndexStoreDeserializer(store)) {
                deserializer.readSegments();
                deserializer.readSegmentDictionaries();
            }
            stores.put(key, store);
            logger.debug("GIN 索引存储已注册: name={}, part={}, dictionaries={}",
                name, key.partPath(), store.getCachedDictionaryCount());
            return Optional.of(store);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 移除分片路径下的全部索引存储；磁盘文件由存储层负责删除。
     *
     * @param partPath 分片完整路径，与 {@link PartStorage#getFullPath()} 一致
     */
    public void remove(String partPath) {
        lock.lock();
        try {
            stores.keySet().removeIf(key -> key.partPath().equals(partPath));
        } finally {
            lock.unlock();
        }
    }

    /**
     * 注册表中的存储数量。
     */
    public int size() {
        lock.lock();
        try {
            return stores.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 判断文件名是否为 GIN 索引文件。
     */
    public static boolean isGinFile(String fileName) {
        if (fileName == null) {
            return false;
        }
        for (String fileType : GIN_FILE_TYPES) {
            if (fileName.endsWith(fileType)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public void close() {
        lock.lock();
        try {
            stores.clear();
        } finally {
            lock.unlock();
        }
    }
}
