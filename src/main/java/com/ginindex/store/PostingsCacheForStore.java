package com.ginindex.store;

import java.io.IOException;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 某个存储在一次查询中的倒排缓存集合：查询串 → {@link PostingsCache}。
 *
 * 一个查询可以包含多个查询串；查询结束后随查询对象一起释放。
 */
public final class PostingsCacheForStore {
    private final GinIndexStore store;
    private final Map<String, PostingsCache> cache = new ConcurrentHashMap<>();

    public PostingsCacheForStore(GinIndexStore store) {
        if (store == null) {
            throw new IllegalArgumentException("GinIndexStore 不能为空");
        }
        this.store = store;
    }

    public GinIndexStore getStore() {
        return store;
    }

    /**
     * 获取查询串对应的倒排缓存。
     *
     * @param queryString 查询串
     * @return 已缓存时返回缓存，否则为空
     */
    public Optional<PostingsCache> getPostings(String queryString) {
        return Optional.ofNullable(cache.get(queryString));
    }

    /**
     * 获取或创建查询串的倒排缓存；未缓存时读取存储并解析全部词项。
     *
     * @param queryString 查询串
     * @param terms 查询串分词后的词项
     * @return 倒排缓存
     * @throws IOException 读取失败时抛出
     */
    public PostingsCache getOrCreatePostings(String queryString, Collection<String> terms) throws IOException {
        PostingsCache existing = cache.get(queryString);
        if (existing != null) {
            return existing;
        }
        PostingsCache created;
        try (GinIndexStoreDeserializer deserializer = new GinIndexStoreDeserializer(store)) {
            deserializer.readSegments();
            created = deserializer.createPostingsCacheFromTerms(terms);
        }
        PostingsCache raced = cache.putIfAbsent(queryString, created);
        return raced == null ? created : raced;
    }
}
