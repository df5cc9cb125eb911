package com.ginindex.store;

import com.ginindex.postings.PostingsList;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * 一个查询串的倒排缓存：词项 → (段ID → 倒排列表)。
 *
 * 仅在查询生命周期内有效，从不持久化。
 */
public final class PostingsCache {
    private final Map<String, Map<Integer, PostingsList>> postingsByTerm = new HashMap<>();

    void put(String term, Map<Integer, PostingsList> segmentedPostings) {
        postingsByTerm.put(term, Collections.unmodifiableMap(segmentedPostings));
    }

    /**
     * 词项是否已解析（解析后在所有段都未命中也算已解析）。
     */
    public boolean containsTerm(String term) {
        return postingsByTerm.containsKey(term);
    }

    /**
     * 获取词项在各段的倒排列表，未解析或未命中时返回空映射。
     */
    public Map<Integer, PostingsList> getSegmentedPostings(String term) {
        return postingsByTerm.getOrDefault(term, Map.of());
    }

    /**
     * 合并词项在所有段的倒排列表。
     */
    public PostingsList getMergedPostings(String term) {
        return PostingsList.union(getSegmentedPostings(term).values());
    }

    /**
     * 判断词项在 [rangeStart, rangeEnd] 行号区间内是否出现，供按区间裁剪。
     */
    public boolean containsRowInRange(String term, int rangeStart, int rangeEnd) {
        for (PostingsList postingsList : getSegmentedPostings(term).values()) {
            if (postingsList.intersectsRange(rangeStart, rangeEnd)) {
                return true;
            }
        }
        return false;
    }

    public Set<String> terms() {
        return Collections.unmodifiableSet(postingsByTerm.keySet());
    }
}
