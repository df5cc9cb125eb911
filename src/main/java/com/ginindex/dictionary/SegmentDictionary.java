package com.ginindex.dictionary;

import com.ginindex.storage.CorruptIndexException;
import org.apache.lucene.store.ByteArrayDataInput;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.fst.FST;
import org.apache.lucene.util.fst.PositiveIntOutputs;
import org.apache.lucene.util.fst.Util;

import java.io.IOException;
import java.util.OptionalLong;

/**
 * 单个段的词典：倒排与词典起始偏移，以及 词项 → 倒排偏移 的 FST。
 *
 * 加载后只读，可被多个查询线程并发查找。
 */
public final class SegmentDictionary {
    private final long postingsStartOffset;
    private final long dictStartOffset;
    /** 空段没有 FST */
    private final FST<Long> offsets;

    private SegmentDictionary(long postingsStartOffset, long dictStartOffset, FST<Long> offsets) {
        this.postingsStartOffset = postingsStartOffset;
        this.dictStartOffset = dictStartOffset;
        this.offsets = offsets;
    }

    /**
     * 从 FST 字节块解析段词典。
     *
     * @param postingsStartOffset 段倒排在 .gin_post 中的起始偏移
     * @param dictStartOffset 段词典在 .gin_dict 中的起始偏移
     * @param blob {@link TermDictionaryBuilder#toBlob()} 生成的字节块
     * @return 段词典
     * @throws CorruptIndexException FST 解析失败时抛出
     */
    public static SegmentDictionary fromBlob(long postingsStartOffset, long dictStartOffset, byte[] blob)
            throws CorruptIndexException {
        if (blob == null) {
            throw new IllegalArgumentException("词典字节块不能为null");
        }
        if (blob.length == 0) {
            return new SegmentDictionary(postingsStartOffset, dictStartOffset, null);
        }
        ByteArrayDataInput input = new ByteArrayDataInput(blob);
        FST<Long> fst;
        try {
            fst = new FST<>(input, input, PositiveIntOutputs.getSingleton());
        } catch (IOException | RuntimeException exception) {
            throw new CorruptIndexException("FST 解析失败: dictStartOffset=" + dictStartOffset, exception);
        }
        if (!input.eof()) {
            throw new CorruptIndexException("FST 字节块包含未解析字节: dictStartOffset=" + dictStartOffset);
        }
        return new SegmentDictionary(postingsStartOffset, dictStartOffset, fst);
    }

    /**
     * 查找词项的倒排偏移（相对段倒排起点）。
     *
     * @param term 词项
     * @return 命中返回偏移，否则为空；未命中不是错误
     * @throws IOException FST 遍历失败时抛出
     */
    public OptionalLong lookup(String term) throws IOException {
        if (offsets == null || term == null) {
            return OptionalLong.empty();
        }
        Long offset = Util.get(offsets, new BytesRef(term));
        return offset == null ? OptionalLong.empty() : OptionalLong.of(offset);
    }

    public long getPostingsStartOffset() {
        return postingsStartOffset;
    }

    public long getDictStartOffset() {
        return dictStartOffset;
    }

    public boolean isEmpty() {
        return offsets == null;
    }

    /**
     * FST 占用的堆内存估算。
     */
    public long ramBytesUsed() {
        return offsets == null ? 0L : offsets.ramBytesUsed();
    }
}
