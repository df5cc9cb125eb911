package com.ginindex.dictionary;

import org.apache.lucene.store.ByteBuffersDataOutput;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.IntsRefBuilder;
import org.apache.lucene.util.fst.Builder;
import org.apache.lucene.util.fst.FST;
import org.apache.lucene.util.fst.PositiveIntOutputs;
import org.apache.lucene.util.fst.Util;

import java.io.IOException;

/**
 * 段词典构建器，将 词项 → 倒排偏移 编译为最小化 FST。
 *
 * FST 要求输入按 UTF-8 字节序严格递增，调用方负责排序，这里只做校验。
 */
public final class TermDictionaryBuilder {
    private final Builder<Long> fstBuilder =
        new Builder<>(FST.INPUT_TYPE.BYTE1, PositiveIntOutputs.getSingleton());
    private final IntsRefBuilder scratchInts = new IntsRefBuilder();
    private BytesRef lastTerm;
    private int termCount;
    private boolean built;

    /**
     * 追加一个词项。
     *
     * @param term 词项的 UTF-8 字节
     * @param postingsOffset 倒排列表相对段起点的偏移
     * @throws IOException FST 编译失败时抛出
     */
    public void add(BytesRef term, long postingsOffset) throws IOException {
        if (built) {
            throw new IllegalStateException("TermDictionaryBuilder 已完成构建");
        }
        if (term == null) {
            throw new IllegalArgumentException("term 不能为空");
        }
        if (postingsOffset < 0) {
            throw new IllegalArgumentException("offset 不能为负数: " + postingsOffset);
        }
        if (lastTerm != null && term.compareTo(lastTerm) <= 0) {
            throw new IllegalArgumentException(
                "term 必须按字节序严格递增，last=" + lastTerm.utf8ToString() + ", current=" + term.utf8ToString());
        }
        fstBuilder.add(Util.toIntsRef(term, scratchInts), postingsOffset);
        lastTerm = BytesRef.deepCopyOf(term);
        termCount++;
    }

    public int getTermCount() {
        return termCount;
    }

    /**
     * 编译 FST 并序列化为字节块；没有任何词项时返回空数组。
     *
     * @return FST 字节块
     * @throws IOException 编译或序列化失败时抛出
     */
    public byte[] toBlob() throws IOException {
        if (built) {
            throw new IllegalStateException("TermDictionaryBuilder 已完成构建");
        }
        built = true;
        if (termCount == 0) {
            return new byte[0];
        }
        FST<Long> fst = fstBuilder.finish();
        ByteBuffersDataOutput output = new ByteBuffersDataOutput();
        fst.save(output, output);
        return output.toArrayCopy();
    }
}
