package com.ginindex.store;

import com.ginindex.config.Constants;
import com.ginindex.dictionary.SegmentDictionary;
import com.ginindex.postings.PostingsBuilder;
import com.ginindex.postings.PostingsList;
import com.ginindex.storage.CorruptIndexException;

import java.io.EOFException;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

/**
 * GIN 索引存储读取器，负责读取段描述符、段词典与倒排列表。
 *
 * 每个查询使用独立实例（持有各自的文件句柄），段词典缓存在 {@link GinIndexStore} 上跨查询共享。
 */
public final class GinIndexStoreDeserializer implements AutoCloseable {
    private final GinIndexStore store;

    private RandomAccessFile metadataFile;
    private RandomAccessFile dictFile;
    private RandomAccessFile postingsFile;

    private List<SegmentDescriptor> segments;
    private boolean closed;

    public GinIndexStoreDeserializer(GinIndexStore store) {
        if (store == null) {
            throw new IllegalArgumentException("GinIndexStore 不能为空");
        }
        this.store = store;
    }

    /**
     * 读取 .gin_seg 中的全部段描述符。
     *
     * @throws IOException 文件损坏或读取失败时抛出
     */
    public void readSegments() throws IOException {
        initFileStreams();
        String metadataFileName = store.getFileName(Constants.GIN_SEGMENT_METADATA_FILE_TYPE);
        long metadataLength = metadataFile.length();
        if (metadataLength % SegmentDescriptor.BYTES != 0) {
            throw new CorruptIndexException("段元数据文件长度非法: " + metadataLength + ", file=" + metadataFileName);
        }
        int segmentCount = (int) (metadataLength / SegmentDescriptor.BYTES);
        long postingsLength = postingsFile.length();
        long dictLength = dictFile.length();

        List<SegmentDescriptor> loaded = new ArrayList<>(segmentCount);
        metadataFile.seek(0L);
        SegmentDescriptor previous = null;
        for (int index = 0; index < segmentCount; index++) {
            SegmentDescriptor descriptor = SegmentDescriptor.readFrom(metadataFile);
            if (descriptor.postingsStartOffset() < 0 || descriptor.postingsStartOffset() > postingsLength
                || descriptor.dictStartOffset() < 0 || descriptor.dictStartOffset() >= dictLength) {
                throw new CorruptIndexException("段偏移越界: segmentId=" + descriptor.segmentId()
                    + ", postingsStartOffset=" + descriptor.postingsStartOffset()
                    + ", dictStartOffset=" + descriptor.dictStartOffset() + ", file=" + metadataFileName);
            }
            if (previous != null && (descriptor.segmentId() <= previous.segmentId()
                || descriptor.nextRowId() < previous.nextRowId())) {
                throw new CorruptIndexException("段顺序损坏: previous=" + previous + ", current=" + descriptor);
            }
            loaded.add(descriptor);
            previous = descriptor;
        }
        segments = Collections.unmodifiableList(loaded);
    }

    /**
     * 已读取的段描述符，按段ID递增。
     */
    public List<SegmentDescriptor> getSegments() {
        ensureSegmentsRead();
        return segments;
    }

    /**
     * 读取全部段的词典。
     *
     * @throws IOException 读取或解析失败时抛出
     */
    public void readSegmentDictionaries() throws IOException {
        ensureSegmentsRead();
        for (SegmentDescriptor descriptor : segments) {
            loadDictionary(descriptor);
        }
    }

    /**
     * 读取指定段的词典，已缓存时直接返回。
     *
     * @param segmentId 段ID
     * @throws IOException 读取或解析失败时抛出
     */
    public void readSegmentDictionary(int segmentId) throws IOException {
        ensureSegmentsRead();
        loadDictionary(findSegment(segmentId));
    }

    /**
     * 在每个段的词典中查找词项并读取命中的倒排列表；某段未命中表示该段没有此词项。
     *
     * @param term 词项
     * @return 段ID → 倒排列表，按段ID递增
     * @throws IOException 格式损坏或读取失败时抛出
     */
    public Map<Integer, PostingsList> readSegmentedPostingsLists(String term) throws IOException {
        ensureSegmentsRead();
        Map<Integer, PostingsList> postingsBySegment = new LinkedHashMap<>();
        for (SegmentDescriptor descriptor : segments) {
            SegmentDictionary dictionary = loadDictionary(descriptor);
            OptionalLong offset = dictionary.lookup(term);
            if (offset.isEmpty()) {
                continue;
            }
            long position = dictionary.getPostingsStartOffset() + offset.getAsLong();
            postingsBySegment.put(descriptor.segmentId(), readPostingsList(descriptor, position));
        }
        return postingsBySegment;
    }

    /**
     * 为查询串分词后的词项逐一解析倒排并缓存，每个词项只查一次。
     *
     * @param terms 查询词项
     * @return 倒排缓存
     * @throws IOException 读取失败时抛出
     */
    public PostingsCache createPostingsCacheFromTerms(Collection<String> terms) throws IOException {
        if (terms == null) {
            throw new IllegalArgumentException("terms 不能为null");
        }
        PostingsCache postingsCache = new PostingsCache();
        for (String term : terms) {
            if (!postingsCache.containsTerm(term)) {
                postingsCache.put(term, readSegmentedPostingsLists(term));
            }
        }
        return postingsCache;
    }

    private SegmentDictionary loadDictionary(SegmentDescriptor descriptor) throws IOException {
        SegmentDictionary cached = store.getCachedDictionary(descriptor.segmentId());
        if (cached != null) {
            return cached;
        }
        byte[] blob;
        try {
            dictFile.seek(descriptor.dictStartOffset());
            blob = store.getDictionaryBlobFormat().read(dictFile, dictFile.length() - descriptor.dictStartOffset());
        } catch (EOFException exception) {
            throw new CorruptIndexException("词典被截断: segmentId=" + descriptor.segmentId()
                + ", dictStartOffset=" + descriptor.dictStartOffset(), exception);
        }
        SegmentDictionary dictionary = SegmentDictionary.fromBlob(
            descriptor.postingsStartOffset(), descriptor.dictStartOffset(), blob);
        return store.cacheDictionary(descriptor.segmentId(), dictionary);
    }

    private PostingsList readPostingsList(SegmentDescriptor descriptor, long position) throws IOException {
        if (position >= postingsFile.length()) {
            throw new CorruptIndexException("倒排偏移越界: segmentId=" + descriptor.segmentId() + ", offset=" + position);
        }
        try {
            postingsFile.seek(position);
            return PostingsBuilder.deserialize(postingsFile, postingsFile.length() - position);
        } catch (EOFException exception) {
            throw new CorruptIndexException("倒排列表被截断: segmentId=" + descriptor.segmentId()
                + ", offset=" + position, exception);
        }
    }

    private SegmentDescriptor findSegment(int segmentId) {
        for (SegmentDescriptor descriptor : segments) {
            if (descriptor.segmentId() == segmentId) {
                return descriptor;
            }
        }
        throw new IllegalArgumentException("段不存在: " + segmentId + ", store=" + store.getName());
    }

    private void initFileStreams() throws IOException {
        ensureOpen();
        if (metadataFile != null) {
            return;
        }
        metadataFile = store.getStorage().openForRead(store.getFileName(Constants.GIN_SEGMENT_METADATA_FILE_TYPE));
        dictFile = store.getStorage().openForRead(store.getFileName(Constants.GIN_DICTIONARY_FILE_TYPE));
        postingsFile = store.getStorage().openForRead(store.getFileName(Constants.GIN_POSTINGS_FILE_TYPE));
    }

    private void ensureSegmentsRead() {
        ensureOpen();
        if (segments == null) {
            throw new IllegalStateException("尚未调用 readSegments(): " + store.getName());
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("GinIndexStoreDeserializer 已关闭");
        }
    }

    /**
     * 关闭读取句柄。
     *
     * @throws IOException 关闭失败时抛出
     */
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        IOException failure = null;
        for (RandomAccessFile file : new RandomAccessFile[] {postingsFile, dictFile, metadataFile}) {
            if (file == null) {
                continue;
            }
            try {
                file.close();
            } catch (IOException exception) {
                if (failure == null) {
                    failure = exception;
                } else {
                    failure.addSuppressed(exception);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }
}
