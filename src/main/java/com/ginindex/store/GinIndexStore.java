package com.ginindex.store;

import com.ginindex.compress.CompressionCodec;
import com.ginindex.compress.Lz4CompressionCodec;
import com.ginindex.config.Constants;
import com.ginindex.config.StoreConfig;
import com.ginindex.dictionary.DictionaryBlobFormat;
import com.ginindex.dictionary.SegmentDictionary;
import com.ginindex.dictionary.TermDictionaryBuilder;
import com.ginindex.postings.PostingsBuilder;
import com.ginindex.storage.CorruptIndexException;
import com.ginindex.storage.PartStorage;
import org.apache.lucene.util.BytesRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 一个数据分片中某一列的 GIN 倒排索引存储，由一个或多个不可变段组成。
 *
 * 每个存储包含 4 个文件，共用 {@code name} 作为文件名前缀：
 * <ol>
 *   <li>.gin_sid：1 字节版本号 + 下一个可用段ID（定长 32 位）</li>
 *   <li>.gin_seg：段描述符数组，见 {@link SegmentDescriptor}</li>
 *   <li>.gin_dict：每段一条 (size, FST) 记录，见 {@link DictionaryBlobFormat}</li>
 *   <li>.gin_post：倒排列表序列</li>
 * </ol>
 * 查询时先由 .gin_seg 找到段的词典位置并加载 FST，再用词项在 FST 中查出倒排偏移，
 * 偏移加上段的 postingsStartOffset 即为倒排列表在 .gin_post 中的位置。
 *
 * 写入状态机：UNINITIALIZED → OPEN → (FLUSHING → OPEN)* → FINALIZED | CANCELLED，
 * 落盘失败进入 FAILED。行ID与段ID分配可被多个写线程并发调用，其余写操作由唯一写入方串行调用。
 */
public class GinIndexStore {
    private static final Logger logger = LoggerFactory.getLogger(GinIndexStore.class);

    /**
     * 索引文件格式版本。
     */
    public enum Format {
        /** 初始版本，支持自适应倒排编码 */
        V1(Constants.CURRENT_FORMAT_VERSION);

        private final byte value;

        Format(byte value) {
            this.value = value;
        }

        public byte value() {
            return value;
        }

        static Format fromByte(byte value) throws CorruptIndexException {
            for (Format format : values()) {
                if (format.value == value) {
                    return format;
                }
            }
            throw new CorruptIndexException("不支持的 GIN 文件格式版本: " + value);
        }
    }

    public enum State {
        UNINITIALIZED,
        /** 仅供查询读取，不允许写操作 */
        READ_ONLY,
        OPEN,
        FLUSHING,
        FINALIZED,
        CANCELLED,
        FAILED
    }

    private static final Format CURRENT_FORMAT = Format.V1;

    private final String name;
    private final PartStorage storage;
    private final boolean writable;
    private final long segmentDigestionThresholdBytes;
    private final DictionaryBlobFormat dictionaryBlobFormat;

    /** 保护段ID计数与当前段的行ID计数 */
    private final ReentrantLock idLock = new ReentrantLock();
    private int nextAvailableSegmentId;
    private SegmentDescriptor currentSegment;

    /** 从 .gin_dict 加载的段词典，按段ID索引，只增不改 */
    private final ConcurrentMap<Integer, SegmentDictionary> segmentDictionaries = new ConcurrentHashMap<>();

    /** 当前段各词项的倒排构建器 */
    private final Map<String, PostingsBuilder> currentPostings = new HashMap<>();
    private long currentSize;
    private int writtenSegmentCount;
    private volatile State state;

    private RandomAccessFile metadataFile;
    private RandomAccessFile dictFile;
    private RandomAccessFile postingsFile;

    /**
     * 创建只读存储，用于查询时读取已落盘的索引，不做任何磁盘 IO。
     *
     * @param name 索引名（文件名前缀）
     * @param storage 分片存储
     */
    public GinIndexStore(String name, PartStorage storage) {
        this(name, storage, Lz4CompressionCodec.INSTANCE);
    }

    /**
     * 创建使用指定压缩编解码器的只读存储。
     */
    public GinIndexStore(String name, PartStorage storage, CompressionCodec compressionCodec) {
        this(name, storage, StoreConfig.defaults(), compressionCodec, false);
        this.state = State.READ_ONLY;
    }

    /**
     * 创建可写存储并完成初始化：读取或创建段ID文件，分配第一个段ID。
     *
     * @param name 索引名（文件名前缀）
     * @param storage 分片存储
     * @param config 存储配置
     * @throws IOException 初始化失败时抛出
     */
    public GinIndexStore(String name, PartStorage storage, StoreConfig config) throws IOException {
        this(name, storage, config, Lz4CompressionCodec.INSTANCE);
    }

    /**
     * 创建使用指定压缩编解码器的可写存储。
     */
    public GinIndexStore(String name, PartStorage storage, StoreConfig config, CompressionCodec compressionCodec)
            throws IOException {
        this(name, storage, config, compressionCodec, true);
        initialize();
    }

    private GinIndexStore(String name, PartStorage storage, StoreConfig config, CompressionCodec compressionCodec,
                          boolean writable) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("索引名不能为空");
        }
        if (storage == null) {
            throw new IllegalArgumentException("分片存储不能为空");
        }
        if (config == null) {
            throw new IllegalArgumentException("存储配置不能为空");
        }
        this.name = name;
        this.storage = storage;
        this.writable = writable;
        this.segmentDigestionThresholdBytes = config.getSegmentDigestionThresholdBytes();
        this.dictionaryBlobFormat = new DictionaryBlobFormat(compressionCodec, config.getDictionaryCompressionThresholdBytes());
        this.state = State.UNINITIALIZED;
    }

    /**
     * 通过段ID文件是否存在判断存储是否存在。
     */
    public boolean exists() {
        return storage.exists(getFileName(Constants.GIN_SEGMENT_ID_FILE_TYPE));
    }

    /**
     * 分配 numIds 个连续行ID，返回起始行ID。
     *
     * @param numIds 行ID个数
     * @return 起始行ID
     */
    public int getNextRowIDRange(int numIds) {
        if (numIds < 0) {
            throw new IllegalArgumentException("行ID个数不能为负数: " + numIds);
        }
        ensureWritable();
        idLock.lock();
        try {
            int start = currentSegment.nextRowId();
            long end = (long) start + numIds;
            if (end > Integer.MAX_VALUE) {
                throw new IllegalStateException("行ID耗尽: start=" + start + ", numIds=" + numIds);
            }
            currentSegment = currentSegment.withNextRowId((int) end);
            return start;
        } finally {
            idLock.unlock();
        }
    }

    /**
     * 分配下一个段ID并持久化到 .gin_sid。
     *
     * @return 段ID
     * @throws IOException 持久化失败时抛出
     */
    public int getNextSegmentID() throws IOException {
        return getNextSegmentIDRange(1);
    }

    /**
     * 批量分配 n 个连续段ID并持久化，返回起始段ID。
     *
     * @param n 段ID个数
     * @return 起始段ID
     * @throws IOException 持久化失败时抛出，此时计数不变
     */
    public int getNextSegmentIDRange(int n) throws IOException {
        if (n <= 0) {
            throw new IllegalArgumentException("段ID个数必须为正数: " + n);
        }
        ensureWritable();
        idLock.lock();
        try {
            int start = nextAvailableSegmentId;
            long next = (long) start + n;
            if (next > Integer.MAX_VALUE) {
                throw new IllegalStateException("段ID耗尽: start=" + start + ", n=" + n);
            }
            writeSegmentId((int) next);
            nextAvailableSegmentId = (int) next;
            return start;
        } finally {
            idLock.unlock();
        }
    }

    /**
     * 已落盘段数量，由 .gin_seg 长度除以描述符大小得到。
     *
     * @return 段数量
     * @throws IOException 读取失败或文件长度非法时抛出
     */
    public int getNumOfSegments() throws IOException {
        long metadataLength = storage.getFileSize(getFileName(Constants.GIN_SEGMENT_METADATA_FILE_TYPE));
        if (metadataLength % SegmentDescriptor.BYTES != 0) {
            throw new CorruptIndexException("段元数据文件长度非法: " + metadataLength
                + ", file=" + getFileName(Constants.GIN_SEGMENT_METADATA_FILE_TYPE));
        }
        return (int) (metadataLength / SegmentDescriptor.BYTES);
    }

    /**
     * 读取 .gin_sid 中记录的文件格式版本。
     *
     * @return 格式版本
     * @throws IOException 文件不存在、损坏或版本未知时抛出
     */
    public Format getVersion() throws IOException {
        try (RandomAccessFile segmentIdFile = storage.openForRead(getFileName(Constants.GIN_SEGMENT_ID_FILE_TYPE))) {
            verifySegmentIdFileLength(segmentIdFile);
            return Format.fromByte(segmentIdFile.readByte());
        }
    }

    /**
     * 当前段的倒排构建器（只读视图）。
     */
    public Map<String, PostingsBuilder> getPostingsListBuilder() {
        return Collections.unmodifiableMap(currentPostings);
    }

    /**
     * 设置词项在当前段的倒排构建器。
     */
    public void setPostingsBuilder(String term, PostingsBuilder builder) {
        if (term == null) {
            throw new IllegalArgumentException("term 不能为空");
        }
        if (builder == null) {
            throw new IllegalArgumentException("倒排构建器不能为空");
        }
        ensureState(State.OPEN);
        currentPostings.put(term, builder);
    }

    /**
     * 已消化文本量达到阈值时需要落盘当前段；阈值为 0 表示不限制。
     */
    public boolean needToWriteCurrentSegment() {
        return segmentDigestionThresholdBytes != Constants.UNLIMITED_SEGMENT_DIGESTION_THRESHOLD_BYTES
            && currentSize >= segmentDigestionThresholdBytes;
    }

    /**
     * 累加已消化的文本字节数。
     */
    public void incrementCurrentSizeBy(long size) {
        if (size < 0) {
            throw new IllegalArgumentException("文本大小不能为负数: " + size);
        }
        currentSize += size;
    }

    public long getCurrentSize() {
        return currentSize;
    }

    public int getCurrentSegmentID() {
        ensureWritable();
        idLock.lock();
        try {
            return currentSegment.segmentId();
        } finally {
            idLock.unlock();
        }
    }

    /**
     * 将当前段写入倒排、词典、段元数据三个文件，然后开启新段。
     *
     * 三个文件的追加视为一个整体：任一写入失败都会截断回写入前的长度并进入 FAILED 状态。
     *
     * @throws IOException 写入失败时抛出
     */
    public void writeSegment() throws IOException {
        ensureState(State.OPEN);
        state = State.FLUSHING;
        try {
            if (metadataFile == null) {
                initFileStreams();
            }
            writeCurrentSegmentFiles();
            writtenSegmentCount++;
            currentPostings.clear();
            currentSize = 0;
            int newSegmentId = getNextSegmentID();
            idLock.lock();
            try {
                currentSegment = new SegmentDescriptor(newSegmentId, currentSegment.nextRowId(), 0L, 0L);
            } finally {
                idLock.unlock();
            }
        } catch (IOException | RuntimeException exception) {
            state = State.FAILED;
            throw exception;
        }
        state = State.OPEN;
    }

    /**
     * 落盘剩余的非空段，同步并关闭全部文件。必须且只能调用一次，之后存储才可被查询。
     *
     * @throws IOException 落盘或关闭失败时抛出
     */
    public void finalizeStore() throws IOException {
        ensureState(State.OPEN);
        if (!currentPostings.isEmpty()) {
            try {
                writeSegment();
            } catch (IOException | RuntimeException exception) {
                closeFileStreamsQuietly();
                throw exception;
            }
        }
        try {
            if (metadataFile == null) {
                initFileStreams();
            }
            syncFileStreams();
            closeFileStreams();
        } catch (IOException | RuntimeException exception) {
            state = State.FAILED;
            closeFileStreamsQuietly();
            throw exception;
        }
        state = State.FINALIZED;
        logger.info("GIN 索引存储已完成: name={}, part={}, writtenSegments={}", name, storage.getFullPath(), writtenSegmentCount);
    }

    /**
     * 放弃构建中的状态并释放文件句柄，不保证磁盘文件一致。不会抛出异常。
     */
    public void cancel() {
        if (!writable || state == State.FINALIZED) {
            return;
        }
        state = State.CANCELLED;
        currentPostings.clear();
        currentSize = 0;
        closeFileStreamsQuietly();
    }

    public String getName() {
        return name;
    }

    public PartStorage getStorage() {
        return storage;
    }

    public State getState() {
        return state;
    }

    public boolean isWritable() {
        return writable;
    }

    /**
     * 丢弃已缓存的段词典，下次查询时重新加载。
     */
    public void dropSegmentDictionaries() {
        segmentDictionaries.clear();
    }

    public int getCachedDictionaryCount() {
        return segmentDictionaries.size();
    }

    String getFileName(String fileType) {
        return name + fileType;
    }

    DictionaryBlobFormat getDictionaryBlobFormat() {
        return dictionaryBlobFormat;
    }

    SegmentDictionary getCachedDictionary(int segmentId) {
        return segmentDictionaries.get(segmentId);
    }

    /**
     * 缓存段词典；并发加载同一段时保留先写入者。
     *
     * @return 缓存中的词典
     */
    SegmentDictionary cacheDictionary(int segmentId, SegmentDictionary dictionary) {
        SegmentDictionary existing = segmentDictionaries.putIfAbsent(segmentId, dictionary);
        return existing == null ? dictionary : existing;
    }

    private void initialize() throws IOException {
        initSegmentId();
        int firstRowId = readResumeRowId();
        currentSegment = new SegmentDescriptor(getNextSegmentID(), firstRowId, 0L, 0L);
        state = State.OPEN;
        logger.debug("GIN 索引存储已打开: name={}, part={}, segmentId={}, rowId={}",
            name, storage.getFullPath(), currentSegment.segmentId(), firstRowId);
    }

    /**
     * 从 .gin_sid 读取下一个可用段ID；文件不存在时以初始值创建。
     */
    private void initSegmentId() throws IOException {
        String segmentIdFileName = getFileName(Constants.GIN_SEGMENT_ID_FILE_TYPE);
        if (!storage.exists(segmentIdFileName)) {
            writeSegmentId(Constants.FIRST_SEGMENT_ID);
            nextAvailableSegmentId = Constants.FIRST_SEGMENT_ID;
            return;
        }
        try (RandomAccessFile segmentIdFile = storage.openForRead(segmentIdFileName)) {
            verifySegmentIdFileLength(segmentIdFile);
            Format.fromByte(segmentIdFile.readByte());
            int storedSegmentId = segmentIdFile.readInt();
            if (storedSegmentId < Constants.FIRST_SEGMENT_ID) {
                throw new CorruptIndexException("段ID非法: " + storedSegmentId + ", file=" + segmentIdFileName);
            }
            nextAvailableSegmentId = storedSegmentId;
        }
    }

    /**
     * 已有段时从最后一个段的 nextRowId 继续分配，保证行ID不被复用。
     */
    private int readResumeRowId() throws IOException {
        int segmentCount = getNumOfSegments();
        if (segmentCount == 0) {
            return Constants.FIRST_ROW_ID;
        }
        try (RandomAccessFile segmentMetadata = storage.openForRead(getFileName(Constants.GIN_SEGMENT_METADATA_FILE_TYPE))) {
            segmentMetadata.seek((long) (segmentCount - 1) * SegmentDescriptor.BYTES);
            return SegmentDescriptor.readFrom(segmentMetadata).nextRowId();
        }
    }

    private void writeSegmentId(int segmentId) throws IOException {
        byte[] content = ByteBuffer.allocate(Constants.SEGMENT_ID_FILE_BYTES)
            .put(CURRENT_FORMAT.value())
            .putInt(segmentId)
            .array();
        storage.replaceFile(getFileName(Constants.GIN_SEGMENT_ID_FILE_TYPE), content);
    }

    private void verifySegmentIdFileLength(RandomAccessFile segmentIdFile) throws IOException {
        long length = segmentIdFile.length();
        if (length != Constants.SEGMENT_ID_FILE_BYTES) {
            throw new CorruptIndexException("段ID文件长度非法: " + length
                + ", file=" + getFileName(Constants.GIN_SEGMENT_ID_FILE_TYPE));
        }
    }

    private void initFileStreams() throws IOException {
        RandomAccessFile openedMetadata = storage.openForAppend(getFileName(Constants.GIN_SEGMENT_METADATA_FILE_TYPE));
        try {
            RandomAccessFile openedDict = storage.openForAppend(getFileName(Constants.GIN_DICTIONARY_FILE_TYPE));
            try {
                postingsFile = storage.openForAppend(getFileName(Constants.GIN_POSTINGS_FILE_TYPE));
            } catch (IOException exception) {
                openedDict.close();
                throw exception;
            }
            dictFile = openedDict;
        } catch (IOException exception) {
            openedMetadata.close();
            throw exception;
        }
        metadataFile = openedMetadata;
    }

    /**
     * 按字节序写出当前段的倒排与 FST，最后追加段描述符作为提交记录。
     */
    private void writeCurrentSegmentFiles() throws IOException {
        long postingsStart = postingsFile.length();
        long dictStart = dictFile.length();
        long metadataStart = metadataFile.length();
        SegmentDescriptor descriptor;
        idLock.lock();
        try {
            descriptor = new SegmentDescriptor(currentSegment.segmentId(), currentSegment.nextRowId(), postingsStart, dictStart);
        } finally {
            idLock.unlock();
        }

        try {
            TreeMap<BytesRef, PostingsBuilder> sortedPostings = new TreeMap<>();
            for (Map.Entry<String, PostingsBuilder> entry : currentPostings.entrySet()) {
                sortedPostings.put(new BytesRef(entry.getKey()), entry.getValue());
            }

            TermDictionaryBuilder dictionaryBuilder = new TermDictionaryBuilder();
            long relativeOffset = 0L;
            for (Map.Entry<BytesRef, PostingsBuilder> entry : sortedPostings.entrySet()) {
                dictionaryBuilder.add(entry.getKey(), relativeOffset);
                relativeOffset += entry.getValue().serialize(postingsFile);
            }

            byte[] dictionaryBlob = dictionaryBuilder.toBlob();
            long dictBytes = dictionaryBlobFormat.write(dictionaryBlob, dictFile);
            descriptor.writeTo(metadataFile);

            logger.debug("GIN 段已落盘: name={}, segmentId={}, terms={}, postingsBytes={}, fstBytes={}, dictBytes={}",
                name, descriptor.segmentId(), sortedPostings.size(), relativeOffset, dictionaryBlob.length, dictBytes);
        } catch (IOException | RuntimeException exception) {
            truncateQuietly(postingsFile, postingsStart, exception);
            truncateQuietly(dictFile, dictStart, exception);
            truncateQuietly(metadataFile, metadataStart, exception);
            throw exception;
        }
    }

    private static void truncateQuietly(RandomAccessFile file, long length, Exception cause) {
        try {
            file.setLength(length);
            file.seek(length);
        } catch (IOException truncateException) {
            cause.addSuppressed(truncateException);
        }
    }

    private void syncFileStreams() throws IOException {
        metadataFile.getFD().sync();
        dictFile.getFD().sync();
        postingsFile.getFD().sync();
    }

    private void closeFileStreams() throws IOException {
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
        postingsFile = null;
        dictFile = null;
        metadataFile = null;
        if (failure != null) {
            throw failure;
        }
    }

    private void closeFileStreamsQuietly() {
        try {
            closeFileStreams();
        } catch (IOException exception) {
            logger.warn("关闭 GIN 索引文件失败: name={}, part={} - {}", name, storage.getFullPath(), exception.getMessage());
        }
    }

    private void ensureWritable() {
        if (!writable) {
            throw new IllegalStateException("GinIndexStore 为只读: " + name);
        }
    }

    private void ensureState(State expected) {
        ensureWritable();
        if (state != expected) {
            throw new IllegalStateException("GinIndexStore 状态为 " + state + "，期望 " + expected + ": " + name);
        }
    }

    @Override
    public String toString() {
        return "GinIndexStore{name=" + name + ", part=" + storage.getFullPath() + ", state=" + state + "}";
    }
}
