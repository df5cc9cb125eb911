package com.ginindex.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ginindex.config.StoreConfig;
import com.ginindex.postings.PostingsBuilder;
import com.ginindex.postings.PostingsList;
import com.ginindex.storage.LocalPartStorage;
import com.ginindex.store.GinIndexStore;
import com.ginindex.store.GinIndexStoreDeserializer;
import com.ginindex.store.GinIndexStoreFactory;
import com.ginindex.store.PostingsCache;
import com.ginindex.store.PostingsCacheForStore;
import com.ginindex.store.SegmentDescriptor;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
    name = "gin",
    description = "🗂 GIN 倒排索引存储工具",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.BuildSubcommand.class,
        MainCommand.InspectSubcommand.class,
        MainCommand.LookupSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("🗂 GIN 倒排索引存储工具");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    /**
     * 索引摘要，用于 inspect 的 JSON 输出。
     */
    public record StoreSummary(String name, String partPath, int version, int segmentCount,
                               int cachedDictionaries, List<SegmentDescriptor> segments) {
    }

    @Command(name = "build", description = "📂 从文本文件构建索引（每行一行数据，空白分隔词项）")
    static class BuildSubcommand implements Callable<Integer> {

        @Parameters(index = "0", description = "分片目录")
        private Path partDir;

        @Parameters(index = "1", description = "索引名")
        private String name;

        @Parameters(index = "2", description = "输入文本文件")
        private Path inputFile;

        @Option(names = {"-c", "--config"}, description = "存储配置文件 (JSON)")
        private Path configFile;

        @Option(names = {"-t", "--threshold"}, description = "段消化阈值（字节，0 表示不限制），覆盖配置文件")
        private Long threshold;

        @Override
        public Integer call() {
            try {
                StoreConfig config = configFile == null ? StoreConfig.defaults() : StoreConfig.readFrom(configFile.toFile());
                if (threshold != null) {
                    config.setSegmentDigestionThresholdBytes(threshold);
                }
                long start = System.currentTimeMillis();
                GinIndexStore store = new GinIndexStore(name, new LocalPartStorage(partDir), config);
                int rows = 0;
                try (BufferedReader reader = Files.newBufferedReader(inputFile, StandardCharsets.UTF_8)) {
                    String line;
                    while ((line = reader.readLine()) != null) {
                        indexRow(store, line);
                        rows++;
                    }
                    store.finalizeStore();
                } catch (IOException | RuntimeException exception) {
                    store.cancel();
                    throw exception;
                }
                long elapsed = System.currentTimeMillis() - start;
                System.out.println("✅ 构建完成！");
                System.out.println("   行数: " + rows);
                System.out.println("   段数量: " + store.getNumOfSegments());
                System.out.println("   用时: " + elapsed + "ms");
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 构建失败: " + exception.getMessage());
                return 1;
            }
        }

        private void indexRow(GinIndexStore store, String line) throws IOException {
            int rowId = store.getNextRowIDRange(1);
            for (String term : line.trim().split("\\s+")) {
                if (term.isEmpty()) {
                    continue;
                }
                PostingsBuilder builder = store.getPostingsListBuilder().get(term);
                if (builder == null) {
                    builder = new PostingsBuilder();
                    store.setPostingsBuilder(term, builder);
                }
                builder.add(rowId);
            }
            store.incrementCurrentSizeBy(line.getBytes(StandardCharsets.UTF_8).length);
            if (store.needToWriteCurrentSegment()) {
                store.writeSegment();
            }
        }
    }

    @Command(name = "inspect", description = "📊 查看索引的段信息")
    static class InspectSubcommand implements Callable<Integer> {

        @Parameters(index = "0", description = "分片目录")
        private Path partDir;

        @Parameters(index = "1", description = "索引名")
        private String name;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @Override
        public Integer call() {
            try (GinIndexStoreFactory factory = new GinIndexStoreFactory()) {
                Optional<GinIndexStore> store = factory.get(name, new LocalPartStorage(partDir));
                if (store.isEmpty()) {
                    System.err.println("⚠️ 索引不存在: " + name);
                    return 1;
                }
                StoreSummary summary = summarize(store.get());
                if ("json".equalsIgnoreCase(format)) {
                    printJsonSummary(summary);
                } else {
                    printTextSummary(summary);
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 读取索引失败: " + exception.getMessage());
                return 1;
            }
        }

        private StoreSummary summarize(GinIndexStore store) throws IOException {
            try (GinIndexStoreDeserializer deserializer = new GinIndexStoreDeserializer(store)) {
                deserializer.readSegments();
                return new StoreSummary(store.getName(), store.getStorage().getFullPath(),
                    Byte.toUnsignedInt(store.getVersion().value()), store.getNumOfSegments(),
                    store.getCachedDictionaryCount(), deserializer.getSegments());
            }
        }

        private void printTextSummary(StoreSummary summary) {
            System.out.println("📊 索引状态");
            System.out.println("═══════════");
            System.out.println("📁 分片目录: " + summary.partPath());
            System.out.println("🏷 索引名: " + summary.name());
            System.out.println("🔖 格式版本: " + summary.version());
            System.out.println("📦 段数量: " + summary.segmentCount());
            for (SegmentDescriptor segment : summary.segments()) {
                System.out.printf("   段 %d: nextRowId=%d, postingsStart=%d, dictStart=%d%n",
                    segment.segmentId(), segment.nextRowId(), segment.postingsStartOffset(), segment.dictStartOffset());
            }
        }

        private void printJsonSummary(StoreSummary summary) throws IOException {
            ObjectMapper mapper = new ObjectMapper();
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(summary));
        }
    }

    @Command(name = "lookup", description = "🔎 查询词项所在的行")
    static class LookupSubcommand implements Callable<Integer> {

        @Parameters(index = "0", description = "分片目录")
        private Path partDir;

        @Parameters(index = "1", description = "索引名")
        private String name;

        @Parameters(index = "2..*", arity = "1..*", description = "要查询的词项")
        private List<String> terms;

        @Override
        public Integer call() {
            try (GinIndexStoreFactory factory = new GinIndexStoreFactory()) {
                Optional<GinIndexStore> store = factory.get(name, new LocalPartStorage(partDir));
                if (store.isEmpty()) {
                    System.err.println("⚠️ 索引不存在: " + name);
                    return 1;
                }
                PostingsCacheForStore cacheForStore = new PostingsCacheForStore(store.get());
                PostingsCache postingsCache = cacheForStore.getOrCreatePostings(String.join(" ", terms), terms);
                for (String term : terms) {
                    Map<Integer, PostingsList> segmented = postingsCache.getSegmentedPostings(term);
                    PostingsList merged = postingsCache.getMergedPostings(term);
                    if (merged.isEmpty()) {
                        System.out.println("⚠️ " + term + ": 未找到");
                        continue;
                    }
                    System.out.println("🔎 " + term + " (" + merged.cardinality() + " 行, "
                        + segmented.size() + " 段): " + formatRowIds(merged));
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 查询失败: " + exception.getMessage());
                return 1;
            }
        }

        private String formatRowIds(PostingsList postingsList) {
            List<String> rowIds = new ArrayList<>();
            Arrays.stream(postingsList.toArray()).limit(100).forEach(rowId -> rowIds.add(Integer.toString(rowId)));
            String joined = String.join(", ", rowIds);
            return postingsList.cardinality() > 100 ? joined + ", ..." : joined;
        }
    }
}
