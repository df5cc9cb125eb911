package com.ginindex.storage;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * 基于本地目录的分片存储实现。
 */
public final class LocalPartStorage implements PartStorage {
    private final Path partDirectory;

    /**
     * 创建分片存储，目录不存在时自动创建。
     *
     * @param partDirectory 分片目录
     * @throws IOException 目录创建失败时抛出
     */
    public LocalPartStorage(Path partDirectory) throws IOException {
        if (partDirectory == null) {
            throw new IllegalArgumentException("分片目录不能为空");
        }
        this.partDirectory = partDirectory.toAbsolutePath().normalize();
        Files.createDirectories(this.partDirectory);
    }

    @Override
    public String getFullPath() {
        return partDirectory.toString();
    }

    @Override
    public boolean exists(String fileName) {
        return Files.isRegularFile(resolve(fileName));
    }

    @Override
    public long getFileSize(String fileName) throws IOException {
        Path file = resolve(fileName);
        if (!Files.exists(file)) {
            return 0L;
        }
        return Files.size(file);
    }

    @Override
    public RandomAccessFile openForAppend(String fileName) throws IOException {
        RandomAccessFile randomAccessFile = new RandomAccessFile(resolve(fileName).toFile(), "rw");
        try {
            randomAccessFile.seek(randomAccessFile.length());
        } catch (IOException exception) {
            randomAccessFile.close();
            throw exception;
        }
        return randomAccessFile;
    }

    @Override
    public RandomAccessFile openForRead(String fileName) throws IOException {
        Path file = resolve(fileName);
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(file.toString());
        }
        return new RandomAccessFile(file.toFile(), "r");
    }

    @Override
    public void replaceFile(String fileName, byte[] content) throws IOException {
        Path target = resolve(fileName);
        Path temporary = resolve(fileName + ".tmp");
        Files.write(temporary, content);
        try {
            Files.move(temporary, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException exception) {
            Files.move(temporary, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Override
    public List<String> listFiles() throws IOException {
        List<String> fileNames = new ArrayList<>();
        try (Stream<Path> entries = Files.list(partDirectory)) {
            entries.filter(Files::isRegularFile)
                .forEach(entry -> fileNames.add(entry.getFileName().toString()));
        }
        fileNames.sort(null);
        return fileNames;
    }

    /**
     * 解析文件路径并拒绝越出分片目录的文件名。
     */
    private Path resolve(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException("文件名不能为空");
        }
        Path resolved = partDirectory.resolve(fileName).normalize();
        if (!partDirectory.equals(resolved.getParent())) {
            throw new IllegalArgumentException("文件名必须位于分片目录内: " + fileName);
        }
        return resolved;
    }

    @Override
    public String toString() {
        return "LocalPartStorage{" + partDirectory + "}";
    }
}
