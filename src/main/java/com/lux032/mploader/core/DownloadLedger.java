package com.lux032.mploader.core;

import com.lux032.mploader.util.FileNameUtils;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 已下载文件台账
 * 输出目录的文件列表只在运行开始时读取一次, 运行期间完成的文件通过 record 追加
 */
@Slf4j
public class DownloadLedger {

    private final Set<String> snapshot;
    private final Set<String> recorded = ConcurrentHashMap.newKeySet();

    DownloadLedger(Set<String> snapshot) {
        this.snapshot = Collections.unmodifiableSet(snapshot);
    }

    /**
     * 读取输出目录中现有的 mp3 文件名, 目录不存在时为空
     */
    public static DownloadLedger snapshot(Path outputDirectory) throws IOException {
        Set<String> names = new HashSet<>();
        if (Files.isDirectory(outputDirectory)) {
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(outputDirectory)) {
                for (Path path : stream) {
                    // 扩展名不区分大小写, 如 .MP3
                    String key = FileNameUtils.comparisonKey(path.getFileName().toString());
                    if (key.endsWith(FileNameUtils.MP3_EXTENSION) && Files.isRegularFile(path)) {
                        names.add(key);
                    }
                }
            }
        }
        log.debug("输出目录已有 {} 个文件: {}", names.size(), outputDirectory);
        return new DownloadLedger(names);
    }

    public boolean exists(Path destinationPath) {
        String key = FileNameUtils.comparisonKey(destinationPath.getFileName().toString());
        return snapshot.contains(key) || recorded.contains(key);
    }

    /**
     * 记录本次运行中完成的文件
     */
    public void record(Path destinationPath) {
        recorded.add(FileNameUtils.comparisonKey(destinationPath.getFileName().toString()));
    }

    public int size() {
        return snapshot.size() + recorded.size();
    }
}
