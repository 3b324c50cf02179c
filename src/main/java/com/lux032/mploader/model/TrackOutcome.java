package com.lux032.mploader.model;

import java.nio.file.Path;

/**
 * 单个条目的最终处理结果
 * 每个 SourceItem 只产生一个结果, 由处理该条目的任务写入一次
 */
public class TrackOutcome {

    public enum Kind {
        DOWNLOADED,
        SKIPPED,
        FAILED,
        CANCELLED
    }

    private final Kind kind;
    private final SourceItem item;
    private final Path destinationPath;
    private final SkipReason skipReason;
    private final ErrorKind errorKind;
    private final String message;

    private TrackOutcome(Kind kind, SourceItem item, Path destinationPath,
                         SkipReason skipReason, ErrorKind errorKind, String message) {
        this.kind = kind;
        this.item = item;
        this.destinationPath = destinationPath;
        this.skipReason = skipReason;
        this.errorKind = errorKind;
        this.message = message;
    }

    public static TrackOutcome downloaded(SourceItem item, Path destinationPath) {
        return new TrackOutcome(Kind.DOWNLOADED, item, destinationPath, null, null, null);
    }

    public static TrackOutcome skipped(SourceItem item, Path destinationPath, SkipReason reason) {
        return new TrackOutcome(Kind.SKIPPED, item, destinationPath, reason, null, null);
    }

    public static TrackOutcome failed(SourceItem item, ErrorKind errorKind, String message) {
        return new TrackOutcome(Kind.FAILED, item, null, null, errorKind, message);
    }

    public static TrackOutcome cancelled(SourceItem item) {
        return new TrackOutcome(Kind.CANCELLED, item, null, null, null, null);
    }

    /**
     * 绑定到具体条目(TrackFetcher 产生的结果不知道条目)
     */
    public TrackOutcome forItem(SourceItem sourceItem) {
        return new TrackOutcome(kind, sourceItem, destinationPath, skipReason, errorKind, message);
    }

    public Kind getKind() {
        return kind;
    }

    public SourceItem getItem() {
        return item;
    }

    public Path getDestinationPath() {
        return destinationPath;
    }

    public SkipReason getSkipReason() {
        return skipReason;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public String getMessage() {
        return message;
    }

    public boolean isDownloaded() {
        return kind == Kind.DOWNLOADED;
    }

    public boolean isSkipped() {
        return kind == Kind.SKIPPED;
    }

    public boolean isFailed() {
        return kind == Kind.FAILED;
    }

    public boolean isCancelled() {
        return kind == Kind.CANCELLED;
    }

    /**
     * 已下载或跳过(文件已存在)都视为成功
     */
    public boolean isSuccess() {
        return kind == Kind.DOWNLOADED || kind == Kind.SKIPPED;
    }

    @Override
    public String toString() {
        String title = item != null ? item.getRawTitle() : "?";
        switch (kind) {
            case DOWNLOADED:
                return String.format("Downloaded{'%s' -> %s}", title, destinationPath);
            case SKIPPED:
                return String.format("Skipped{'%s', %s}", title, skipReason);
            case FAILED:
                return String.format("Failed{'%s', %s: %s}", title, errorKind, message);
            default:
                return String.format("Cancelled{'%s'}", title);
        }
    }
}
