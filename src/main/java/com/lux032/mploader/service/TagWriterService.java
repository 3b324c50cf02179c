package com.lux032.mploader.service;

import com.lux032.mploader.exception.TagWriteException;
import com.lux032.mploader.model.TagFields;
import lombok.extern.slf4j.Slf4j;
import org.jaudiotagger.audio.AudioFile;
import org.jaudiotagger.audio.AudioFileIO;
import org.jaudiotagger.tag.FieldDataInvalidException;
import org.jaudiotagger.tag.FieldKey;
import org.jaudiotagger.tag.Tag;
import org.jaudiotagger.tag.images.Artwork;
import org.jaudiotagger.tag.images.StandardArtwork;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 标签写入服务
 * 使用 JAudioTagger 写入文本标签和封面
 */
@Slf4j
public class TagWriterService implements TagWriter {

    @Override
    public void writeTags(Path audioFile, TagFields fields, byte[] artwork) throws TagWriteException {
        if (!Files.isRegularFile(audioFile)) {
            throw new TagWriteException("Audio file does not exist: " + audioFile);
        }

        try {
            log.debug("开始更新标签: {}", audioFile.getFileName());
            AudioFile audioFileObj = AudioFileIO.read(audioFile.toFile());
            Tag tag = audioFileObj.getTagOrCreateAndSetDefault();

            updateTextTags(tag, fields);

            if (artwork != null && artwork.length > 0) {
                Artwork cover = new StandardArtwork();
                cover.setBinaryData(artwork);
                cover.setMimeType(detectMimeType(artwork));
                tag.deleteArtworkField();
                tag.setField(cover);
            }

            audioFileObj.commit();
        } catch (Exception e) {
            log.error("写入标签失败: {} - {}", audioFile.getFileName(), e.getMessage());
            throw new TagWriteException("Failed to write tags to " + audioFile.getFileName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * 更新文本标签, 空值跳过
     */
    private void updateTextTags(Tag tag, TagFields fields) throws FieldDataInvalidException {
        setIfPresent(tag, FieldKey.TITLE, fields.getTitle());
        setIfPresent(tag, FieldKey.ARTIST, fields.getArtist());
        setIfPresent(tag, FieldKey.ALBUM, fields.getAlbum());
        setIfPresent(tag, FieldKey.ALBUM_ARTIST, fields.getAlbumArtist());
        if (fields.getYear() != null && fields.getYear() > 0) {
            tag.setField(FieldKey.YEAR, String.valueOf(fields.getYear()));
        }
        setIfPresent(tag, FieldKey.COMPOSER, fields.getComposer());
        setIfPresent(tag, FieldKey.RECORD_LABEL, fields.getLabel());
        setIfPresent(tag, FieldKey.GENRE, fields.getGenre());
        setIfPresent(tag, FieldKey.COPYRIGHT, fields.getCopyright());
        setIfPresent(tag, FieldKey.COMMENT, buildComment(fields));
    }

    private void setIfPresent(Tag tag, FieldKey key, String value) throws FieldDataInvalidException {
        if (value != null && !value.isEmpty()) {
            tag.setField(key, value);
        }
    }

    /**
     * 注释: 时长和来源地址, 如 "Duration 3:53; URL https://..."
     */
    static String buildComment(TagFields fields) {
        List<String> parts = new ArrayList<>();
        String duration = fields.formattedDuration();
        if (duration != null) {
            parts.add("Duration " + duration);
        }
        if (fields.getUrl() != null && !fields.getUrl().isEmpty()) {
            parts.add("URL " + fields.getUrl());
        }
        return parts.isEmpty() ? null : String.join("; ", parts);
    }

    private static String detectMimeType(byte[] data) {
        if (data.length >= 8 && (data[0] & 0xFF) == 0x89 && data[1] == 'P' && data[2] == 'N' && data[3] == 'G') {
            return "image/png";
        }
        return "image/jpeg";
    }
}
