package com.lux032.mploader.core;

import com.lux032.mploader.model.NormalizedQuery;
import com.lux032.mploader.model.SourceItem;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 标题清洗
 * 去除视频标题中的装饰标记, 生成可用于搜索的标题和艺术家提示
 * 纯函数, 不会失败
 */
public class TitleNormalizer {

    // 括号分组: (...) [...] {...}
    private static final Pattern BRACKET_GROUP = Pattern.compile("[(\\[{]([^)\\]}]*)[)\\]}]");

    // 合作艺术家标记, 括号内整体匹配
    private static final Pattern FEATURING_GROUP = Pattern.compile(
        "^\\s*(?:ft\\.?|feat\\.?|featuring)\\s+(.+?)\\s*$", Pattern.CASE_INSENSITIVE);

    // 括号外的合作艺术家, 截取到两侧带空格的分隔符, 竖线, 括号或结尾
    // 名字中的连字符(Jay-Z, A-ha)不作为分隔符
    private static final Pattern FEATURING_INLINE = Pattern.compile(
        "\\s+(?:ft\\.?|feat\\.?|featuring)\\s+(.+?)(?=\\s+[-–—]\\s+|\\s*\\||\\s*[(\\[{]|\\s*$)",
        Pattern.CASE_INSENSITIVE);

    // 噪声标记, 括号内出现任一即整体移除
    private static final Pattern NOISE_MARKER = Pattern.compile(
        "\\b(?:official|video|audio|lyrics?|lyrical|visuali[sz]er|music\\s+video|mv|hd|hq|4k|1080p|720p"
            + "|remix|cover|live|acoustic|slowed|reverb|sped\\s+up|lo-?fi|8d|explicit|clean"
            + "|full\\s+song|full\\s+version)\\b",
        Pattern.CASE_INSENSITIVE);

    private static final Pattern BARE_QUALITY_TAG = Pattern.compile("\\b(?:HD|HQ|4K)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern PIPE_SUFFIX = Pattern.compile("\\|.*$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern EDGE_SEPARATORS = Pattern.compile("^[\\s\\-|–—:]+|[\\s\\-|–—:]+$");

    // 频道名后缀, 反复去除直到稳定
    private static final Pattern CHANNEL_SUFFIX = Pattern.compile(
        "(?:\\s*-\\s*topic|vevo|\\s+official(?:\\s+artist)?(?:\\s+channel)?|\\s+music|\\s+records"
            + "|\\s+tv|\\s+channel)\\s*$",
        Pattern.CASE_INSENSITIVE);

    public NormalizedQuery normalize(SourceItem item) {
        NormalizedQuery query = normalize(item.getRawTitle(), item.getUploader());
        return new NormalizedQuery(query.getSearchTitle(), query.getArtistHint(),
            query.getFeaturedArtist(), item.getDurationSeconds());
    }

    public NormalizedQuery normalize(String rawTitle, String uploader) {
        String raw = rawTitle == null ? "" : rawTitle;
        String featured = null;

        // 1. 检查所有括号分组
        StringBuilder cleaned = new StringBuilder();
        Matcher group = BRACKET_GROUP.matcher(raw);
        int last = 0;
        while (group.find()) {
            cleaned.append(raw, last, group.start());
            String content = group.group(1);
            Matcher feat = FEATURING_GROUP.matcher(content);
            if (feat.matches()) {
                if (featured == null) {
                    featured = feat.group(1).trim();
                }
            } else if (!NOISE_MARKER.matcher(content).find()) {
                // 普通括号内容(如电影名)保留
                cleaned.append(group.group());
            }
            cleaned.append(' ');
            last = group.end();
        }
        cleaned.append(raw.substring(last));
        String title = cleaned.toString();

        // 2. 括号外的 ft./feat.
        Matcher inline = FEATURING_INLINE.matcher(title);
        if (inline.find()) {
            if (featured == null) {
                featured = inline.group(1).trim();
            }
            title = title.substring(0, inline.start()) + " " + title.substring(inline.end());
        }

        // 3. 质量标记和竖线后的内容
        title = PIPE_SUFFIX.matcher(title).replaceAll("");
        title = BARE_QUALITY_TAG.matcher(title).replaceAll("");

        // 4. 合并空白, 去除首尾分隔符
        title = WHITESPACE.matcher(title).replaceAll(" ");
        title = EDGE_SEPARATORS.matcher(title).replaceAll("");

        // 5. 清洗后为空时回退到原始标题
        if (title.isEmpty()) {
            title = raw.trim();
        }

        if (featured != null) {
            featured = EDGE_SEPARATORS.matcher(WHITESPACE.matcher(featured).replaceAll(" ")).replaceAll("");
            if (featured.isEmpty()) {
                featured = null;
            }
        }

        return new NormalizedQuery(title, cleanUploader(uploader), featured, null);
    }

    /**
     * 去除频道名后缀噪声, 如 "XXX - Topic", "XXXVEVO", "XXX Official"
     */
    String cleanUploader(String uploader) {
        if (uploader == null) {
            return null;
        }
        String current = WHITESPACE.matcher(uploader).replaceAll(" ").trim();
        String previous;
        do {
            previous = current;
            current = CHANNEL_SUFFIX.matcher(current).replaceAll("").trim();
        } while (!current.equals(previous) && !current.isEmpty());

        if (current.isEmpty()) {
            // 整个名字都是"后缀"时保留原名
            current = previous;
        }
        current = EDGE_SEPARATORS.matcher(current).replaceAll("");
        return current.isEmpty() ? null : current;
    }
}
