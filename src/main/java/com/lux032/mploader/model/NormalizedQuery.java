package com.lux032.mploader.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 清洗后的搜索条件
 */
@Data
public class NormalizedQuery {
    private final String searchTitle;
    private final String artistHint; // 来自上传者, 可能为 null
    private final String featuredArtist; // 来自 ft./feat., 可能为 null
    private final Integer durationSeconds;

    /**
     * 所有可用的艺术家提示, 上传者在前, 合作艺术家在后
     */
    public List<String> getHints() {
        List<String> hints = new ArrayList<>(2);
        if (artistHint != null && !artistHint.isBlank()) {
            hints.add(artistHint);
        }
        if (featuredArtist != null && !featuredArtist.isBlank()) {
            hints.add(featuredArtist);
        }
        return Collections.unmodifiableList(hints);
    }
}
