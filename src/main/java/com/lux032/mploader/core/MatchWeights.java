package com.lux032.mploader.core;

import com.lux032.mploader.config.LoaderConfig;
import lombok.Data;

/**
 * 匹配评分权重
 * 没有统一的"正确"权重, 由配置提供
 */
@Data
public class MatchWeights {
    private final double titleWeight;
    private final double durationWeight;
    private final double artistWeight;
    private final double minSimilarity; // 标题相似度低于此值的候选直接丢弃

    public MatchWeights(double titleWeight, double durationWeight, double artistWeight, double minSimilarity) {
        if (titleWeight < 0 || durationWeight < 0 || artistWeight < 0) {
            throw new IllegalArgumentException("match weights must not be negative");
        }
        if (titleWeight + durationWeight + artistWeight <= 0) {
            throw new IllegalArgumentException("at least one match weight must be positive");
        }
        this.titleWeight = titleWeight;
        this.durationWeight = durationWeight;
        this.artistWeight = artistWeight;
        this.minSimilarity = minSimilarity;
    }

    public static MatchWeights fromConfig(LoaderConfig config) {
        return new MatchWeights(
            config.getTitleWeight(),
            config.getDurationWeight(),
            config.getArtistWeight(),
            config.getMinSimilarity()
        );
    }
}
