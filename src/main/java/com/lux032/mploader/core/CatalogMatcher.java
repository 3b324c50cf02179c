package com.lux032.mploader.core;

import com.lux032.mploader.exception.NoMatchException;
import com.lux032.mploader.model.MatchCandidate;
import com.lux032.mploader.model.NormalizedQuery;
import com.lux032.mploader.service.CatalogSearch;
import com.lux032.mploader.util.TextSimilarity;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 目录匹配
 * 调用目录搜索并按评分选择最佳候选
 *
 * 排序是全序的: 评分降序, 然后目录报告的质量降序, 最后按返回顺序,
 * 因此相同的搜索结果总是选出同一个候选, 目标文件名也就保持稳定
 */
@Slf4j
public class CatalogMatcher {

    // 时长容差(秒), 容差内视为完全一致
    private static final int DURATION_TOLERANCE = 3;
    // 超出容差后线性衰减到 0 的区间(秒)
    private static final int DURATION_DECAY_WINDOW = 30;

    private static final Pattern TRAILING_BRACKETS = Pattern.compile("\\s*[(\\[][^)\\]]*[)\\]]\\s*$");

    private final CatalogSearch catalogSearch;
    private final MatchWeights weights;

    public CatalogMatcher(CatalogSearch catalogSearch, MatchWeights weights) {
        this.catalogSearch = catalogSearch;
        this.weights = weights;
    }

    /**
     * 查找最佳匹配
     * @throws NoMatchException 没有候选, 或所有候选的标题相似度都低于阈值
     */
    public MatchCandidate match(NormalizedQuery query) throws NoMatchException {
        List<MatchCandidate> candidates = catalogSearch.search(query.getSearchTitle(), query.getHints());
        if (candidates == null || candidates.isEmpty()) {
            throw new NoMatchException("No catalog results for: " + query.getSearchTitle());
        }

        List<ScoredCandidate> accepted = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            MatchCandidate candidate = candidates.get(i);
            if (candidate == null) {
                continue;
            }
            double titleScore = titleSimilarity(query.getSearchTitle(), candidate);
            if (titleScore < weights.getMinSimilarity()) {
                log.debug("候选相似度过低 {} < {}: {}", String.format("%.2f", titleScore),
                    weights.getMinSimilarity(), candidate);
                continue;
            }
            double score = score(query, candidate, titleScore);
            log.debug("候选评分 {}: {}", String.format("%.3f", score), candidate);
            accepted.add(new ScoredCandidate(candidate, score, i));
        }

        if (accepted.isEmpty()) {
            throw new NoMatchException(String.format("No candidate above similarity %.2f for: %s",
                weights.getMinSimilarity(), query.getSearchTitle()));
        }

        accepted.sort(RANKING);
        ScoredCandidate best = accepted.get(0);
        log.info("匹配成功: '{}' -> {} - {} (评分: {})", query.getSearchTitle(),
            best.candidate.getTitle(), best.candidate.getArtist(), String.format("%.3f", best.score));
        return best.candidate;
    }

    /**
     * 计算综合评分
     * 无法计算的分项(时长未知, 没有艺术家提示)不参与, 其余权重重新归一化
     */
    double score(NormalizedQuery query, MatchCandidate candidate, double titleScore) {
        double weighted = weights.getTitleWeight() * titleScore;
        double totalWeight = weights.getTitleWeight();

        Integer queryDuration = query.getDurationSeconds();
        Integer candidateDuration = candidate.getDurationSeconds();
        if (queryDuration != null && candidateDuration != null && queryDuration > 0 && candidateDuration > 0) {
            weighted += weights.getDurationWeight() * durationCloseness(queryDuration, candidateDuration);
            totalWeight += weights.getDurationWeight();
        }

        List<String> hints = query.getHints();
        if (!hints.isEmpty()) {
            weighted += weights.getArtistWeight() * artistMatch(hints, candidate.getArtist());
            totalWeight += weights.getArtistWeight();
        }

        return totalWeight > 0 ? weighted / totalWeight : 0.0;
    }

    /**
     * 标题相似度
     * 视频标题常带有 "艺术家 - 标题" 形式, 目录标题常带有 "(From ...)" 后缀, 取各种组合中的最大值
     */
    double titleSimilarity(String searchTitle, MatchCandidate candidate) {
        String title = candidate.getTitle();
        if (title == null) {
            return 0.0;
        }
        String bare = TRAILING_BRACKETS.matcher(title).replaceAll("");
        double best = Math.max(
            TextSimilarity.similarity(searchTitle, title),
            TextSimilarity.similarity(searchTitle, bare));

        String artist = candidate.getArtist();
        if (artist != null && !artist.isBlank()) {
            best = Math.max(best, TextSimilarity.similarity(searchTitle, artist + " " + bare));
            best = Math.max(best, TextSimilarity.similarity(searchTitle, bare + " " + artist));
        }
        return best;
    }

    static double durationCloseness(int expectedSeconds, int actualSeconds) {
        int diff = Math.abs(expectedSeconds - actualSeconds);
        if (diff <= DURATION_TOLERANCE) {
            return 1.0;
        }
        return Math.max(0.0, 1.0 - (double) (diff - DURATION_TOLERANCE) / DURATION_DECAY_WINDOW);
    }

    /**
     * 艺术家匹配: 任一提示与候选的任一艺术家最接近的相似度, 包含关系视为完全匹配
     */
    static double artistMatch(List<String> hints, String candidateArtists) {
        if (candidateArtists == null || candidateArtists.isBlank()) {
            return 0.0;
        }
        String[] names = candidateArtists.split("\\s*[,&]\\s*");
        double best = 0.0;
        for (String hint : hints) {
            for (String name : names) {
                if (TextSimilarity.containsEither(hint, name)) {
                    return 1.0;
                }
                best = Math.max(best, TextSimilarity.similarity(hint, name));
            }
        }
        return best;
    }

    private static final Comparator<ScoredCandidate> RANKING = Comparator
        .comparingDouble((ScoredCandidate s) -> s.score).reversed()
        .thenComparing(Comparator.comparingDouble((ScoredCandidate s) -> s.candidate.getQualityScore()).reversed())
        .thenComparingInt(s -> s.responseIndex);

    private static class ScoredCandidate {
        private final MatchCandidate candidate;
        private final double score;
        private final int responseIndex;

        private ScoredCandidate(MatchCandidate candidate, double score, int responseIndex) {
            this.candidate = candidate;
            this.score = score;
            this.responseIndex = responseIndex;
        }
    }
}
