package com.lux032.mploader.util;

import java.text.Normalizer;
import java.util.Locale;

/**
 * 字符串相似度计算
 */
public final class TextSimilarity {

    private TextSimilarity() {
    }

    /**
     * 比较前的规范化: 去除重音符号, 转小写, 只保留字母数字, 合并空白
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFD)
            .replaceAll("\\p{M}", "");
        return decomposed.toLowerCase(Locale.ROOT)
            .replace("&", " and ")
            .replaceAll("[^\\p{L}\\p{N}]+", " ")
            .trim();
    }

    /**
     * 基于编辑距离的相似度
     * @return 0.0-1.0, 1.0 表示规范化后完全相同
     */
    public static double similarity(String a, String b) {
        String left = normalize(a);
        String right = normalize(b);
        if (left.isEmpty() && right.isEmpty()) {
            return 1.0;
        }
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        if (left.equals(right)) {
            return 1.0;
        }

        int distance = editDistance(left, right);
        int maxLength = Math.max(left.length(), right.length());
        return Math.max(0.0, 1.0 - (double) distance / maxLength);
    }

    /**
     * 一方(规范化后)按单词边界包含另一方时视为匹配
     */
    public static boolean containsEither(String a, String b) {
        String left = " " + normalize(a) + " ";
        String right = " " + normalize(b) + " ";
        if (left.isBlank() || right.isBlank()) {
            return false;
        }
        return left.contains(right) || right.contains(left);
    }

    /**
     * Levenshtein 编辑距离, 只保留两行 DP 表
     */
    static int editDistance(String a, String b) {
        int m = a.length();
        int n = b.length();
        int[] previous = new int[n + 1];
        int[] current = new int[n + 1];

        for (int j = 0; j <= n; j++) {
            previous[j] = j;
        }

        for (int i = 1; i <= m; i++) {
            current[0] = i;
            for (int j = 1; j <= n; j++) {
                if (a.charAt(i - 1) == b.charAt(j - 1)) {
                    current[j] = previous[j - 1];
                } else {
                    current[j] = 1 + Math.min(
                        Math.min(previous[j], current[j - 1]),  // 删除或插入
                        previous[j - 1]  // 替换
                    );
                }
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[n];
    }
}
