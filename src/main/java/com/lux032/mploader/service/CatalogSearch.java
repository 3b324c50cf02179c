package com.lux032.mploader.service;

import com.lux032.mploader.model.MatchCandidate;

import java.util.List;

/**
 * 音乐目录搜索
 * 实现内部可以重试临时网络错误, 最终失败时返回空列表而不是抛出异常
 */
public interface CatalogSearch {

    List<MatchCandidate> search(String query, List<String> hints);
}
