package com.lux032.mploader.service;

/**
 * 封面获取, 失败时返回 null
 */
public interface ArtworkSource {

    byte[] fetchArtwork(String artworkUrl);
}
