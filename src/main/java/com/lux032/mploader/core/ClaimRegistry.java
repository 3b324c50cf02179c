package com.lux032.mploader.core;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 目标路径占用表
 * 保证同一次运行中每个目标路径最多只有一个下载在进行
 * 占用在运行期间不会释放
 */
public class ClaimRegistry {

    private final Set<String> claims = ConcurrentHashMap.newKeySet();

    /**
     * 原子地占用目标路径
     * @return 占用成功返回 true, 已被其他任务占用返回 false
     */
    public boolean tryClaim(Path destinationPath) {
        return claims.add(key(destinationPath));
    }

    public boolean isClaimed(Path destinationPath) {
        return claims.contains(key(destinationPath));
    }

    public int size() {
        return claims.size();
    }

    private static String key(Path path) {
        return path.toAbsolutePath().normalize().toString().toLowerCase(Locale.ROOT);
    }
}
