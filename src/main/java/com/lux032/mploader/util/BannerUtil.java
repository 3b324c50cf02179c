package com.lux032.mploader.util;

/**
 * Banner 工具类 - 用于在控制台启动时显示程序信息
 */
public class BannerUtil {

    private static final String SEPARATOR =
        " ════════════════════════════════════════════════════════════════════════════";

    private BannerUtil() {
    }

    /**
     * 显示应用启动 Banner
     */
    public static void printBanner() {
        String banner =
            "\n" +
            SEPARATOR + "\n" +
            "  " + I18nUtil.getMessage("main.title") + "\n" +
            "  Version: 1.0.0 | Powered by yt-dlp, JioSaavn & FFmpeg\n" +
            SEPARATOR + "\n";

        System.out.println(banner);
    }
}
