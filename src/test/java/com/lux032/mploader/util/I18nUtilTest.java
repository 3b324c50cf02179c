package com.lux032.mploader.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class I18nUtilTest {

    @AfterEach
    public void resetLanguage() {
        I18nUtil.init("en_US");
    }

    @Test
    public void testPlaceholdersReplacedInOrder() {
        Assertions.assertEquals("a 1 b 2", I18nUtil.format("a {} b {}", 1, 2));
        Assertions.assertEquals("x {}", I18nUtil.format("x {}"));
        Assertions.assertEquals("only 1 {}", I18nUtil.format("only {} {}", 1));
    }

    @Test
    public void testMessagesLoadedPerLanguage() {
        I18nUtil.init("en_US");
        Assertions.assertEquals("Download summary", I18nUtil.getMessage("summary.title"));

        I18nUtil.init("zh_CN");
        Assertions.assertEquals("下载汇总", I18nUtil.getMessage("summary.title"));
        Assertions.assertEquals("zh_CN", I18nUtil.getCurrentLanguage());
    }

    @Test
    public void testUnknownLanguageFallsBackToEnglish() {
        I18nUtil.init("xx_XX");

        Assertions.assertEquals("en_US", I18nUtil.getCurrentLanguage());
        Assertions.assertEquals("Download summary", I18nUtil.getMessage("summary.title"));
    }

    @Test
    public void testUnknownKeyReturnsKey() {
        Assertions.assertEquals("no.such.key", I18nUtil.getMessage("no.such.key"));
        Assertions.assertEquals("Cannot read source: gone", I18nUtil.getMessage("main.source.unavailable", "gone"));
    }
}
