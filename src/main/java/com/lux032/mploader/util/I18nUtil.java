package com.lux032.mploader.util;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

/**
 * 国际化工具类
 * 消息模板使用 SLF4J 风格的 {} 占位符, 既可以直接交给日志, 也可以用 getMessage 格式化
 */
@Slf4j
public class I18nUtil {

    private static final String DEFAULT_LANGUAGE = "en_US";

    private static volatile Properties messages;
    private static volatile String currentLanguage = DEFAULT_LANGUAGE;

    private I18nUtil() {
    }

    /**
     * 初始化国际化资源
     * @param language 语言代码，如 zh_CN 或 en_US
     */
    public static synchronized void init(String language) {
        if (language == null || language.trim().isEmpty()) {
            language = DEFAULT_LANGUAGE;
        }

        String resourceFile = "/messages_" + language + ".properties";
        InputStream is = I18nUtil.class.getResourceAsStream(resourceFile);
        if (is == null) {
            log.warn("i18n resource file not found: {}, falling back to {}", resourceFile, DEFAULT_LANGUAGE);
            if (!DEFAULT_LANGUAGE.equals(language)) {
                init(DEFAULT_LANGUAGE);
            } else {
                messages = new Properties();
            }
            return;
        }

        Properties loaded = new Properties();
        try (InputStreamReader reader = new InputStreamReader(is, StandardCharsets.UTF_8)) {
            loaded.load(reader);
            log.debug("Loaded i18n resource file: {}", resourceFile);
        } catch (IOException e) {
            log.error("Failed to load i18n resource file: {}", resourceFile, e);
        }
        currentLanguage = language;
        messages = loaded;
    }

    /**
     * 获取国际化消息
     * @return 对应语言的消息文本，如果找不到则返回键本身
     */
    public static String getMessage(String key) {
        if (messages == null) {
            init(currentLanguage);
        }
        return messages.getProperty(key, key);
    }

    /**
     * 获取国际化消息并替换 {} 占位符
     */
    public static String getMessage(String key, Object... args) {
        String pattern = getMessage(key);
        if (args == null || args.length == 0) {
            return pattern;
        }
        return format(pattern, args);
    }

    static String format(String pattern, Object... args) {
        StringBuilder result = new StringBuilder(pattern.length() + 16);
        int argIndex = 0;
        int i = 0;

        while (i < pattern.length()) {
            if (i < pattern.length() - 1 && pattern.charAt(i) == '{' && pattern.charAt(i + 1) == '}') {
                if (argIndex < args.length) {
                    result.append(args[argIndex]);
                    argIndex++;
                } else {
                    result.append("{}");
                }
                i += 2;
            } else {
                result.append(pattern.charAt(i));
                i++;
            }
        }

        return result.toString();
    }

    public static String getCurrentLanguage() {
        return currentLanguage;
    }
}
