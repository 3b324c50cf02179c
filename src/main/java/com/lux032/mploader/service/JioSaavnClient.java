package com.lux032.mploader.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lux032.mploader.config.LoaderConfig;
import com.lux032.mploader.exception.StreamUnavailableException;
import com.lux032.mploader.model.MatchCandidate;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.CloseableHttpResponse;
import org.apache.hc.client5.http.impl.classic.HttpClientBuilder;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.HttpHost;
import org.apache.hc.core5.http.ParseException;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.util.Timeout;
import org.jsoup.parser.Parser;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * JioSaavn API 客户端
 * 搜索曲目并下载音频流
 */
@Slf4j
public class JioSaavnClient implements CatalogSearch, AudioStreamSource, Closeable {

    private static final Pattern KBPS = Pattern.compile("(\\d+)\\s*kbps", Pattern.CASE_INSENSITIVE);

    private final LoaderConfig config;
    private final CloseableHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public JioSaavnClient(LoaderConfig config) {
        this.config = config;
        this.httpClient = createHttpClient(config);
        this.objectMapper = new ObjectMapper();
    }

    /**
     * 创建 HttpClient,支持代理配置
     */
    private CloseableHttpClient createHttpClient(LoaderConfig config) {
        HttpClientBuilder builder = HttpClients.custom();

        RequestConfig requestConfig = RequestConfig.custom()
            .setConnectionRequestTimeout(Timeout.ofSeconds(30))
            .setResponseTimeout(Timeout.ofSeconds(60))
            .build();
        builder.setDefaultRequestConfig(requestConfig);

        if (config.isProxyEnabled() && config.getProxyHost() != null && !config.getProxyHost().isEmpty()) {
            HttpHost proxy = new HttpHost(config.getProxyHost(), config.getProxyPort());
            builder.setProxy(proxy);
            log.info("HTTP 代理已启用: {}:{}", config.getProxyHost(), config.getProxyPort());
        } else if (config.isProxyEnabled()) {
            log.warn("代理已启用但未配置代理地址, 使用直连");
        }

        return builder.build();
    }

    /**
     * 搜索曲目
     * 先用"标题 + 艺术家提示"搜索, 没有结果再只用标题, 最后回退到综合搜索的 topQuery
     */
    @Override
    public List<MatchCandidate> search(String query, List<String> hints) {
        if (query == null || query.isBlank()) {
            return Collections.emptyList();
        }

        Set<String> queries = new LinkedHashSet<>();
        if (hints != null) {
            for (String hint : hints) {
                if (hint != null && !hint.isBlank()) {
                    queries.add(query + " " + hint);
                    break;
                }
            }
        }
        queries.add(query);

        for (String q : queries) {
            try {
                String url = config.getCatalogApiUrl() + "/search/songs?query=" + encode(q);
                List<MatchCandidate> candidates = parseSongResults(executeRequest(url));
                if (!candidates.isEmpty()) {
                    log.debug("搜索 '{}' 得到 {} 个结果", q, candidates.size());
                    return candidates;
                }
            } catch (IOException e) {
                log.warn("曲目搜索失败: {} - {}", q, e.getMessage());
            }
        }

        try {
            String url = config.getCatalogApiUrl() + "/search?query=" + encode(query);
            List<MatchCandidate> candidates = parseTopQuery(executeRequest(url));
            if (!candidates.isEmpty()) {
                log.debug("使用综合搜索结果: {}", query);
            }
            return candidates;
        } catch (IOException e) {
            log.warn("综合搜索失败: {} - {}", query, e.getMessage());
        }
        return Collections.emptyList();
    }

    /**
     * 下载音频流到 target
     * 候选没有音频地址时(如来自 topQuery), 先查询曲目详情
     */
    @Override
    public void fetchStream(MatchCandidate candidate, Path target) throws StreamUnavailableException {
        String streamUrl = candidate.getStreamUrl();
        if (streamUrl == null || streamUrl.isEmpty()) {
            streamUrl = lookupStreamUrl(candidate.getCatalogId());
        }
        if (streamUrl == null || streamUrl.isEmpty()) {
            throw new StreamUnavailableException("No stream available for " + candidate.getCatalogId());
        }

        int maxRetries = Math.max(0, config.getCatalogMaxRetries());
        int retryCount = 0;
        IOException lastException = null;

        while (retryCount <= maxRetries) {
            HttpGet httpGet = new HttpGet(streamUrl);
            httpGet.setHeader("User-Agent", config.getUserAgent());

            try (CloseableHttpResponse response = httpClient.execute(httpGet)) {
                int statusCode = response.getCode();
                HttpEntity entity = response.getEntity();
                if (statusCode != 200 || entity == null) {
                    EntityUtils.consume(entity);
                    throw new IOException("音频流请求失败: " + statusCode);
                }
                try (InputStream in = entity.getContent()) {
                    long bytes = Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
                    if (bytes == 0) {
                        throw new IOException("音频流为空");
                    }
                    log.debug("音频流下载完成: {} KB", bytes / 1024);
                }
                return;
            } catch (IOException e) {
                lastException = e;
                retryCount++;
                if (retryCount <= maxRetries) {
                    log.warn("下载音频流失败(第{}/{}次尝试): {}", retryCount, maxRetries, e.getMessage());
                    try {
                        sleepBeforeRetry();
                    } catch (IOException interrupted) {
                        throw new StreamUnavailableException("Stream download interrupted", interrupted);
                    }
                }
            }
        }

        throw new StreamUnavailableException(
            "Stream download failed after " + retryCount + " attempts: " + lastException.getMessage(), lastException);
    }

    /**
     * 下载封面图片, 失败时返回 null
     */
    public byte[] downloadArtwork(String url) {
        if (url == null || url.isEmpty()) {
            return null;
        }

        int maxRetries = Math.max(0, config.getCatalogMaxRetries());
        int retryCount = 0;

        while (retryCount <= maxRetries) {
            try {
                HttpGet httpGet = new HttpGet(url);
                httpGet.setHeader("User-Agent", config.getUserAgent());

                try (CloseableHttpResponse response = httpClient.execute(httpGet)) {
                    if (response.getCode() == 200) {
                        return EntityUtils.toByteArray(response.getEntity());
                    }
                    log.warn("封面请求失败: {} - {}", response.getCode(), url);
                }
                // 请求成功但状态码不是200,不需要重试
                return null;

            } catch (IOException e) {
                retryCount++;
                if (retryCount <= maxRetries) {
                    log.warn("下载封面图片失败(第{}/{}次尝试): {}", retryCount, maxRetries, e.getMessage());
                    try {
                        sleepBeforeRetry();
                    } catch (IOException interrupted) {
                        log.error("重试等待被中断");
                        return null;
                    }
                } else {
                    log.error("下载封面图片失败,已达最大重试次数({}/{}): {}", retryCount - 1, maxRetries, url);
                }
            }
        }
        return null;
    }

    private String lookupStreamUrl(String catalogId) throws StreamUnavailableException {
        if (catalogId == null || catalogId.isEmpty()) {
            return null;
        }
        try {
            String url = config.getCatalogApiUrl() + "/songs/" + encode(catalogId);
            JsonNode data = objectMapper.readTree(executeRequest(url)).path("data");
            JsonNode song = data.isArray() ? data.path(0) : data;
            if (song.isMissingNode() || song.isNull()) {
                return null;
            }
            return toCandidate(song).getStreamUrl();
        } catch (IOException e) {
            throw new StreamUnavailableException("Song details unavailable for " + catalogId + ": " + e.getMessage(), e);
        }
    }

    /**
     * 执行 GET 请求, 失败时按配置重试
     */
    private String executeRequest(String url) throws IOException {
        int maxRetries = Math.max(0, config.getCatalogMaxRetries());
        int retryCount = 0;
        IOException lastException = null;

        while (retryCount <= maxRetries) {
            try {
                HttpGet httpGet = new HttpGet(url);
                httpGet.setHeader("User-Agent", config.getUserAgent());
                httpGet.setHeader("Accept", "application/json");

                try (CloseableHttpResponse response = httpClient.execute(httpGet)) {
                    int statusCode = response.getCode();
                    String responseBody = EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8);

                    if (statusCode != 200) {
                        log.error("JioSaavn API 请求失败: {} - {}", statusCode, url);
                        throw new IOException("API 请求失败: " + statusCode);
                    }
                    return responseBody;
                }
            } catch (ParseException e) {
                throw new IOException("读取响应失败", e);
            } catch (IOException e) {
                lastException = e;
                retryCount++;
                if (retryCount <= maxRetries) {
                    log.warn("网络请求失败(第{}/{}次尝试): {} - {}ms后重试",
                        retryCount, maxRetries, e.getMessage(), config.getCatalogRetryDelayMs());
                    sleepBeforeRetry();
                } else {
                    log.error("网络请求失败,已达最大重试次数({}/{})", retryCount - 1, maxRetries);
                }
            }
        }

        throw lastException;
    }

    private void sleepBeforeRetry() throws IOException {
        try {
            Thread.sleep(config.getCatalogRetryDelayMs());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IOException("重试等待被中断", ie);
        }
    }

    /**
     * 解析 /search/songs 的响应
     */
    List<MatchCandidate> parseSongResults(String json) throws IOException {
        JsonNode root = objectMapper.readTree(json);
        if (!root.path("success").asBoolean(true)) {
            return Collections.emptyList();
        }
        return toCandidates(root.path("data").path("results"));
    }

    /**
     * 解析 /search 的响应, 只取 topQuery 中的歌曲
     */
    List<MatchCandidate> parseTopQuery(String json) throws IOException {
        JsonNode root = objectMapper.readTree(json);
        if (!root.path("success").asBoolean(true)) {
            return Collections.emptyList();
        }
        JsonNode data = root.path("data");
        List<MatchCandidate> candidates = toCandidates(data.path("songs").path("results"));
        if (candidates.isEmpty()) {
            candidates = toCandidates(data.path("topQuery").path("results"));
        }
        return candidates;
    }

    private List<MatchCandidate> toCandidates(JsonNode results) {
        List<MatchCandidate> candidates = new ArrayList<>();
        if (!results.isArray()) {
            return candidates;
        }
        for (JsonNode result : results) {
            String type = result.path("type").asText("song");
            if (!"song".equalsIgnoreCase(type)) {
                continue;
            }
            MatchCandidate candidate = toCandidate(result);
            if (candidate.getCatalogId() != null && candidate.getTitle() != null) {
                candidates.add(candidate);
            }
        }
        return candidates;
    }

    /**
     * 将一条曲目 JSON 转换为 MatchCandidate
     */
    MatchCandidate toCandidate(JsonNode song) {
        String title = text(song, "name");
        if (title == null) {
            title = text(song, "title");
        }

        JsonNode artists = song.path("artists");
        String artist = joinNames(artists.path("primary"), null);
        if (artist == null) {
            artist = unescapeHtml(firstNonBlank(text(song, "primaryArtists"), text(song, "singers")));
        }
        String composer = joinNames(artists.path("all"), Set.of("lyricist"));
        String albumArtist = joinNames(artists.path("all"), Set.of("music", "composer"));

        JsonNode albumNode = song.path("album");
        String album = albumNode.isObject() ? text(albumNode, "name") : unescapeHtml(albumNode.asText(null));

        JsonNode stream = pickByQuality(song.path("downloadUrl"), config.getStreamQuality());
        JsonNode image = pickByQuality(song.path("image"), config.getArtworkQuality());
        String streamUrl = stream == null ? null : emptyToNull(stream.path("url").asText(null));

        return MatchCandidate.builder()
            .catalogId(emptyToNull(song.path("id").asText(null)))
            .title(title)
            .artist(artist)
            .album(album)
            .year(parseInteger(song.path("year")))
            .durationSeconds(parseInteger(song.path("duration")))
            .artworkUrl(image == null ? null : emptyToNull(image.path("url").asText(null)))
            .qualityScore(stream == null ? 0 : parseKbps(stream.path("quality").asText("")))
            .albumArtist(albumArtist)
            .composer(composer)
            .label(text(song, "label"))
            .language(text(song, "language"))
            .copyright(text(song, "copyright"))
            .pageUrl(emptyToNull(song.path("url").asText(null)))
            .streamUrl(streamUrl)
            .build();
    }

    /**
     * 优先选择指定质量, 没有时取最后一个(最高质量)
     */
    private JsonNode pickByQuality(JsonNode links, String preferred) {
        if (!links.isArray() || links.size() == 0) {
            return null;
        }
        for (JsonNode link : links) {
            if (preferred != null && preferred.equalsIgnoreCase(link.path("quality").asText())) {
                return link;
            }
        }
        return links.get(links.size() - 1);
    }

    private String joinNames(JsonNode artists, Set<String> roles) {
        if (!artists.isArray()) {
            return null;
        }
        List<String> names = new ArrayList<>();
        for (JsonNode artist : artists) {
            if (roles != null && !roles.contains(artist.path("role").asText("").toLowerCase())) {
                continue;
            }
            String name = text(artist, "name");
            if (name != null && !names.contains(name)) {
                names.add(name);
            }
        }
        return names.isEmpty() ? null : String.join(", ", names);
    }

    private String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        return emptyToNull(unescapeHtml(value.asText()).trim());
    }

    /**
     * 解码接口返回的 HTML 实体, 如 "&amp;" "&eacute;" "&#039;"
     * 无效的数字实体解码为替换字符, 不会抛出异常
     */
    static String unescapeHtml(String value) {
        if (value == null || value.indexOf('&') < 0) {
            return value;
        }
        return Parser.unescapeEntities(value, false);
    }

    static double parseKbps(String quality) {
        Matcher matcher = KBPS.matcher(quality == null ? "" : quality);
        return matcher.find() ? Double.parseDouble(matcher.group(1)) : 0;
    }

    private static Integer parseInteger(JsonNode node) {
        if (node.isNumber()) {
            return node.asInt();
        }
        String value = node.asText("").trim();
        if (value.isEmpty()) {
            return null;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String firstNonBlank(String first, String second) {
        return first != null && !first.isBlank() ? first : second;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    /**
     * 关闭客户端
     */
    @Override
    public void close() throws IOException {
        httpClient.close();
    }
}
