package com.jay.cryptoagent.layer1_data;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jay.cryptoagent.config.AgentConfig;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Layer 1 — External sentiment sources.
 * DuckDuckGo HTML search (no key), Reddit public JSON (no key) and CryptoPanic news (free key).
 *
 * Every fetch is fault-tolerant: a failed source returns an empty list and never throws.
 * Repeated identical failures are logged once so a dead upstream does not flood the log.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SentimentSources {

    private static final String DDG_URL = "https://html.duckduckgo.com/html/";
    private static final String REDDIT_URL = "https://www.reddit.com/r/%s/hot.json?limit=10";
    private static final String CRYPTOPANIC_URL = "https://cryptopanic.com/api/v1/posts/";
    private static final Pattern DDG_RESULT = Pattern.compile(
        "<a[^>]*class=\"result__a\"[^>]*href=\"([^\"]*)\"[^>]*>(.*?)</a>[\\s\\S]*?<a[^>]*class=\"result__snippet\"[^>]*>(.*?)</a>");
    private static final Pattern UDDG = Pattern.compile("uddg=([^&]+)");
    private static final Pattern TAGS = Pattern.compile("<[^>]*>");

    private static final Map<String, List<String>> COIN_SUBREDDITS = Map.of(
        "BTC",  List.of("bitcoin", "CryptoMarkets"),
        "ETH",  List.of("ethereum", "CryptoMarkets"),
        "SOL",  List.of("solana", "CryptoMarkets"),
        "DOGE", List.of("dogecoin", "CryptoMarkets"),
        "XRP",  List.of("Ripple", "CryptoMarkets"),
        "ADA",  List.of("cardano", "CryptoMarkets")
    );
    private static final List<String> DEFAULT_SUBREDDITS = List.of("cryptocurrency", "CryptoMarkets");
    private static final long REDDIT_PAUSE_MS = 1000;
    private static final int MAX_LOGGED_ERRORS = 200;

    private final AgentConfig config;
    private final ObjectMapper mapper = new ObjectMapper();
    private final Set<String> loggedErrors = ConcurrentHashMap.newKeySet();
    private OkHttpClient http;

    public record WebSearchResult(String title, String url, String snippet) {}

    public record RedditPost(String title, int score, int numComments, String selftext,
                             long createdUtc, String subreddit, String permalink) {}

    public record CryptoNewsItem(String title, String url, String source, String publishedAt,
                                 int votesPositive, int votesNegative, int votesImportant) {}

    @PostConstruct
    public void init() {
        int timeout = config.sources().getTimeoutSeconds();
        this.http = new OkHttpClient.Builder()
            .connectTimeout(timeout, TimeUnit.SECONDS)
            .readTimeout(timeout, TimeUnit.SECONDS)
            .callTimeout(timeout, TimeUnit.SECONDS)
            .build();
    }

    // ── Web Search (DuckDuckGo) ────────────────────────────────────────────────

    public List<WebSearchResult> webSearch(String query, int limit) {
        HttpUrl url = HttpUrl.get(DDG_URL).newBuilder().addQueryParameter("q", query).build();
        Request request = new Request.Builder()
            .url(url)
            .addHeader("User-Agent", "Mozilla/5.0 (compatible; CryptoAgent/1.0)")
            .get().build();
        try (Response response = http.newCall(request).execute()) {
            if (!response.isSuccessful() || response.body() == null) {
                warnOnce("DuckDuckGo search failed: HTTP " + response.code());
                return List.of();
            }
            return parseDuckDuckGo(response.body().string(), limit);
        } catch (Exception e) {
            warnOnce("Web search error: " + e.getMessage());
            return List.of();
        }
    }

    static List<WebSearchResult> parseDuckDuckGo(String html, int limit) {
        List<WebSearchResult> results = new ArrayList<>();
        Matcher m = DDG_RESULT.matcher(html);
        while (m.find() && results.size() < limit) {
            String url = m.group(1);
            Matcher uddg = UDDG.matcher(url);
            if (uddg.find()) {
                url = URLDecoder.decode(uddg.group(1), StandardCharsets.UTF_8);
            }
            results.add(new WebSearchResult(
                TAGS.matcher(m.group(2)).replaceAll("").trim(),
                url,
                TAGS.matcher(m.group(3)).replaceAll("").trim()));
        }
        return results;
    }

    /** One search per coin: "<COIN> crypto sentiment analysis today". */
    public List<WebSearchResult> searchCoins(List<String> coins) {
        int perCoin = config.sources().getWebResultsPerCoin();
        List<WebSearchResult> all = new ArrayList<>();
        for (String coin : coins) {
            all.addAll(webSearch(coin + " crypto sentiment analysis today", perCoin));
        }
        return all;
    }

    // ── Reddit ─────────────────────────────────────────────────────────────────

    /**
     * Hot posts from the subreddits mapped to the given coins, deduplicated per subreddit,
     * stickied posts skipped, top 15 by score.
     */
    public List<RedditPost> fetchRedditSentiment(List<String> coins) {
        Set<String> subreddits = new LinkedHashSet<>();
        for (String coin : coins) {
            subreddits.addAll(COIN_SUBREDDITS.getOrDefault(coin.toUpperCase(), DEFAULT_SUBREDDITS));
        }

        List<RedditPost> posts = new ArrayList<>();
        int index = 0;
        for (String subreddit : subreddits) {
            posts.addAll(fetchSubreddit(subreddit));
            // Reddit rate limit: 1s between requests
            if (++index < subreddits.size()) {
                try {
                    Thread.sleep(REDDIT_PAUSE_MS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        return posts.stream()
            .sorted(Comparator.comparingInt(RedditPost::score).reversed())
            .limit(15)
            .toList();
    }

    private List<RedditPost> fetchSubreddit(String subreddit) {
        Request request = new Request.Builder()
            .url(String.format(REDDIT_URL, subreddit))
            .addHeader("User-Agent", "CryptoAgent/1.0 (crypto sentiment monitor)")
            .get().build();
        try (Response response = http.newCall(request).execute()) {
            if (!response.isSuccessful() || response.body() == null) {
                warnOnce("Reddit r/" + subreddit + " returned HTTP " + response.code());
                return List.of();
            }
            return parseReddit(mapper.readTree(response.body().string()), subreddit);
        } catch (Exception e) {
            warnOnce("Reddit r/" + subreddit + " error: " + e.getMessage());
            return List.of();
        }
    }

    static List<RedditPost> parseReddit(JsonNode root, String subreddit) {
        List<RedditPost> out = new ArrayList<>();
        for (JsonNode child : root.path("data").path("children")) {
            JsonNode post = child.path("data");
            if (post.isMissingNode() || post.path("stickied").asBoolean(false)) continue;
            String selftext = post.path("selftext").asText("");
            out.add(new RedditPost(
                post.path("title").asText(""),
                post.path("score").asInt(0),
                post.path("num_comments").asInt(0),
                selftext.length() > 300 ? selftext.substring(0, 300) : selftext,
                post.path("created_utc").asLong(0),
                post.path("subreddit").asText(subreddit),
                post.path("permalink").asText("")));
        }
        return out;
    }

    // ── CryptoPanic ────────────────────────────────────────────────────────────

    /** Top 10 news items for the coins. Requires a CryptoPanic API key, else empty. */
    public List<CryptoNewsItem> fetchCryptoNews(List<String> coins) {
        String apiKey = config.sources().getCryptoPanicApiKey();
        if (apiKey == null || apiKey.isBlank()) return List.of();

        HttpUrl url = HttpUrl.get(CRYPTOPANIC_URL).newBuilder()
            .addQueryParameter("auth_token", apiKey)
            .addQueryParameter("currencies", String.join(",", coins.stream().map(String::toUpperCase).toList()))
            .addQueryParameter("kind", "news")
            .addQueryParameter("public", "true")
            .build();
        try (Response response = http.newCall(new Request.Builder().url(url).get().build()).execute()) {
            if (!response.isSuccessful() || response.body() == null) {
                warnOnce("CryptoPanic failed: HTTP " + response.code());
                return List.of();
            }
            return parseCryptoPanic(mapper.readTree(response.body().string()));
        } catch (Exception e) {
            warnOnce("CryptoPanic error: " + e.getMessage());
            return List.of();
        }
    }

    static List<CryptoNewsItem> parseCryptoPanic(JsonNode root) {
        List<CryptoNewsItem> out = new ArrayList<>();
        for (JsonNode item : root.path("results")) {
            if (out.size() >= 10) break;
            JsonNode votes = item.path("votes");
            out.add(new CryptoNewsItem(
                item.path("title").asText(""),
                item.path("url").asText(""),
                item.path("source").path("title").asText("Unknown"),
                item.path("published_at").asText(""),
                votes.path("positive").asInt(0),
                votes.path("negative").asInt(0),
                votes.path("important").asInt(0)));
        }
        return out;
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private void warnOnce(String message) {
        if (loggedErrors.size() >= MAX_LOGGED_ERRORS) loggedErrors.clear();
        if (loggedErrors.add(message)) {
            log.warn("[Sources] {}", message);
        } else {
            log.debug("[Sources] {}", message);
        }
    }
}
