package io.tickersched.marketdata;

import io.tickersched.core.TimeSeries;
import io.tickersched.core.TimeSeriesFetcher;
import io.tickersched.error.FetchError;
import io.tickersched.error.FetchFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Fetches bars from a Yahoo-style v8 chart endpoint. Retrying is left to the scheduler; this class only maps
 * each response onto a {@link FetchError}.
 */
public class HttpChartFetcher implements TimeSeriesFetcher {
    public static final String DEFAULT_BASE_URL = "https://query1.finance.yahoo.com";
    private static final Logger log = LoggerFactory.getLogger(HttpChartFetcher.class);

    private final HttpClient http;
    private final String baseUrl;
    private final Duration timeout;
    private final Clock clock;
    private final ChartResponseParser parser;

    public HttpChartFetcher(String baseUrl, Duration timeout, Clock clock) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(), baseUrl, timeout, clock, new ChartResponseParser());
    }

    HttpChartFetcher(HttpClient http, String baseUrl, Duration timeout, Clock clock, ChartResponseParser parser) {
        this.http = http;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.timeout = timeout;
        this.clock = clock;
        this.parser = parser;
    }

    @Override
    public TimeSeries fetch(String ticker, String interval, Instant since) throws FetchFailure {
        Instant end = clock.instant();
        Instant start = since != null ? since : end.minus(lookback(interval));
        URI uri = URI.create(String.format("%s/v8/finance/chart/%s?interval=%s&period1=%d&period2=%d",
                baseUrl,
                URLEncoder.encode(ticker, StandardCharsets.UTF_8),
                URLEncoder.encode(interval, StandardCharsets.UTF_8),
                start.getEpochSecond(), end.getEpochSecond()));
        HttpRequest req = HttpRequest.newBuilder(uri)
                .header("User-Agent", "Mozilla/5.0")
                .timeout(timeout)
                .GET()
                .build();
        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw FetchFailure.of(FetchError.TRANSIENT, "request for " + ticker + " failed: " + e, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw FetchFailure.of(FetchError.TRANSIENT, "request for " + ticker + " interrupted", e);
        }
        int status = resp.statusCode();
        log.debug("GET {} -> {}", uri, status);
        if (status == 200) return parser.parse(ticker, interval, resp.body());
        if (status == 429) throw FetchFailure.of(FetchError.RATE_LIMITED, "HTTP 429 for " + ticker);
        if (status == 404) throw FetchFailure.of(FetchError.NOT_FOUND, "HTTP 404 for " + ticker);
        throw FetchFailure.of(FetchError.TRANSIENT, "HTTP " + status + " for " + ticker);
    }

    /**
     * History requested when an entity has never been fetched: 7 days for {@code 1m}, 60 days for other minute
     * intervals, 730 days for hourly, 10 years otherwise. Mirrors the provider's retention per granularity.
     */
    public static Duration lookback(String interval) {
        if (interval.equals("1m")) return Duration.ofDays(7);
        if (interval.endsWith("m")) return Duration.ofDays(60);
        if (interval.endsWith("h")) return Duration.ofDays(730);
        return Duration.ofDays(3650);
    }
}
