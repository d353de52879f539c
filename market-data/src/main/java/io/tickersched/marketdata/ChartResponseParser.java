package io.tickersched.marketdata;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tickersched.core.Bar;
import io.tickersched.core.TimeSeries;
import io.tickersched.error.FetchError;
import io.tickersched.error.FetchFailure;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads the v8 chart JSON payload into bars. Rows with a missing price are skipped; a missing volume counts as 0.
 */
public class ChartResponseParser {
    private final ObjectMapper mapper;

    public ChartResponseParser() { this(new ObjectMapper()); }

    public ChartResponseParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public TimeSeries parse(String ticker, String interval, String body) throws FetchFailure {
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (IOException e) {
            throw FetchFailure.of(FetchError.MALFORMED, "unparsable chart response for " + ticker, e);
        }
        if (root == null || !root.has("chart")) {
            throw FetchFailure.of(FetchError.MALFORMED, "no chart object in response for " + ticker);
        }
        JsonNode chart = root.get("chart");
        JsonNode error = chart.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw providerError(ticker, error);
        }
        JsonNode result = chart.path("result");
        if (!result.isArray() || result.isEmpty()) {
            throw FetchFailure.of(FetchError.MALFORMED, "empty chart result for " + ticker);
        }
        JsonNode first = result.get(0);
        JsonNode timestamps = first.path("timestamp");
        if (!timestamps.isArray()) {
            // no bars in the requested window
            return TimeSeries.empty(ticker, interval);
        }
        JsonNode quote = first.path("indicators").path("quote").path(0);
        if (quote.isMissingNode()) {
            throw FetchFailure.of(FetchError.MALFORMED, "chart result for " + ticker + " has timestamps but no quote");
        }
        List<Bar> bars = new ArrayList<>(timestamps.size());
        for (int i = 0; i < timestamps.size(); i++) {
            JsonNode ts = timestamps.get(i);
            JsonNode open = quote.path("open").path(i);
            JsonNode high = quote.path("high").path(i);
            JsonNode low = quote.path("low").path(i);
            JsonNode close = quote.path("close").path(i);
            if (!ts.isNumber() || !open.isNumber() || !high.isNumber() || !low.isNumber() || !close.isNumber()) continue;
            JsonNode volume = quote.path("volume").path(i);
            bars.add(new Bar(Instant.ofEpochSecond(ts.asLong()), open.asDouble(), high.asDouble(), low.asDouble(),
                    close.asDouble(), volume.isNumber() ? volume.asLong() : 0L));
        }
        return new TimeSeries(ticker, interval, bars);
    }

    /** Maps a provider {@code chart.error} object (also carried by 404 bodies). */
    FetchFailure providerError(String ticker, JsonNode error) {
        String code = error.path("code").asText("");
        String description = error.path("description").asText("");
        String text = (code + " " + description).toLowerCase(Locale.ROOT);
        if (text.contains("not found") || text.contains("no data found") || text.contains("delisted")) {
            return FetchFailure.of(FetchError.NOT_FOUND, ticker + ": " + description);
        }
        return FetchFailure.of(FetchError.MALFORMED, ticker + ": provider error " + code + " " + description);
    }
}
