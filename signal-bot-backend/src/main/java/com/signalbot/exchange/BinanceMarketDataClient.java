package com.signalbot.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalbot.core.exception.ProviderException;
import com.signalbot.core.market.MarketDataSource;
import com.signalbot.core.model.Candle;
import com.signalbot.core.model.Timeframe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * Public Binance spot market-data endpoints. No API key is needed for klines or ticker prices.
 */
public final class BinanceMarketDataClient implements MarketDataSource {
    private static final Logger logger = LoggerFactory.getLogger(BinanceMarketDataClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String EXCHANGE_ID = "EXCHANGE";
    static final int MAX_KLINES_PER_REQUEST = 1000;
    private static final Pattern INSTRUMENT_FORMAT = Pattern.compile("^[A-Z0-9]+/[A-Z0-9]+$");

    private final String baseUrl;
    private final HttpClient httpClient;
    private final Duration timeout;

    public BinanceMarketDataClient(String baseUrl, Duration timeout) {
        this(baseUrl, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), timeout);
    }

    public BinanceMarketDataClient(String baseUrl, HttpClient httpClient, Duration timeout) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.httpClient = httpClient;
        this.timeout = timeout;
        logger.info("📈 Binance market data client initialized - {}", this.baseUrl);
    }

    @Override
    public CompletableFuture<List<Candle>> fetchCandles(String instrument, Timeframe timeframe,
                                                        Instant since, int limit) {
        String symbol;
        try {
            symbol = toSymbol(instrument);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }
        int boundedLimit = Math.max(1, Math.min(limit, MAX_KLINES_PER_REQUEST));
        var url = new StringBuilder(baseUrl)
            .append("/api/v3/klines?symbol=").append(symbol)
            .append("&interval=").append(timeframe.code())
            .append("&limit=").append(boundedLimit);
        if (since != null) {
            url.append("&startTime=").append(since.toEpochMilli());
        }
        logger.debug("Fetching {} {} candles since {} (limit {})", instrument, timeframe, since, boundedLimit);
        return get(url.toString())
            .thenApply(body -> parseKlines(body, instrument, timeframe));
    }

    @Override
    public CompletableFuture<Double> fetchPrice(String instrument) {
        String symbol;
        try {
            symbol = toSymbol(instrument);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }
        return get(baseUrl + "/api/v3/ticker/price?symbol=" + symbol)
            .thenApply(BinanceMarketDataClient::parsePrice);
    }

    private CompletableFuture<String> get(String url) {
        var request = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .timeout(timeout)
            .header("Accept", "application/json")
            .GET()
            .build();

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
            .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
            .thenApply(response -> {
                if (response.statusCode() / 100 != 2) {
                    throw ProviderException.forHttpStatus(EXCHANGE_ID, response.statusCode(), response.body());
                }
                return response.body();
            });
    }

    /** {@code BTC/USDT} becomes {@code BTCUSDT}. */
    static String toSymbol(String instrument) {
        if (instrument == null || !INSTRUMENT_FORMAT.matcher(instrument).matches()) {
            throw new IllegalArgumentException("Invalid instrument '" + instrument + "', expected BASE/QUOTE");
        }
        return instrument.replace("/", "");
    }

    /**
     * Kline rows are arrays of {@code [openTime, open, high, low, close, volume, closeTime, ...]}
     * with prices encoded as strings.
     */
    static List<Candle> parseKlines(String body, String instrument, Timeframe timeframe) {
        JsonNode root = readTree(body);
        if (!root.isArray()) {
            throw new ProviderException(EXCHANGE_ID, "Unexpected klines payload: " + root.getNodeType(), false);
        }
        List<Candle> candles = new ArrayList<>(root.size());
        for (JsonNode row : root) {
            if (!row.isArray() || row.size() < 6) {
                throw new ProviderException(EXCHANGE_ID, "Malformed kline row: " + row, false);
            }
            candles.add(new Candle(
                instrument,
                timeframe,
                Instant.ofEpochMilli(row.get(0).asLong()),
                row.get(1).asDouble(),
                row.get(2).asDouble(),
                row.get(3).asDouble(),
                row.get(4).asDouble(),
                row.get(5).asDouble()));
        }
        candles.sort(Comparator.comparing(Candle::openTime));
        return candles;
    }

    static double parsePrice(String body) {
        JsonNode price = readTree(body).path("price");
        if (price.isMissingNode() || price.isNull()) {
            throw new ProviderException(EXCHANGE_ID, "Ticker response has no price", false);
        }
        double value = price.asDouble(Double.NaN);
        if (!Double.isFinite(value) || value <= 0) {
            throw new ProviderException(EXCHANGE_ID, "Invalid ticker price: " + price.asText(), false);
        }
        return value;
    }

    private static JsonNode readTree(String body) {
        try {
            return MAPPER.readTree(body);
        } catch (IOException e) {
            throw new UncheckedIOException("Unparseable exchange response", e);
        }
    }
}
