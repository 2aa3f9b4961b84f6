package com.signalbot.ai;

import com.signalbot.core.exception.ProviderException;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link JsonHttpTransport} over OkHttp's async {@code enqueue}. The per-call timeout
 * covers the whole exchange, connect to last byte.
 */
public final class OkHttpJsonTransport implements JsonHttpTransport {

    private static final MediaType JSON = MediaType.parse("application/json");

    private final String name;
    private final OkHttpClient httpClient;

    public OkHttpJsonTransport(String name, OkHttpClient httpClient) {
        this.name = name;
        this.httpClient = httpClient;
    }

    /** Shared client; per-call timeouts are applied on each call. */
    public static OkHttpClient defaultClient() {
        return new OkHttpClient.Builder()
            .connectTimeout(10, TimeUnit.SECONDS)
            .readTimeout(30, TimeUnit.SECONDS)
            .writeTimeout(10, TimeUnit.SECONDS)
            .retryOnConnectionFailure(true)
            .build();
    }

    @Override
    public CompletableFuture<String> post(String url, Map<String, String> headers, String jsonBody, Duration timeout) {
        Request.Builder builder = new Request.Builder()
            .url(url)
            .post(RequestBody.create(jsonBody, JSON));
        headers.forEach(builder::addHeader);

        CompletableFuture<String> result = new CompletableFuture<>();
        Call call = httpClient.newCall(builder.build());
        call.timeout().timeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        call.enqueue(new Callback() {
            @Override
            public void onFailure(Call failedCall, IOException e) {
                result.completeExceptionally(e);
            }

            @Override
            public void onResponse(Call completedCall, Response response) {
                try (ResponseBody body = response.body()) {
                    String text = body != null ? body.string() : "";
                    if (!response.isSuccessful()) {
                        result.completeExceptionally(ProviderException.forHttpStatus(name, response.code(), text));
                    } else {
                        result.complete(text);
                    }
                } catch (IOException e) {
                    result.completeExceptionally(e);
                }
            }
        });
        // cancelling the future aborts the HTTP call
        result.whenComplete((ignored, failure) -> {
            if (result.isCancelled()) {
                call.cancel();
            }
        });
        return result;
    }

    public void shutdown() {
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
    }
}
