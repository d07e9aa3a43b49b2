package com.marketpool.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketpool.error.TransientFetchException;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Cookie;
import okhttp3.CookieJar;
import okhttp3.FormBody;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * One source's network session: its own connection pool, dispatcher and cookie
 * store. Closing it releases all of them.
 */
@Slf4j
public class HttpSession implements Closeable {

    private static final MediaType JSON = MediaType.parse("application/json");
    private static final int MAX_ATTEMPTS = 3;

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Map<String, String> defaultHeaders;

    HttpSession(OkHttpClient httpClient, ObjectMapper objectMapper, Map<String, String> defaultHeaders) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.defaultHeaders = Map.copyOf(defaultHeaders);
    }

    public JsonNode getJson(String url) {
        return readJson(url, getPage(url).getBody());
    }

    public String getText(String url) {
        return getPage(url).getBody();
    }

    public HttpPage getPage(String url) {
        return execute(newRequest(url).get().build());
    }

    public byte[] getBytes(String url) {
        Request request = newRequest(url).get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new TransientFetchException("HTTP " + response.code() + " for " + url);
            }
            ResponseBody body = response.body();
            return body == null ? new byte[0] : body.bytes();
        } catch (IOException e) {
            throw new TransientFetchException("Failed to download " + url, e);
        }
    }

    public HttpPage postForm(String url, Map<String, String> fields) {
        FormBody.Builder form = new FormBody.Builder();
        fields.forEach(form::add);
        return execute(newRequest(url).post(form.build()).build());
    }

    public JsonNode postJson(String url, Object payload) {
        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot serialize request payload", e);
        }
        HttpPage page = execute(newRequest(url).post(RequestBody.create(json, JSON)).build());
        return readJson(url, page.getBody());
    }

    private Request.Builder newRequest(String url) {
        Request.Builder builder = new Request.Builder().url(url);
        defaultHeaders.forEach(builder::header);
        return builder;
    }

    private HttpPage execute(Request request) {
        String url = request.url().toString();
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            try (Response response = httpClient.newCall(request).execute()) {
                if (!response.isSuccessful()) {
                    if (response.code() == 429 && attempt < MAX_ATTEMPTS) {
                        // Backoff for 429
                        backoff(1000L * attempt);
                        continue;
                    }
                    throw new TransientFetchException("HTTP " + response.code() + " " + response.message()
                            + " for " + url);
                }
                ResponseBody body = response.body();
                return new HttpPage(response.request().url().toString(), body == null ? "" : body.string());
            } catch (IOException e) {
                if (attempt == MAX_ATTEMPTS) {
                    throw new TransientFetchException("Request failed after " + MAX_ATTEMPTS + " attempts: " + url, e);
                }
                log.debug("Transient network error on {} (attempt {}): {}", url, attempt, e.getMessage());
                backoff(500L);
            }
        }
        throw new TransientFetchException("Request failed: " + url);
    }

    private JsonNode readJson(String url, String body) {
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            throw new TransientFetchException("Response from " + url + " is not JSON", e);
        }
    }

    private void backoff(long millis) {
        try {
            TimeUnit.MILLISECONDS.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientFetchException("Interrupted while backing off");
        }
    }

    @Override
    public void close() {
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
    }

    /**
     * Per-session cookie store, enough for a login handshake.
     */
    static final class SessionCookieJar implements CookieJar {

        private final Map<String, List<Cookie>> cookiesByHost = new ConcurrentHashMap<>();

        @Override
        public void saveFromResponse(HttpUrl url, List<Cookie> cookies) {
            cookiesByHost.compute(url.host(), (host, existing) -> {
                List<Cookie> merged = new ArrayList<>();
                if (existing != null) {
                    for (Cookie cookie : existing) {
                        boolean replaced = cookies.stream().anyMatch(c -> c.name().equals(cookie.name()));
                        if (!replaced) {
                            merged.add(cookie);
                        }
                    }
                }
                merged.addAll(cookies);
                return merged;
            });
        }

        @Override
        public List<Cookie> loadForRequest(HttpUrl url) {
            long now = System.currentTimeMillis();
            List<Cookie> out = new ArrayList<>();
            for (Cookie cookie : cookiesByHost.getOrDefault(url.host(), List.of())) {
                if (cookie.expiresAt() > now && cookie.matches(url)) {
                    out.add(cookie);
                }
            }
            return out;
        }
    }
}
