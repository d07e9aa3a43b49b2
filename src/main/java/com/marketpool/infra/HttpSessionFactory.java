package com.marketpool.infra;

import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.ConnectionPool;
import okhttp3.ConnectionSpec;
import okhttp3.Dispatcher;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Opens independent {@link HttpSession}s. Every call carries its own connect
 * and read timeout; sessions share nothing.
 */
@Component
public class HttpSessionFactory {

    private final ObjectMapper objectMapper;
    private final String userAgent;
    private final int connectTimeoutSeconds;
    private final int readTimeoutSeconds;

    public HttpSessionFactory(ObjectMapper objectMapper,
            @Value("${marketpool.http.user-agent:Mozilla/5.0 (compatible; MarketPool/1.0)}") String userAgent,
            @Value("${marketpool.http.connect-timeout-seconds:10}") int connectTimeoutSeconds,
            @Value("${marketpool.http.read-timeout-seconds:30}") int readTimeoutSeconds) {
        this.objectMapper = objectMapper;
        this.userAgent = userAgent;
        this.connectTimeoutSeconds = connectTimeoutSeconds;
        this.readTimeoutSeconds = readTimeoutSeconds;
    }

    public HttpSession open() {
        return open(Map.of());
    }

    public HttpSession open(Map<String, String> extraHeaders) {
        ConnectionSpec spec = new ConnectionSpec.Builder(ConnectionSpec.MODERN_TLS)
                .allEnabledTlsVersions()
                .allEnabledCipherSuites()
                .build();

        OkHttpClient client = new OkHttpClient.Builder()
                .connectionSpecs(Arrays.asList(spec, ConnectionSpec.CLEARTEXT))
                .connectionPool(new ConnectionPool())
                .dispatcher(new Dispatcher())
                .cookieJar(new HttpSession.SessionCookieJar())
                .connectTimeout(connectTimeoutSeconds, TimeUnit.SECONDS)
                .readTimeout(readTimeoutSeconds, TimeUnit.SECONDS)
                .retryOnConnectionFailure(true)
                .followRedirects(true)
                .build();

        Map<String, String> headers = new HashMap<>();
        headers.put("User-Agent", userAgent);
        headers.putAll(extraHeaders);
        return new HttpSession(client, objectMapper, headers);
    }
}
