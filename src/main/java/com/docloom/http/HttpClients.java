package com.docloom.http;

import java.time.Duration;

import com.docloom.runtime.AppConfig;

import okhttp3.OkHttpClient;

public final class HttpClients {
    private HttpClients() {
    }

    public static OkHttpClient create(AppConfig.HttpConfig config) {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofMillis(config.getConnectTimeoutMs()))
                .readTimeout(Duration.ofMillis(config.getReadTimeoutMs()))
                .callTimeout(Duration.ofMillis(config.getCallTimeoutMs()))
                .addInterceptor(new RequestLoggingInterceptor())
                .build();
    }
}
