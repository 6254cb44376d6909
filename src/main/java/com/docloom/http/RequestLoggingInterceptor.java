package com.docloom.http;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;

/**
 * Logs method, URL, status and latency at DEBUG. Headers are never logged since they carry tokens.
 */
public class RequestLoggingInterceptor implements Interceptor {
    private static final Logger log = LoggerFactory.getLogger(RequestLoggingInterceptor.class);

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        long start = System.nanoTime();
        log.debug("Sending {} {}", request.method(), request.url());
        Response response;
        try {
            response = chain.proceed(request);
        } catch (IOException e) {
            log.debug("Request {} {} failed after {} ms: {}", request.method(), request.url(),
                    (System.nanoTime() - start) / 1_000_000, e.toString());
            throw e;
        }
        log.debug("Received {} for {} {} in {} ms", response.code(), request.method(), request.url(),
                (System.nanoTime() - start) / 1_000_000);
        return response;
    }
}
