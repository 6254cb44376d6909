package com.docloom.http;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import okhttp3.HttpUrl;
import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;

/**
 * Answers requests from canned routes without touching the network. Unmatched requests get a 404.
 */
public class StubInterceptor implements Interceptor {
    private final List<Route> routes = Collections.synchronizedList(new ArrayList<>());
    private final List<Request> requests = Collections.synchronizedList(new ArrayList<>());

    public StubInterceptor on(String path, Handler handler) {
        routes.add(new Route(path, null, handler));
        return this;
    }

    /**
     * Matches only requests whose {@code page} query parameter equals {@code page}.
     */
    public StubInterceptor onPage(String path, String page, Handler handler) {
        routes.add(new Route(path, page, handler));
        return this;
    }

    public StubInterceptor json(String path, String body) {
        return on(path, request -> Stub.json(body));
    }

    public List<Request> requests() {
        synchronized (requests) {
            return List.copyOf(requests);
        }
    }

    public long count(String path) {
        return requests().stream().filter(request -> request.url().encodedPath().equals(path)).count();
    }

    public static String bodyOf(Request request) throws IOException {
        if (request.body() == null) {
            return "";
        }
        Buffer buffer = new Buffer();
        request.body().writeTo(buffer);
        return buffer.readUtf8();
    }

    public OkHttpClient client() {
        return new OkHttpClient.Builder().addInterceptor(this).build();
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        requests.add(request);
        Stub stub = Stub.status(404, "{\"message\":\"Not Found\"}");
        for (Route route : List.copyOf(routes)) {
            if (route.matches(request.url())) {
                stub = route.handler().handle(request);
                break;
            }
        }
        Response.Builder builder = new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(stub.status())
                .message("stub")
                .body(ResponseBody.create(stub.body(), MediaType.get(stub.contentType())));
        stub.headers().forEach(builder::header);
        return builder.build();
    }

    @FunctionalInterface
    public interface Handler {
        Stub handle(Request request) throws IOException;
    }

    public record Stub(int status, String body, String contentType, Map<String, String> headers) {

        public static Stub json(String body) {
            return new Stub(200, body, "application/json", Map.of());
        }

        public static Stub json(String body, Map<String, String> headers) {
            return new Stub(200, body, "application/json", headers);
        }

        public static Stub html(String body) {
            return new Stub(200, body, "text/html", Map.of());
        }

        public static Stub status(int status, String body) {
            return new Stub(status, body, "application/json", Map.of());
        }

        public static Stub status(int status, String body, Map<String, String> headers) {
            return new Stub(status, body, "application/json", headers);
        }
    }

    private record Route(String path, String page, Handler handler) {
        boolean matches(HttpUrl url) {
            return url.encodedPath().equals(path) && (page == null || page.equals(url.queryParameter("page")));
        }
    }
}
