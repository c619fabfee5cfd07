package io.corekit.client.http;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

public interface HttpResponse {
    int statusCode();

    default boolean success() {
        return statusCode() >= 200 && statusCode() < 300;
    }

    Map<String, List<String>> headers();

    CompletableFuture<String> body();
}
