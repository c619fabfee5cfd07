package io.corekit.client.http.jdk;

import io.corekit.client.http.HttpClient;
import io.corekit.client.http.HttpClientBuilder;

import java.time.Duration;

import org.jspecify.annotations.Nullable;

public class JdkHttpClientBuilder implements HttpClientBuilder {

    private @Nullable Duration connectTimeout;
    private java.net.http.HttpClient.Version version = java.net.http.HttpClient.Version.HTTP_1_1;

    public JdkHttpClientBuilder connectTimeout(@Nullable Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
        return this;
    }

    public JdkHttpClientBuilder version(java.net.http.HttpClient.Version version) {
        this.version = version;
        return this;
    }

    @Override
    public HttpClient create(String url) {
        java.net.http.HttpClient.Builder builder = java.net.http.HttpClient.newBuilder()
                .version(version)
                .followRedirects(java.net.http.HttpClient.Redirect.NORMAL);
        if (connectTimeout != null) {
            builder.connectTimeout(connectTimeout);
        }
        return new JdkHttpClient(url, builder.build());
    }
}
