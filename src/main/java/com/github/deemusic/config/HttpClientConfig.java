package com.github.deemusic.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Interceptor;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.time.Duration;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class HttpClientConfig {

    private final DeeMusicProperties properties;

    /**
     * Retries are not done here; the queue's retry policy owns them.
     */
    @Bean
    public OkHttpClient okHttpClient() {
        Duration timeout = Duration.ofSeconds(properties.getCatalog().getTimeoutSeconds());
        return new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .writeTimeout(timeout)
                .addInterceptor(new CatalogHeaderInterceptor(properties.getCatalog()))
                .followRedirects(true)
                .followSslRedirects(true)
                .build();
    }

    /**
     * Adds the client identification and, when configured, the session credential cookie.
     */
    static class CatalogHeaderInterceptor implements Interceptor {

        private final DeeMusicProperties.Catalog catalog;

        CatalogHeaderInterceptor(DeeMusicProperties.Catalog catalog) {
            this.catalog = catalog;
        }

        @NotNull
        @Override
        public Response intercept(@NotNull Chain chain) throws IOException {
            Request.Builder builder = chain.request().newBuilder()
                    .header("User-Agent", catalog.getUserAgent())
                    .header("Accept", "application/json, audio/*;q=0.9, */*;q=0.8");

            if (catalog.hasCredential()) {
                builder.header("Cookie", "arl=" + catalog.getArl());
            }

            Response response = chain.proceed(builder.build());
            if (response.code() == 401 || response.code() == 403) {
                log.warn("Catalog rejected credentials for {}", chain.request().url().encodedPath());
            }
            return response;
        }
    }
}
