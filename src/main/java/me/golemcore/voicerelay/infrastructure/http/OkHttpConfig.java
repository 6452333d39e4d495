/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */


package me.golemcore.voicerelay.infrastructure.http;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.voicerelay.infrastructure.config.RelayProperties;
import okhttp3.ConnectionPool;
import okhttp3.Interceptor;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Shared OkHttp client for the speech adapters and the Feign client of the
 * local model server. Timeouts and pool size come from {@code voice.http.*};
 * every request carries the relay's {@code User-Agent}.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class OkHttpConfig {

    private final RelayProperties properties;

    @Bean
    public OkHttpClient okHttpClient() {
        RelayProperties.HttpProperties http = properties.getHttp();
        log.debug("[HTTP] Client: connect={}, read={}, write={}, pool={}",
                http.getConnectTimeout(), http.getReadTimeout(), http.getWriteTimeout(),
                http.getMaxIdleConnections());

        return new OkHttpClient.Builder()
                .connectTimeout(http.getConnectTimeout())
                .readTimeout(http.getReadTimeout())
                .writeTimeout(http.getWriteTimeout())
                .connectionPool(new ConnectionPool(
                        http.getMaxIdleConnections(),
                        http.getKeepAlive().toMillis(),
                        TimeUnit.MILLISECONDS))
                .addInterceptor(userAgent(http.getUserAgent()))
                .build();
    }

    static Interceptor userAgent(String userAgent) {
        return chain -> {
            if (userAgent == null || userAgent.isBlank() || chain.request().header("User-Agent") != null) {
                return chain.proceed(chain.request());
            }
            return chain.proceed(chain.request().newBuilder()
                    .header("User-Agent", userAgent)
                    .build());
        };
    }
}
