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

import com.fasterxml.jackson.databind.ObjectMapper;
import feign.Feign;
import feign.Request;
import feign.Retryer;
import feign.jackson.JacksonDecoder;
import feign.jackson.JacksonEncoder;
import feign.okhttp.OkHttpClient;
import lombok.RequiredArgsConstructor;
import me.golemcore.voicerelay.infrastructure.config.RelayProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Builds JSON Feign clients on top of the shared OkHttp client.
 *
 * <p>
 * Clients never retry: a failed call surfaces immediately so the provider
 * router can move on to the next provider.
 */
@Component
@RequiredArgsConstructor
public class FeignClientFactory {

    private final okhttp3.OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;
    private final RelayProperties properties;

    /**
     * Creates a client for {@code apiType} rooted at {@code baseUrl}.
     *
     * @param readTimeout
     *            per-request read timeout, or null for {@code voice.http.read-timeout}
     */
    public <T> T create(Class<T> apiType, String baseUrl, Duration readTimeout) {
        Duration connectTimeout = properties.getHttp().getConnectTimeout();
        Duration effectiveReadTimeout = readTimeout != null ? readTimeout : properties.getHttp().getReadTimeout();
        return Feign.builder()
                .client(new OkHttpClient(okHttpClient))
                .encoder(new JacksonEncoder(objectMapper))
                .decoder(new JacksonDecoder(objectMapper))
                .options(new Request.Options(
                        connectTimeout.toMillis(), TimeUnit.MILLISECONDS,
                        effectiveReadTimeout.toMillis(), TimeUnit.MILLISECONDS,
                        true))
                .retryer(Retryer.NEVER_RETRY)
                .target(apiType, baseUrl);
    }
}
