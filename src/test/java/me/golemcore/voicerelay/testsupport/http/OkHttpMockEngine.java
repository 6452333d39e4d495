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

package me.golemcore.voicerelay.testsupport.http;

import okhttp3.Headers;
import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Interceptor that answers OkHttp calls from a queue of planned responses.
 * No network I/O happens; every request is captured for assertions.
 */
public final class OkHttpMockEngine implements Interceptor {

    private final ConcurrentLinkedQueue<Planned> planned = new ConcurrentLinkedQueue<>();
    private final ConcurrentLinkedQueue<CapturedRequest> captured = new ConcurrentLinkedQueue<>();
    private final AtomicInteger requestCount = new AtomicInteger();

    public OkHttpClient client() {
        return new OkHttpClient.Builder().addInterceptor(this).build();
    }

    public void enqueueJson(int code, String body) {
        enqueueBytes(code, body != null ? body.getBytes(StandardCharsets.UTF_8) : new byte[0], "application/json");
    }

    public void enqueueBytes(int code, byte[] body, String contentType) {
        planned.add(new Planned(code, body != null ? body : new byte[0], contentType, null));
    }

    public void enqueueFailure(IOException failure) {
        planned.add(new Planned(0, new byte[0], null, failure));
    }

    public CapturedRequest takeRequest() {
        return captured.poll();
    }

    public int getRequestCount() {
        return requestCount.get();
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        captured.add(new CapturedRequest(request, readBody(request)));
        requestCount.incrementAndGet();

        Planned next = planned.poll();
        if (next == null) {
            throw new IOException("No planned response for " + request.method() + " " + request.url());
        }
        if (next.failure() != null) {
            throw next.failure();
        }
        MediaType mediaType = next.contentType() != null ? MediaType.parse(next.contentType()) : null;
        return new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(next.code())
                .message("mock")
                .headers(Headers.of())
                .body(ResponseBody.create(next.body(), mediaType))
                .build();
    }

    private static String readBody(Request request) throws IOException {
        RequestBody body = request.body();
        if (body == null) {
            return "";
        }
        Buffer buffer = new Buffer();
        body.writeTo(buffer);
        return buffer.readString(StandardCharsets.UTF_8);
    }

    private record Planned(int code, byte[] body, String contentType, IOException failure) {
    }

    public static final class CapturedRequest {
        private final Request request;
        private final String body;

        private CapturedRequest(Request request, String body) {
            this.request = request;
            this.body = body;
        }

        public String method() {
            return request.method();
        }

        /** Path plus query string. */
        public String target() {
            String query = request.url().encodedQuery();
            String path = request.url().encodedPath();
            return query == null || query.isBlank() ? path : path + "?" + query;
        }

        public String header(String name) {
            if (request.header(name) != null) {
                return request.header(name);
            }
            if ("Content-Type".equalsIgnoreCase(name) && request.body() != null
                    && request.body().contentType() != null) {
                return request.body().contentType().toString();
            }
            return null;
        }

        public String body() {
            return body;
        }
    }
}
