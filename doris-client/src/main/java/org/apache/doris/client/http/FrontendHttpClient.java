/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.doris.client.http;

import org.apache.doris.client.config.FrontendConfig;
import org.apache.doris.client.exception.DorisHttpException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;

/**
 * JSON client for the HTTP control-plane API of a frontend node.
 *
 * <p>Each call is a single request without retry. Responses with a non-2xx status and transport
 * failures are raised as {@link DorisHttpException}; successful bodies are returned as parsed JSON
 * without any shape validation.
 */
public class FrontendHttpClient {

    private static final Logger LOG = LoggerFactory.getLogger(FrontendHttpClient.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final FrontendConfig frontend;
    @Nullable private final String authorization;
    private final HttpClient httpClient;

    private FrontendHttpClient(
            FrontendConfig frontend, @Nullable String authorization, HttpClient httpClient) {
        this.frontend = frontend;
        this.authorization = authorization;
        this.httpClient = httpClient;
    }

    /** Creates a client that sends HTTP basic authentication with every request. */
    public static FrontendHttpClient create(
            FrontendConfig frontend, String user, String password, int connectTimeoutMillis) {
        String token =
                Base64.getEncoder()
                        .encodeToString((user + ":" + password).getBytes(StandardCharsets.UTF_8));
        return new FrontendHttpClient(
                frontend, "Basic " + token, newHttpClient(connectTimeoutMillis));
    }

    /** Creates a client that sends no credentials. */
    public static FrontendHttpClient unauthenticated(
            FrontendConfig frontend, int connectTimeoutMillis) {
        return new FrontendHttpClient(frontend, null, newHttpClient(connectTimeoutMillis));
    }

    private static HttpClient newHttpClient(int connectTimeoutMillis) {
        HttpClient.Builder builder = HttpClient.newBuilder();
        if (connectTimeoutMillis > 0) {
            builder.connectTimeout(Duration.ofMillis(connectTimeoutMillis));
        }
        return builder.build();
    }

    /** Returns a client for another frontend that reuses these credentials. */
    public FrontendHttpClient forFrontend(FrontendConfig other) {
        return new FrontendHttpClient(other, authorization, httpClient);
    }

    public FrontendConfig getFrontend() {
        return frontend;
    }

    public JsonNode get(String path) {
        return send(newRequest(path).GET().build());
    }

    public JsonNode post(String path, JsonNode body) {
        String payload;
        try {
            payload = MAPPER.writeValueAsString(body);
        } catch (IOException e) {
            throw new DorisHttpException("Failed to serialize request body: " + e.getMessage(), e);
        }
        return send(
                newRequest(path)
                        .header("Content-Type", "application/json; charset=utf-8")
                        .POST(HttpRequest.BodyPublishers.ofString(payload, StandardCharsets.UTF_8))
                        .build());
    }

    /** URL-encodes a single path segment. */
    public static String encodePathSegment(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private HttpRequest.Builder newRequest(String path) {
        HttpRequest.Builder builder =
                HttpRequest.newBuilder()
                        .uri(URI.create(frontend.toBaseUrl() + path))
                        .header("Accept", "application/json");
        if (authorization != null) {
            builder.header("Authorization", authorization);
        }
        return builder;
    }

    private JsonNode send(HttpRequest request) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            LOG.error("Request {} {} failed: {}", request.method(), request.uri(), e.toString());
            throw new DorisHttpException(
                    "Request to " + request.uri() + " failed: " + describe(e), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DorisHttpException("Request to " + request.uri() + " was interrupted", e);
        }

        int statusCode = response.statusCode();
        String body = response.body();
        if (statusCode < 200 || statusCode >= 300) {
            LOG.error(
                    "Request {} {} returned status {}: {}",
                    request.method(),
                    request.uri(),
                    statusCode,
                    body);
            throw new DorisHttpException(
                    "Request to " + request.uri() + " failed with status code " + statusCode,
                    statusCode,
                    body);
        }
        if (body == null || body.trim().isEmpty()) {
            return MAPPER.createObjectNode();
        }
        try {
            return MAPPER.readTree(body);
        } catch (IOException e) {
            LOG.error("Response of {} {} is not JSON: {}", request.method(), request.uri(), body);
            throw new DorisHttpException(
                    "Response from " + request.uri() + " is not valid JSON: " + e.getMessage(), e);
        }
    }

    private static String describe(IOException e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
