package me.golemcore.dialogs.adapter.outbound.rpc;

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

import me.golemcore.dialogs.domain.model.ProtocolContractViolationException;
import me.golemcore.dialogs.domain.model.RpcInvocationException;
import me.golemcore.dialogs.domain.model.RpcRequest;
import me.golemcore.dialogs.infrastructure.config.DialogsProperties;
import me.golemcore.dialogs.port.outbound.RpcTransportPort;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.exc.InvalidTypeIdException;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Transport adapter that forwards RPC calls to an HTTP gateway speaking the
 * platform API on our behalf.
 *
 * <p>
 * Protocol:
 * <ul>
 * <li>POST {@code {url}/{method}} with the request as snake_case JSON;
 * polymorphic values carry an {@code @type} discriminator</li>
 * <li>2xx - body is the result, decoded into the request's result type</li>
 * <li>non-2xx - body is {@code {"error_code": 400, "error_message":
 * "PEER_ID_INVALID"}}, surfaced as {@link RpcInvocationException}</li>
 * </ul>
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code dialogs.gateway.url} - gateway base URL</li>
 * <li>{@code dialogs.gateway.api-key} - optional bearer token</li>
 * </ul>
 *
 * <p>
 * Calls are executed asynchronously on OkHttp's dispatcher. Cancelling a
 * returned future cancels the HTTP call.
 *
 * @see RpcTransportPort
 */
@Slf4j
public class HttpRpcTransportAdapter implements RpcTransportPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final String baseUrl;
    private final String apiKey;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpRpcTransportAdapter(DialogsProperties properties, OkHttpClient httpClient, ObjectMapper objectMapper) {
        String url = Objects.requireNonNull(properties.getGateway().getUrl(), "dialogs.gateway.url");
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.apiKey = properties.getGateway().getApiKey();
        this.httpClient = httpClient;
        this.objectMapper = configure(objectMapper.copy());
    }

    static ObjectMapper configure(ObjectMapper mapper) {
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Override
    public <R> CompletableFuture<R> invoke(RpcRequest<R> request) {
        CompletableFuture<R> future = new CompletableFuture<>();
        String method = request.method();

        Request httpRequest;
        try {
            httpRequest = buildRequest(request);
        } catch (JsonProcessingException e) {
            future.completeExceptionally(new RpcInvocationException(RpcInvocationException.IO_ERROR_CODE,
                    "Failed to encode " + method + ": " + e.getOriginalMessage(), e));
            return future;
        }

        log.debug("[RPC] → {}", method);
        Call call = httpClient.newCall(httpRequest);
        future.whenComplete((result, error) -> {
            if (future.isCancelled()) {
                call.cancel();
            }
        });
        call.enqueue(new Callback() {
            @Override
            public void onFailure(Call failedCall, IOException e) {
                if (!future.isDone()) {
                    log.warn("[RPC] {} failed: {}", method, e.getMessage());
                }
                future.completeExceptionally(new RpcInvocationException(RpcInvocationException.IO_ERROR_CODE,
                        method + " failed: " + e.getMessage(), e));
            }

            @Override
            public void onResponse(Call completedCall, Response response) {
                try (response) {
                    complete(future, request, response);
                }
            }
        });
        return future;
    }

    private Request buildRequest(RpcRequest<?> request) throws JsonProcessingException {
        String body = objectMapper.writeValueAsString(request);
        Request.Builder builder = new Request.Builder()
                .url(baseUrl + "/" + request.method())
                .post(RequestBody.create(body, JSON));
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        return builder.build();
    }

    private <R> void complete(CompletableFuture<R> future, RpcRequest<R> request, Response response) {
        String method = request.method();
        String payload;
        try {
            ResponseBody body = response.body();
            payload = body != null ? body.string() : "";
        } catch (IOException e) {
            future.completeExceptionally(new RpcInvocationException(RpcInvocationException.IO_ERROR_CODE,
                    "Failed to read " + method + " response: " + e.getMessage(), e));
            return;
        }

        if (!response.isSuccessful()) {
            RpcInvocationException error = parseError(response.code(), payload);
            log.warn("[RPC] {} rejected: {} {}", method, error.getCode(), error.getMessage());
            future.completeExceptionally(error);
            return;
        }

        try {
            R result = objectMapper.readValue(payload, request.responseType());
            log.debug("[RPC] ← {} ({} bytes)", method, payload.length());
            future.complete(result);
        } catch (InvalidTypeIdException e) {
            future.completeExceptionally(new ProtocolContractViolationException(
                    "Unknown variant '" + e.getTypeId() + "' in " + method + " response", e));
        } catch (JsonProcessingException e) {
            future.completeExceptionally(new RpcInvocationException(RpcInvocationException.IO_ERROR_CODE,
                    "Malformed " + method + " response: " + e.getOriginalMessage(), e));
        }
    }

    private RpcInvocationException parseError(int httpCode, String payload) {
        try {
            JsonNode node = objectMapper.readTree(payload);
            if (node != null && node.has("error_message")) {
                int code = node.has("error_code") ? node.get("error_code").asInt(httpCode) : httpCode;
                return new RpcInvocationException(code, node.get("error_message").asText());
            }
        } catch (JsonProcessingException e) {
            log.debug("[RPC] Error body is not JSON: {}", e.getOriginalMessage());
        }
        return new RpcInvocationException(httpCode, "HTTP " + httpCode);
    }
}
