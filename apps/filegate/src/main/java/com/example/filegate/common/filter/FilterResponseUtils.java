package com.example.filegate.common.filter;

import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.lang.NonNull;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Response writers for WebFilters that answer a request themselves.
 * Error statuses carry no body so that denied and missing files look the same.
 */
public final class FilterResponseUtils {

    private FilterResponseUtils() {}

    /**
     * Returns a 404 Not Found response with an empty body.
     */
    @NonNull
    public static Mono<Void> notFound(@NonNull ServerWebExchange exchange) {
        return emptyResponse(exchange, HttpStatus.NOT_FOUND);
    }

    /**
     * Returns a 503 Service Unavailable response with an empty body.
     */
    @NonNull
    public static Mono<Void> serviceUnavailable(@NonNull ServerWebExchange exchange) {
        return emptyResponse(exchange, HttpStatus.SERVICE_UNAVAILABLE);
    }

    /**
     * Streams a body with the given content type and length and a 200 OK status.
     */
    @NonNull
    public static Mono<Void> stream(
            @NonNull ServerWebExchange exchange,
            @NonNull String contentType,
            long contentLength,
            @NonNull Flux<DataBuffer> body) {

        ServerHttpResponse response = exchange.getResponse();
        response.setStatusCode(HttpStatus.OK);
        HttpHeaders headers = response.getHeaders();
        headers.set(HttpHeaders.CONTENT_TYPE, contentType);
        headers.setContentLength(contentLength);
        return response.writeWith(body);
    }

    @NonNull
    private static Mono<Void> emptyResponse(@NonNull ServerWebExchange exchange, @NonNull HttpStatus status) {
        ServerHttpResponse response = exchange.getResponse();
        response.setStatusCode(status);
        response.getHeaders().setContentLength(0);
        return response.setComplete();
    }
}
