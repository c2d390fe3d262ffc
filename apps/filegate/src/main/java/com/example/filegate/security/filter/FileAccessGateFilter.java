package com.example.filegate.security.filter;

import com.example.filegate.common.exception.InvalidGroupListException;
import com.example.filegate.common.filter.FilterResponseUtils;
import com.example.filegate.common.util.StringSanitizer;
import com.example.filegate.observability.metrics.GateMetrics;
import com.example.filegate.security.access.FileAccessPolicy;
import com.example.filegate.security.resolver.FrontendUserResolver;
import com.example.filegate.storage.ResourceStorage;
import com.example.filegate.storage.StorageRepository;
import com.example.filegate.storage.model.FileRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Intercepts direct requests for files under the protected prefix and only streams a file when
 * the visitor may read it.
 *
 * <p>Outcomes:</p>
 * <ul>
 *   <li>path outside the prefix: passed to the chain untouched</li>
 *   <li>no default storage: 503, logged once at ERROR</li>
 *   <li>missing file, denied file, malformed identifier or collaborator failure: 404</li>
 *   <li>readable file: 200 with the file's content type, length and bytes</li>
 * </ul>
 * Denied files answer 404, never 403, so restricted files cannot be told apart from missing ones.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileAccessGateFilter implements WebFilter, Ordered {

    private final ProtectedPathMatcher pathMatcher;
    private final StorageRepository storageRepository;
    private final FrontendUserResolver frontendUserResolver;
    private final FileAccessPolicy accessPolicy;
    private final GateMetrics metrics;

    @Override
    public int getOrder() {
        return 0; // After the Spring Security chain so the frontend login is known
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().pathWithinApplication().value();
        Optional<String> rawIdentifier = pathMatcher.extractIdentifier(path);
        if (rawIdentifier.isEmpty()) {
            metrics.recordDecision(GateDecision.PASS_THROUGH);
            return chain.filter(exchange);
        }

        return storageRepository.findDefaultStorage()
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(storage -> storage
                        .map(defaultStorage -> handleProtectedRequest(exchange, defaultStorage, rawIdentifier.get()))
                        .orElseGet(() -> serviceUnavailable(exchange)));
    }

    private Mono<Void> handleProtectedRequest(ServerWebExchange exchange, ResourceStorage storage, String rawIdentifier) {
        Optional<String> identifier = pathMatcher.decodeIdentifier(rawIdentifier);
        if (identifier.isEmpty()) {
            log.debug("Malformed identifier under protected prefix: {}", StringSanitizer.forLog(rawIdentifier));
            return notFound(exchange);
        }

        return resolveReadableFile(exchange, storage, identifier.get())
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .onErrorResume(error -> {
                    logResolutionFailure(storage, identifier.get(), error);
                    return Mono.just(Optional.empty());
                })
                .flatMap(file -> file
                        .map(readable -> serve(exchange, storage, readable))
                        .orElseGet(() -> notFound(exchange)));
    }

    // Completes empty when the file is missing or the visitor may not read it
    private Mono<FileRecord> resolveReadableFile(ServerWebExchange exchange, ResourceStorage storage, String identifier) {
        return storage.hasFile(identifier)
                .filter(Boolean::booleanValue)
                .flatMap(exists -> storage.getFile(identifier))
                .flatMap(file -> frontendUserResolver.resolve(exchange)
                        .filter(user -> {
                            boolean accessible = accessPolicy.isAccessible(storage, file, user);
                            log.debug("Access to {} in storage {}: user={}, accessible={}",
                                    StringSanitizer.forLog(identifier), storage.getUid(),
                                    StringSanitizer.forLog(user.username()), accessible);
                            return accessible;
                        })
                        .map(user -> file));
    }

    private Mono<Void> serve(ServerWebExchange exchange, ResourceStorage storage, FileRecord file) {
        metrics.recordDecision(GateDecision.SERVE);
        return FilterResponseUtils.stream(
                exchange,
                file.mimeType(),
                file.size(),
                storage.readContent(file, exchange.getResponse().bufferFactory()));
    }

    private Mono<Void> notFound(ServerWebExchange exchange) {
        metrics.recordDecision(GateDecision.NOT_FOUND);
        return FilterResponseUtils.notFound(exchange);
    }

    private Mono<Void> serviceUnavailable(ServerWebExchange exchange) {
        log.error("Default storage cannot be determined, please check the storage configuration "
                + "(exactly one online storage must be flagged as default)");
        metrics.recordDecision(GateDecision.SERVICE_UNAVAILABLE);
        return FilterResponseUtils.serviceUnavailable(exchange);
    }

    private void logResolutionFailure(ResourceStorage storage, String identifier, Throwable error) {
        if (error instanceof InvalidGroupListException invalid) {
            log.error("File {} in storage {} has an invalid access group list '{}', denying access",
                    StringSanitizer.forLog(identifier), storage.getUid(),
                    StringSanitizer.forLog(invalid.getGroupList()));
            return;
        }
        log.warn("Failed to resolve file {} in storage {}, denying access: {}",
                StringSanitizer.forLog(identifier), storage.getUid(), error.getMessage());
    }
}
