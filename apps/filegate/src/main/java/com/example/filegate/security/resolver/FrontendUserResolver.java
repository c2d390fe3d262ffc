package com.example.filegate.security.resolver;

import com.example.filegate.security.context.FrontendUser;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * Resolves the visitor behind a request. Implementations never complete empty and never
 * signal an error: an unresolvable visitor is anonymous.
 */
public interface FrontendUserResolver {

    Mono<FrontendUser> resolve(ServerWebExchange exchange);
}
