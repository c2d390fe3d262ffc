package com.example.filegate.security.resolver;

import com.example.filegate.common.util.StringSanitizer;
import com.example.filegate.security.context.FrontendUser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Maps the Spring Security authentication of the current request to a {@link FrontendUser}.
 * Authorities named {@code GROUP_<id>} become frontend group ids.
 */
@Slf4j
@Component
public class SecurityContextFrontendUserResolver implements FrontendUserResolver {

    public static final String GROUP_AUTHORITY_PREFIX = "GROUP_";

    @Override
    public Mono<FrontendUser> resolve(ServerWebExchange exchange) {
        return ReactiveSecurityContextHolder.getContext()
                .mapNotNull(SecurityContext::getAuthentication)
                .filter(this::isFrontendLogin)
                .map(this::toFrontendUser)
                .defaultIfEmpty(FrontendUser.anonymous())
                .onErrorResume(e -> {
                    log.warn("Could not resolve frontend user for {}, continuing as anonymous: {}",
                            StringSanitizer.forLog(exchange.getRequest().getPath().value()), e.getMessage());
                    return Mono.just(FrontendUser.anonymous());
                });
    }

    private boolean isFrontendLogin(Authentication authentication) {
        return authentication.isAuthenticated() && !(authentication instanceof AnonymousAuthenticationToken);
    }

    private FrontendUser toFrontendUser(Authentication authentication) {
        Set<Integer> groupIds = new LinkedHashSet<>();
        for (GrantedAuthority authority : authentication.getAuthorities()) {
            String name = authority.getAuthority();
            if (name == null || !name.startsWith(GROUP_AUTHORITY_PREFIX)) {
                continue;
            }
            try {
                groupIds.add(Integer.parseInt(name.substring(GROUP_AUTHORITY_PREFIX.length())));
            } catch (NumberFormatException e) {
                log.debug("Ignoring non-numeric group authority {} of user {}",
                        StringSanitizer.forLog(name), StringSanitizer.forLog(authentication.getName()));
            }
        }
        return FrontendUser.authenticated(authentication.getName(), groupIds);
    }
}
