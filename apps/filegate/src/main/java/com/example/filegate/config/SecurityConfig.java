package com.example.filegate.config;

import com.example.filegate.config.properties.FileGateProperties;
import com.example.filegate.security.resolver.SecurityContextFrontendUserResolver;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.reactive.EnableWebFluxSecurity;
import org.springframework.security.config.web.server.ServerHttpSecurity;
import org.springframework.security.core.userdetails.ReactiveUserDetailsService;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.crypto.factory.PasswordEncoderFactories;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.server.SecurityWebFilterChain;
import reactor.core.publisher.Mono;

import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Frontend login via HTTP Basic. Authentication only: every exchange is permitted and file
 * access is decided by the gate filter.
 */
@Configuration
@EnableWebFluxSecurity
public class SecurityConfig {

    @Bean
    public SecurityWebFilterChain frontendSecurityFilterChain(ServerHttpSecurity http) {
        return http
                .csrf(ServerHttpSecurity.CsrfSpec::disable) // Read-only file delivery, no state-changing endpoints
                .formLogin(ServerHttpSecurity.FormLoginSpec::disable)
                .httpBasic(Customizer.withDefaults())
                .authorizeExchange(exchanges -> exchanges.anyExchange().permitAll())
                .build();
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return PasswordEncoderFactories.createDelegatingPasswordEncoder();
    }

    @Bean
    public ReactiveUserDetailsService frontendUserDetailsService(FileGateProperties properties) {
        Map<String, UserDetails> users = properties.frontendUsers().stream()
                .map(SecurityConfig::toUserDetails)
                .collect(Collectors.toUnmodifiableMap(
                        user -> user.getUsername().toLowerCase(Locale.ROOT),
                        Function.identity()));

        return username -> Mono.justOrEmpty(users.get(username.toLowerCase(Locale.ROOT)))
                .map(user -> User.withUserDetails(user).build());
    }

    private static UserDetails toUserDetails(FileGateProperties.FrontendUserProperties user) {
        return User.withUsername(user.username())
                .password(user.password())
                .authorities(user.groups().stream()
                        .map(groupId -> SecurityContextFrontendUserResolver.GROUP_AUTHORITY_PREFIX + groupId)
                        .toArray(String[]::new))
                .build();
    }
}
