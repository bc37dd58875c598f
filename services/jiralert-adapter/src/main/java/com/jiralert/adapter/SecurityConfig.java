package com.jiralert.adapter;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.reactive.EnableWebFluxSecurity;
import org.springframework.security.config.web.server.ServerHttpSecurity;
import org.springframework.security.core.userdetails.MapReactiveUserDetailsService;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.web.server.SecurityWebFilterChain;

import com.jiralert.adapter.integration.props.JiralertProperties;

/**
 * Central Spring Security configuration for the adapter.
 *
 * <p>Probe and actuator endpoints are always open. The webhook endpoints are
 * open too unless {@code jiralert.webhook.basic-auth.enabled} is set, in which
 * case they require the configured HTTP Basic credentials (Alertmanager's
 * {@code basic_auth} setting).</p>
 */
@Configuration
@EnableWebFluxSecurity
public class SecurityConfig {

    @Bean
    public SecurityWebFilterChain securityWebFilterChain(ServerHttpSecurity http, JiralertProperties properties) {
        http
            .formLogin(ServerHttpSecurity.FormLoginSpec::disable)
            .csrf(ServerHttpSecurity.CsrfSpec::disable);

        if (properties.getWebhook().getBasicAuth().isEnabled()) {
            http
                .authorizeExchange(exchanges -> exchanges
                    .pathMatchers("/-/**", "/actuator/**").permitAll()
                    .anyExchange().authenticated()
                )
                .httpBasic(Customizer.withDefaults());
        } else {
            http
                .authorizeExchange(exchanges -> exchanges.anyExchange().permitAll())
                .httpBasic(ServerHttpSecurity.HttpBasicSpec::disable);
        }
        return http.build();
    }

    @Bean
    public MapReactiveUserDetailsService webhookUsers(JiralertProperties properties) {
        JiralertProperties.BasicAuthProperties credentials = properties.getWebhook().getBasicAuth();
        UserDetails alertmanager = User.withUsername(credentials.getUsername())
            .password("{noop}" + credentials.getPassword())
            .roles("WEBHOOK")
            .build();
        return new MapReactiveUserDetailsService(alertmanager);
    }
}
