package org.rttrail.global;

import java.security.SecureRandom;
import java.time.Clock;

import org.rttrail.auth.rest.AuthenticatedUserArgumentResolver;
import org.rttrail.global.rest.HttpFilter;
import org.rttrail.global.rest.JwtFilter;
import org.rttrail.init.SuperuserProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.security.authentication.ReactiveAuthenticationManager;
import org.springframework.security.config.web.server.SecurityWebFiltersOrder;
import org.springframework.security.config.web.server.ServerHttpSecurity;
import org.springframework.security.config.web.server.ServerHttpSecurity.CsrfSpec;
import org.springframework.security.config.web.server.ServerHttpSecurity.FormLoginSpec;
import org.springframework.security.config.web.server.ServerHttpSecurity.HttpBasicSpec;
import org.springframework.security.config.web.server.ServerHttpSecurity.LogoutSpec;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.server.SecurityWebFilterChain;
import org.springframework.security.web.server.context.NoOpServerSecurityContextRepository;
import org.springframework.web.reactive.config.WebFluxConfigurer;
import org.springframework.web.reactive.result.method.annotation.ArgumentResolverConfigurer;
import org.springframework.web.server.session.WebSessionManager;

import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Mono;

@Configuration
@EnableScheduling
@EnableConfigurationProperties(SuperuserProperties.class)
@RequiredArgsConstructor
public class RttrailConfiguration implements WebFluxConfigurer {

	private final AuthenticatedUserArgumentResolver authenticatedUserResolver;

	@Bean
	WebSessionManager webSessionManager() {
		return exchange -> Mono.empty();
	}

	/**
	 * Every exchange goes through; access rules are enforced on the handler parameters annotated
	 * with {@link org.rttrail.auth.Authenticated}, so that errors are rendered as {@code ApiError}.
	 */
	@Bean
	SecurityWebFilterChain springSecurityFilterChain(ServerHttpSecurity http, ReactiveAuthenticationManager authManager) {
		return http
		.csrf(CsrfSpec::disable)
		.formLogin(FormLoginSpec::disable)
		.httpBasic(HttpBasicSpec::disable)
		.logout(LogoutSpec::disable)
		.authorizeExchange(auth -> auth.anyExchange().permitAll())
		.addFilterBefore(new HttpFilter(), SecurityWebFiltersOrder.HTTP_BASIC)
		.addFilterBefore(new JwtFilter(authManager), SecurityWebFiltersOrder.HTTP_BASIC)
		.securityContextRepository(NoOpServerSecurityContextRepository.getInstance())
		.build();
	}

	@Bean
	SecureRandom secureRandom() {
		return new SecureRandom();
	}

	@Bean
	Clock clock() {
		return Clock.systemUTC();
	}

	@Bean
	PasswordEncoder passwordEncoder() {
		return new BCryptPasswordEncoder();
	}

	@Override
	public void configureArgumentResolvers(ArgumentResolverConfigurer configurer) {
		configurer.addCustomResolver(authenticatedUserResolver);
	}

}
