package com.example.programmers.config;

import com.example.programmers.security.CsrfCookieFilter;
import com.example.programmers.security.JsonAccessDeniedHandler;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.csrf.CookieCsrfTokenRepository;
import org.springframework.security.web.csrf.CsrfFilter;
import org.springframework.security.web.csrf.CsrfTokenRequestAttributeHandler;

/**
 * No login: every route is open, but writes must echo the {@code XSRF-TOKEN} cookie in the
 * {@code X-XSRF-TOKEN} header (or the {@code _csrf} form parameter), which is what
 * Angular's {@code $http} does out of the box.
 */
@Configuration
public class SecurityConfig {

  @Value("${programmers.security.bcrypt-strength:10}")
  private int bcryptStrength;

  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http, ObjectMapper objectMapper) throws Exception {
    CookieCsrfTokenRepository tokenRepository = CookieCsrfTokenRepository.withHttpOnlyFalse();
    tokenRepository.setCookieCustomizer(cookie -> cookie.path("/"));

    http
        .csrf(csrf -> csrf
            .csrfTokenRepository(tokenRepository)
            // The client sends the cookie value verbatim, so no per-request masking
            .csrfTokenRequestHandler(new CsrfTokenRequestAttributeHandler()))
        .authorizeHttpRequests(auth -> auth.anyRequest().permitAll())
        .exceptionHandling(ex -> ex.accessDeniedHandler(new JsonAccessDeniedHandler(objectMapper)))
        .sessionManagement(sess -> sess.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .httpBasic(basic -> basic.disable())
        .formLogin(form -> form.disable())
        .addFilterAfter(new CsrfCookieFilter(), CsrfFilter.class);

    return http.build();
  }

  @Bean
  public PasswordEncoder passwordEncoder() {
    return new BCryptPasswordEncoder(bcryptStrength);
  }
}
