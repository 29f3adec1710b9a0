package com.remotelink.app.web;

import com.remotelink.common.config.ConfigService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.CorsUtils;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import org.springframework.web.filter.CorsFilter;

import java.io.IOException;
import java.util.List;

/**
 * Lets the browser dashboard on the allowed origins call {@code /api/**}.
 * An accepted preflight is answered with 204 before it reaches the controller.
 */
@Slf4j
@Configuration
public class CorsConfig {

    private final ConfigService configService;

    public CorsConfig(ConfigService configService) {
        this.configService = configService;
    }

    @Bean
    public FilterRegistrationBean<PreflightCorsFilter> corsFilter() {
        FilterRegistrationBean<PreflightCorsFilter> registrationBean = new FilterRegistrationBean<>();
        registrationBean.setFilter(new PreflightCorsFilter(corsConfigurationSource()));
        registrationBean.addUrlPatterns("/api/*");
        registrationBean.setOrder(Ordered.HIGHEST_PRECEDENCE);
        return registrationBean;
    }

    CorsConfigurationSource corsConfigurationSource() {
        List<String> origins = configService.loadConfig().getCors().getAllowedOrigins();
        log.debug("CORS origins: {}", origins);

        CorsConfiguration cors = new CorsConfiguration();
        cors.setAllowedOriginPatterns(origins);
        cors.setAllowedMethods(List.of("GET", "POST", "OPTIONS"));
        cors.setAllowedHeaders(List.of("Content-Type", "Authorization", ApiController.TOKEN_HEADER));

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/api/**", cors);
        return source;
    }

    /**
     * {@link CorsFilter} that ends an accepted preflight with 204 instead of
     * the servlet default 200. A rejected preflight keeps the 403 the
     * processor wrote.
     */
    static class PreflightCorsFilter extends CorsFilter {

        PreflightCorsFilter(CorsConfigurationSource source) {
            super(source);
        }

        @Override
        protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                FilterChain filterChain) throws ServletException, IOException {
            super.doFilterInternal(request, response, filterChain);
            if (CorsUtils.isPreFlightRequest(request) && response.getStatus() == HttpServletResponse.SC_OK) {
                response.setStatus(HttpServletResponse.SC_NO_CONTENT);
            }
        }
    }
}
