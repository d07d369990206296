package org.mediacatalog.security;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.mediacatalog.entity.Usr;
import org.mediacatalog.exception.AuthException;
import org.mediacatalog.service.AuthService;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.cors.CorsUtils;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Пропускает запрос только с валидным {@code Authorization: Bearer <token>}.
 * CORS preflight пропускается без проверки. Текущий пользователь кладется в атрибут запроса {@link #CURRENT_USER}.
 */
@Component
@RequiredArgsConstructor
public class BearerTokenInterceptor implements HandlerInterceptor {
    public static final String CURRENT_USER = "currentUser";
    private static final String BEARER_PREFIX = "Bearer ";

    private final AuthService authService;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        // CORS preflight приходит без токена, на него отвечает CorsConfiguration
        if (CorsUtils.isPreFlightRequest(request)) {
            return true;
        }
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            throw new AuthException("Not authenticated");
        }
        String token = header.substring(BEARER_PREFIX.length()).trim();
        if (token.isEmpty()) {
            throw new AuthException("Not authenticated");
        }

        Usr user = authService.authenticate(token);
        request.setAttribute(CURRENT_USER, user);
        return true;
    }
}
