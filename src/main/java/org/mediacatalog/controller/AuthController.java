package org.mediacatalog.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.mediacatalog.dto.LoginRequest;
import org.mediacatalog.dto.RegisterRequest;
import org.mediacatalog.dto.TokenResponse;
import org.mediacatalog.dto.UserResponse;
import org.mediacatalog.entity.Usr;
import org.mediacatalog.security.BearerTokenInterceptor;
import org.mediacatalog.service.AuthService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
public class AuthController {
    private final AuthService authService;

    @PostMapping("/register")
    @ResponseStatus(HttpStatus.CREATED)
    public UserResponse register(@Valid @RequestBody RegisterRequest request) {
        return UserResponse.from(authService.register(request));
    }

    @PostMapping("/login")
    public TokenResponse login(@Valid @RequestBody LoginRequest request) {
        return authService.login(request);
    }

    @GetMapping("/me")
    public UserResponse me(@RequestAttribute(BearerTokenInterceptor.CURRENT_USER) Usr currentUser) {
        return UserResponse.from(currentUser);
    }
}
