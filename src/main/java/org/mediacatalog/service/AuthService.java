package org.mediacatalog.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.mediacatalog.dto.LoginRequest;
import org.mediacatalog.dto.RegisterRequest;
import org.mediacatalog.dto.TokenResponse;
import org.mediacatalog.entity.Usr;
import org.mediacatalog.exception.AuthException;
import org.mediacatalog.exception.RegistrationException;
import org.mediacatalog.repository.UsrRepository;
import org.mediacatalog.security.JwtTokenService;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional
public class AuthService {
    private final UsrRepository usrRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;

    public Usr register(RegisterRequest request) {
        if (usrRepository.existsByUsername(request.getUsername())) {
            throw new RegistrationException("Пользователь с таким именем уже существует");
        }
        if (usrRepository.existsByEmail(request.getEmail())) {
            throw new RegistrationException("Email уже зарегистрирован");
        }

        Usr user = new Usr();
        user.setUsername(request.getUsername());
        user.setEmail(request.getEmail());
        user.setHashedPassword(passwordEncoder.encode(request.getPassword()));
        Usr saved = usrRepository.save(user);
        log.info("Зарегистрирован пользователь: {}", saved.getUsername());
        return saved;
    }

    @Transactional(readOnly = true)
    public TokenResponse login(LoginRequest request) {
        Usr user = usrRepository.findByUsername(request.getUsername())
                .filter(candidate -> passwordEncoder.matches(request.getPassword(), candidate.getHashedPassword()))
                .orElseThrow(() -> {
                    log.warn("Неудачная попытка входа для {}", request.getUsername());
                    return new AuthException("Неверное имя пользователя или пароль");
                });
        if (!Boolean.TRUE.equals(user.getActive())) {
            throw new AuthException("Пользователь деактивирован");
        }
        return TokenResponse.bearer(jwtTokenService.issueToken(user.getUsername()));
    }

    /**
     * Пользователь по токену; неизвестный или неактивный пользователь считается ошибкой авторизации.
     */
    @Transactional(readOnly = true)
    public Usr authenticate(String token) {
        String username = jwtTokenService.validateToken(token);
        return usrRepository.findByUsername(username)
                .filter(user -> Boolean.TRUE.equals(user.getActive()))
                .orElseThrow(() -> new AuthException("Не удалось проверить учетные данные"));
    }
}
