package dev.vibeshowcase.service;

import dev.vibeshowcase.config.ResilienceConfig;
import dev.vibeshowcase.dto.LoginRequest;
import dev.vibeshowcase.dto.RegisterRequest;
import dev.vibeshowcase.dto.UserResponse;
import dev.vibeshowcase.entity.User;
import dev.vibeshowcase.entity.UserRole;
import dev.vibeshowcase.exception.DuplicateResourceException;
import dev.vibeshowcase.exception.ResourceNotFoundException;
import dev.vibeshowcase.repository.UserRepository;
import dev.vibeshowcase.security.ShowcaseUserDetails;
import dev.vibeshowcase.security.Viewer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.security.authentication.ReactiveAuthenticationManager;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Locale;

/**
 * Registration and credential checks. Storing the resulting {@link Authentication} in the
 * session is left to the web layer.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuthService {

    // unique index on LOWER(email) in schema.sql
    private static final String EMAIL_INDEX = "ux_users_email";

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final ReactiveAuthenticationManager authenticationManager;
    private final IdService idService;
    private final ResilienceConfig resilience;
    private final Clock clock;

    public Mono<User> register(RegisterRequest request) {
        String username = request.username().trim();
        String email = request.email().trim().toLowerCase(Locale.ROOT);

        return userRepository.findByUsernameIgnoreCase(username)
                .flatMap(existing -> Mono.<User>error(new DuplicateResourceException("error.username_taken")))
                .switchIfEmpty(Mono.defer(() -> userRepository.findByEmailIgnoreCase(email)))
                .flatMap(existing -> Mono.<User>error(new DuplicateResourceException("error.email_taken")))
                // hashing runs off the event loop
                .switchIfEmpty(Mono.defer(() -> Mono.fromCallable(() -> passwordEncoder.encode(request.password()))
                        .subscribeOn(Schedulers.boundedElastic())
                        .flatMap(hash -> userRepository.save(User.builder()
                                .id(idService.nextId())
                                .username(username)
                                .email(email)
                                .password(hash)
                                .role(UserRole.USER.value())
                                .createdAt(LocalDateTime.now(clock))
                                .build()))))
                // a concurrent registration can win between the lookups and the insert
                .onErrorMap(DuplicateKeyException.class, AuthService::toDuplicateResource)
                .doOnNext(user -> log.info("User registered: id={}, username={}", user.getId(), user.getUsername()))
                .timeout(resilience.getDatabaseTimeout());
    }

    private static DuplicateResourceException toDuplicateResource(DuplicateKeyException e) {
        String message = e.getMessage();
        return new DuplicateResourceException(message != null && message.contains(EMAIL_INDEX)
                ? "error.email_taken" : "error.username_taken");
    }

    /**
     * Checks the credentials; fails with an {@code AuthenticationException} when they are wrong.
     */
    public Mono<Authentication> authenticate(LoginRequest request) {
        return authenticationManager.authenticate(
                        UsernamePasswordAuthenticationToken.unauthenticated(request.username().trim(), request.password()))
                .doOnNext(auth -> log.info("User logged in: {}", auth.getName()))
                .doOnError(e -> log.warn("Login failed for '{}': {}", request.username(), e.getMessage()));
    }

    /**
     * Authentication for a user whose password was just verified or set, so registration
     * signs in without hashing the password a second time.
     */
    public Authentication authenticationFor(User user) {
        ShowcaseUserDetails principal = new ShowcaseUserDetails(user);
        return UsernamePasswordAuthenticationToken.authenticated(principal, null, principal.getAuthorities());
    }

    public Mono<UserResponse> getUser(Viewer viewer) {
        return userRepository.findById(viewer.id())
                .map(UserResponse::fromEntity)
                .switchIfEmpty(Mono.error(ResourceNotFoundException::user))
                .timeout(resilience.getDatabaseTimeout());
    }
}
