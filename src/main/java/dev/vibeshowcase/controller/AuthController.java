package dev.vibeshowcase.controller;

import dev.vibeshowcase.dto.LoginRequest;
import dev.vibeshowcase.dto.MessageResponse;
import dev.vibeshowcase.dto.RegisterRequest;
import dev.vibeshowcase.dto.UserResponse;
import dev.vibeshowcase.security.CurrentViewer;
import dev.vibeshowcase.security.ShowcaseUserDetails;
import dev.vibeshowcase.service.AuthService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextImpl;
import org.springframework.security.web.server.context.ServerSecurityContextRepository;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebSession;
import reactor.core.publisher.Mono;

/**
 * Session login. A successful login or registration rotates the session id and stores the
 * security context in the session.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Authentication", description = "Registration and session login")
@Slf4j
public class AuthController {

    private final AuthService authService;
    private final CurrentViewer currentViewer;
    private final ServerSecurityContextRepository securityContextRepository;

    @PostMapping("/register")
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Register", description = "Creates the account and signs in")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Registered and logged in"),
            @ApiResponse(responseCode = "409", description = "Username or email taken")
    })
    public Mono<UserResponse> register(@Valid @RequestBody RegisterRequest request, ServerWebExchange exchange) {
        return authService.register(request)
                .flatMap(user -> signIn(exchange, authService.authenticationFor(user))
                        .thenReturn(UserResponse.fromEntity(user)));
    }

    @PostMapping("/login")
    @Operation(summary = "Login")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Logged in"),
            @ApiResponse(responseCode = "401", description = "Invalid credentials")
    })
    public Mono<UserResponse> login(@Valid @RequestBody LoginRequest request, ServerWebExchange exchange) {
        return authService.authenticate(request)
                .flatMap(auth -> signIn(exchange, auth).thenReturn(auth))
                .flatMap(auth -> authService.getUser(((ShowcaseUserDetails) auth.getPrincipal()).toViewer()));
    }

    @PostMapping("/logout")
    @Operation(summary = "Logout", description = "Invalidates the session")
    public Mono<MessageResponse> logout(ServerWebExchange exchange) {
        return exchange.getSession()
                .flatMap(WebSession::invalidate)
                .thenReturn(MessageResponse.of("Logged out successfully"));
    }

    @GetMapping("/user")
    @Operation(summary = "Current user")
    public Mono<UserResponse> currentUser() {
        return currentViewer.require().flatMap(authService::getUser);
    }

    private Mono<Void> signIn(ServerWebExchange exchange, Authentication authentication) {
        return exchange.getSession()
                .flatMap(WebSession::changeSessionId)
                .then(Mono.defer(() -> securityContextRepository.save(exchange, new SecurityContextImpl(authentication))));
    }
}
