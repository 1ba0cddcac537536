package dev.vibeshowcase.security;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Reads the viewer from the reactive security context.
 */
@Component
public class CurrentViewer {

    /**
     * The signed-in viewer, or {@link Viewer#ANONYMOUS}.
     */
    public Mono<Viewer> get() {
        return ReactiveSecurityContextHolder.getContext()
                .map(SecurityContext::getAuthentication)
                .filter(Authentication::isAuthenticated)
                .map(Authentication::getPrincipal)
                .filter(ShowcaseUserDetails.class::isInstance)
                .map(principal -> ((ShowcaseUserDetails) principal).toViewer())
                .defaultIfEmpty(Viewer.ANONYMOUS);
    }

    /**
     * The signed-in viewer; 401 when the request is anonymous.
     */
    public Mono<Viewer> require() {
        return get().flatMap(viewer -> viewer.isAnonymous()
                ? Mono.error(new ResponseStatusException(HttpStatus.UNAUTHORIZED, "error.authentication_required"))
                : Mono.just(viewer));
    }
}
