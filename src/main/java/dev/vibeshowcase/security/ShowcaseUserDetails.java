package dev.vibeshowcase.security;

import dev.vibeshowcase.entity.User;
import dev.vibeshowcase.entity.UserRole;
import lombok.Getter;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.userdetails.UserDetails;

import java.util.Collection;
import java.util.List;

/**
 * Principal kept in the session after login.
 */
@Getter
public class ShowcaseUserDetails implements UserDetails {

    private final Long id;
    private final String username;
    private final String password;
    private final UserRole role;

    public ShowcaseUserDetails(User user) {
        this.id = user.getId();
        this.username = user.getUsername();
        this.password = user.getPassword();
        this.role = UserRole.fromValue(user.getRole()).orElse(UserRole.USER);
    }

    @Override
    public Collection<? extends GrantedAuthority> getAuthorities() {
        return List.of(new SimpleGrantedAuthority(role.authority()));
    }

    public Viewer toViewer() {
        return new Viewer(id, username, role == UserRole.ADMIN);
    }
}
