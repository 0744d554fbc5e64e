package com.example.projectservice.security;

import com.example.projectservice.entity.UserRole;
import lombok.Getter;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.userdetails.UserDetails;

import java.util.Collection;
import java.util.Optional;

/**
 * Authenticated caller as verified from the JWT.
 * The e-mail is what the project services resolve the caller's user row by.
 */
@Getter
public class CurrentUser implements UserDetails {

    private final Long userId;
    private final String email;
    private final Collection<? extends GrantedAuthority> authorities;

    public CurrentUser(Long userId, String email, Collection<? extends GrantedAuthority> authorities) {
        this.userId = userId;
        this.email = email;
        this.authorities = authorities;
    }

    @Override
    public Collection<? extends GrantedAuthority> getAuthorities() {
        return authorities;
    }

    @Override
    public String getPassword() {
        return null;
    }

    @Override
    public String getUsername() {
        return email != null ? email : String.valueOf(userId);
    }

    @Override
    public boolean isAccountNonExpired() {
        return true;
    }

    @Override
    public boolean isAccountNonLocked() {
        return true;
    }

    @Override
    public boolean isCredentialsNonExpired() {
        return true;
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    public boolean hasRole(String role) {
        return authorities.stream()
                .anyMatch(auth -> auth.getAuthority().equals("ROLE_" + role));
    }

    /**
     * First authority that maps to a system role. Coordinator wins over advisor over student
     * when a token carries several.
     */
    public Optional<UserRole> getRole() {
        if (hasRole("COORDINATOR")) {
            return Optional.of(UserRole.COORDINATOR);
        }
        if (hasRole("ADVISOR")) {
            return Optional.of(UserRole.ADVISOR);
        }
        if (hasRole("STUDENT")) {
            return Optional.of(UserRole.STUDENT);
        }
        return Optional.empty();
    }
}
