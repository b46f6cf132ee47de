package com.bugbounty.api.security;

import com.bugbounty.core.domain.User;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

import java.util.List;

/**
 * Authentication for a user resolved from a verified bearer token.
 * The principal is the full {@link User} record as loaded for this request.
 */
public class ActorAuthenticationToken extends AbstractAuthenticationToken {

    private final User actor;
    private final String token;

    public ActorAuthenticationToken(User actor, String token) {
        super(List.of(new SimpleGrantedAuthority("ROLE_" + actor.getRole().name())));
        this.actor = actor;
        this.token = token;
        setAuthenticated(true);
    }

    @Override
    public Object getCredentials() {
        return token;
    }

    @Override
    public User getPrincipal() {
        return actor;
    }

    @Override
    public String getName() {
        return actor.getId().toString();
    }
}
