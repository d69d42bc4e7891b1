package com.cardiorecords.infrastructure.security;

import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

import java.util.List;

/**
 * Spring Security authentication carrying a verified {@link SecurityContext}.
 * The raw token is not retained.
 */
public class BearerAuthenticationToken extends AbstractAuthenticationToken {

    private final SecurityContext context;

    public BearerAuthenticationToken(SecurityContext context) {
        super(List.of(new SimpleGrantedAuthority(context.getRole().authority())));
        this.context = context;
        setAuthenticated(true);
    }

    @Override
    public Object getCredentials() {
        return null;
    }

    @Override
    public SecurityContext getPrincipal() {
        return context;
    }

    @Override
    public String getName() {
        return context.getPrincipalId().toString();
    }
}
