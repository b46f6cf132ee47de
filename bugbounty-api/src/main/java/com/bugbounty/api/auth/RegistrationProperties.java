package com.bugbounty.api.auth;

import com.bugbounty.core.domain.User.Role;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.EnumSet;
import java.util.Set;

/**
 * Registration settings.
 *
 * {@code allowed-roles} lists the roles a client may pick for itself when
 * registering. ADMIN is left out by default; add it only for deployments
 * where open self-registration as administrator is intended.
 */
@Configuration
@ConfigurationProperties(prefix = "bugbounty.registration")
public class RegistrationProperties {

    private Set<Role> allowedRoles = EnumSet.of(Role.RESEARCHER, Role.COMPANY);

    public Set<Role> getAllowedRoles() { return allowedRoles; }
    public void setAllowedRoles(Set<Role> allowedRoles) { this.allowedRoles = allowedRoles; }

    public boolean isSelfAssignable(Role role) {
        return allowedRoles.contains(role);
    }
}
