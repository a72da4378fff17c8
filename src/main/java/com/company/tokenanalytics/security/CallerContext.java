package com.company.tokenanalytics.security;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Component;

/**
 * Identity of the authenticated caller, for logging
 */
@Component
public class CallerContext {

    public String getCurrentUserId() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication == null || !authentication.isAuthenticated()) {
            return "anonymous";
        }

        if (authentication.getPrincipal() instanceof Jwt jwt) {
            // Azure AD: prefer the readable UPN over the opaque subject
            String username = jwt.getClaimAsString("preferred_username");
            return username != null ? username : jwt.getSubject();
        }

        return authentication.getName();
    }
}
