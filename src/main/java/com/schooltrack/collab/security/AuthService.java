package com.schooltrack.collab.security;

import com.schooltrack.collab.client.UserProfileClient;
import com.schooltrack.collab.client.UserProfileResponse;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.jwt.JsonWebToken;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jboss.logging.Logger;

import java.util.Optional;

/**
 * Resolves the caller's verified identity from the session token.
 * <p>
 * May call the user-profile service, so it must run before any room state is touched.
 */
@ApplicationScoped
public class AuthService {

    private static final Logger LOG = Logger.getLogger(AuthService.class);

    static final String UNKNOWN_NAME = "Unknown";

    @Inject
    JsonWebToken jwt;

    @Inject
    @RestClient
    UserProfileClient profileClient;

    /**
     * Get the current user's id (token subject).
     * Returns null if not authenticated.
     */
    public String getCurrentUserId() {
        try {
            return jwt.getSubject();
        } catch (Exception e) {
            LOG.debugf("No usable token: %s", e.getMessage());
            return null;
        }
    }

    public Optional<UserIdentity> currentIdentity() {
        String userId = getCurrentUserId();
        if (userId == null || userId.isBlank()) {
            return Optional.empty();
        }
        String email = claim("email");
        String name = nameFromToken();
        if (name == null) {
            name = lookupName(userId);
        }
        if (name == null) {
            name = email != null ? email : UNKNOWN_NAME;
        }
        return Optional.of(new UserIdentity(userId, name, email));
    }

    private String nameFromToken() {
        String name = claim("name");
        if (name != null) {
            return name;
        }
        String given = claim("given_name");
        String family = claim("family_name");
        String joined = ((given == null ? "" : given) + " " + (family == null ? "" : family)).trim();
        return joined.isEmpty() ? null : joined;
    }

    private String lookupName(String userId) {
        try {
            UserProfileResponse profile = profileClient.getById(userId);
            return profile == null ? null : profile.fullName();
        } catch (RuntimeException e) {
            LOG.warnf("Profile lookup for %s failed: %s", userId, e.getMessage());
            return null;
        }
    }

    private String claim(String name) {
        Object value = jwt.getClaim(name);
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        // JSON string claims surface as quoted JsonString values
        if (text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"")) {
            text = text.substring(1, text.length() - 1);
        }
        return text.isBlank() ? null : text;
    }
}
