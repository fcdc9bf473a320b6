package com.teamA.cra.api.auth;

import com.teamA.cra.common.domain.model.Actor;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

/**
 * SecurityContext -> 변경 주체(Actor)
 */
@Component
public class UserResolver {

    public Actor currentActor() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth == null || auth.getPrincipal() == null) {
            throw new IllegalStateException("No authenticated user");
        }
        if (auth.getPrincipal() instanceof AuthenticatedUser user) {
            return new Actor(user.userId(), user.name());
        }
        return new Actor(auth.getPrincipal().toString(), null);
    }

    public String currentUserId() {
        return currentActor().id();
    }
}
