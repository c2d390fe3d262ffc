package com.example.filegate.security.context;

import org.springframework.lang.Nullable;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The visitor requesting a file, reduced to what access checks need.
 *
 * <p>Group ids include the pseudo groups every visitor carries: {@link #ALL_VISITORS_GROUP}
 * always, plus {@link #ANONYMOUS_GROUP} or {@link #ANY_LOGIN_GROUP}.</p>
 */
public record FrontendUser(
        @Nullable String username,
        Set<Integer> groupIds
) {
    public static final int ALL_VISITORS_GROUP = 0;
    public static final int ANONYMOUS_GROUP = -1;
    public static final int ANY_LOGIN_GROUP = -2;

    public FrontendUser {
        groupIds = groupIds == null ? Set.of() : Set.copyOf(groupIds);
    }

    public static FrontendUser anonymous() {
        return new FrontendUser(null, Set.of(ALL_VISITORS_GROUP, ANONYMOUS_GROUP));
    }

    public static FrontendUser authenticated(String username, Set<Integer> memberGroupIds) {
        Set<Integer> groupIds = new LinkedHashSet<>(memberGroupIds);
        groupIds.add(ALL_VISITORS_GROUP);
        groupIds.add(ANY_LOGIN_GROUP);
        return new FrontendUser(username, groupIds);
    }

    public boolean isAuthenticated() {
        return username != null;
    }
}
