package com.skillgate.agent.tier;

import java.util.Locale;

/**
 * Trust tier of a platform user, derived from config membership lists.
 */
public enum UserTier {
    ADMIN, TRUSTED, DEFAULT;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return id();
    }
}
