package fr.lapetina.scheduler.domain.model;

import java.util.Locale;

/**
 * Coarse-grained tenant classification.
 *
 * The rank is the most significant component of the queue sort key:
 * lower rank is served first within its allocated credits.
 */
public enum TenantTier {
    ENTERPRISE(0),
    PROFESSIONAL(1),
    STARTER(2),
    FREE(3);

    private final int rank;

    TenantTier(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    /**
     * Parses a tier name, case-insensitive.
     *
     * @throws IllegalArgumentException if the name is not a known tier
     */
    public static TenantTier fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tier name is required");
        }
        return TenantTier.valueOf(name.trim().toUpperCase(Locale.ROOT));
    }

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
