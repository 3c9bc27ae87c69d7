package com.master.sync.reconcile;

import java.util.Objects;

/**
 * Entity-specific disable semantics used by the {@link ChangeClassifier}.
 * Standard entities are disabled with {@code disable_flag = 1}; user-like entities are
 * retired through their {@link RetirementPolicy}.
 */
public final class EntityProfile {

    public static final String DISABLE_FLAG = "disable_flag";

    public static final EntityProfile STANDARD = new EntityProfile(null);

    private final RetirementPolicy retirementPolicy;

    private EntityProfile(RetirementPolicy retirementPolicy) {
        this.retirementPolicy = retirementPolicy;
    }

    public static EntityProfile userLike(RetirementPolicy policy) {
        return new EntityProfile(Objects.requireNonNull(policy, "policy is required"));
    }

    public static EntityProfile userLike() {
        return userLike(RetirementPolicy.defaults());
    }

    public boolean isUserLike() {
        return retirementPolicy != null;
    }

    /**
     * The retirement policy, or null for standard entities.
     */
    public RetirementPolicy getRetirementPolicy() {
        return retirementPolicy;
    }

    @Override
    public String toString() {
        return isUserLike() ? "EntityProfile{userLike, " + retirementPolicy + '}' : "EntityProfile{standard}";
    }
}
