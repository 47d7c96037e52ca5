package com.ninesync.domain;

import lombok.EqualsAndHashCode;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Unordered set of advertised capabilities plus the unrecognized tokens.
 */
@EqualsAndHashCode
public final class CapabilitySet {

    private final Set<Capability> known;
    private final Set<String> other;

    private CapabilitySet(Set<Capability> known, Set<String> other) {
        this.known = known;
        this.other = other;
    }

    public static CapabilitySet empty() {
        return new CapabilitySet(EnumSet.noneOf(Capability.class), new LinkedHashSet<>());
    }

    public static CapabilitySet of(Iterable<String> tokens) {
        EnumSet<Capability> known = EnumSet.noneOf(Capability.class);
        Set<String> other = new LinkedHashSet<>();
        for (String token : tokens) {
            Capability capability = Capability.fromToken(token);
            if (capability != null) {
                known.add(capability);
            } else {
                other.add(token);
            }
        }
        return new CapabilitySet(known, other);
    }

    public boolean has(Capability capability) {
        return known.contains(capability);
    }

    public boolean isEmpty() {
        return known.isEmpty() && other.isEmpty();
    }

    public Set<Capability> getKnown() {
        return Collections.unmodifiableSet(known);
    }

    public Set<String> getOther() {
        return Collections.unmodifiableSet(other);
    }

    /**
     * All tokens in wire form
     */
    public Set<String> tokens() {
        Set<String> tokens = new LinkedHashSet<>();
        known.forEach(c -> tokens.add(c.getToken()));
        tokens.addAll(other);
        return tokens;
    }

    @Override
    public String toString() {
        return String.join(" ", tokens());
    }
}
