package me.tavon.omnidock.channel;

import com.google.common.collect.ImmutableMap;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Maps keys stored in their old all-lower form onto the canonical keys currently reported.
 * One table is built per merge cycle and every stored key goes through {@link #migrate}.
 */
public final class LegacyKeyMigration {

    private final ImmutableMap<CanonicalKey, CanonicalKey> legacyToCanonical;

    private LegacyKeyMigration(ImmutableMap<CanonicalKey, CanonicalKey> legacyToCanonical) {
        this.legacyToCanonical = legacyToCanonical;
    }

    public static LegacyKeyMigration of(Collection<CanonicalKey> incoming) {
        ImmutableMap.Builder<CanonicalKey, CanonicalKey> builder = ImmutableMap.builder();
        Set<CanonicalKey> seen = new LinkedHashSet<>();

        for (CanonicalKey key : incoming) {
            CanonicalKey legacy = key.legacyForm();

            // two canonical keys may share a legacy form; the first reported wins
            if (!legacy.equals(key) && seen.add(legacy)) {
                builder.put(legacy, key);
            }
        }

        return new LegacyKeyMigration(builder.build());
    }

    public CanonicalKey migrate(CanonicalKey key) {
        CanonicalKey canonical = legacyToCanonical.get(key);
        return canonical == null ? key : canonical;
    }
}
