package dev.ebullient.detective.lookup;

import dev.ebullient.detective.model.ReferenceTraits;

/**
 * Best-effort source of reference traits for names the bundled tables do not know.
 */
@FunctionalInterface
public interface EncyclopediaLookup {

    /**
     * @return what the source knows about the name, or {@link ReferenceTraits#UNKNOWN}
     */
    ReferenceTraits lookup(String name);
}
