package com.plant.hierarchy.engine;

/**
 * How {@link IntegrityValidator#repair} resolves nodes that cannot be attached to the tree.
 */
public enum OrphanPolicy {

    /**
     * Orphans become roots; each cycle is broken at its lowest-ordered member.
     */
    ATTACH_TO_ROOT,

    /**
     * Orphans and cycle members are removed together with their descendants.
     */
    REJECT
}
