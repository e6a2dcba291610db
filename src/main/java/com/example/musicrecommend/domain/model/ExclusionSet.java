package com.example.musicrecommend.domain.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import lombok.ToString;

/**
 * Track ids that must not show up in a ranking pass.
 */
@ToString
public final class ExclusionSet {

    private static final ExclusionSet EMPTY = new ExclusionSet(Collections.<Long>emptySet());

    private final Set<Long> ids;

    private ExclusionSet(Set<Long> ids) {
        this.ids = ids;
    }

    public static ExclusionSet empty() {
        return EMPTY;
    }

    public static ExclusionSet of(Collection<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            return EMPTY;
        }
        Set<Long> copy = new LinkedHashSet<>();
        for (Long id : ids) {
            if (id != null) {
                copy.add(id);
            }
        }
        return new ExclusionSet(Collections.unmodifiableSet(copy));
    }

    public ExclusionSet plusAll(Collection<Long> more) {
        if (more == null || more.isEmpty()) {
            return this;
        }
        Set<Long> copy = new LinkedHashSet<>(ids);
        copy.addAll(more);
        copy.remove(null);
        return new ExclusionSet(Collections.unmodifiableSet(copy));
    }

    public boolean contains(Long id) {
        return id != null && ids.contains(id);
    }
}
