package io.snapdiff.core.snapshot;

import java.util.List;
import java.util.Objects;

/** A section identifier together with its ordered items. */
public record SectionModel<S, I>(S id, List<I> items) {

    public SectionModel {
        Objects.requireNonNull(id, "id");
        items = List.copyOf(items);
    }

    @SafeVarargs
    public static <S, I> SectionModel<S, I> of(S id, I... items) {
        return new SectionModel<>(id, List.of(items));
    }
}
