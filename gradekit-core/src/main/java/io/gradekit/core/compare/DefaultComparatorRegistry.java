package io.gradekit.core.compare;

import io.gradekit.core.grader.model.ComparatorType;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Immutable comparator registry backed by an {@link EnumMap}.
///
/// A later registration for the same type replaces an earlier one, so callers can override a
/// built-in comparator by listing theirs after {@link #builtIns()}.
///
/// @implNote Immutable and thread-safe after construction.
public final class DefaultComparatorRegistry implements ComparatorRegistry {

    private final Map<ComparatorType, FieldComparator> comparators;

    public DefaultComparatorRegistry(List<? extends FieldComparator> comparators) {
        Objects.requireNonNull(comparators, "comparators must not be null");
        Map<ComparatorType, FieldComparator> byType = new EnumMap<>(ComparatorType.class);
        for (FieldComparator comparator : comparators) {
            byType.put(comparator.type(), comparator);
        }
        this.comparators = byType;
    }

    /// Creates a registry holding every built-in comparator.
    ///
    /// @return new registry, never null
    public static DefaultComparatorRegistry withDefaults() {
        return new DefaultComparatorRegistry(builtIns());
    }

    /// Returns one instance of each built-in comparator.
    public static List<FieldComparator> builtIns() {
        return List.of(
                new EqualsComparator(),
                new ContainsComparator(),
                new RangeComparator(),
                new RegexComparator(),
                new ToleranceComparator(),
                new InListComparator(),
                new LengthComparator());
    }

    @Override
    public Optional<FieldComparator> find(ComparatorType type) {
        return Optional.ofNullable(comparators.get(type));
    }
}
