package io.gradekit.core.compare;

import io.gradekit.core.grader.model.ComparatorType;
import java.util.Optional;

/// Lookup of comparator implementations by type.
///
/// @see DefaultComparatorRegistry for the built-in set
public interface ComparatorRegistry {

    /// Finds the comparator for a type.
    ///
    /// @param type comparator type, not null
    /// @return the comparator, or empty if none is registered
    Optional<FieldComparator> find(ComparatorType type);
}
