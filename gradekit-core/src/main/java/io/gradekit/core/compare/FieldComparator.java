package io.gradekit.core.compare;

import io.gradekit.core.extract.TypedValue;
import io.gradekit.core.grader.model.ComparatorConfig;
import io.gradekit.core.grader.model.ComparatorType;

/// One comparison semantics, selected by {@link ComparatorType}.
///
/// ### Contracts
/// - **Pure**: no side effects beyond logging; same inputs give the same verdict
/// - **Total**: never throws for any configuration or value; a malformed parameter yields
///   `false`
/// - **Applicability first**: {@link #matches} is only called when {@link #isApplicable}
///   returned true for the same configuration
///
/// @implNote Implementations must be stateless and thread-safe.
///
/// @see ComparatorRegistry for lookup by type
public interface FieldComparator {

    /// Returns the comparator type this implementation handles.
    ComparatorType type();

    /// Checks whether the configuration carries an expectation to compare against.
    ///
    /// A field whose comparator is not applicable is still extracted and reported, but
    /// contributes nothing to the score.
    ///
    /// @param config comparator configuration, not null
    /// @return true if the field should be scored
    boolean isApplicable(ComparatorConfig config);

    /// Compares an extracted value with the configured expectation.
    ///
    /// @param config comparator configuration, not null
    /// @param actual coerced field value, not null
    /// @return true if the value satisfies the expectation
    boolean matches(ComparatorConfig config, TypedValue actual);
}
