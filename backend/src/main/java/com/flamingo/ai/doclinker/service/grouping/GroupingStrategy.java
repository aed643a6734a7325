package com.flamingo.ai.doclinker.service.grouping;

/**
 * One way of deciding that several layout elements form a single logical figure.
 *
 * <p>Implementations merge records and attach free-standing elements inside a {@link
 * GroupingContext}. Every strategy is idempotent: applying it to its own output changes nothing.
 */
public interface GroupingStrategy {

  /**
   * Merges records and attaches elements in place.
   *
   * @param context records and unattached elements of one page, or of the whole document
   */
  void group(GroupingContext context);

  /**
   * Returns a human-readable name of this strategy for logging and debugging.
   *
   * @return strategy name (e.g., "IdentifierMatchStrategy", "ProximityMergeStrategy")
   */
  String getStrategyName();
}
