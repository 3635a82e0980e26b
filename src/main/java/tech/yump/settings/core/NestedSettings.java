package tech.yump.settings.core;

/**
 * Capability of an object that persists itself to its own file. When such an object is
 * reachable from another document's fields, saving that document cascades into it.
 */
public interface NestedSettings {

  /**
   * Saves this object unless it is already part of {@code visited}.
   *
   * @param visited Instances already saved in the current cascade. Implementations add
   *                themselves before writing and pass the same set on to their own children.
   * @return false if writing failed; the failure is logged, not thrown.
   */
  boolean save(VisitedSet visited);
}
