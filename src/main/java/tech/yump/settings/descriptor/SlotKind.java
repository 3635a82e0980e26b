package tech.yump.settings.descriptor;

import java.util.Collection;
import java.util.Map;
import tech.yump.settings.core.NestedSettings;

/**
 * How the traversal treats a field or collection element.
 */
public enum SlotKind {
  /** Plain data: primitives, boxed values, strings, enums and other JDK types. */
  VALUE,
  /** A {@code String} field marked {@link Encrypted}. */
  ENCRYPTED,
  /** Collections, maps (their values) and object arrays. */
  COLLECTION,
  /** Any other application type; its own fields are walked. */
  COMPOSITE,
  /** A type that saves itself to its own file. */
  NESTED_DOCUMENT;

  private static final String[] SYSTEM_PACKAGES = {"java.", "javax.", "jdk.", "sun.", "com.sun."};

  /**
   * Classifies a declared type. Never returns {@link #ENCRYPTED}; that kind comes from the
   * field annotation, not from the type.
   */
  public static SlotKind classify(Class<?> type) {
    if (type == null) {
      return VALUE;
    }
    if (NestedSettings.class.isAssignableFrom(type)) {
      return NESTED_DOCUMENT;
    }
    if (type.isArray()) {
      return type.getComponentType().isPrimitive() ? VALUE : COLLECTION;
    }
    if (Collection.class.isAssignableFrom(type) || Map.class.isAssignableFrom(type)) {
      return COLLECTION;
    }
    if (type.isPrimitive() || type.isEnum() || isSystemType(type)) {
      return VALUE;
    }
    return COMPOSITE;
  }

  private static boolean isSystemType(Class<?> type) {
    String name = type.getName();
    for (String prefix : SYSTEM_PACKAGES) {
      if (name.startsWith(prefix)) {
        return true;
      }
    }
    return false;
  }
}
