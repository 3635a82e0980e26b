package tech.yump.settings.walker;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import tech.yump.settings.core.NestedSettings;
import tech.yump.settings.core.PasswordSession;
import tech.yump.settings.core.SettingsLockedException;
import tech.yump.settings.core.VisitedSet;
import tech.yump.settings.crypto.EncryptionService;
import tech.yump.settings.descriptor.FieldDescriptor;
import tech.yump.settings.descriptor.SettingsDescriptor;
import tech.yump.settings.descriptor.SlotKind;

/**
 * Walks the object graph reachable from a settings document, driven by the descriptor of
 * each type it meets. Three passes exist:
 * <ul>
 *   <li>{@link #encryptGraph}: replaces plaintext of encrypted fields with ciphertext, in place, before writing.</li>
 *   <li>{@link #decryptGraph}: turns ciphertext read from disk back into plaintext.</li>
 *   <li>{@link #saveNestedDocuments}: saves every reachable {@link NestedSettings} after the owner was written.</li>
 * </ul>
 * Every pass carries a {@link VisitedSet}, so an instance reached twice (shared reference or
 * back-reference) is handled once. Nested documents are never entered by the encrypt and
 * decrypt passes; they hold their own password.
 */
@Slf4j
public class GraphWalker {

  /**
   * Encrypts, in place, every non-null encrypted field reachable from {@code root}.
   * Values this session already produced as ciphertext are left alone. Slots declared as
   * {@code Object} or an abstract JDK type are walked by the runtime class of their value.
   *
   * @throws SettingsLockedException if an encrypted value is found and the session is locked.
   */
  public void encryptGraph(Object root, PasswordSession session) {
    VisitedSet visited = new VisitedSet();
    Set<String> held = new HashSet<>();
    encryptFields(root, session, visited, held);
    session.retainIssuedCiphertexts(held);
    log.debug("Encryption pass visited {} objects.", visited.size());
  }

  /**
   * Converts one raw slot value read from disk into its in-memory form.
   *
   * @param rawValue The value already converted to the slot's declared type.
   * @param slot     The slot the value belongs to.
   * @param session  The owning document's session.
   * @param visited  Objects already decrypted in this load pass.
   * @return The value to assign: plaintext for encrypted slots, a rebuilt collection for
   *         collections, the same (mutated) instance for composites.
   * @throws SettingsLockedException if an encrypted value is met while the session is locked.
   */
  public Object decryptGraph(Object rawValue, FieldDescriptor slot, PasswordSession session, VisitedSet visited) {
    if (rawValue == null) {
      return null;
    }
    return switch (slot.kind()) {
      case ENCRYPTED -> decryptValue(rawValue, slot, session);
      case COLLECTION -> decryptCollection(rawValue, slot.declaredType(), session, visited);
      case COMPOSITE -> decryptElement(rawValue, session, visited);
      case VALUE, NESTED_DOCUMENT -> rawValue;
    };
  }

  /**
   * Saves every nested document reachable from {@code root}'s fields, collection elements
   * and composite values. {@code visited} must already contain {@code root}; it is passed on
   * to each nested save so back-references end the cascade.
   *
   * @return false if any nested document could not be saved. The remaining ones are still saved.
   */
  public boolean saveNestedDocuments(Object root, VisitedSet visited) {
    return cascade(root, visited);
  }

  private void encryptFields(Object owner, PasswordSession session, VisitedSet visited, Set<String> held) {
    if (!visited.add(owner)) {
      return;
    }
    SettingsDescriptor descriptor = SettingsDescriptor.of(owner.getClass());
    if (!descriptor.hasReachableEncryptedField() && !descriptor.hasReachableOpenSlot()) {
      return;
    }
    for (FieldDescriptor slot : descriptor.getFields()) {
      Object value = slot.get(owner);
      if (value == null) {
        continue;
      }
      switch (slot.kind()) {
        case ENCRYPTED -> {
          String stored = (String) value;
          if (!session.isIssuedCiphertext(stored)) {
            stored = session.encrypt(stored);
            slot.set(owner, stored);
          }
          held.add(stored);
        }
        case COLLECTION -> {
          for (Object element : elements(value)) {
            encryptElement(element, session, visited, held);
          }
        }
        case COMPOSITE -> encryptElement(value, session, visited, held);
        case VALUE -> {
          if (slot.open()) {
            encryptElement(value, session, visited, held);
          }
        }
        case NESTED_DOCUMENT -> {
        }
      }
    }
  }

  private void encryptElement(Object element, PasswordSession session, VisitedSet visited, Set<String> held) {
    if (element == null) {
      return;
    }
    switch (SlotKind.classify(element.getClass())) {
      case COMPOSITE -> encryptFields(element, session, visited, held);
      case COLLECTION -> {
        for (Object inner : elements(element)) {
          encryptElement(inner, session, visited, held);
        }
      }
      default -> {
      }
    }
  }

  private Object decryptValue(Object rawValue, FieldDescriptor slot, PasswordSession session) {
    if (!(rawValue instanceof String ciphertext)) {
      return rawValue;
    }
    if (!session.isUnlocked()) {
      throw new SettingsLockedException(
          "Cannot decrypt " + slot.qualifiedName() + " without a password.");
    }
    if (ciphertext.isBlank()) {
      return null;
    }
    try {
      return session.decrypt(ciphertext);
    } catch (EncryptionService.DecryptionException e) {
      log.warn("Could not decrypt {}; keeping the stored value unchanged. Cause: {}",
          slot.qualifiedName(), e.getMessage());
      return rawValue;
    }
  }

  private Object decryptElement(Object element, PasswordSession session, VisitedSet visited) {
    return switch (SlotKind.classify(element.getClass())) {
      case COMPOSITE -> {
        decryptFields(element, session, visited);
        yield element;
      }
      case COLLECTION -> decryptCollection(element, element.getClass(), session, visited);
      default -> element;
    };
  }

  private void decryptFields(Object owner, PasswordSession session, VisitedSet visited) {
    if (!visited.add(owner)) {
      return;
    }
    SettingsDescriptor descriptor = SettingsDescriptor.of(owner.getClass());
    if (!descriptor.hasReachableEncryptedField()) {
      return;
    }
    for (FieldDescriptor slot : descriptor.getFields()) {
      if (slot.kind() == SlotKind.VALUE || slot.kind() == SlotKind.NESTED_DOCUMENT) {
        continue;
      }
      Object value = slot.get(owner);
      if (value != null) {
        slot.set(owner, decryptGraph(value, slot, session, visited));
      }
    }
  }

  private Object decryptCollection(Object collection, Class<?> declaredType, PasswordSession session, VisitedSet visited) {
    if (collection.getClass().isArray()) {
      int length = Array.getLength(collection);
      Object rebuilt = Array.newInstance(collection.getClass().getComponentType(), length);
      for (int i = 0; i < length; i++) {
        Object element = Array.get(collection, i);
        Array.set(rebuilt, i, element == null ? null : decryptElement(element, session, visited));
      }
      return rebuilt;
    }

    if (collection instanceof Map<?, ?> map) {
      Map<Object, Object> rebuilt = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        Object element = entry.getValue();
        rebuilt.put(entry.getKey(), element == null ? null : decryptElement(element, session, visited));
      }
      return fitOrRefill(map, rebuilt, declaredType);
    }

    if (collection instanceof Collection<?> source) {
      Collection<Object> rebuilt = source instanceof Set<?> ? new LinkedHashSet<>() : new ArrayList<>();
      for (Object element : source) {
        rebuilt.add(element == null ? null : decryptElement(element, session, visited));
      }
      return fitOrRefill(source, rebuilt, declaredType);
    }
    return collection;
  }

  /**
   * Returns the rebuilt container when the slot's declared type accepts it, otherwise
   * refills the original in place (a {@code SortedSet} or {@code EnumMap} slot, for example).
   */
  @SuppressWarnings("unchecked")
  private Object fitOrRefill(Object original, Object rebuilt, Class<?> declaredType) {
    if (declaredType.isInstance(rebuilt)) {
      return rebuilt;
    }
    if (original instanceof Map<?, ?>) {
      Map<Object, Object> target = (Map<Object, Object>) original;
      target.clear();
      target.putAll((Map<Object, Object>) rebuilt);
    } else {
      Collection<Object> target = (Collection<Object>) original;
      target.clear();
      target.addAll((Collection<Object>) rebuilt);
    }
    return original;
  }

  private boolean cascade(Object owner, VisitedSet visited) {
    boolean saved = true;
    for (FieldDescriptor slot : SettingsDescriptor.of(owner.getClass()).getFields()) {
      if (slot.kind() == SlotKind.ENCRYPTED || (slot.kind() == SlotKind.VALUE && !slot.open())) {
        continue;
      }
      try {
        Object value = slot.get(owner);
        if (value != null) {
          saved &= cascadeInto(value, visited);
        }
      } catch (RuntimeException e) {
        log.warn("Failed to process {} while saving nested settings: {}", slot.qualifiedName(), e.getMessage());
        saved = false;
      }
    }
    return saved;
  }

  private boolean cascadeInto(Object value, VisitedSet visited) {
    switch (SlotKind.classify(value.getClass())) {
      case NESTED_DOCUMENT -> {
        return ((NestedSettings) value).save(visited);
      }
      case COLLECTION -> {
        boolean saved = true;
        for (Object element : elements(value)) {
          if (element != null) {
            saved &= cascadeInto(element, visited);
          }
        }
        return saved;
      }
      case COMPOSITE -> {
        return !visited.add(value) || cascade(value, visited);
      }
      default -> {
        return true;
      }
    }
  }

  private static Iterable<?> elements(Object container) {
    if (container instanceof Map<?, ?> map) {
      return map.values();
    }
    if (container instanceof Iterable<?> iterable) {
      return iterable;
    }
    if (container.getClass().isArray() && !container.getClass().getComponentType().isPrimitive()) {
      int length = Array.getLength(container);
      List<Object> list = new ArrayList<>(length);
      for (int i = 0; i < length; i++) {
        list.add(Array.get(container, i));
      }
      return list;
    }
    return Collections.emptyList();
  }
}
