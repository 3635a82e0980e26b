package tech.yump.settings.walker;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.yump.settings.core.NestedSettings;
import tech.yump.settings.core.PasswordGate;
import tech.yump.settings.core.PasswordSession;
import tech.yump.settings.core.SettingsLockedException;
import tech.yump.settings.core.VisitedSet;
import tech.yump.settings.crypto.EncryptionService;
import tech.yump.settings.descriptor.Encrypted;
import tech.yump.settings.descriptor.FieldDescriptor;
import tech.yump.settings.descriptor.SettingsDescriptor;
import tech.yump.settings.prompt.ScriptedPasswordPrompt;

import javax.crypto.SecretKey;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class GraphWalkerTest {

  static class Secret {
    String label;
    @Encrypted
    String value;

    Secret() {
    }

    Secret(String label, String value) {
      this.label = label;
      this.value = value;
    }
  }

  static class Holder {
    @Encrypted
    String apiKey;
    Secret primary;
    Secret backup;
    List<Secret> list = new ArrayList<>();
    Map<String, Secret> byName = new LinkedHashMap<>();
  }

  static class Node {
    @Encrypted
    String secret;
    Node next;
  }

  static class Grouped {
    List<List<Secret>> groups = new ArrayList<>();
    Map<String, List<Secret>> byRegion = new LinkedHashMap<>();
  }

  static class Loose {
    Object extra;
  }

  static class RecordingDocument implements NestedSettings {
    String name;
    NestedSettings peer;
    Container owner;
    boolean failing;
    int saves;

    @Override
    public boolean save(VisitedSet visited) {
      if (!visited.add(this)) {
        return true;
      }
      saves++;
      boolean nestedSaved = new GraphWalker().saveNestedDocuments(this, visited);
      return !failing && nestedSaved;
    }
  }

  static class Container {
    RecordingDocument child;
    List<RecordingDocument> children = new ArrayList<>();
    Wrapper wrapper;
  }

  static class Wrapper {
    RecordingDocument inner;
  }

  @Spy
  private EncryptionService encryptionService = new EncryptionService(1000);

  private final GraphWalker walker = new GraphWalker();
  private PasswordSession session;

  @BeforeEach
  void setUp() {
    PasswordGate gate = new PasswordGate(encryptionService, new ScriptedPasswordPrompt(), true);
    gate.unlock("p1", null, null);
    session = gate.getSession();
  }

  private FieldDescriptor slot(Class<?> type, String name) {
    return SettingsDescriptor.of(type).findField(name).orElseThrow();
  }

  @Test
  @DisplayName("Encrypts top-level, composite, list and map values in place")
  void encryptGraph_EncryptsReachableFields() {
    Holder holder = new Holder();
    holder.apiKey = "key";
    holder.primary = new Secret("p", "one");
    holder.list.add(new Secret("l", "two"));
    holder.byName.put("m", new Secret("m", "three"));

    walker.encryptGraph(holder, session);

    assertEquals("key", session.decrypt(holder.apiKey));
    assertEquals("one", session.decrypt(holder.primary.value));
    assertEquals("two", session.decrypt(holder.list.get(0).value));
    assertEquals("three", session.decrypt(holder.byName.get("m").value));
    assertEquals("p", holder.primary.label);
    assertNull(holder.backup);
  }

  @Test
  @DisplayName("A shared instance is encrypted exactly once per pass")
  void encryptGraph_SharedReference_EncryptedOnce() {
    Holder holder = new Holder();
    Secret shared = new Secret("shared", "s3cret");
    holder.primary = shared;
    holder.backup = shared;
    holder.list.add(shared);

    walker.encryptGraph(holder, session);

    verify(encryptionService, times(1)).encrypt(eq("s3cret"), any(SecretKey.class));
    assertEquals("s3cret", session.decrypt(shared.value));
  }

  @Test
  @DisplayName("A second pass leaves values this session already encrypted alone")
  void encryptGraph_Twice_NoDoubleEncryption() {
    Holder holder = new Holder();
    holder.apiKey = "key";

    walker.encryptGraph(holder, session);
    String first = holder.apiKey;
    walker.encryptGraph(holder, session);

    assertEquals(first, holder.apiKey);
    assertEquals("key", session.decrypt(holder.apiKey));
  }

  @Test
  @DisplayName("Self-referencing composites terminate")
  void encryptGraph_Cycle_Terminates() {
    Node node = new Node();
    node.secret = "loop";
    node.next = node;

    walker.encryptGraph(node, session);

    assertEquals("loop", session.decrypt(node.secret));
  }

  @Test
  @DisplayName("Encrypting with a locked session fails loudly")
  void encryptGraph_Locked_Throws() {
    Holder holder = new Holder();
    holder.apiKey = "key";

    assertThrows(SettingsLockedException.class, () -> walker.encryptGraph(holder, PasswordSession.locked()));
  }

  @Test
  @DisplayName("Encrypted slot: ciphertext decrypts, blank becomes null, legacy text is kept")
  void decryptGraph_EncryptedSlot() {
    FieldDescriptor apiKey = slot(Holder.class, "apiKey");

    assertEquals("key", walker.decryptGraph(session.encrypt("key"), apiKey, session, new VisitedSet()));
    assertNull(walker.decryptGraph("", apiKey, session, new VisitedSet()));
    assertNull(walker.decryptGraph(null, apiKey, session, new VisitedSet()));
    assertEquals("legacy-plaintext", walker.decryptGraph("legacy-plaintext", apiKey, session, new VisitedSet()));
  }

  @Test
  @DisplayName("A value encrypted under another password is kept unchanged")
  void decryptGraph_OtherPassword_KeepsValue() {
    String foreign = encryptionService.encrypt("x", "other password");

    Object result = walker.decryptGraph(foreign, slot(Holder.class, "apiKey"), session, new VisitedSet());

    assertEquals(foreign, result);
  }

  @Test
  @DisplayName("Decrypting with a locked session fails loudly")
  void decryptGraph_Locked_Throws() {
    String ciphertext = session.encrypt("key");

    assertThrows(SettingsLockedException.class,
        () -> walker.decryptGraph(ciphertext, slot(Holder.class, "apiKey"), PasswordSession.locked(), new VisitedSet()));
  }

  @Test
  @DisplayName("Collections are rebuilt with decrypted elements")
  void decryptGraph_Collections() {
    List<Secret> list = new ArrayList<>(List.of(new Secret("a", session.encrypt("one")), new Secret("b", null)));
    Map<String, Secret> map = new LinkedHashMap<>();
    map.put("k", new Secret("k", session.encrypt("two")));

    Object decryptedList = walker.decryptGraph(list, slot(Holder.class, "list"), session, new VisitedSet());
    Object decryptedMap = walker.decryptGraph(map, slot(Holder.class, "byName"), session, new VisitedSet());

    List<?> resultList = assertInstanceOf(List.class, decryptedList);
    assertEquals("one", ((Secret) resultList.get(0)).value);
    assertNull(((Secret) resultList.get(1)).value);
    Map<?, ?> resultMap = assertInstanceOf(Map.class, decryptedMap);
    assertEquals("two", ((Secret) resultMap.get("k")).value);
  }

  @Test
  @DisplayName("Composite slots are decrypted in place")
  void decryptGraph_Composite() {
    Secret secret = new Secret("label", session.encrypt("plain"));

    Object result = walker.decryptGraph(secret, slot(Holder.class, "primary"), session, new VisitedSet());

    assertSame(secret, result);
    assertEquals("plain", secret.value);
    assertEquals("label", secret.label);
  }

  @Test
  @DisplayName("Nested documents are saved once, even when reachable several ways or through a back-reference")
  void saveNestedDocuments_SavesEachDocumentOnce() {
    Container container = new Container();
    RecordingDocument document = new RecordingDocument();
    document.owner = container;
    container.child = document;
    container.children.add(document);
    container.wrapper = new Wrapper();
    container.wrapper.inner = document;

    VisitedSet visited = new VisitedSet();
    visited.add(container);
    walker.saveNestedDocuments(container, visited);

    assertEquals(1, document.saves);
  }

  @Test
  @DisplayName("Two documents referring to each other end the cascade")
  void saveNestedDocuments_MutualReference_Terminates() {
    RecordingDocument a = new RecordingDocument();
    RecordingDocument b = new RecordingDocument();
    a.peer = b;
    b.peer = a;

    a.save(new VisitedSet());

    assertEquals(1, a.saves);
    assertEquals(1, b.saves);
  }

  @Test
  @DisplayName("Lists of lists and maps of lists are encrypted")
  void encryptGraph_NestedContainers() {
    Grouped grouped = new Grouped();
    grouped.groups.add(new ArrayList<>(List.of(new Secret("h", "TOPSECRET"))));
    grouped.byRegion.put("eu", new ArrayList<>(List.of(new Secret("e", "EUSECRET"))));

    walker.encryptGraph(grouped, session);

    assertEquals("TOPSECRET", session.decrypt(grouped.groups.get(0).get(0).value));
    assertEquals("EUSECRET", session.decrypt(grouped.byRegion.get("eu").get(0).value));
  }

  @Test
  @DisplayName("An Object-typed slot is walked by the runtime class of its value")
  void encryptGraph_ObjectSlot_UsesRuntimeClass() {
    Loose loose = new Loose();
    Secret secret = new Secret("h", "OBJSECRET");
    loose.extra = secret;

    walker.encryptGraph(loose, session);

    assertEquals("OBJSECRET", session.decrypt(secret.value));
    assertEquals("h", secret.label);
  }

  @Test
  @DisplayName("An Object-typed slot holding an encrypted value cannot be saved without a password")
  void encryptGraph_ObjectSlot_LockedSessionThrows() {
    Loose loose = new Loose();
    loose.extra = new Secret("h", "OBJSECRET");

    assertThrows(SettingsLockedException.class, () -> walker.encryptGraph(loose, PasswordSession.locked()));
  }

  @Test
  @DisplayName("Only ciphertexts still held by the graph are remembered after a pass")
  void encryptGraph_ForgetsReplacedCiphertexts() {
    Holder holder = new Holder();
    holder.apiKey = "key";
    walker.encryptGraph(holder, session);
    String first = holder.apiKey;

    holder.apiKey = "rotated";
    walker.encryptGraph(holder, session);

    assertFalse(session.isIssuedCiphertext(first));
    assertTrue(session.isIssuedCiphertext(holder.apiKey));
    assertEquals("rotated", session.decrypt(holder.apiKey));
  }

  @Test
  @DisplayName("A nested document that fails to save makes the cascade report failure")
  void saveNestedDocuments_FailureReported() {
    Container container = new Container();
    RecordingDocument healthy = new RecordingDocument();
    RecordingDocument failing = new RecordingDocument();
    failing.failing = true;
    container.children.add(failing);
    container.children.add(healthy);

    VisitedSet visited = new VisitedSet();
    visited.add(container);

    assertFalse(walker.saveNestedDocuments(container, visited));
    assertEquals(1, healthy.saves);
    assertTrue(walker.saveNestedDocuments(new Container(), new VisitedSet()));
  }
}
