package tech.yump.settings.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;
import tech.yump.settings.core.PasswordSession;
import tech.yump.settings.core.VisitedSet;
import tech.yump.settings.descriptor.FieldDescriptor;
import tech.yump.settings.descriptor.SettingsDescriptor;
import tech.yump.settings.storage.StorageException;
import tech.yump.settings.storage.TextFileStore;
import tech.yump.settings.walker.GraphWalker;

/**
 * Reads and writes the JSON file behind a settings document. Stateless; one instance
 * serves every document of a {@link SettingsContext}.
 */
@Slf4j
public class SettingsPersistence {

  private final ObjectMapper objectMapper;
  private final TextFileStore fileStore;
  private final GraphWalker graphWalker;

  public SettingsPersistence(ObjectMapper objectMapper, TextFileStore fileStore, GraphWalker graphWalker) {
    this.objectMapper = objectMapper;
    this.fileStore = fileStore;
    this.graphWalker = graphWalker;
  }

  /**
   * Parses the settings file into a property map whose keys compare case-insensitively.
   *
   * @return Empty if the file does not exist or holds only whitespace.
   * @throws SettingsParseException if the file is not a JSON object.
   * @throws StorageException       if the file cannot be read.
   */
  public Optional<Map<String, JsonNode>> read(Path filePath) {
    if (!fileStore.exists(filePath)) {
      log.debug("No settings file at {}; using defaults.", filePath);
      return Optional.empty();
    }
    String content = fileStore.read(filePath);
    if (content.isBlank()) {
      log.warn("Settings file is empty: {}. Keeping default values.", filePath);
      return Optional.empty();
    }

    JsonNode root;
    try {
      root = objectMapper.readTree(content);
    } catch (JsonProcessingException e) {
      throw new SettingsParseException("Settings file " + filePath + " is not valid JSON: " + e.getOriginalMessage(), e);
    }
    if (root == null || !root.isObject()) {
      throw new SettingsParseException("Settings file " + filePath + " does not contain a JSON object.");
    }

    Map<String, JsonNode> properties = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      properties.put(field.getKey(), field.getValue());
    }
    log.debug("Read {} properties from {}.", properties.size(), filePath);
    return Optional.of(properties);
  }

  /**
   * @return The stored password hash, or null if the file carries none.
   */
  public String storedPasswordHash(Map<String, JsonNode> properties) {
    JsonNode hash = properties.get(SettingsDescriptor.PASSWORD_HASH_FIELD);
    return hash != null && hash.isTextual() ? hash.asText() : null;
  }

  /**
   * Assigns every persisted slot of {@code document} that has a property in the file.
   * A value that cannot be converted to its slot type is logged and skipped.
   *
   * @throws tech.yump.settings.core.SettingsLockedException if an encrypted value is met while the session is locked.
   */
  public void apply(Object document, Map<String, JsonNode> properties, PasswordSession session) {
    SettingsDescriptor descriptor = SettingsDescriptor.of(document.getClass());
    VisitedSet visited = new VisitedSet();
    visited.add(document);
    int assigned = 0;
    for (FieldDescriptor slot : descriptor.getPersistedFields()) {
      JsonNode node = properties.get(slot.name());
      if (node == null) {
        continue;
      }
      try {
        Object raw = objectMapper.convertValue(node, objectMapper.getTypeFactory().constructType(slot.genericType()));
        slot.set(document, graphWalker.decryptGraph(raw, slot, session, visited));
        assigned++;
      } catch (IllegalArgumentException e) {
        log.warn("Skipping field {}: stored value cannot be converted to {}. Cause: {}",
            slot.qualifiedName(), slot.genericType().getTypeName(), e.getMessage());
      }
    }
    log.debug("Assigned {} of {} fields for {}.", assigned, descriptor.getPersistedFields().size(),
        document.getClass().getSimpleName());
  }

  /**
   * Encrypts the document in place, writes it, then saves the nested documents it reaches.
   *
   * @param visited Already contains {@code document}.
   * @return false if the file or one of the nested documents could not be written.
   * @throws tech.yump.settings.core.SettingsLockedException if an encrypted value is set while the session is locked.
   */
  public boolean save(Object document, Path filePath, String passwordHash, PasswordSession session, VisitedSet visited) {
    try {
      fileStore.ensureDirectory(filePath.toAbsolutePath().getParent());
      graphWalker.encryptGraph(document, session);

      ObjectNode root = objectMapper.createObjectNode();
      if (passwordHash != null) {
        root.put(SettingsDescriptor.PASSWORD_HASH_FIELD, passwordHash);
      }
      for (FieldDescriptor slot : SettingsDescriptor.of(document.getClass()).getPersistedFields()) {
        root.set(slot.name(), objectMapper.valueToTree(slot.get(document)));
      }
      fileStore.write(filePath, objectMapper.writeValueAsString(root));
      log.info("Settings saved to {}.", filePath);
    } catch (StorageException | JsonProcessingException | IllegalArgumentException e) {
      log.error("Failed to save settings to {}: {}", filePath, e.getMessage(), e);
      return false;
    }

    boolean nestedSaved = graphWalker.saveNestedDocuments(document, visited);
    if (!nestedSaved) {
      log.warn("Settings saved to {}, but at least one nested settings document was not.", filePath);
    }
    return nestedSaved;
  }
}
