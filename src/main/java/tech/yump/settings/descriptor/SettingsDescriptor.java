package tech.yump.settings.descriptor;

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import tech.yump.settings.core.NestedSettings;
import tech.yump.settings.core.SettingsValidationException;

/**
 * Field table of one settings type, built by reflection on first use and cached for the
 * life of the JVM. Only the type's own slots are stored; nested types get their own
 * descriptor, looked up when the traversal reaches them.
 * <p>
 * Static, transient and synthetic fields are not slots.
 */
@Slf4j
public final class SettingsDescriptor {

    /** Top-level property name reserved in every settings file for the password hash. */
    public static final String PASSWORD_HASH_FIELD = "passwordHash";

    private static final Map<Class<?>, SettingsDescriptor> CACHE = new ConcurrentHashMap<>();

    private final Class<?> type;
    private final List<FieldDescriptor> fields;
    private final Map<String, FieldDescriptor> fieldsByName;
    private volatile Boolean reachableEncryptedField;
    private volatile Boolean reachableOpenSlot;

    private SettingsDescriptor(Class<?> type, List<FieldDescriptor> fields) {
        this.type = type;
        this.fields = Collections.unmodifiableList(fields);
        Map<String, FieldDescriptor> byName = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (FieldDescriptor field : fields) {
            if (byName.put(field.name(), field) != null) {
                throw new SettingsValidationException(
                        "Settings type " + type.getName() + " declares field '" + field.name()
                                + "' more than once (names are compared case-insensitively).");
            }
        }
        this.fieldsByName = byName;
    }

    /**
     * @return The cached descriptor for {@code type}, building it on first use.
     * @throws SettingsValidationException if the type declares an illegal slot.
     */
    public static SettingsDescriptor of(Class<?> type) {
        SettingsDescriptor descriptor = CACHE.get(type);
        if (descriptor == null) {
            descriptor = build(type);
            SettingsDescriptor existing = CACHE.putIfAbsent(type, descriptor);
            if (existing != null) {
                descriptor = existing;
            }
        }
        return descriptor;
    }

    /**
     * Every field carrying {@link Encrypted} that is reachable from {@code type}, at any depth,
     * through composite fields and collection element types, including collections of
     * collections. Nested documents are not entered; they gate their own password.
     */
    public static List<FieldDescriptor> getEncryptedFields(Class<?> type) {
        List<FieldDescriptor> encrypted = new ArrayList<>();
        collectEncryptedFields(type, encrypted, new HashSet<>(), false);
        return encrypted;
    }

    /**
     * Short-circuiting form of {@link #getEncryptedFields(Class)}.
     */
    public static boolean hasAnyEncryptedField(Class<?> type) {
        return collectEncryptedFields(type, new ArrayList<>(), new HashSet<>(), true);
    }

    public Class<?> getType() {
        return type;
    }

    public List<FieldDescriptor> getFields() {
        return fields;
    }

    /**
     * @return The slots written to this type's own settings file.
     */
    public List<FieldDescriptor> getPersistedFields() {
        return fields.stream().filter(FieldDescriptor::persisted).toList();
    }

    /**
     * Case-insensitive lookup by field name.
     */
    public Optional<FieldDescriptor> findField(String name) {
        return Optional.ofNullable(fieldsByName.get(name));
    }

    /**
     * Cached {@link #hasAnyEncryptedField(Class)} for this descriptor's type.
     */
    public boolean hasReachableEncryptedField() {
        Boolean cached = reachableEncryptedField;
        if (cached == null) {
            cached = hasAnyEncryptedField(type);
            reachableEncryptedField = cached;
        }
        return cached;
    }

    /**
     * @return true if this type, or a type reachable from it, has a slot whose declared type
     *         does not fix the runtime class of its value (see {@link FieldDescriptor#open()}).
     *         Such values are classified when the graph is walked.
     */
    public boolean hasReachableOpenSlot() {
        Boolean cached = reachableOpenSlot;
        if (cached == null) {
            cached = reachesOpenSlot(type, new HashSet<>());
            reachableOpenSlot = cached;
        }
        return cached;
    }

    private static boolean reachesOpenSlot(Class<?> type, Set<Class<?>> seenTypes) {
        if (type == null || !seenTypes.add(type)) {
            return false;
        }
        for (FieldDescriptor field : of(type).getFields()) {
            if (field.open()) {
                return true;
            }
            Class<?> nested = traversedType(field);
            if (nested != null && reachesOpenSlot(nested, seenTypes)) {
                return true;
            }
        }
        return false;
    }

    private static Class<?> traversedType(FieldDescriptor field) {
        return switch (field.kind()) {
            case COMPOSITE -> field.declaredType();
            case COLLECTION -> {
                Class<?> leaf = leafElementType(field.genericType());
                yield SlotKind.classify(leaf) == SlotKind.COMPOSITE ? leaf : null;
            }
            default -> null;
        };
    }

    private static boolean collectEncryptedFields(Class<?> type, List<FieldDescriptor> found,
                                                  Set<Class<?>> seenTypes, boolean stopAtFirst) {
        if (type == null || !seenTypes.add(type)) {
            return false;
        }
        for (FieldDescriptor field : of(type).getFields()) {
            if (field.encrypted()) {
                found.add(field);
                if (stopAtFirst) {
                    return true;
                }
            }
            Class<?> nested = traversedType(field);
            if (nested != null && collectEncryptedFields(nested, found, seenTypes, stopAtFirst) && stopAtFirst) {
                return true;
            }
        }
        return !found.isEmpty();
    }

    private static SettingsDescriptor build(Class<?> type) {
        Deque<Class<?>> hierarchy = new ArrayDeque<>();
        for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
            hierarchy.push(current);
        }

        List<FieldDescriptor> fields = new ArrayList<>();
        for (Class<?> declaring : hierarchy) {
            for (Field field : declaring.getDeclaredFields()) {
                int modifiers = field.getModifiers();
                if (Modifier.isStatic(modifiers) || Modifier.isTransient(modifiers) || field.isSynthetic()) {
                    continue;
                }
                fields.add(describe(type, declaring, field));
            }
        }
        log.debug("Built settings descriptor for {} with {} fields.", type.getName(), fields.size());
        return new SettingsDescriptor(type, fields);
    }

    private static FieldDescriptor describe(Class<?> type, Class<?> declaring, Field field) {
        String name = field.getName();
        if (NestedSettings.class.isAssignableFrom(type) && PASSWORD_HASH_FIELD.equalsIgnoreCase(name)) {
            throw new SettingsValidationException(
                    "Field name '" + name + "' in " + declaring.getName() + " is reserved for the password hash.");
        }

        Class<?> declaredType = field.getType();
        boolean encrypted = field.isAnnotationPresent(Encrypted.class);
        if (encrypted && declaredType != String.class) {
            throw new SettingsValidationException(
                    "@Encrypted is only supported on String fields: " + declaring.getName() + "." + name
                            + " is " + declaredType.getSimpleName() + ".");
        }

        SlotKind kind = encrypted ? SlotKind.ENCRYPTED : SlotKind.classify(declaredType);
        Class<?> elementType = kind == SlotKind.COLLECTION ? resolveElementType(field) : null;
        SlotKind elementKind = elementType != null ? SlotKind.classify(elementType) : null;
        boolean open = switch (kind) {
            case VALUE -> isOpenType(declaredType);
            case COLLECTION -> isOpenType(leafElementType(field.getGenericType()));
            default -> false;
        };

        SettingInfo info = field.getAnnotation(SettingInfo.class);
        field.setAccessible(true);

        return FieldDescriptor.builder()
                .owningType(declaring)
                .name(name)
                .field(field)
                .genericType(field.getGenericType())
                .declaredType(declaredType)
                .encrypted(encrypted)
                .kind(kind)
                .elementType(elementType)
                .elementKind(elementKind)
                .open(open)
                .label(info != null ? info.name() : name)
                .description(info != null ? info.description() : "")
                .build();
    }

    private static Class<?> resolveElementType(Field field) {
        Class<?> raw = field.getType();
        if (raw.isArray()) {
            return raw.getComponentType();
        }
        if (field.getGenericType() instanceof ParameterizedType parameterized) {
            Type[] arguments = parameterized.getActualTypeArguments();
            if (Map.class.isAssignableFrom(raw)) {
                return arguments.length == 2 ? rawClass(arguments[1]) : Object.class;
            }
            return arguments.length >= 1 ? rawClass(arguments[0]) : Object.class;
        }
        return Object.class;
    }

    /**
     * Element type of a container type, unwrapped through nested collections, maps (their
     * values) and arrays: {@code Map<String, List<Cred>>} yields {@code Cred}.
     */
    static Class<?> leafElementType(Type type) {
        Class<?> raw = rawClass(type);
        if (raw.isArray()) {
            Type component = type instanceof GenericArrayType generic
                    ? generic.getGenericComponentType() : raw.getComponentType();
            return leafElementType(component);
        }
        if (!Collection.class.isAssignableFrom(raw) && !Map.class.isAssignableFrom(raw)) {
            return raw;
        }
        if (type instanceof ParameterizedType parameterized) {
            Type[] arguments = parameterized.getActualTypeArguments();
            if (Map.class.isAssignableFrom(raw)) {
                return arguments.length == 2 ? leafElementType(arguments[1]) : Object.class;
            }
            return arguments.length >= 1 ? leafElementType(arguments[0]) : Object.class;
        }
        return Object.class;
    }

    /**
     * A plain-data declared type that may still hold an application object at runtime:
     * {@code Object}, or a JDK interface or abstract class such as {@code Serializable}.
     */
    private static boolean isOpenType(Class<?> type) {
        if (type.isPrimitive() || type.isArray() || type.isEnum() || SlotKind.classify(type) != SlotKind.VALUE) {
            return false;
        }
        return type == Object.class || type.isInterface() || Modifier.isAbstract(type.getModifiers());
    }

    private static Class<?> rawClass(Type type) {
        if (type instanceof Class<?> clazz) {
            return clazz;
        }
        if (type instanceof ParameterizedType parameterized && parameterized.getRawType() instanceof Class<?> clazz) {
            return clazz;
        }
        if (type instanceof GenericArrayType generic) {
            return Array.newInstance(rawClass(generic.getGenericComponentType()), 0).getClass();
        }
        return Object.class;
    }
}
