package tech.yump.settings.descriptor;

import java.lang.reflect.Field;
import java.lang.reflect.Type;
import lombok.Builder;

/**
 * One slot of a settings type: a declared instance field together with how it is persisted
 * and traversed. Built once per type by {@link SettingsDescriptor}.
 *
 * @param owningType   Class that declares the field.
 * @param name         Field name, also the property name in the settings file.
 * @param field        The accessible reflective handle.
 * @param genericType  Full generic type, used for conversion on load.
 * @param declaredType Raw declared type.
 * @param encrypted    true if the field is marked {@link Encrypted}.
 * @param kind         How the slot is traversed.
 * @param elementType  Element (or map value) type for collections, otherwise null.
 * @param elementKind  Kind of the elements for collections, otherwise null.
 * @param open         true if the declared type (or, for collections, the innermost element
 *                     type) is {@code Object} or an abstract JDK type, so the runtime value
 *                     may be an application object that has to be walked.
 * @param label        Display name from {@link SettingInfo}, or the field name.
 * @param description  Description from {@link SettingInfo}, or empty.
 */
@Builder
public record FieldDescriptor(
        Class<?> owningType,
        String name,
        Field field,
        Type genericType,
        Class<?> declaredType,
        boolean encrypted,
        SlotKind kind,
        Class<?> elementType,
        SlotKind elementKind,
        boolean open,
        String label,
        String description
) {

    public boolean collection() {
        return kind == SlotKind.COLLECTION;
    }

    /**
     * @return false for slots that hold nested documents; those persist to their own files.
     */
    public boolean persisted() {
        return kind != SlotKind.NESTED_DOCUMENT
                && !(kind == SlotKind.COLLECTION && elementKind == SlotKind.NESTED_DOCUMENT);
    }

    public Object get(Object owner) {
        try {
            return field.get(owner);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot read field " + qualifiedName(), e);
        }
    }

    /**
     * @throws IllegalArgumentException if the value does not fit the declared type.
     */
    public void set(Object owner, Object value) {
        try {
            field.set(owner, value);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot write field " + qualifiedName(), e);
        }
    }

    public String qualifiedName() {
        return owningType.getSimpleName() + "." + name;
    }
}
