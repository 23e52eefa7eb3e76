package de.t14d3.skein.mapping;

import de.t14d3.skein.annotations.*;
import de.t14d3.skein.schema.ObjectSchema;
import de.t14d3.skein.schema.Property;
import de.t14d3.skein.schema.PropertyType;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Describes {@link Entity} classes through reflection.
 * <p>
 * Fields of superclasses come first, in declaration order. Static, {@code transient} and
 * {@link Transient} fields are skipped. Descriptions are cached per class; each call returns
 * a fresh copy.
 */
public class EntityDescriber implements TypeDescriber {
    private static final Map<Class<?>, ObjectSchema> SCHEMA_CACHE = new ConcurrentHashMap<>();

    @Override
    public ObjectSchema describe(Class<?> type) {
        return SCHEMA_CACHE.computeIfAbsent(type, EntityDescriber::build).copy();
    }

    /**
     * Object type name of an entity class: {@link Entity#value()} or the simple class name.
     */
    public static String objectTypeName(Class<?> entityClass) {
        Entity entity = entityClass.getAnnotation(Entity.class);
        if (entity == null) {
            throw new IllegalArgumentException("Class " + entityClass.getName() + " is not annotated with @Entity");
        }
        return entity.value().isEmpty() ? entityClass.getSimpleName() : entity.value();
    }

    private static ObjectSchema build(Class<?> entityClass) {
        String objectType = objectTypeName(entityClass);

        List<Class<?>> hierarchy = new ArrayList<>();
        for (Class<?> c = entityClass; c != null && c != Object.class; c = c.getSuperclass()) {
            hierarchy.add(0, c);
        }

        List<Property> properties = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (Class<?> c : hierarchy) {
            for (Field field : c.getDeclaredFields()) {
                if (isSkipped(field)) {
                    continue;
                }
                Property property = describeField(objectType, field);
                if (!names.add(property.getName())) {
                    throw new IllegalArgumentException("Property '" + property.getName()
                            + "' is declared multiple times in the class hierarchy of '" + entityClass.getName() + "'");
                }
                properties.add(property);
            }
        }
        return new ObjectSchema(objectType, properties);
    }

    private static boolean isSkipped(Field field) {
        int modifiers = field.getModifiers();
        return Modifier.isStatic(modifiers)
                || Modifier.isTransient(modifiers)
                || field.isSynthetic()
                || field.isAnnotationPresent(Transient.class);
    }

    private static Property describeField(String objectType, Field field) {
        Column column = field.getAnnotation(Column.class);
        String name = column != null && !column.name().isEmpty() ? column.name() : field.getName();
        Class<?> javaType = field.getType();

        PropertyType type;
        String target = null;
        if (field.isAnnotationPresent(OneToMany.class) || Collection.class.isAssignableFrom(javaType)) {
            type = PropertyType.ARRAY;
            target = objectTypeName(listElementType(objectType, field));
        } else if (field.isAnnotationPresent(ManyToOne.class) || javaType.isAnnotationPresent(Entity.class)) {
            type = PropertyType.OBJECT;
            target = objectTypeName(javaType);
        } else {
            type = TypeMapper.propertyType(javaType);
            if (type == null) {
                throw new IllegalArgumentException("Property '" + name + "' of '" + objectType
                        + "' has unsupported type '" + javaType.getName() + "'");
            }
        }

        boolean nullable;
        if (type == PropertyType.OBJECT) {
            nullable = true;
        } else if (type == PropertyType.ARRAY || TypeMapper.isAlwaysRequired(javaType)) {
            nullable = false;
        } else {
            nullable = column == null || !column.required();
        }

        boolean primary = field.isAnnotationPresent(Id.class);
        boolean indexed = primary
                || field.isAnnotationPresent(Indexed.class)
                || (column != null && column.indexed());

        return Property.builder(name, type)
                .objectType(target)
                .nullable(nullable)
                .indexed(indexed)
                .primary(primary)
                .build();
    }

    private static Class<?> listElementType(String objectType, Field field) {
        OneToMany oneToMany = field.getAnnotation(OneToMany.class);
        if (oneToMany != null && oneToMany.targetEntity() != void.class) {
            return oneToMany.targetEntity();
        }
        Type generic = field.getGenericType();
        if (generic instanceof ParameterizedType parameterized
                && parameterized.getActualTypeArguments().length == 1
                && parameterized.getActualTypeArguments()[0] instanceof Class<?> element
                && element.isAnnotationPresent(Entity.class)) {
            return element;
        }
        throw new IllegalArgumentException("Property '" + field.getName() + "' of '" + objectType
                + "' must be a collection of an @Entity type");
    }
}
