package org.ontobind.mapping;

import org.apache.commons.lang3.ClassUtils;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reflective access to domain objects: records through their components and canonical constructor, other classes
 * through their declared fields and no-arg constructor.
 */
final class DomainObjects {

    private DomainObjects() {
    }

    static Object readField(final Object source, final String fieldName) {
        final Class<?> type = source.getClass();
        try {
            if (type.isRecord()) {
                for (final RecordComponent component : type.getRecordComponents()) {
                    if (component.getName().equals(fieldName)) {
                        final Method accessor = component.getAccessor();
                        accessor.setAccessible(true);
                        return accessor.invoke(source);
                    }
                }
                throw new MappingConfigurationException(String.format("Record %s has no component '%s'", type.getName(), fieldName));
            }
            final Field field = findField(type, fieldName);
            field.setAccessible(true);
            return field.get(source);
        } catch (final IllegalAccessException | InvocationTargetException e) {
            throw new MappingException(String.format("Cannot read field '%s' of %s", fieldName, type.getName()), e);
        }
    }

    /**
     * Elements of a multi-valued field, in iteration order. A {@code null} field has no elements.
     */
    static List<Object> elements(final Object value, final String fieldName) {
        if (value == null) {
            return Collections.emptyList();
        }
        if (!(value instanceof Iterable)) {
            throw new MappingConfigurationException(String.format("Field '%s' holds a %s, expected a collection",
                    fieldName, value.getClass().getName()));
        }
        final List<Object> elements = new ArrayList<>();
        for (final Object element : (Iterable<?>) value) {
            elements.add(element);
        }
        return elements;
    }

    static <S> S instantiate(final Class<S> type, final Map<String, Object> values) {
        try {
            if (type.isRecord()) {
                return instantiateRecord(type, values);
            }
            return instantiateBean(type, values);
        } catch (final InstantiationException | IllegalAccessException | NoSuchMethodException e) {
            throw new DomainConstructionException("Cannot instantiate " + type.getName(), e);
        } catch (final InvocationTargetException e) {
            throw new DomainConstructionException("Constructor of " + type.getName() + " failed", e.getCause());
        } catch (final IllegalArgumentException e) {
            throw new DomainConstructionException("Field values " + values + " do not fit " + type.getName(), e);
        }
    }

    private static <S> S instantiateRecord(final Class<S> type, final Map<String, Object> values)
            throws NoSuchMethodException, InstantiationException, IllegalAccessException, InvocationTargetException {
        final RecordComponent[] components = type.getRecordComponents();
        final Set<String> componentNames = new HashSet<>();
        for (final RecordComponent component : components) {
            componentNames.add(component.getName());
        }
        if (!componentNames.equals(values.keySet())) {
            throw new DomainConstructionException(String.format("Record %s has components %s but the mapping provides %s",
                    type.getName(), componentNames, values.keySet()));
        }

        final Class<?>[] parameterTypes = Arrays.stream(components).map(RecordComponent::getType).toArray(Class<?>[]::new);
        final Object[] arguments = Arrays.stream(components)
                .map(component -> coerce(values.get(component.getName()), component.getGenericType()))
                .toArray();

        final Constructor<S> constructor = type.getDeclaredConstructor(parameterTypes);
        constructor.setAccessible(true);
        return constructor.newInstance(arguments);
    }

    private static <S> S instantiateBean(final Class<S> type, final Map<String, Object> values)
            throws NoSuchMethodException, InstantiationException, IllegalAccessException, InvocationTargetException {
        final Constructor<S> constructor = type.getDeclaredConstructor();
        constructor.setAccessible(true);
        final S instance = constructor.newInstance();
        for (final Map.Entry<String, Object> entry : values.entrySet()) {
            final Field field;
            try {
                field = findField(type, entry.getKey());
            } catch (final MappingConfigurationException e) {
                throw new DomainConstructionException(e.getMessage(), e);
            }
            field.setAccessible(true);
            field.set(instance, coerce(entry.getValue(), field.getGenericType()));
        }
        return instance;
    }

    /**
     * Converts numbers read from the store to the declared type. The store hands back the narrowest type holding
     * the value, an {@code xsd:long} 5 comes back as an {@link Integer}. Collection elements are converted against
     * the declared element type.
     */
    static Object coerce(final Object value, final Type declaredType) {
        if (value instanceof Collection) {
            final Type elementType = elementType(declaredType);
            if (elementType == null) {
                return value;
            }
            final Collection<Object> converted = (value instanceof Set) ? new HashSet<>() : new ArrayList<>();
            for (final Object element : (Collection<?>) value) {
                converted.add(coerce(element, elementType));
            }
            return converted;
        }
        if (!(value instanceof Number) || !(declaredType instanceof Class)) {
            return value;
        }
        return convertNumber((Number) value, ClassUtils.primitiveToWrapper((Class<?>) declaredType));
    }

    private static Type elementType(final Type collectionType) {
        if (collectionType instanceof ParameterizedType) {
            final Type[] arguments = ((ParameterizedType) collectionType).getActualTypeArguments();
            if (arguments.length == 1) {
                return arguments[0];
            }
        }
        return null;
    }

    private static Object convertNumber(final Number number, final Class<?> target) {
        if (target.isInstance(number)) {
            return number;
        }
        if (target == Long.class) {
            return number.longValue();
        }
        if (target == Integer.class) {
            return number.intValue();
        }
        if (target == Short.class) {
            return number.shortValue();
        }
        if (target == Byte.class) {
            return number.byteValue();
        }
        if (target == Double.class) {
            return number.doubleValue();
        }
        if (target == Float.class) {
            return number.floatValue();
        }
        if (target == BigInteger.class) {
            return new BigInteger(number.toString());
        }
        if (target == BigDecimal.class) {
            return new BigDecimal(number.toString());
        }
        return number;
    }

    private static Field findField(final Class<?> type, final String fieldName) {
        Class<?> current = type;
        while ((current != null) && (current != Object.class)) {
            try {
                return current.getDeclaredField(fieldName);
            } catch (final NoSuchFieldException e) {
                current = current.getSuperclass();
            }
        }
        throw new MappingConfigurationException(String.format("%s has no field '%s'", type.getName(), fieldName));
    }
}
