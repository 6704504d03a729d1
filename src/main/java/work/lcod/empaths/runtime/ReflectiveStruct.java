package work.lcod.empaths.runtime;

import java.lang.reflect.AccessibleObject;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reflective member access on an arbitrary object (records, beans, enums, plain classes).
 *
 * <p>Only public instance members are visible. A public member declared by a non-public class is
 * called through a public supertype when one declares it, otherwise through
 * {@link Method#trySetAccessible()}; if neither works the member counts as missing.
 */
final class ReflectiveStruct implements StructHandle {
    private static final Logger LOG = LoggerFactory.getLogger(ReflectiveStruct.class);

    private final Object target;

    ReflectiveStruct(Object target) {
        this.target = target;
    }

    @Override
    public Object raw() {
        return target;
    }

    @Override
    public Optional<Value> invoke0(String name) {
        if (name == null || name.isEmpty()) {
            return Optional.empty();
        }
        var method = findAccessor(name);
        if (method == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Values.of(method.invoke(target)));
        } catch (IllegalAccessException ex) {
            LOG.debug("Accessor {}.{} is not accessible", target.getClass().getName(), method.getName());
            return Optional.empty();
        } catch (InvocationTargetException ex) {
            throw rethrow(method, ex.getCause());
        }
    }

    @Override
    public Value field(String name) {
        if (name == null || name.isEmpty()) {
            return Value.ABSENT;
        }
        var field = findField(name);
        if (field == null) {
            return Value.ABSENT;
        }
        try {
            return Values.of(field.get(target));
        } catch (IllegalAccessException ex) {
            LOG.debug("Field {}.{} is not accessible", target.getClass().getName(), name);
            return Value.ABSENT;
        }
    }

    private Method findAccessor(String name) {
        var method = usable(lookupMethod(target.getClass(), name));
        if (method != null) {
            return method;
        }
        var suffix = name.substring(0, 1).toUpperCase(Locale.ROOT) + name.substring(1);
        method = usable(lookupMethod(target.getClass(), "get" + suffix));
        if (method != null) {
            return method;
        }
        method = usable(lookupMethod(target.getClass(), "is" + suffix));
        if (method != null && (method.getReturnType() == boolean.class || method.getReturnType() == Boolean.class)) {
            return method;
        }
        return null;
    }

    private Method usable(Method method) {
        if (method == null || Modifier.isStatic(method.getModifiers()) || method.getReturnType() == void.class) {
            return null;
        }
        if (method.canAccess(target)) {
            return method;
        }
        var declared = publicDeclaration(method.getName());
        if (declared != null) {
            return declared;
        }
        if (trySetAccessible(method)) {
            return method;
        }
        LOG.debug("Accessor {}.{} is not accessible", target.getClass().getName(), method.getName());
        return null;
    }

    private Method publicDeclaration(String name) {
        var pending = new ArrayDeque<Class<?>>();
        var seen = new HashSet<Class<?>>();
        pending.add(target.getClass());
        while (!pending.isEmpty()) {
            var type = pending.poll();
            if (!seen.add(type)) continue;
            if (Modifier.isPublic(type.getModifiers())) {
                var candidate = lookupMethod(type, name);
                if (candidate != null && candidate.canAccess(target)) {
                    return candidate;
                }
            }
            if (type.getSuperclass() != null) {
                pending.add(type.getSuperclass());
            }
            pending.addAll(Arrays.asList(type.getInterfaces()));
        }
        return null;
    }

    private Field findField(String name) {
        Field field;
        try {
            field = target.getClass().getField(name);
        } catch (NoSuchFieldException ex) {
            return null;
        }
        if (Modifier.isStatic(field.getModifiers())) {
            return null;
        }
        if (field.canAccess(target) || trySetAccessible(field)) {
            return field;
        }
        LOG.debug("Field {}.{} is not accessible", target.getClass().getName(), name);
        return null;
    }

    private static Method lookupMethod(Class<?> type, String name) {
        try {
            return type.getMethod(name);
        } catch (NoSuchMethodException ex) {
            return null;
        }
    }

    private static boolean trySetAccessible(AccessibleObject member) {
        try {
            return member.trySetAccessible();
        } catch (SecurityException ex) {
            return false;
        }
    }

    private RuntimeException rethrow(Method method, Throwable cause) {
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new AccessorInvocationException(target.getClass().getName() + "." + method.getName(), cause);
    }
}
