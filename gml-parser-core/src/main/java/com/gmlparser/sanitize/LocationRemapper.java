package com.gmlparser.sanitize;

import com.gmlparser.ast.Location;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rewrites every {@link Location} reachable from a finished tree so it refers to the
 * original, unsanitized source.
 *
 * <p>The walk follows record components, the fields of this library's own classes, and
 * the elements of collections, maps and arrays. Each object is visited once, so a location
 * instance shared between two nodes is translated only once.</p>
 *
 * <p>Remapping never fails the parse: if the walk hits anything it cannot read, a warning
 * is logged and positions are left exactly as they were.</p>
 */
public final class LocationRemapper {
    private static final Logger log = LoggerFactory.getLogger(LocationRemapper.class);
    private static final String OWN_PACKAGE_PREFIX = "com.gmlparser.";

    private LocationRemapper() {
    }

    /**
     * @return {@code true} if the locations were remapped, {@code false} when the mapper is
     *         the identity or the walk degraded to identity
     */
    public static boolean remap(Object root, IndexMapper mapper) {
        if (root == null || mapper == null || mapper.isIdentity()) {
            return false;
        }
        List<Location> locations;
        try {
            locations = collectLocations(root);
        } catch (RuntimeException | ReflectiveOperationException e) {
            log.warn("Could not walk {} to remap locations; keeping sanitized positions", root.getClass().getSimpleName(), e);
            return false;
        }
        for (Location location : locations) {
            location.setIndex(mapper.map(location.index()));
        }
        log.debug("Remapped {} location(s) with {}", locations.size(), mapper);
        return true;
    }

    /**
     * Every distinct {@link Location} instance reachable from {@code root}, in discovery order.
     */
    static List<Location> collectLocations(Object root) throws ReflectiveOperationException {
        Set<Object> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        List<Location> locations = new ArrayList<>();
        Deque<Object> stack = new ArrayDeque<>();
        stack.push(root);

        while (!stack.isEmpty()) {
            Object current = stack.pop();
            if (!seen.add(current)) {
                continue;
            }
            if (current instanceof Location location) {
                locations.add(location);
            } else if (current instanceof Iterable<?> iterable) {
                for (Object item : iterable) {
                    pushIfWalkable(stack, item);
                }
            } else if (current instanceof Map<?, ?> map) {
                for (Object value : map.values()) {
                    pushIfWalkable(stack, value);
                }
            } else if (current instanceof Object[] array) {
                for (Object item : array) {
                    pushIfWalkable(stack, item);
                }
            } else if (current.getClass().isRecord()) {
                for (RecordComponent component : current.getClass().getRecordComponents()) {
                    pushIfWalkable(stack, component.getAccessor().invoke(current));
                }
            } else {
                for (Class<?> type = current.getClass(); type != null && isOwnType(type); type = type.getSuperclass()) {
                    for (Field field : type.getDeclaredFields()) {
                        if (Modifier.isStatic(field.getModifiers()) || field.getType().isPrimitive()) {
                            continue;
                        }
                        field.setAccessible(true);
                        pushIfWalkable(stack, field.get(current));
                    }
                }
            }
        }
        return locations;
    }

    private static void pushIfWalkable(Deque<Object> stack, Object value) {
        if (value == null || value instanceof CharSequence || value instanceof Number
            || value instanceof Boolean || value instanceof Character || value instanceof Enum<?>) {
            return;
        }
        if (value instanceof Location || value instanceof Iterable<?> || value instanceof Map<?, ?>
            || value instanceof Object[] || value.getClass().isRecord() || isOwnType(value.getClass())) {
            stack.push(value);
        }
    }

    private static boolean isOwnType(Class<?> type) {
        return type.getName().startsWith(OWN_PACKAGE_PREFIX);
    }
}
