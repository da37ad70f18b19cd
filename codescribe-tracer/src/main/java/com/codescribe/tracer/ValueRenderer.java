package com.codescribe.tracer;

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collection;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Renders a traced variable's value as a single line of text.
 *
 * Rules:
 * - null: {@code null}
 * - String: double-quoted with escapes, char: single-quoted
 * - Boxed primitives and enums: {@code String.valueOf}
 * - Arrays and collections: {@code [a, b, ...]}, maps: {@code {k=v, ...}}, truncated after maxCollectionElements
 * - Objects overriding toString(): that result
 * - Other objects: {@code Type{field=value}} walking declared and inherited fields
 * - Depth limit: at renderDepth, containers and objects render as {@code <Type>}
 * - Cycles render as {@code <circular>}
 */
public final class ValueRenderer {

    private ValueRenderer() {}

    public static String render(Object value, TracerConfig config) {
        StringBuilder out = new StringBuilder();
        renderInto(value, config, 0, out, new IdentityHashMap<>());
        return out.toString();
    }

    private static void renderInto(
            Object value,
            TracerConfig config,
            int depth,
            StringBuilder out,
            IdentityHashMap<Object, Boolean> visited) {

        if (value == null) {
            out.append("null");
            return;
        }
        Class<?> cls = value.getClass();
        if (value instanceof String s) {
            quote(s, '"', out);
            return;
        }
        if (value instanceof Character c) {
            quote(String.valueOf(c), '\'', out);
            return;
        }
        if (isScalar(cls)) {
            out.append(value);
            return;
        }
        if (visited.containsKey(value)) {
            out.append("<circular>");
            return;
        }
        if (depth >= config.renderDepth()) {
            out.append('<').append(typeName(cls)).append('>');
            return;
        }

        visited.put(value, Boolean.TRUE);
        try {
            if (cls.isArray()) {
                List<Object> elements = new ArrayList<>();
                int len = Array.getLength(value);
                for (int i = 0; i < len && i < config.maxCollectionElements(); i++) {
                    elements.add(Array.get(value, i));
                }
                renderSequence(elements, len, config, depth, out, visited);
            } else if (value instanceof Collection<?> col) {
                List<Object> elements = new ArrayList<>();
                Iterator<?> it = col.iterator();
                while (it.hasNext() && elements.size() < config.maxCollectionElements()) {
                    elements.add(it.next());
                }
                renderSequence(elements, col.size(), config, depth, out, visited);
            } else if (value instanceof Map<?, ?> map) {
                renderMap(map, config, depth, out, visited);
            } else if (overridesToString(cls)) {
                out.append(value);
            } else {
                renderFields(value, cls, config, depth, out, visited);
            }
        } catch (RuntimeException e) {
            out.append("<unrenderable ").append(typeName(cls)).append(": ").append(e).append('>');
        } finally {
            visited.remove(value);
        }
    }

    private static void renderSequence(
            List<Object> elements,
            int size,
            TracerConfig config,
            int depth,
            StringBuilder out,
            IdentityHashMap<Object, Boolean> visited) {

        out.append('[');
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) out.append(", ");
            renderInto(elements.get(i), config, depth + 1, out, visited);
        }
        if (size > elements.size()) {
            out.append(elements.isEmpty() ? "..." : ", ...");
        }
        out.append(']');
    }

    private static void renderMap(
            Map<?, ?> map,
            TracerConfig config,
            int depth,
            StringBuilder out,
            IdentityHashMap<Object, Boolean> visited) {

        out.append('{');
        int count = 0;
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (count >= config.maxCollectionElements()) {
                out.append(count == 0 ? "..." : ", ...");
                break;
            }
            if (count > 0) out.append(", ");
            renderInto(entry.getKey(), config, depth + 1, out, visited);
            out.append('=');
            renderInto(entry.getValue(), config, depth + 1, out, visited);
            count++;
        }
        out.append('}');
    }

    private static void renderFields(
            Object value,
            Class<?> cls,
            TracerConfig config,
            int depth,
            StringBuilder out,
            IdentityHashMap<Object, Boolean> visited) {

        // JDK internals are not opened to us, the type name is all we can show
        if (cls.getName().startsWith("java.")) {
            out.append('<').append(typeName(cls)).append('>');
            return;
        }

        List<Field> fields = new ArrayList<>();
        for (Class<?> c = cls; c != null && c != Object.class; c = c.getSuperclass()) {
            for (Field f : c.getDeclaredFields()) {
                if (f.isSynthetic() || Modifier.isStatic(f.getModifiers())) continue;
                fields.add(f);
            }
        }

        out.append(typeName(cls)).append('{');
        boolean first = true;
        for (Field field : fields) {
            Object fieldValue;
            try {
                field.setAccessible(true);
                fieldValue = field.get(value);
            } catch (IllegalAccessException | RuntimeException e) {
                // Module system may refuse access, skip the field
                continue;
            }
            if (!first) out.append(", ");
            first = false;
            out.append(field.getName()).append('=');
            renderInto(fieldValue, config, depth + 1, out, visited);
        }
        out.append('}');
    }

    private static void quote(String s, char quote, StringBuilder out) {
        out.append(quote);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                case '\\' -> out.append("\\\\");
                default -> {
                    if (c == quote) out.append('\\');
                    out.append(c);
                }
            }
        }
        out.append(quote);
    }

    static boolean overridesToString(Class<?> cls) {
        try {
            return cls.getMethod("toString").getDeclaringClass() != Object.class;
        } catch (NoSuchMethodException e) {
            return false;
        }
    }

    private static String typeName(Class<?> cls) {
        String simple = cls.getSimpleName();
        return simple.isEmpty() ? cls.getName() : simple;
    }

    static boolean isScalar(Class<?> cls) {
        return cls.isPrimitive()
            || cls == Boolean.class
            || cls == Byte.class
            || cls == Short.class
            || cls == Integer.class
            || cls == Long.class
            || cls == Float.class
            || cls == Double.class
            || Enum.class.isAssignableFrom(cls)
            || Number.class.isAssignableFrom(cls) && cls.getPackageName().startsWith("java.");
    }
}
