package com.codescribe.tracer;

import java.util.List;
import java.util.Set;

/**
 * Allow-list of JDK types and members that traced code may reference.
 *
 * Traced code gets value types, strings, math, the java.util collections, functional interfaces and
 * streams, and printing through the redirected standard streams. There is no file, network, process,
 * thread, reflection or class loading access. Names are JVM internal names ({@code java/lang/String}).
 */
final class SandboxPolicy {

    private SandboxPolicy() {}

    private static final Set<String> THROWABLE_TYPES = Set.of(
        "java/lang/Throwable", "java/lang/Exception", "java/lang/RuntimeException", "java/lang/Error",
        "java/lang/ArithmeticException", "java/lang/ArrayIndexOutOfBoundsException",
        "java/lang/IndexOutOfBoundsException", "java/lang/StringIndexOutOfBoundsException",
        "java/lang/IllegalArgumentException", "java/lang/IllegalStateException",
        "java/lang/NullPointerException", "java/lang/ClassCastException", "java/lang/NumberFormatException",
        "java/lang/NegativeArraySizeException", "java/lang/UnsupportedOperationException",
        "java/lang/CloneNotSupportedException", "java/lang/AssertionError", "java/lang/NoSuchFieldError"
    );

    private static final Set<String> VALUE_TYPES = Set.of(
        "java/lang/Object", "java/lang/String", "java/lang/CharSequence", "java/lang/StringBuilder",
        "java/lang/StringBuffer", "java/lang/Math", "java/lang/StrictMath", "java/lang/Number",
        "java/lang/Integer", "java/lang/Long", "java/lang/Short", "java/lang/Byte", "java/lang/Double",
        "java/lang/Float", "java/lang/Boolean", "java/lang/Character", "java/lang/Void",
        "java/lang/Comparable", "java/lang/Iterable", "java/lang/Runnable", "java/lang/AutoCloseable",
        "java/lang/Enum", "java/lang/Record", "java/lang/Cloneable",
        "java/math/BigInteger", "java/math/BigDecimal", "java/math/RoundingMode"
    );

    // Members may be called, instances may not be created
    private static final Set<String> CALL_ONLY_TYPES = Set.of(
        "java/io/PrintStream", "java/lang/System"
    );

    private static final Set<String> SYSTEM_METHODS = Set.of(
        "currentTimeMillis", "nanoTime", "lineSeparator", "identityHashCode", "arraycopy"
    );

    private static final Set<String> BLOCKED_UTIL_TYPES = Set.of(
        "java/util/Scanner", "java/util/Formatter", "java/util/ServiceLoader", "java/util/Timer",
        "java/util/TimerTask", "java/util/ResourceBundle", "java/util/Properties", "java/util/PropertyResourceBundle"
    );

    // Process-wide defaults shared with the host and with other traces
    private static final Set<String> GLOBAL_SETTER_OWNERS = Set.of("java/util/Locale", "java/util/TimeZone");

    private static final List<String> OPEN_PACKAGES = List.of("java/util/function/", "java/util/stream/");

    private static final Set<String> BOOTSTRAP_OWNERS = Set.of(
        "java/lang/invoke/StringConcatFactory", "java/lang/invoke/LambdaMetafactory", "java/lang/runtime/ObjectMethods"
    );

    /** True when traced code may reference the type at all. */
    static boolean isAllowedType(String internalName) {
        String name = elementType(internalName);
        if (name == null) return true;
        if (VALUE_TYPES.contains(name) || THROWABLE_TYPES.contains(name) || CALL_ONLY_TYPES.contains(name)) {
            return true;
        }
        for (String pkg : OPEN_PACKAGES) {
            if (name.startsWith(pkg)) return name.indexOf('/', pkg.length()) < 0;
        }
        if (name.startsWith("java/util/")) {
            return name.indexOf('/', "java/util/".length()) < 0 && !BLOCKED_UTIL_TYPES.contains(outerType(name));
        }
        return false;
    }

    /** True when traced code may create instances of the type. */
    static boolean isInstantiable(String internalName) {
        return isAllowedType(internalName) && !CALL_ONLY_TYPES.contains(elementType(internalName));
    }

    /** True when traced code may invoke {@code owner.name}. */
    static boolean isAllowedMethod(String owner, String name) {
        if (!isAllowedType(owner)) return false;
        if ("java/lang/System".equals(owner)) return SYSTEM_METHODS.contains(name);
        if ("java/io/PrintStream".equals(owner)) return !"<init>".equals(name);
        if (GLOBAL_SETTER_OWNERS.contains(owner) && "setDefault".equals(name)) return false;
        // parallel streams and Arrays.parallel* run user lambdas on common pool threads, outside the trace
        if (owner.startsWith("java/util/") && name.startsWith("parallel")) return false;
        return true;
    }

    /** True for the JDK throwable types traced code may use. */
    static boolean isThrowableType(String internalName) {
        return THROWABLE_TYPES.contains(internalName);
    }

    /** System.out and System.err are rewritten to the capture streams, other System fields are refused. */
    static boolean isAllowedField(String owner, String name) {
        if (!isAllowedType(owner)) return false;
        return !"java/lang/System".equals(owner);
    }

    static boolean isAllowedBootstrap(String owner) {
        return BOOTSTRAP_OWNERS.contains(owner);
    }

    /**
     * True when the sandbox class loader may hand the class to traced code. Wider than
     * {@link #isAllowedType} because javac emits references to invoke and runtime support classes.
     */
    static boolean isLinkable(String binaryName) {
        String internal = binaryName.replace('.', '/');
        return isAllowedType(internal)
            || internal.startsWith("java/lang/invoke/")
            || internal.startsWith("java/lang/runtime/")
            || internal.equals("java/lang/Class")
            || internal.equals("java/io/Serializable");
    }

    /**
     * Strips array dimensions. Returns null for primitive arrays, which need no check.
     */
    static String elementType(String internalName) {
        String name = internalName;
        if (!name.startsWith("[")) return name;
        while (name.startsWith("[")) name = name.substring(1);
        if (name.startsWith("L") && name.endsWith(";")) {
            return name.substring(1, name.length() - 1);
        }
        return null;
    }

    private static String outerType(String name) {
        int dollar = name.indexOf('$');
        return dollar < 0 ? name : name.substring(0, dollar);
    }
}
