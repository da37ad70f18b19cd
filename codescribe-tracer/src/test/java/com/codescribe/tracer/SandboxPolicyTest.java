package com.codescribe.tracer;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SandboxPolicyTest {

    @Test
    void coreValueTypesAndCollectionsAreAllowed() {
        assertTrue(SandboxPolicy.isAllowedType("java/lang/String"));
        assertTrue(SandboxPolicy.isAllowedType("java/lang/Math"));
        assertTrue(SandboxPolicy.isAllowedType("java/util/ArrayList"));
        assertTrue(SandboxPolicy.isAllowedType("java/util/Map$Entry"));
        assertTrue(SandboxPolicy.isAllowedType("java/util/function/Function"));
        assertTrue(SandboxPolicy.isAllowedType("java/util/stream/Collectors"));
    }

    @Test
    void ioNetworkReflectionAndThreadsAreRefused() {
        assertFalse(SandboxPolicy.isAllowedType("java/io/File"));
        assertFalse(SandboxPolicy.isAllowedType("java/nio/file/Files"));
        assertFalse(SandboxPolicy.isAllowedType("java/net/Socket"));
        assertFalse(SandboxPolicy.isAllowedType("java/lang/reflect/Method"));
        assertFalse(SandboxPolicy.isAllowedType("java/lang/Thread"));
        assertFalse(SandboxPolicy.isAllowedType("java/lang/ProcessBuilder"));
        assertFalse(SandboxPolicy.isAllowedType("java/lang/Class"));
    }

    @Test
    void utilSubpackagesAndFileBackedUtilitiesAreRefused() {
        assertFalse(SandboxPolicy.isAllowedType("java/util/concurrent/Executors"));
        assertFalse(SandboxPolicy.isAllowedType("java/util/Scanner"));
        assertFalse(SandboxPolicy.isAllowedType("java/util/Formatter"));
        assertFalse(SandboxPolicy.isAllowedType("java/util/stream/nested/Thing"));
    }

    @Test
    void arraysAreCheckedByElementType() {
        assertTrue(SandboxPolicy.isAllowedType("[I"));
        assertTrue(SandboxPolicy.isAllowedType("[[Ljava/lang/String;"));
        assertFalse(SandboxPolicy.isAllowedType("[Ljava/io/File;"));
    }

    @Test
    void systemOnlyExposesHarmlessMethods() {
        assertTrue(SandboxPolicy.isAllowedMethod("java/lang/System", "currentTimeMillis"));
        assertTrue(SandboxPolicy.isAllowedMethod("java/lang/System", "arraycopy"));
        assertFalse(SandboxPolicy.isAllowedMethod("java/lang/System", "exit"));
        assertFalse(SandboxPolicy.isAllowedMethod("java/lang/System", "getenv"));
        assertFalse(SandboxPolicy.isAllowedMethod("java/lang/System", "setOut"));
        assertFalse(SandboxPolicy.isAllowedField("java/lang/System", "in"));
    }

    @Test
    void printStreamIsCallOnly() {
        assertTrue(SandboxPolicy.isAllowedMethod("java/io/PrintStream", "println"));
        assertFalse(SandboxPolicy.isAllowedMethod("java/io/PrintStream", "<init>"));
        assertFalse(SandboxPolicy.isInstantiable("java/io/PrintStream"));
        assertTrue(SandboxPolicy.isInstantiable("java/util/HashMap"));
    }

    @Test
    void onlyCompilerBootstrapsAreAllowed() {
        assertTrue(SandboxPolicy.isAllowedBootstrap("java/lang/invoke/StringConcatFactory"));
        assertTrue(SandboxPolicy.isAllowedBootstrap("java/lang/invoke/LambdaMetafactory"));
        assertFalse(SandboxPolicy.isAllowedBootstrap("java/lang/invoke/MethodHandles"));
    }

    @Test
    void linkableIsWiderThanAllowed() {
        assertTrue(SandboxPolicy.isLinkable("java.lang.invoke.LambdaMetafactory"));
        assertTrue(SandboxPolicy.isLinkable("java.lang.Class"));
        assertTrue(SandboxPolicy.isLinkable("java.util.ArrayList"));
        assertFalse(SandboxPolicy.isLinkable("java.io.FileInputStream"));
        assertFalse(SandboxPolicy.isLinkable("java.lang.Runtime"));
    }

    @Test
    void parallelExecutionIsRefused() {
        assertFalse(SandboxPolicy.isAllowedMethod("java/util/stream/IntStream", "parallel"));
        assertFalse(SandboxPolicy.isAllowedMethod("java/util/Collection", "parallelStream"));
        assertFalse(SandboxPolicy.isAllowedMethod("java/util/Arrays", "parallelSetAll"));
        assertTrue(SandboxPolicy.isAllowedMethod("java/util/stream/IntStream", "sum"));
        assertTrue(SandboxPolicy.isAllowedMethod("java/util/stream/IntStream", "isParallel"));
    }

    @Test
    void processWideDefaultsCannotBeChanged() {
        assertFalse(SandboxPolicy.isAllowedMethod("java/util/Locale", "setDefault"));
        assertFalse(SandboxPolicy.isAllowedMethod("java/util/TimeZone", "setDefault"));
        assertTrue(SandboxPolicy.isAllowedMethod("java/util/Locale", "getDefault"));
        assertTrue(SandboxPolicy.isAllowedMethod("java/util/TimeZone", "getDefault"));
    }

    @Test
    void throwableTypesAreRecognised() {
        assertTrue(SandboxPolicy.isThrowableType("java/lang/ArithmeticException"));
        assertTrue(SandboxPolicy.isThrowableType("java/lang/Throwable"));
        assertFalse(SandboxPolicy.isThrowableType("java/lang/String"));
    }
}
