package com.codescribe.tracer;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryCompilerTest {

    private final InMemoryCompiler compiler = new InMemoryCompiler();

    @Test
    void compilesEveryClassIncludingNested() {
        Map<String, byte[]> classes = compiler.compile(
            "public class Outer { static class Inner {} } class Side {}", null);

        assertEquals(java.util.Set.of("Outer", "Outer$Inner", "Side"), classes.keySet());
        classes.values().forEach(bytes -> assertTrue(bytes.length > 0));
    }

    @Test
    void publicClassNameNeedNotMatchFileName() {
        assertDoesNotThrow(() -> compiler.compile("public class AnythingGoes {}", null));
    }

    @Test
    void driverIsWrappedIntoRunnableClass() {
        Map<String, byte[]> classes = compiler.compile("public class Lib {}", "int x = 1;");

        assertTrue(classes.containsKey(InMemoryCompiler.DRIVER_CLASS));
    }

    @Test
    void blankDriverIsIgnored() {
        Map<String, byte[]> classes = compiler.compile("public class Lib {}", "  ");

        assertFalse(classes.containsKey(InMemoryCompiler.DRIVER_CLASS));
    }

    @Test
    void driverWrapperKeepsFirstLineAligned() {
        String wrapped = InMemoryCompiler.wrapDriver("a();\nb();");

        assertEquals(3, wrapped.split("\n").length);
        assertTrue(wrapped.split("\n")[0].endsWith("a();"));
        assertEquals("b();", wrapped.split("\n")[1]);
    }

    @Test
    void errorsReportUnitAndLine() {
        InMemoryCompiler.CompilationException e = assertThrows(InMemoryCompiler.CompilationException.class,
            () -> compiler.compile("public class A {\n  void f() { undefined(); }\n}", null));

        assertTrue(e.getMessage().startsWith("source line 2: "), e.getMessage());
    }
}
