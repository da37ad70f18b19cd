package com.codescribe.tracer;

import net.bytebuddy.ByteBuddy;
import net.bytebuddy.asm.AsmVisitorWrapper;
import net.bytebuddy.description.method.MethodDescription;
import net.bytebuddy.description.type.TypeDescription;
import net.bytebuddy.dynamic.ClassFileLocator;
import net.bytebuddy.implementation.Implementation;
import net.bytebuddy.jar.asm.AnnotationVisitor;
import net.bytebuddy.jar.asm.ClassReader;
import net.bytebuddy.jar.asm.ClassWriter;
import net.bytebuddy.jar.asm.ConstantDynamic;
import net.bytebuddy.jar.asm.Handle;
import net.bytebuddy.jar.asm.Label;
import net.bytebuddy.jar.asm.MethodVisitor;
import net.bytebuddy.jar.asm.Opcodes;
import net.bytebuddy.jar.asm.Type;
import net.bytebuddy.jar.asm.TypePath;
import net.bytebuddy.pool.TypePool;
import net.bytebuddy.utility.OpenedClassReader;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

import static net.bytebuddy.matcher.ElementMatchers.any;

/**
 * Rewrites compiled user classes so that every line reports its visible locals to {@link LineHook}
 * before it runs, and checks every referenced JDK type and member against {@link SandboxPolicy}.
 *
 * Local variable scopes are only known once the whole method body has been read, so each method's
 * code is buffered and replayed with the hook calls inserted in front of the first instruction of
 * each line.
 */
public class LineHookInstrumenter {

    private static final int MAX_REPORTED_VIOLATIONS = 5;

    /**
     * @param classes binary class name to class file bytes, as produced by {@link InMemoryCompiler}
     * @return the same classes, instrumented
     * @throws SandboxViolationException if any class references something outside the sandbox
     */
    public Map<String, byte[]> instrument(Map<String, byte[]> classes) {
        Map<String, List<String>> userTypes = new LinkedHashMap<>();
        for (Map.Entry<String, byte[]> entry : classes.entrySet()) {
            userTypes.put(entry.getKey().replace('.', '/'), supertypes(entry.getValue()));
        }

        List<String> violations = new ArrayList<>();
        userTypes.forEach((name, supertypes) -> checkHierarchy(name, supertypes, userTypes, violations));

        ClassFileLocator locator = new ClassFileLocator.Compound(
            new ClassFileLocator.Simple(classes),
            ClassFileLocator.ForClassLoader.ofSystemLoader());
        TypePool pool = TypePool.Default.of(locator);

        Map<String, byte[]> instrumented = new LinkedHashMap<>();
        for (String name : classes.keySet()) {
            TypeDescription type = pool.describe(name).resolve();
            String origin = InMemoryCompiler.DRIVER_CLASS.equals(name) ? "driver" : "source";
            AsmVisitorWrapper lineHooks = new AsmVisitorWrapper.ForDeclaredMethods()
                .writerFlags(ClassWriter.COMPUTE_MAXS)
                .invokable(any(), new LineHookWrapper(origin, userTypes, violations));
            byte[] bytes = new ByteBuddy()
                .redefine(type, locator)
                .visit(lineHooks)
                .make()
                .getBytes();
            instrumented.put(name, bytes);
        }

        if (!violations.isEmpty()) {
            List<String> shown = violations.subList(0, Math.min(violations.size(), MAX_REPORTED_VIOLATIONS));
            String more = violations.size() > shown.size()
                ? " (and " + (violations.size() - shown.size()) + " more)"
                : "";
            throw new SandboxViolationException(String.join("; ", shown) + more);
        }
        return instrumented;
    }

    /** Superclass first, then interfaces. */
    private static List<String> supertypes(byte[] bytes) {
        ClassReader reader = OpenedClassReader.of(bytes);
        List<String> supertypes = new ArrayList<>();
        if (reader.getSuperName() != null) supertypes.add(reader.getSuperName());
        supertypes.addAll(List.of(reader.getInterfaces()));
        return supertypes;
    }

    private static void checkHierarchy(String name, List<String> supertypes,
                                       Map<String, List<String>> userTypes, List<String> violations) {
        for (String supertype : supertypes) {
            if (!userTypes.containsKey(supertype) && !SandboxPolicy.isAllowedType(supertype)) {
                violations.add(name.replace('/', '.') + " may not extend " + supertype.replace('/', '.'));
            }
        }
    }

    private static final class LineHookWrapper implements AsmVisitorWrapper.ForDeclaredMethods.MethodVisitorWrapper {
        private final String origin;
        private final Map<String, List<String>> userTypes;
        private final List<String> violations;

        LineHookWrapper(String origin, Map<String, List<String>> userTypes, List<String> violations) {
            this.origin = origin;
            this.userTypes = userTypes;
            this.violations = violations;
        }

        @Override
        public MethodVisitor wrap(TypeDescription instrumentedType,
                                  MethodDescription instrumentedMethod,
                                  MethodVisitor methodVisitor,
                                  Implementation.Context implementationContext,
                                  TypePool typePool,
                                  int writerFlags,
                                  int readerFlags) {
            String where = instrumentedType.getName() + "." + instrumentedMethod.getInternalName();
            return new LineHookMethodVisitor(methodVisitor, origin, where, userTypes, violations);
        }
    }

    private record LocalSlot(String name, String descriptor, Label start, Label end, int index) {}

    /**
     * A buffered visitor call. {@code label} is set for label entries only, {@code lineStart} for line
     * number entries only.
     */
    private record TryCatch(Label start, Label end, Label handler) {}

    private record Op(boolean instruction, Label label, Label lineStart, int line, Consumer<MethodVisitor> action) {}

    static final class LineHookMethodVisitor extends MethodVisitor {

        private final String origin;
        private final String where;
        private final Map<String, List<String>> userTypes;
        private final List<String> violations;

        private final List<Op> ops = new ArrayList<>();
        private final List<LocalSlot> locals = new ArrayList<>();
        private final Map<Label, Integer> labelOrder = new IdentityHashMap<>();
        private final List<TryCatch> tryCatches = new ArrayList<>();
        private boolean buffering;

        LineHookMethodVisitor(MethodVisitor next, String origin, String where,
                           Map<String, List<String>> userTypes, List<String> violations) {
            super(OpenedClassReader.ASM_API, next);
            this.origin = origin;
            this.where = where;
            this.userTypes = userTypes;
            this.violations = violations;
        }

        @Override
        public void visitCode() {
            super.visitCode();
            buffering = true;
        }

        private void record(boolean instruction, Consumer<MethodVisitor> action) {
            record(new Op(instruction, null, null, 0, action));
        }

        private void record(Op op) {
            if (buffering) {
                ops.add(op);
            } else {
                op.action().accept(mv);
            }
        }

        @Override
        public void visitFrame(int type, int numLocal, Object[] local, int numStack, Object[] stack) {
            // the reader reuses these arrays for every frame
            Object[] localCopy = local == null ? null : local.clone();
            Object[] stackCopy = stack == null ? null : stack.clone();
            record(false, v -> v.visitFrame(type, numLocal, localCopy, numStack, stackCopy));
        }

        @Override
        public void visitInsn(int opcode) {
            record(true, v -> v.visitInsn(opcode));
        }

        @Override
        public void visitIntInsn(int opcode, int operand) {
            record(true, v -> v.visitIntInsn(opcode, operand));
        }

        @Override
        public void visitVarInsn(int opcode, int varIndex) {
            record(true, v -> v.visitVarInsn(opcode, varIndex));
        }

        @Override
        public void visitTypeInsn(int opcode, String type) {
            boolean allowed = opcode == Opcodes.NEW
                ? isUserType(type) || SandboxPolicy.isInstantiable(type)
                : isAllowedType(type);
            if (!allowed) {
                violation((opcode == Opcodes.NEW ? "creates " : "uses ") + readable(type));
            }
            record(true, v -> v.visitTypeInsn(opcode, type));
        }

        @Override
        public void visitFieldInsn(int opcode, String owner, String name, String descriptor) {
            if (opcode == Opcodes.GETSTATIC && "java/lang/System".equals(owner)
                    && ("out".equals(name) || "err".equals(name))) {
                String replacement = "out".equals(name) ? "stdout" : "stderr";
                record(true, v -> v.visitMethodInsn(Opcodes.INVOKESTATIC, LineHook.INTERNAL_NAME,
                    replacement, LineHook.STREAM_DESCRIPTOR, false));
                return;
            }
            if (!isUserType(owner) && !SandboxPolicy.isAllowedField(owner, name)) {
                violation("accesses " + readable(owner) + "." + name);
            }
            record(true, v -> v.visitFieldInsn(opcode, owner, name, descriptor));
        }

        @Override
        public void visitMethodInsn(int opcode, String owner, String name, String descriptor, boolean isInterface) {
            checkMethod(owner, name);
            if (opcode == Opcodes.INVOKEVIRTUAL && "printStackTrace".equals(name) && "()V".equals(descriptor)
                    && isThrowable(owner)) {
                record(true, v -> {
                    v.visitMethodInsn(Opcodes.INVOKESTATIC, LineHook.INTERNAL_NAME, "stderr",
                        LineHook.STREAM_DESCRIPTOR, false);
                    v.visitMethodInsn(Opcodes.INVOKEVIRTUAL, owner, "printStackTrace", "(Ljava/io/PrintStream;)V", false);
                });
                return;
            }
            record(true, v -> v.visitMethodInsn(opcode, owner, name, descriptor, isInterface));
        }

        @Override
        public void visitInvokeDynamicInsn(String name, String descriptor, Handle bootstrap, Object... arguments) {
            if (!SandboxPolicy.isAllowedBootstrap(bootstrap.getOwner())) {
                violation("uses dynamic call site bootstrap " + readable(bootstrap.getOwner()));
            }
            for (Object argument : arguments) {
                checkConstant(argument);
            }
            record(true, v -> v.visitInvokeDynamicInsn(name, descriptor, bootstrap, arguments));
        }

        @Override
        public void visitJumpInsn(int opcode, Label label) {
            record(true, v -> v.visitJumpInsn(opcode, label));
        }

        @Override
        public void visitLabel(Label label) {
            labelOrder.putIfAbsent(label, labelOrder.size());
            record(new Op(false, label, null, 0, v -> v.visitLabel(label)));
        }

        @Override
        public void visitLdcInsn(Object value) {
            checkConstant(value);
            record(true, v -> v.visitLdcInsn(value));
        }

        @Override
        public void visitIincInsn(int varIndex, int increment) {
            record(true, v -> v.visitIincInsn(varIndex, increment));
        }

        @Override
        public void visitTableSwitchInsn(int min, int max, Label dflt, Label... labels) {
            record(true, v -> v.visitTableSwitchInsn(min, max, dflt, labels));
        }

        @Override
        public void visitLookupSwitchInsn(Label dflt, int[] keys, Label[] labels) {
            record(true, v -> v.visitLookupSwitchInsn(dflt, keys, labels));
        }

        @Override
        public void visitMultiANewArrayInsn(String descriptor, int numDimensions) {
            if (!isAllowedType(Type.getType(descriptor).getInternalName())) {
                violation("uses " + readable(descriptor));
            }
            record(true, v -> v.visitMultiANewArrayInsn(descriptor, numDimensions));
        }

        @Override
        public AnnotationVisitor visitInsnAnnotation(int typeRef, TypePath typePath, String descriptor, boolean visible) {
            return null;
        }

        @Override
        public void visitTryCatchBlock(Label start, Label end, Label handler, String type) {
            if (type != null && !isAllowedType(type)) {
                violation("catches " + readable(type));
            }
            tryCatches.add(new TryCatch(start, end, handler));
            record(false, v -> v.visitTryCatchBlock(start, end, handler, type));
        }

        @Override
        public AnnotationVisitor visitTryCatchAnnotation(int typeRef, TypePath typePath, String descriptor, boolean visible) {
            return null;
        }

        @Override
        public void visitLocalVariable(String name, String descriptor, String signature, Label start, Label end, int index) {
            locals.add(new LocalSlot(name, descriptor, start, end, index));
            record(false, v -> v.visitLocalVariable(name, descriptor, signature, start, end, index));
        }

        @Override
        public AnnotationVisitor visitLocalVariableAnnotation(int typeRef, TypePath typePath, Label[] start,
                                                              Label[] end, int[] index, String descriptor, boolean visible) {
            return null;
        }

        @Override
        public void visitLineNumber(int line, Label start) {
            record(new Op(false, null, start, line, v -> v.visitLineNumber(line, start)));
        }

        @Override
        public void visitMaxs(int maxStack, int maxLocals) {
            buffering = false;
            Set<Label> handlers = abortCheckedHandlers();
            Op pendingLine = null;
            boolean pendingHandler = false;
            for (Op op : ops) {
                if (op.instruction()) {
                    // a handler may swallow the abort error, so every handler entry re-checks it
                    if (pendingHandler) {
                        mv.visitMethodInsn(Opcodes.INVOKESTATIC, LineHook.INTERNAL_NAME, "checkAbort",
                            LineHook.CHECK_ABORT_DESCRIPTOR, false);
                        pendingHandler = false;
                    }
                    if (pendingLine != null) {
                        emitLineHook(pendingLine.lineStart(), pendingLine.line());
                        pendingLine = null;
                    }
                }
                op.action().accept(mv);
                if (op.lineStart() != null) {
                    pendingLine = op;
                }
                if (op.label() != null && handlers.contains(op.label())) {
                    pendingHandler = true;
                }
            }
            ops.clear();
            super.visitMaxs(maxStack, maxLocals);
        }

        private void emitLineHook(Label lineStart, int line) {
            int position = labelOrder.getOrDefault(lineStart, -1);
            List<LocalSlot> visible = visibleLocals(position);

            mv.visitLdcInsn(origin);
            pushInt(line);

            pushInt(visible.size());
            mv.visitTypeInsn(Opcodes.ANEWARRAY, "java/lang/String");
            for (int i = 0; i < visible.size(); i++) {
                mv.visitInsn(Opcodes.DUP);
                pushInt(i);
                mv.visitLdcInsn(visible.get(i).name());
                mv.visitInsn(Opcodes.AASTORE);
            }

            pushInt(visible.size());
            mv.visitTypeInsn(Opcodes.ANEWARRAY, "java/lang/Object");
            for (int i = 0; i < visible.size(); i++) {
                mv.visitInsn(Opcodes.DUP);
                pushInt(i);
                loadBoxed(visible.get(i));
                mv.visitInsn(Opcodes.AASTORE);
            }

            mv.visitMethodInsn(Opcodes.INVOKESTATIC, LineHook.INTERNAL_NAME, "onLine",
                LineHook.ON_LINE_DESCRIPTOR, false);
        }

        List<LocalSlot> visibleLocals(int position) {
            Map<String, LocalSlot> byName = new LinkedHashMap<>();
            locals.stream()
                .filter(l -> !"this".equals(l.name()) && !l.name().startsWith("__"))
                .filter(l -> labelOrder.getOrDefault(l.start(), Integer.MAX_VALUE) <= position
                          && position < labelOrder.getOrDefault(l.end(), -1))
                .sorted(Comparator.comparingInt(LocalSlot::index))
                .forEach(l -> byName.putIfAbsent(l.name(), l));
            return new ArrayList<>(byName.values());
        }

        private void loadBoxed(LocalSlot slot) {
            Type type = Type.getType(slot.descriptor());
            mv.visitVarInsn(type.getOpcode(Opcodes.ILOAD), slot.index());
            String box = switch (type.getSort()) {
                case Type.BOOLEAN -> "java/lang/Boolean";
                case Type.BYTE -> "java/lang/Byte";
                case Type.CHAR -> "java/lang/Character";
                case Type.SHORT -> "java/lang/Short";
                case Type.INT -> "java/lang/Integer";
                case Type.LONG -> "java/lang/Long";
                case Type.FLOAT -> "java/lang/Float";
                case Type.DOUBLE -> "java/lang/Double";
                default -> null;
            };
            if (box != null) {
                mv.visitMethodInsn(Opcodes.INVOKESTATIC, box, "valueOf",
                    "(" + type.getDescriptor() + ")L" + box + ";", false);
            }
        }

        private void pushInt(int value) {
            if (value >= -1 && value <= 5) {
                mv.visitInsn(Opcodes.ICONST_0 + value);
            } else if (value >= Byte.MIN_VALUE && value <= Byte.MAX_VALUE) {
                mv.visitIntInsn(Opcodes.BIPUSH, value);
            } else if (value >= Short.MIN_VALUE && value <= Short.MAX_VALUE) {
                mv.visitIntInsn(Opcodes.SIPUSH, value);
            } else {
                mv.visitLdcInsn(value);
            }
        }

        /**
         * Handlers that may re-check the abort. A handler inside its own range (javac's monitor release
         * for {@code synchronized}) would catch its own rethrow, so it is left alone.
         */
        private Set<Label> abortCheckedHandlers() {
            Set<Label> result = Collections.newSetFromMap(new IdentityHashMap<>());
            Set<Label> selfCovered = Collections.newSetFromMap(new IdentityHashMap<>());
            for (TryCatch block : tryCatches) {
                int handler = labelOrder.getOrDefault(block.handler(), -1);
                if (labelOrder.getOrDefault(block.start(), -1) <= handler
                        && handler < labelOrder.getOrDefault(block.end(), -1)) {
                    selfCovered.add(block.handler());
                }
                result.add(block.handler());
            }
            result.removeAll(selfCovered);
            return result;
        }

        private void checkMethod(String owner, String name) {
            if (!isUserType(owner)) {
                if (!SandboxPolicy.isAllowedMethod(owner, name)) {
                    violation("calls " + readable(owner) + "." + name);
                }
                return;
            }
            // a user subclass inherits the JDK method, so the JDK supertype's rules apply
            for (String base : jdkSupertypes(owner)) {
                if (!SandboxPolicy.isAllowedMethod(base, name)) {
                    violation("calls " + readable(base) + "." + name + " through " + readable(owner));
                    return;
                }
            }
        }

        private Set<String> jdkSupertypes(String userType) {
            Set<String> result = new LinkedHashSet<>();
            Deque<String> pending = new ArrayDeque<>(List.of(userType));
            Set<String> seen = new HashSet<>();
            while (!pending.isEmpty()) {
                String type = pending.pop();
                if (!seen.add(type)) continue;
                List<String> supertypes = userTypes.get(type);
                if (supertypes == null) {
                    result.add(type);
                } else {
                    pending.addAll(supertypes);
                }
            }
            return result;
        }

        private boolean isThrowable(String owner) {
            String type = owner;
            while (userTypes.containsKey(type)) {
                List<String> supertypes = userTypes.get(type);
                if (supertypes.isEmpty()) return false;
                type = supertypes.get(0);
            }
            return SandboxPolicy.isThrowableType(type);
        }

        private void checkConstant(Object value) {
            if (value instanceof Type type) {
                if (type.getSort() == Type.OBJECT || type.getSort() == Type.ARRAY) {
                    if (!isAllowedType(type.getInternalName())) violation("uses " + readable(type.getInternalName()));
                }
            } else if (value instanceof Handle handle) {
                checkMethod(handle.getOwner(), handle.getName());
            } else if (value instanceof ConstantDynamic) {
                violation("uses a dynamic constant");
            }
        }

        private boolean isAllowedType(String internalName) {
            return isUserType(internalName) || SandboxPolicy.isAllowedType(internalName);
        }

        private boolean isUserType(String internalName) {
            String element = SandboxPolicy.elementType(internalName);
            return element == null || userTypes.containsKey(element);
        }

        private void violation(String what) {
            violations.add(where + " " + what + ", which is not available in the trace sandbox");
        }

        private static String readable(String internalName) {
            return internalName.replace('/', '.');
        }
    }

    public static class SandboxViolationException extends RuntimeException {
        public SandboxViolationException(String msg) { super(msg); }
    }
}
