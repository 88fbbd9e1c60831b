package io.github.sigwasm.core.ir;

import io.github.sigwasm.core.IRExtractionException;
import io.github.sigwasm.core.UnknownSignalException;
import io.github.sigwasm.core.analysis.AnalyzedHandler;
import io.github.sigwasm.core.analysis.ComponentAnalysis;
import io.github.sigwasm.core.passes.IRPass;
import io.github.sigwasm.core.signal.SignalAccessor;
import io.github.sigwasm.core.wasm.ValType;
import org.objectweb.asm.ClassReader;
import org.objectweb.asm.Type;
import org.objectweb.asm.tree.ClassNode;
import org.objectweb.asm.tree.MethodNode;
import org.objectweb.asm.tree.analysis.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.lang.invoke.MethodHandleInfo;
import java.lang.invoke.SerializedLambda;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;

/**
 * Recovers the typed instructions of a handler closure, and traces its captured values to signals.
 * <p>
 * Handlers must be serializable lambdas, so that their {@link SerializedLambda} form names the
 * implementation method and lists the captured arguments. The implementation method must be static
 * (the lambda must not use {@code this}) and take exactly the captured arguments. Every captured argument
 * must be a getter or setter of a signal of the analyzed component, or a primitive constant.
 */
public class HandlerIRExtractor implements IRPass<AnalyzedHandler, HandlerIR> {
    private static final Logger LOGGER = LoggerFactory.getLogger(HandlerIRExtractor.class);

    private final ComponentAnalysis analysis;

    public HandlerIRExtractor(ComponentAnalysis analysis) {
        this.analysis = analysis;
    }

    @Override
    public HandlerIR run(AnalyzedHandler handler) {
        String subject = "handler_" + handler.id;
        Object closure = handler.closure;
        SerializedLambda lambda = serializedForm(subject, closure);

        if (lambda.getImplMethodKind() != MethodHandleInfo.REF_invokeStatic) {
            throw new IRExtractionException(subject, "closure is implemented by "
                    + MethodHandleInfo.referenceKindToString(lambda.getImplMethodKind())
                    + " " + lambda.getImplClass() + "." + lambda.getImplMethodName()
                    + "; handlers must be lambdas that do not refer to this");
        }
        if (!"()V".equals(lambda.getInstantiatedMethodType())) {
            throw new IRExtractionException(subject, "closure has type " + lambda.getInstantiatedMethodType()
                    + ", expected ()V");
        }

        ClassNode classNode = readClass(subject, closure, lambda.getImplClass());
        MethodNode method = null;
        for (MethodNode mn : classNode.methods) {
            if (mn.name.equals(lambda.getImplMethodName()) && mn.desc.equals(lambda.getImplMethodSignature())) {
                method = mn;
                break;
            }
        }
        if (method == null) {
            throw new IRExtractionException(subject, "implementation method "
                    + lambda.getImplMethodName() + lambda.getImplMethodSignature()
                    + " not found in " + lambda.getImplClass());
        }

        Type[] paramTypes = Type.getArgumentTypes(method.desc);
        if (paramTypes.length != lambda.getCapturedArgCount()) {
            throw new IRExtractionException(subject, "implementation method takes " + paramTypes.length
                    + " arguments but " + lambda.getCapturedArgCount() + " are captured");
        }
        List<CapturedValue> captured = new ArrayList<>();
        int slot = 0;
        for (int i = 0; i < paramTypes.length; i++) {
            captured.add(classify(subject, i, slot, paramTypes[i], lambda.getCapturedArg(i)));
            slot += paramTypes[i].getSize();
        }

        Frame<BasicValue>[] typeFrames;
        Frame<SourceValue>[] sourceFrames;
        try {
            typeFrames = new Analyzer<>(new BasicInterpreter()).analyze(classNode.name, method);
            sourceFrames = new Analyzer<>(new SourceInterpreter()).analyze(classNode.name, method);
        } catch (AnalyzerException e) {
            throw new IRExtractionException(subject, "could not analyze "
                    + classNode.name + "." + method.name + method.desc, e);
        }

        LOGGER.debug("{}: {}.{}{} with captures {}", subject,
                classNode.name, method.name, method.desc, captured);
        return new HandlerIR(handler.id, closure, classNode.name, method, typeFrames, sourceFrames, captured);
    }

    private static SerializedLambda serializedForm(String subject, Object closure) {
        Object replaced;
        try {
            Method writeReplace = closure.getClass().getDeclaredMethod("writeReplace");
            writeReplace.setAccessible(true);
            replaced = writeReplace.invoke(closure);
        } catch (NoSuchMethodException e) {
            throw new IRExtractionException(subject, closure.getClass().getName()
                    + " is not a serializable lambda; declare handlers as Handler lambdas", e);
        } catch (ReflectiveOperationException | RuntimeException e) {
            throw new IRExtractionException(subject, "could not introspect " + closure.getClass().getName(), e);
        }
        if (!(replaced instanceof SerializedLambda)) {
            throw new IRExtractionException(subject, closure.getClass().getName()
                    + " is not a serializable lambda; declare handlers as Handler lambdas");
        }
        return (SerializedLambda) replaced;
    }

    private static ClassNode readClass(String subject, Object closure, String internalName) {
        ClassLoader loader = closure.getClass().getClassLoader();
        if (loader == null) loader = ClassLoader.getSystemClassLoader();
        try (InputStream in = loader.getResourceAsStream(internalName + ".class")) {
            if (in == null) {
                throw new IRExtractionException(subject, "class file of " + internalName + " not found");
            }
            ClassNode node = new ClassNode();
            new ClassReader(in).accept(node, ClassReader.SKIP_FRAMES);
            return node;
        } catch (IOException e) {
            throw new IRExtractionException(subject, "could not read class file of " + internalName, e);
        }
    }

    private CapturedValue classify(String subject, int index, int slot, Type type, Object value) {
        Long getter = analysis.getterId(value);
        if (getter != null) {
            return CapturedValue.accessor(CapturedValue.Kind.GETTER, index, slot, type, getter);
        }
        Long setter = analysis.setterId(value);
        if (setter != null) {
            return CapturedValue.accessor(CapturedValue.Kind.SETTER, index, slot, type, setter);
        }
        if (value instanceof SignalAccessor) {
            throw new UnknownSignalException(subject, "captured value " + index
                    + " is an accessor of a signal that was not created by this component");
        }
        ValType valType = ValType.fromJava(type);
        if (valType != null && (value instanceof Number || value instanceof Boolean || value instanceof Character)) {
            return CapturedValue.constant(index, slot, type, toConstant(type, value));
        }
        throw new IRExtractionException(subject, "captured value " + index + " is a "
                + (value == null ? "null " + type.getClassName() : value.getClass().getName())
                + "; handlers may only capture signal getters, signal setters and primitive constants");
    }

    private static Number toConstant(Type type, Object value) {
        Number number;
        if (value instanceof Boolean) {
            number = (Boolean) value ? 1 : 0;
        } else if (value instanceof Character) {
            number = (int) (Character) value;
        } else {
            number = (Number) value;
        }
        switch (type.getSort()) {
            case Type.LONG:
                return number.longValue();
            case Type.FLOAT:
                return number.floatValue();
            case Type.DOUBLE:
                return number.doubleValue();
            default:
                return number.intValue();
        }
    }
}
