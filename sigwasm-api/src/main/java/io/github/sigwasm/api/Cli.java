package io.github.sigwasm.api;

import io.github.sigwasm.api.bits.OutputsToDirectory;
import io.github.sigwasm.api.events.EmitModuleEvent;
import io.github.sigwasm.core.CompilationException;
import io.github.sigwasm.core.assemble.NumericPolicy;
import io.github.sigwasm.core.dom.Component;
import io.github.sigwasm.core.signal.Signals;
import io.github.sigwasm.core.wasm.Disassembler;

import java.io.File;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.List;

public class Cli {
    public static void main(String[] args) {
        List<String> specs = new ArrayList<>();
        boolean setOutput = false;
        File outputDir = new File(".");
        boolean suppressFlags = false;
        boolean dump = false;
        boolean narrow = false;
        boolean exportGlobals = true;
        String importModule = null;
        for (int i = 0; i < args.length; ) {
            String arg = args[i++];
            if (!suppressFlags && arg.startsWith("-")) {
                switch (arg) {
                    case "-h":
                    case "--help":
                        printHelp();
                        return;
                    case "-o":
                    case "--output":
                        if (i == args.length) {
                            System.err.printf("%s: expected directory%n", arg);
                            System.exit(1);
                        }
                        if (setOutput) {
                            System.err.printf("%s: output already specified%n", arg);
                            System.exit(1);
                        }
                        setOutput = true;
                        outputDir = new File(args[i++]);
                        break;
                    case "--import-module":
                        if (i == args.length) {
                            System.err.printf("%s: expected module name%n", arg);
                            System.exit(1);
                        }
                        importModule = args[i++];
                        break;
                    case "--dump":
                        dump = true;
                        break;
                    case "--narrow-i64":
                        narrow = true;
                        break;
                    case "--no-export-globals":
                        exportGlobals = false;
                        break;
                    case "--":
                        suppressFlags = true;
                        break;
                    default:
                        System.err.printf("%s: unknown flag%n", arg);
                        System.exit(1);
                }
                continue;
            }
            specs.add(arg);
        }
        if (specs.isEmpty()) {
            printHelp();
            System.exit(1);
        }

        SignalCompiler cc = new SignalCompiler();
        cc.add(new OutputsToDirectory(outputDir.toPath()));
        if (dump) {
            cc.lift().listen(EmitModuleEvent.class, evt -> System.out.println(
                    ";; " + evt.name + "\n" + Disassembler.disassemble(evt.component.getModule().getModule())));
        }
        for (String spec : specs) {
            int hash = spec.indexOf('#');
            if (hash <= 0 || hash == spec.length() - 1) {
                System.err.printf("invalid component specification: \"%s\"%n", spec);
                System.exit(1);
            }
            String className = spec.substring(0, hash);
            String methodName = spec.substring(hash + 1);
            Component component;
            try {
                component = resolve(className, methodName);
            } catch (ReflectiveOperationException e) {
                System.err.printf("could not load component %s: %s%n", spec, e);
                System.exit(1);
                return;
            }

            boolean narrowI64 = narrow;
            boolean exportSignalGlobals = exportGlobals;
            String module = importModule;
            try {
                cc.submit(methodName, component)
                        .configure(options -> {
                            if (narrowI64) options.numericPolicy(NumericPolicy.NARROW_I64);
                            if (module != null) options.importModule(module);
                            options.exportSignalGlobals(exportSignalGlobals);
                        })
                        .run();
            } catch (CompilationException e) {
                System.err.printf("%s: %s%n", spec, e.getMessage());
                System.exit(1);
            }
        }
    }

    /**
     * Find a component by a static method, either taking {@link Signals} or returning a {@link Component}.
     */
    static Component resolve(String className, String methodName) throws ReflectiveOperationException {
        Class<?> clazz = Class.forName(className);
        for (Method method : clazz.getMethods()) {
            if (!method.getName().equals(methodName) || !Modifier.isStatic(method.getModifiers())) continue;
            Class<?>[] params = method.getParameterTypes();
            if (params.length == 0 && Component.class.isAssignableFrom(method.getReturnType())) {
                return (Component) method.invoke(null);
            }
            if (params.length == 1 && params[0] == Signals.class) {
                return signals -> {
                    try {
                        return method.invoke(null, signals);
                    } catch (InvocationTargetException e) {
                        if (e.getCause() instanceof RuntimeException) throw (RuntimeException) e.getCause();
                        throw new IllegalStateException("component " + methodName + " failed", e.getCause());
                    } catch (IllegalAccessException e) {
                        throw new IllegalStateException("component " + methodName + " is not accessible", e);
                    }
                };
            }
        }
        throw new NoSuchMethodException(className + "." + methodName
                + " must be public static, and take Signals or return a Component");
    }

    private static void printHelp() {
        System.out.println(
                "usage: sigwasm [-h|--help] [-o|--output <dir>] [--dump] [--narrow-i64]\n" +
                        "               [--import-module <name>] [--no-export-globals] <class>#<method> ...\n" +
                        "\n" +
                        "  <class>#<method> : a public static method that takes Signals and returns the page,\n" +
                        "                     or takes nothing and returns a Component\n" +
                        "  -o|--output <dir> : write <method>.wasm, <method>.html and <method>.hydration.json to <dir>\n" +
                        "  --dump : print the disassembled module\n" +
                        "  --narrow-i64 : store long signals that fit in an int as i32\n" +
                        "  --import-module <name> : import host callbacks from <name> instead of dom\n" +
                        "  --no-export-globals : do not export signal globals\n" +
                        "  -h|--help : show this help"
        );
    }
}
