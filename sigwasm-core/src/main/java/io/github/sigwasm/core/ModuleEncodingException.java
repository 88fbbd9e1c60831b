package io.github.sigwasm.core;

/**
 * Thrown when a module cannot be encoded, because an index, length or value is out of range.
 */
public class ModuleEncodingException extends CompilationException {
    public ModuleEncodingException(String message) {
        super(null, message);
    }
}
