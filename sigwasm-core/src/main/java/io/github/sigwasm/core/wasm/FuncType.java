package io.github.sigwasm.core.wasm;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A function type: a list of parameters and a list of results.
 */
public final class FuncType {
    /**
     * The type of a function that takes and returns nothing.
     */
    public static final FuncType VOID = new FuncType(Collections.emptyList(), Collections.emptyList());

    public final List<ValType> params;
    public final List<ValType> results;

    public FuncType(List<ValType> params, List<ValType> results) {
        this.params = Collections.unmodifiableList(params);
        this.results = Collections.unmodifiableList(results);
    }

    public static FuncType of(ValType[] params, ValType... results) {
        return new FuncType(Arrays.asList(params), Arrays.asList(results));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FuncType that = (FuncType) o;
        return params.equals(that.params) && results.equals(that.results);
    }

    @Override
    public int hashCode() {
        return Objects.hash(params, results);
    }

    @Override
    public String toString() {
        return params + " -> " + results;
    }
}
