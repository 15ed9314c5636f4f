package ir;

import ir.type.FunctionType;
import ir.value.Function;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A translation unit: functions in declaration order. Modules are plain
 * objects so independent builds never share state.
 */
public class IRModule {
    private final String moduleName;
    private final Map<String, Function> functions = new LinkedHashMap<>();

    public IRModule(String name) {
        this.moduleName = name;
    }

    public String getName() {
        return moduleName;
    }

    public Function addFunction(String name, FunctionType type, List<String> argNames) {
        return register(new Function(this, type, name, argNames, false));
    }

    public Function declareFunction(String name, FunctionType type) {
        return register(new Function(this, type, name, null, true));
    }

    private Function register(Function function) {
        if (functions.containsKey(function.getName())) {
            throw new IllegalArgumentException(
                    "Function '" + function.getName() + "' has already been declared.");
        }
        functions.put(function.getName(), function);
        return function;
    }

    public Function getFunction(String name) {
        return functions.get(name);
    }

    public Collection<Function> getFunctions() {
        return Collections.unmodifiableCollection(functions.values());
    }

    public String toLLVM() {
        StringBuilder sb = new StringBuilder();
        sb.append("; ModuleID = '").append(moduleName).append("'\n");
        for (Function function : functions.values()) {
            sb.append("\n").append(function.toLLVM());
        }
        return sb.toString();
    }
}
