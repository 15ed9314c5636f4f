package ir.value;

import ir.IRModule;
import ir.type.FunctionType;
import ir.type.Type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public class Function extends Value {
    private final IRModule module;
    private final List<Argument> arguments;
    private final List<BasicBlock> blocks;
    private final Map<String, Integer> nameCounts;
    private final boolean declaration;

    public Function(IRModule parent, FunctionType type, String name, List<String> argNames, boolean declaration) {
        super(type, name);
        this.module = parent;
        this.arguments = new ArrayList<>();
        this.blocks = new ArrayList<>();
        this.nameCounts = new HashMap<>();
        this.declaration = declaration;

        List<Type> paramTypes = type.getParamTypes();
        for (int i = 0; i < paramTypes.size(); i++) {
            String argName = argNames != null && i < argNames.size() && argNames.get(i) != null
                    ? argNames.get(i)
                    : "arg" + i;
            arguments.add(new Argument(paramTypes.get(i), getUniqueName(argName), i, this));
        }
    }

    public BasicBlock getBlockByName(String name) {
        for (BasicBlock block : blocks) {
            if (block.getName().equals(name)) {
                return block;
            }
        }
        return null;
    }

    /* getter setter */
    public IRModule getParent() {
        return module;
    }

    public FunctionType getFunctionType() {
        return (FunctionType) super.getType();
    }

    public List<Argument> getArguments() {
        return Collections.unmodifiableList(arguments);
    }

    public Argument getParam(int index) {
        return arguments.get(index);
    }

    public List<BasicBlock> getBlocks() {
        return Collections.unmodifiableList(blocks);
    }

    public BasicBlock getEntryBlock() {
        return blocks.isEmpty() ? null : blocks.get(0);
    }

    public BasicBlock appendBasicBlock(String name) {
        BasicBlock block = new BasicBlock(getUniqueName(name), this);
        blocks.add(block);
        return block;
    }

    /* a name not used yet in this function: name, name.1, name.2, ... */
    public String getUniqueName(String name) {
        int count = nameCounts.getOrDefault(name, 0);
        nameCounts.put(name, count + 1);
        if (count == 0) {
            return name;
        }
        String candidate = name + "." + count;
        while (nameCounts.containsKey(candidate)) {
            count++;
            candidate = name + "." + count;
        }
        nameCounts.put(name, count + 1);
        nameCounts.put(candidate, 1);
        return candidate;
    }

    public boolean isDeclaration() {
        return declaration;
    }

    @Override
    public String getReference() {
        return "@" + getName();
    }

    @Override
    public String toLLVM() {
        FunctionType fnType = getFunctionType();
        StringBuilder sb = new StringBuilder();
        if (declaration) {
            String params = fnType.getParamTypes().stream()
                    .map(Type::toLLVM)
                    .collect(Collectors.joining(", "));
            return sb.append("declare ").append(fnType.getReturnType().toLLVM())
                    .append(" @").append(getName()).append("(").append(params).append(")\n")
                    .toString();
        }

        String argsStr = arguments.stream()
                .map(Argument::toLLVM)
                .collect(Collectors.joining(", "));
        sb.append("define ").append(fnType.getReturnType().toLLVM())
                .append(" @").append(getName()).append("(")
                .append(argsStr).append(") {\n");
        for (BasicBlock block : blocks) {
            sb.append(block.toLLVM());
        }
        sb.append("}\n");
        return sb.toString();
    }
}
