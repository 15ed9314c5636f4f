package ir.type;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

public final class FunctionType extends Type {
    private final Type returnType;
    private final List<Type> paramTypes;

    private static final Map<Key, FunctionType> pool = new ConcurrentHashMap<>();

    private record Key(Type ret, List<Type> params) {}

    private FunctionType(Type returnType, List<Type> paramTypes) {
        super(TypeKind.FUNC);
        this.returnType = returnType != null ? returnType : VoidType.getVoid();
        this.paramTypes = List.copyOf(paramTypes);
    }

    public static FunctionType get(Type ret, List<Type> params) {
        return pool.computeIfAbsent(new Key(ret, List.copyOf(params)),
                k -> new FunctionType(k.ret(), k.params()));
    }

    public Type getReturnType() { return returnType; }
    public List<Type> getParamTypes() { return paramTypes; }

    @Override
    public String toLLVM() {
        StringBuilder sb = new StringBuilder();
        sb.append(returnType.toLLVM()).append(" (");
        for (int i = 0; i < paramTypes.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(paramTypes.get(i).toLLVM());
        }
        sb.append(")");
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FunctionType other)) return false;
        return returnType.equals(other.returnType) && paramTypes.equals(other.paramTypes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), returnType, paramTypes);
    }
}
