package ir.type;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

import exception.CompileException;

public final class IntegerType extends Type {
    private final int bitWidth;

    private static final Map<Integer, IntegerType> pool = new ConcurrentHashMap<>();

    private IntegerType(int bitWidth) {
        super(kindOf(bitWidth));
        this.bitWidth = bitWidth;
    }

    public int getBitWidth() {
        return bitWidth;
    }

    private static TypeKind kindOf(int bitWidth) {
        return switch (bitWidth) {
            case 1 -> TypeKind.I1;
            case 8 -> TypeKind.I8;
            case 16 -> TypeKind.I16;
            case 32 -> TypeKind.I32;
            case 64 -> TypeKind.I64;
            default -> throw CompileException.unSupported("Integer with bitWidth " + bitWidth);
        };
    }

    public static IntegerType getInteger(int bitWidth) {
        // validate before touching the pool so a bad width never gets cached
        kindOf(bitWidth);
        return pool.computeIfAbsent(bitWidth, IntegerType::new);
    }

    public static IntegerType getI1() { return getInteger(1); }
    public static IntegerType getI32() { return getInteger(32); }
    public static IntegerType getI64() { return getInteger(64); }

    @Override
    public String toLLVM() {
        return "i" + bitWidth;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IntegerType other)) return false;
        return bitWidth == other.bitWidth;
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), bitWidth);
    }
}
