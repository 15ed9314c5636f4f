package ir.value;

import ir.type.Type;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class UndefValue extends Value {
    private static final Map<Type, UndefValue> undefs = new ConcurrentHashMap<>();

    private UndefValue(Type type, String name) {
        super(type, name);
    }

    /**
     * Shared undef per type. Do NOT use it where a unique identity is needed.
     */
    public static UndefValue get(Type type) {
        return undefs.computeIfAbsent(type, t -> new UndefValue(t, "undef"));
    }

    /**
     * Fresh instance, used by the parser as a placeholder for forward references.
     */
    public static UndefValue createPlaceholder(Type type, String name) {
        return new UndefValue(type, name);
    }

    @Override
    public String getReference() {
        return "undef";
    }

    @Override
    public String toLLVM() {
        return getType().toLLVM() + " undef";
    }
}
