package ir.value.constants;

import ir.type.IntegerType;

/**
 * Integer literal. Instances are not interned: two literals with the same
 * value are distinct values, which is how the parser produces them.
 */
public class ConstantInt extends Constant {
    private final long value;

    public ConstantInt(IntegerType type, long value) {
        super(type);
        this.value = value;
    }

    public static ConstantInt getBool(boolean value) {
        return new ConstantInt(IntegerType.getI1(), value ? 1 : 0);
    }

    public long getValue() { return value; }

    @Override
    public String getReference() {
        if (getType().isI1()) {
            return value != 0 ? "true" : "false";
        }
        return Long.toString(value);
    }
}
