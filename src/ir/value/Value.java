package ir.value;

import ir.type.Type;
import java.util.ArrayList;
import java.util.LinkedList;
import java.util.Objects;

public abstract class Value {
    private final Type type;
    private String name;

    // who uses me
    private final LinkedList<Use> usesList;

    protected Value(Type type, String name) {
        this.type = Objects.requireNonNull(type, "type");
        this.name = name;
        this.usesList = new LinkedList<>();
    }

    public abstract String toLLVM();

    /* getter setter */
    public String getName() { return this.name; }
    public Type getType() { return this.type; }

    public void setName(String name) { this.name = name; }

    /**
     * How this value is spelled when it appears as an operand:
     * the literal for constants, {@code %name} for everything else.
     */
    public String getReference() {
        return "%" + getName();
    }

    // every user of this value now uses newValue instead
    public void replaceAllUsesWith(Value newValue) {
        if (this == newValue) return;
        for (Use use : new ArrayList<>(usesList)) {
            use.getUser().setOperand(use.getOperandIndex(), newValue);
        }
    }

    void addUse(Use use) {
        Objects.requireNonNull(use, "use");
        this.usesList.add(use);
    }

    void removeUseBy(User user, int index) {
        usesList.removeIf(use -> use.getUser() == user && use.getOperandIndex() == index);
    }

    @Override
    public String toString() {
        return getReference();
    }
}
