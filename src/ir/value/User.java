package ir.value;

import ir.type.Type;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public abstract class User extends Value {

    private final ArrayList<Value> operands;

    protected User(Type type, String name) {
        super(type, name);
        this.operands = new ArrayList<>();
    }

    /* getter */
    public int getNumOperands() { return operands.size(); }
    public Value getOperand(int index) { return operands.get(index); }

    // read only, go through the updaters to keep use-lists consistent
    public List<Value> getOperands() {
        return Collections.unmodifiableList(operands);
    }

    /* updater */
    public void setOperand(int index, Value value) {
        Objects.requireNonNull(value, "Operand value cannot be null");
        operands.get(index).removeUseBy(this, index);
        operands.set(index, value);
        value.addUse(new Use(this, value, index));
    }

    public void addOperand(Value value) {
        Objects.requireNonNull(value, "Operand value cannot be null");
        this.operands.add(value);
        value.addUse(new Use(this, value, operands.size() - 1));
    }
}
