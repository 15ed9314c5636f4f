package ir.value;

/*
 * one row of the user--usee--index table
 *   op(a, b, c): user:op, usee:b, index: 1
 */
public class Use {
    private final User user;
    private final Value usee;
    private final int operandIndex;

    public Use(User user, Value usee, int index) {
        this.user = user;
        this.usee = usee;
        this.operandIndex = index;
    }

    public User getUser() { return user; }
    public Value getUsee() { return usee; }
    public int getOperandIndex() { return operandIndex; }

    @Override
    public String toString() {
        return "Use(" + user.getName() + " -> " + usee.getReference() + ", index=" + operandIndex + ")";
    }
}
