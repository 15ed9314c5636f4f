package vplan;

import ir.value.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An operand in a {@link VPlan}. Either a live-in, which wraps a value
 * defined outside the plan, or a {@link VPRecipeBase}.
 */
public class VPValue {
    private final Value underlying;

    // recipes using this value, one entry per operand slot
    private final List<VPRecipeBase> users;

    public VPValue(Value underlying) {
        this.underlying = underlying;
        this.users = new ArrayList<>();
    }

    public Value getUnderlyingValue() {
        return underlying;
    }

    /** the recipe defining this value, null for a live-in */
    public VPRecipeBase getDefiningRecipe() {
        return null;
    }

    public boolean isLiveIn() {
        return getDefiningRecipe() == null;
    }

    public List<VPRecipeBase> getUsers() {
        return Collections.unmodifiableList(users);
    }

    public int getNumUsers() {
        return users.size();
    }

    void addUser(VPRecipeBase user) {
        users.add(user);
    }

    /** How the value is spelled as an operand in a plan dump. */
    public String getReference() {
        return "ir<" + underlying.getReference() + ">";
    }

    @Override
    public String toString() {
        return getReference();
    }
}
