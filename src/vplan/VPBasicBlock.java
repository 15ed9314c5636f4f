package vplan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Leaf node holding an ordered list of recipes.
 */
public class VPBasicBlock extends VPBlockBase {
    private final List<VPRecipeBase> recipes;

    VPBasicBlock(String name) {
        super(name);
        this.recipes = new ArrayList<>();
    }

    public List<VPRecipeBase> getRecipes() {
        return Collections.unmodifiableList(recipes);
    }

    public int size() {
        return recipes.size();
    }

    public boolean isEmpty() {
        return recipes.isEmpty();
    }

    public void appendRecipe(VPRecipeBase recipe) {
        if (recipe.getParent() != null) {
            throw new IllegalStateException("recipe already inserted in " + recipe.getParent().getName());
        }
        recipes.add(recipe);
        recipe.setParent(this);
    }

    /** the leading widen-phi recipes */
    public List<VPWidenPhiRecipe> getPhis() {
        List<VPWidenPhiRecipe> phis = new ArrayList<>();
        for (VPRecipeBase recipe : recipes) {
            if (!(recipe instanceof VPWidenPhiRecipe phi)) {
                break;
            }
            phis.add(phi);
        }
        return phis;
    }

    @Override
    public VPBasicBlock getEntryBasicBlock() {
        return this;
    }

    @Override
    public VPBasicBlock getExitingBasicBlock() {
        return this;
    }
}
