package vplan;

import ir.value.Value;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Root of a hierarchical CFG. Owns every block created through it and the
 * live-in values, which are unique per IR value.
 */
public class VPlan {
    private final String name;
    private final List<VPBlockBase> blocks;
    private final Map<Value, VPValue> liveIns;
    private final VPBasicBlock entry;

    public VPlan(String name) {
        this.name = name;
        this.blocks = new ArrayList<>();
        this.liveIns = new LinkedHashMap<>();
        this.entry = createVPBasicBlock("ph");
    }

    public String getName() {
        return name;
    }

    /** the plan-level entry, standing for the loop preheader */
    public VPBasicBlock getEntry() {
        return entry;
    }

    /** every block in creation order */
    public List<VPBlockBase> getBlocks() {
        return Collections.unmodifiableList(blocks);
    }

    public List<VPBasicBlock> getBasicBlocks() {
        return blocks.stream()
                .filter(VPBasicBlock.class::isInstance)
                .map(VPBasicBlock.class::cast)
                .collect(Collectors.toList());
    }

    public List<VPRegionBlock> getRegions() {
        return blocks.stream()
                .filter(VPRegionBlock.class::isInstance)
                .map(VPRegionBlock.class::cast)
                .collect(Collectors.toList());
    }

    public VPBasicBlock createVPBasicBlock(String name) {
        VPBasicBlock block = new VPBasicBlock(name);
        blocks.add(block);
        return block;
    }

    public VPRegionBlock createVPRegionBlock(String name) {
        VPRegionBlock region = new VPRegionBlock(name);
        blocks.add(region);
        return region;
    }

    public VPValue getOrAddLiveIn(Value value) {
        return liveIns.computeIfAbsent(value, VPValue::new);
    }

    public VPValue getLiveIn(Value value) {
        return liveIns.get(value);
    }

    public Collection<VPValue> getLiveIns() {
        return Collections.unmodifiableCollection(liveIns.values());
    }

    /* ---------- dump ---------- */

    public String print() {
        StringBuilder sb = new StringBuilder();
        sb.append("VPlan '").append(name).append("' {\n");
        for (VPValue liveIn : liveIns.values()) {
            sb.append("Live-in ").append(liveIn.getReference()).append("\n");
        }
        for (VPBlockBase block : blocks) {
            if (block.getParent() == null) {
                sb.append("\n");
                printBlock(block, sb, "");
            }
        }
        sb.append("}\n");
        return sb.toString();
    }

    private void printBlock(VPBlockBase block, StringBuilder sb, String indent) {
        if (block instanceof VPBasicBlock vpbb) {
            sb.append(indent).append(vpbb.getName()).append(":\n");
            for (VPRecipeBase recipe : vpbb.getRecipes()) {
                sb.append(indent).append("  ").append(recipe.print()).append("\n");
            }
        } else if (block instanceof VPRegionBlock region) {
            sb.append(indent).append("<loop> ").append(region.getName()).append(": {\n");
            boolean first = true;
            for (VPBlockBase member : blocks) {
                if (member.getParent() == region) {
                    if (!first) {
                        sb.append("\n");
                    }
                    printBlock(member, sb, indent + "  ");
                    first = false;
                }
            }
            sb.append(indent).append("}\n");
        }
        printSuccessors(block, sb, indent);
    }

    private static void printSuccessors(VPBlockBase block, StringBuilder sb, String indent) {
        if (block.getNumSuccessors() == 0) {
            sb.append(indent).append("No successors\n");
            return;
        }
        sb.append(indent).append("Successor(s): ")
                .append(block.getSuccessors().stream().map(VPBlockBase::getName).collect(Collectors.joining(", ")))
                .append("\n");
    }

    @Override
    public String toString() {
        return print();
    }
}
