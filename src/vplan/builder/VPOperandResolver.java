package vplan.builder;

import exception.InvariantViolationException;
import ir.value.Value;
import ir.value.instructions.Instruction;
import vplan.VPValue;
import vplan.VPlan;

import java.util.HashMap;
import java.util.Map;

/**
 * Maps IR values to VP values. A value never seen before must be defined
 * outside the loop nest and becomes a live-in of the plan.
 */
public class VPOperandResolver {
    private final VPlan plan;
    private final LoopNestRoles roles;
    private final Map<Value, VPValue> irDef2VPValue;

    public VPOperandResolver(VPlan plan, LoopNestRoles roles) {
        this.plan = plan;
        this.roles = roles;
        this.irDef2VPValue = new HashMap<>();
    }

    public VPValue resolve(Value irValue) {
        VPValue existing = irDef2VPValue.get(irValue);
        if (existing != null) {
            return existing;
        }
        if (!roles.isExternalDef(irValue)) {
            Instruction inst = (Instruction) irValue;
            throw InvariantViolationException.externalDef(
                    "operand " + irValue.getReference() + " is defined inside the loop but was not translated yet",
                    inst.getParent(), inst);
        }
        VPValue liveIn = plan.getOrAddLiveIn(irValue);
        irDef2VPValue.put(irValue, liveIn);
        return liveIn;
    }

    public void registerLiveIn(Instruction inst) {
        irDef2VPValue.put(inst, plan.getOrAddLiveIn(inst));
    }

    public void record(Instruction inst, VPValue value) {
        if (irDef2VPValue.putIfAbsent(inst, value) != null) {
            throw InvariantViolationException.traversalOrder("instruction translated twice", inst.getParent(), inst);
        }
    }

    public boolean isMapped(Value irValue) {
        return irDef2VPValue.containsKey(irValue);
    }

    public VPValue lookup(Value irValue) {
        return irDef2VPValue.get(irValue);
    }
}
