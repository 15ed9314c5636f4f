package vplan;

import ir.value.Opcode;
import ir.value.instructions.Instruction;

import java.util.List;

/**
 * Generic recipe. Keeps the IR opcode of its source instruction, so a
 * multi-way branch is a VPInstruction with {@link Opcode#SWITCH}.
 */
public class VPInstruction extends VPRecipeBase {
    private final Opcode opcode;

    public VPInstruction(Opcode opcode, List<VPValue> operands, Instruction underlying) {
        super(underlying, operands);
        this.opcode = opcode;
    }

    public Opcode getOpcode() {
        return opcode;
    }

    @Override
    public String print() {
        StringBuilder sb = new StringBuilder("EMIT ");
        if (isValueProducing()) {
            sb.append(getReference()).append(" = ");
        }
        String mnemonic = opcode.isCompare() ? "icmp " + opcode.getMnemonic() : opcode.getMnemonic();
        sb.append(mnemonic);
        if (getNumOperands() > 0) {
            sb.append(' ').append(operandsToString());
        }
        return sb.toString();
    }
}
