package pass;

import ir.IRModule;

public interface Pass {
    // just a mark class

    public interface IRPass extends Pass {
        IRPassType getType();

        void run(IRModule module);
    }
}
