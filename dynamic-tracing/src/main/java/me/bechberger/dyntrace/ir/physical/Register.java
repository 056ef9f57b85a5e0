package me.bechberger.dyntrace.ir.physical;

/**
 * CPU registers accessible via the {@code PT_REGS_*} accessors of the probe context
 */
public enum Register {
    SP, IP, FP, RC, PARM1, PARM2, PARM3, PARM4, PARM5, PARM6;

    /**
     * Accessor macro, e.g. {@code PT_REGS_SP}
     */
    public String accessor() {
        return "PT_REGS_" + name();
    }
}
