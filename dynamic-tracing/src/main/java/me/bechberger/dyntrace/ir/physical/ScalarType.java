package me.bechberger.dyntrace.ir.physical;

/**
 * Scalar value types with their C spelling
 */
public enum ScalarType implements VariableType {
    INT32("int32_t"),
    INT64("int64_t"),
    UINT32("uint32_t"),
    UINT64("uint64_t"),
    DOUBLE("double"),
    VOID_POINTER("void*"),
    /** a C string, passed around as a character pointer */
    STRING("char*");

    private final String cName;

    ScalarType(String cName) {
        this.cName = cName;
    }

    public String cName() {
        return cName;
    }
}
