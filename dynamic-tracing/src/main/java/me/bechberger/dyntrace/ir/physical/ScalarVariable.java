package me.bechberger.dyntrace.ir.physical;

import org.jetbrains.annotations.Nullable;

/**
 * @param source {@code null} if unset, which code generation rejects
 */
public record ScalarVariable(String name, VariableType valType, @Nullable ValueSource source) {
}
