package me.bechberger.dyntrace.ir.physical;

/**
 * Submit the bytes of the variable to the perf buffer
 */
public record OutputAction(String perfBufferName, String variableName) {
}
