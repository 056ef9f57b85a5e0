package me.bechberger.dyntrace.ir.physical;

public record MapStashAction(String mapName, String keyVariableName, String valueVariableName) {
}
