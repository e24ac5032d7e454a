package org.pragmatica.plc.project;

public record StLine(int number, String text) {}
