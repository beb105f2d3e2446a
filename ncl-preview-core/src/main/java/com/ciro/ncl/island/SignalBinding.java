package com.ciro.ncl.island;

/**
 * Celda reactiva: nombre + literal inicial tal como lo escribió el autor.
 */
public record SignalBinding(String name, String literal) {}
