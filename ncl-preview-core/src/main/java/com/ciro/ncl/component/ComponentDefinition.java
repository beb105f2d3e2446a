package com.ciro.ncl.component;

/**
 * Componente declarado por el autor con {@code <n:component name="X">}.
 * Vive solo durante una compilación.
 */
public record ComponentDefinition(String name, String body) {}
