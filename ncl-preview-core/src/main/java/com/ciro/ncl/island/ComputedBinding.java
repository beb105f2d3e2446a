package com.ciro.ncl.island;

/**
 * Valor derivado de una sola dependencia.
 *
 * @param derivation expresión JS sobre {@code state} o null cuando la forma no es soportada
 */
public record ComputedBinding(String name, String dependency, String parameter, String expression, String derivation) {

    public boolean isDerivable() {
        return derivation != null;
    }
}
