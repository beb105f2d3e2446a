package com.ciro.ncl.island;

/**
 * Acción de click declarativa, serializada como {@code signal:op:operando}.
 */
public record EventAction(String signal, String operator, String operand) {

    public String encode() {
        return signal + ":" + operator + ":" + operand;
    }

    public static EventAction decode(String encoded) {
        if (encoded == null) throw new IllegalArgumentException("Action is null");
        // el operador puede ser '=' y no contiene ':'
        String[] parts = encoded.split(":", 3);
        if (parts.length != 3) throw new IllegalArgumentException("Malformed action: " + encoded);
        return new EventAction(parts[0], parts[1], parts[2]);
    }
}
