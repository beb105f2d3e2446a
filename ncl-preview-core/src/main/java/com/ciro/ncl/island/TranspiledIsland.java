package com.ciro.ncl.island;

import java.util.List;

/**
 * Resultado de transpilar el contenido de una isla.
 *
 * @param runtime fragmento JS, vacío cuando no se declaró ninguna señal
 */
public record TranspiledIsland(String markup,
                               String runtime,
                               List<SignalBinding> signals,
                               List<ComputedBinding> computeds,
                               List<EventAction> actions) {

    public TranspiledIsland {
        signals = List.copyOf(signals);
        computeds = List.copyOf(computeds);
        actions = List.copyOf(actions);
    }

    public boolean hasSignals() {
        return !signals.isEmpty();
    }

    /** Markup seguido del {@code <script>} del runtime, si lo hay. */
    public String toHtml() {
        if (runtime == null || runtime.isEmpty()) return markup;
        return markup + "<script>" + runtime + "</script>";
    }
}
