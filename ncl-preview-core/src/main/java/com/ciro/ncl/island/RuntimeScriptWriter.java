package com.ciro.ncl.island;

import java.util.List;

/**
 * Genera el fragmento JS de una isla. Cada isla declara su propio
 * {@code state}; nada se comparte entre islas.
 */
final class RuntimeScriptWriter {

    private RuntimeScriptWriter() {}

    static String write(List<SignalBinding> signals,
                        List<ComputedBinding> computeds,
                        HydrationMode mode) {
        if (signals.isEmpty()) return "";

        String primary = signals.get(0).name();
        StringBuilder js = new StringBuilder(1024);

        js.append("(function () {\n");
        js.append("  var root = document.currentScript ? document.currentScript.parentElement : null;\n");
        js.append("  if (!root) return;\n");
        js.append("  function boot() {\n");
        js.append("    const state = {};\n");
        for (SignalBinding s : signals) {
            js.append("    state.").append(s.name()).append(" = ").append(s.literal()).append(";\n");
        }
        js.append("    function update() {\n");
        for (ComputedBinding c : computeds) {
            if (c.isDerivable()) {
                js.append("      state.").append(c.name()).append(" = ").append(c.derivation()).append(";\n");
            }
        }
        js.append("      root.querySelectorAll('[data-n-bind]').forEach(function (el) {\n");
        js.append("        var key = el.getAttribute('data-n-bind');\n");
        js.append("        if (key in state) el.textContent = state[key];\n");
        js.append("      });\n");
        js.append("      var primary = root.querySelector('[data-n-bind=\"").append(primary).append("\"]');\n");
        js.append("      if (primary && primary.parentElement && typeof state.").append(primary).append(" === 'number') {\n");
        js.append("        var even = state.").append(primary).append(" % 2 === 0;\n");
        js.append("        primary.parentElement.classList.toggle('n-even', even);\n");
        js.append("        primary.parentElement.classList.toggle('n-odd', !even);\n");
        js.append("      }\n");
        js.append("    }\n");
        js.append("    root.querySelectorAll('[data-n-action]').forEach(function (el) {\n");
        js.append("      el.addEventListener('click', function (ev) {\n");
        js.append("        ev.preventDefault();\n");
        js.append("        var parts = el.getAttribute('data-n-action').split(':');\n");
        js.append("        var key = parts[0], op = parts[1], val = parseFloat(parts[2]);\n");
        js.append("        if (!(key in state)) return;\n");
        js.append("        if (op === '+=') state[key] += val;\n");
        js.append("        else if (op === '-=') state[key] -= val;\n");
        js.append("        else if (op === '=') state[key] = val;\n");
        js.append("        update();\n");
        js.append("      });\n");
        js.append("    });\n");
        js.append("    update();\n");
        js.append("  }\n");
        appendHydration(js, mode);
        js.append("})();\n");
        return js.toString();
    }

    private static void appendHydration(StringBuilder js, HydrationMode mode) {
        switch (mode) {
            case VISIBLE -> {
                js.append("  if ('IntersectionObserver' in window) {\n");
                js.append("    var io = new IntersectionObserver(function (entries) {\n");
                js.append("      if (entries.some(function (e) { return e.isIntersecting; })) { io.disconnect(); boot(); }\n");
                js.append("    });\n");
                js.append("    io.observe(root);\n");
                js.append("  } else {\n");
                js.append("    boot();\n");
                js.append("  }\n");
            }
            case IDLE -> {
                js.append("  if ('requestIdleCallback' in window) {\n");
                js.append("    requestIdleCallback(boot);\n");
                js.append("  } else {\n");
                js.append("    setTimeout(boot, 1);\n");
                js.append("  }\n");
            }
            default -> js.append("  boot();\n");
        }
    }
}
