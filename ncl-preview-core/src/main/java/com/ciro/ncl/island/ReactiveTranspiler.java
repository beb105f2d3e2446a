package com.ciro.ncl.island;

import com.ciro.ncl.Markup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Convierte el contenido de una isla (declaraciones de señales + markup) en
 * markup con marcadores {@code data-n-bind}/{@code data-n-action} y un runtime JS mínimo.
 */
public final class ReactiveTranspiler {

    private static final Logger log = LoggerFactory.getLogger(ReactiveTranspiler.class);

    private static final String LITERAL = "-?\\d+(?:\\.\\d+)?|\"[^\"]*\"|'[^']*'|true|false";

    private static final Pattern SCRIPT_BLOCK = Pattern.compile("<n:script\\b" + Markup.ATTRS + ">([\\s\\S]*?)</n:script\\s*>");

    private static final Pattern SIGNAL_DECL = Pattern.compile(
        "(?:\\blet\\s+(?:mut\\s+)?)?\\b([A-Za-z_]\\w*)\\s*=\\s*(?:Signal::new|Signal\\.of|createSignal|signal)\\s*\\(\\s*("
        + LITERAL + ")\\s*\\)\\s*;?");

    private static final Pattern COMPUTED_DECL = Pattern.compile(
        "(?:\\blet\\s+(?:mut\\s+)?)?\\b([A-Za-z_]\\w*)\\s*=\\s*(?:computed|derive|memo)\\s*\\(\\s*([A-Za-z_]\\w*)(?:\\.clone\\(\\))?"
        + "\\s*,\\s*(?:move\\s+)?\\|\\s*([A-Za-z_]\\w*)\\s*\\|\\s*([^;\\n]*?)\\s*\\)\\s*(?:;|$)",
        Pattern.MULTILINE);

    private static final Pattern USE_LINE = Pattern.compile("(?m)^\\s*(?:use|import)\\s+[^;\\n]*;?\\s*$");
    // un tag al inicio de línea; así Signal<i32> no corta el preámbulo
    private static final Pattern FIRST_LINE_TAG = Pattern.compile("(?m)^[ \\t]*<[A-Za-z]");
    private static final Pattern FIRST_TAG = Pattern.compile("<[A-Za-z]");

    // {count} fuera de atributos; {{…}} no se toca
    private static final Pattern BINDING = Pattern.compile("(?<!\\{)(?<!=\\s{0,8})\\{\\s*([A-Za-z_]\\w*)\\s*}(?!})");

    private static final String NUM = "-?\\d+(?:\\.\\d+)?";
    private static final String OP = "[+\\-*/%]";

    private ReactiveTranspiler() {}

    public static TranspiledIsland transpile(String body, HydrationMode mode) {
        String source = body == null ? "" : body;
        HydrationMode hydration = mode == null ? HydrationMode.LOAD : mode;

        Map<String, SignalBinding> signals = new LinkedHashMap<>();
        Map<String, ComputedBinding> computeds = new LinkedHashMap<>();

        // 1. Bloques de servidor: se leen y se quitan
        StringBuilder declarations = new StringBuilder();
        Matcher script = SCRIPT_BLOCK.matcher(source);
        while (script.find()) declarations.append(script.group(1)).append('\n');
        String markup = SCRIPT_BLOCK.matcher(source).replaceAll("");

        // 2. Preámbulo antes del primer tag (use, let, comentarios)
        int tagAt = firstTag(markup);
        if (tagAt >= 0) {
            declarations.append(markup, 0, tagAt).append('\n');
            markup = markup.substring(tagAt);
        } else {
            declarations.append(markup).append('\n');
            markup = "";
        }

        collectSignals(declarations, signals);
        collectComputeds(declarations, computeds);

        // declaraciones sueltas entre tags
        collectSignals(markup, signals);
        collectComputeds(markup, computeds);
        markup = stripStatements(markup);

        // 3. Acciones antes que bindings: los handlers también usan llaves
        List<EventAction> actions = new ArrayList<>();
        markup = ClickHandlerScanner.rewrite(markup, actions);

        // 4. Bindings
        markup = Markup.outsideCode(markup, text -> Markup.replace(text, BINDING,
                m -> "<span data-n-bind=\"" + m.group(1) + "\"></span>"));

        List<SignalBinding> signalList = new ArrayList<>(signals.values());
        List<ComputedBinding> computedList = new ArrayList<>(computeds.values());
        String runtime = RuntimeScriptWriter.write(signalList, computedList, hydration);

        log.debug("Island transpiled: {} signal(s), {} computed, {} action(s)",
                signalList.size(), computedList.size(), actions.size());

        return new TranspiledIsland(markup.strip(), runtime, signalList, computedList, actions);
    }

    /**
     * Isla sin señales: contador por defecto {@code count = 0} con su marcador.
     */
    public static TranspiledIsland withDefaultCounter(TranspiledIsland island, HydrationMode mode) {
        List<SignalBinding> signals = List.of(new SignalBinding("count", "0"));
        String markup = island.markup() + "<div data-n-bind=\"count\">0</div>";
        String runtime = RuntimeScriptWriter.write(signals, island.computeds(), mode == null ? HydrationMode.LOAD : mode);
        return new TranspiledIsland(markup, runtime, signals, island.computeds(), island.actions());
    }

    private static int firstTag(String markup) {
        Matcher line = FIRST_LINE_TAG.matcher(markup);
        if (line.find()) return markup.indexOf('<', line.start());
        Matcher any = FIRST_TAG.matcher(markup);
        return any.find() ? any.start() : -1;
    }

    private static void collectSignals(CharSequence text, Map<String, SignalBinding> out) {
        Matcher m = SIGNAL_DECL.matcher(text);
        while (m.find()) {
            // redeclarar conserva el último valor y la posición original
            out.put(m.group(1), new SignalBinding(m.group(1), m.group(2)));
        }
    }

    private static void collectComputeds(CharSequence text, Map<String, ComputedBinding> out) {
        Matcher m = COMPUTED_DECL.matcher(text);
        while (m.find()) {
            String name = m.group(1);
            String dep = m.group(2);
            String param = m.group(3);
            String expr = m.group(4).trim();
            out.put(name, new ComputedBinding(name, dep, param, expr, retarget(expr, param, dep)));
        }
    }

    /**
     * Solo {@code p op n} y {@code n op p} (con {@code *p} permitido). Lo demás devuelve null.
     */
    static String retarget(String expr, String param, String dep) {
        String p = "\\*?\\s*" + Pattern.quote(param);
        Matcher left = Pattern.compile("^" + p + "\\s*(" + OP + ")\\s*(" + NUM + ")$").matcher(expr);
        if (left.matches()) {
            return "state." + dep + " " + left.group(1) + " " + left.group(2);
        }
        Matcher right = Pattern.compile("^(" + NUM + ")\\s*(" + OP + ")\\s*" + p + "$").matcher(expr);
        if (right.matches()) {
            return right.group(1) + " " + right.group(2) + " state." + dep;
        }
        return null;
    }

    private static String stripStatements(String markup) {
        if (markup.isEmpty()) return markup;
        String out = Markup.outsideCode(markup, text -> {
            String t = SIGNAL_DECL.matcher(text).replaceAll("");
            t = COMPUTED_DECL.matcher(t).replaceAll("");
            return USE_LINE.matcher(t).replaceAll("");
        });
        return out;
    }
}
