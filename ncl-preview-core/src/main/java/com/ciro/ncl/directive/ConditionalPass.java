package com.ciro.ncl.directive;

import com.ciro.ncl.CompileContext;
import com.ciro.ncl.Markup;
import com.ciro.ncl.component.ComponentAttributes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * {@code <n:if condition="…">} y {@code {% if … %}…{% else %}…{% endif %}},
 * evaluados con {@link ConditionHeuristic}.
 */
public final class ConditionalPass implements DirectivePass {

    private static final Logger log = LoggerFactory.getLogger(ConditionalPass.class);

    private static final Pattern N_IF_OPEN = Pattern.compile("<n:if\\b(" + Markup.ATTRS + ")>");
    private static final Pattern N_IF_CLOSE = Pattern.compile("</n:if\\s*>");
    private static final Pattern N_ELSE = Pattern.compile("<n:else\\s*/?>(?:\\s*</n:else\\s*>)?");

    private static final Pattern JINJA_IF_OPEN = Pattern.compile("\\{%-?\\s*if\\b([\\s\\S]*?)-?%}");
    private static final Pattern JINJA_IF_CLOSE = Pattern.compile("\\{%-?\\s*endif\\s*-?%}");
    private static final Pattern JINJA_ELSE = Pattern.compile("\\{%-?\\s*else\\s*-?%}");

    @Override
    public String apply(String html, CompileContext ctx) {
        return processJinja(processTags(html));
    }

    private static String processTags(String html) {
        if (!html.contains("<n:if")) return html;
        return BlockScanner.rewrite(html, N_IF_OPEN, N_IF_CLOSE, (open, body) -> {
            ComponentAttributes attrs = ComponentAttributes.parse(open.group(1));
            String condition = attrs.has("condition") ? attrs.get("condition") : attrs.get("cond");
            if (condition == null || condition.isBlank()) {
                log.debug("n:if without condition left as text");
                return null;
            }
            String[] branches = BlockScanner.splitAtTopLevel(body, N_IF_OPEN, N_IF_CLOSE, N_ELSE);
            return choose(condition, branches, ConditionalPass::processTags);
        });
    }

    private static String processJinja(String html) {
        if (!html.contains("{%")) return html;
        return BlockScanner.rewrite(html, JINJA_IF_OPEN, JINJA_IF_CLOSE, (open, body) -> {
            String condition = open.group(1).trim();
            if (condition.isEmpty()) return null;
            String[] branches = BlockScanner.splitAtTopLevel(body,
                    LoopExpander.JINJA_ANY_OPEN, LoopExpander.JINJA_ANY_CLOSE, JINJA_ELSE);
            return choose(condition, branches, ConditionalPass::processJinja);
        });
    }

    private static String choose(String condition, String[] branches, UnaryOperator<String> nested) {
        boolean truthy = ConditionHeuristic.evaluate(condition);
        String chosen = truthy ? branches[0] : branches[1];
        return chosen == null ? "" : nested.apply(chosen);
    }
}
