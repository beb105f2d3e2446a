package com.ciro.ncl.directive;

import com.ciro.ncl.CompileContext;
import com.ciro.ncl.HtmlEscaper;
import com.ciro.ncl.Markup;
import com.ciro.ncl.component.ComponentAttributes;

import java.util.regex.Pattern;

/**
 * Formularios y asistentes. El envío nunca sale de la vista previa: se
 * notifica a la ventana padre con postMessage.
 */
public final class FormPass implements DirectivePass {

    private static final Pattern FORM_OPEN = Pattern.compile("<n:form\\b(" + Markup.ATTRS + ")>");
    private static final Pattern FORM_CLOSE = Pattern.compile("</n:form\\s*>");
    private static final Pattern STEP_OPEN = Pattern.compile("<n:step\\b(" + Markup.ATTRS + ")>");
    private static final Pattern STEP_CLOSE = Pattern.compile("</n:step\\s*>");
    private static final Pattern FIELD_PAIR = Pattern.compile("<n:field\\b(" + Markup.ATTRS + "?)(?<!/)>([\\s\\S]*?)</n:field\\s*>");
    private static final Pattern FIELD_SELF = Pattern.compile("<n:field\\b(" + Markup.ATTRS + "?)/>");

    @Override
    public String apply(String html, CompileContext ctx) {
        if (!html.contains("<n:")) return html;

        String out = Markup.replace(html, FORM_OPEN, m -> {
            ComponentAttributes attrs = ComponentAttributes.parse(m.group(1));
            String classes = "nucleus-form" + (attrs.has("class") ? " " + attrs.get("class") : "");
            return "<form" + attrs.toAttributeString("class", "onsubmit")
                    + " class=\"" + classes + "\" onsubmit=\"" + onSubmit(attrs.getOrDefault("action", "")) + "\">";
        });
        out = FORM_CLOSE.matcher(out).replaceAll("</form>");

        out = Markup.replace(out, STEP_OPEN, m -> {
            ComponentAttributes attrs = ComponentAttributes.parse(m.group(1));
            String id = attrs.get("id");
            if (id == null) return null;
            String title = attrs.getOrDefault("title", id);
            return "<fieldset class=\"wizard-step\" data-step=\"" + id + "\"><legend>" + title + "</legend>";
        });
        out = STEP_CLOSE.matcher(out).replaceAll("</fieldset>");

        out = Markup.replace(out, FIELD_PAIR, m -> {
            String label = ComponentAttributes.parse(m.group(1)).get("label");
            if (label == null) return null;
            return "<div class=\"form-group\"><label>" + label + "</label>" + m.group(2) + "</div>";
        });
        return Markup.replace(out, FIELD_SELF, m -> {
            ComponentAttributes attrs = ComponentAttributes.parse(m.group(1));
            String label = attrs.get("label");
            if (label == null) return null;
            String name = attrs.getOrDefault("name", "");
            String input = "<input type=\"" + attrs.getOrDefault("type", "text") + "\""
                    + (name.isEmpty() ? "" : " id=\"" + name + "\" name=\"" + name + "\"")
                    + (attrs.flag("required") ? " required" : "")
                    + " class=\"form-input\">";
            String forAttr = name.isEmpty() ? "" : " for=\"" + name + "\"";
            return "<div class=\"form-group\"><label" + forAttr + ">" + label + "</label>" + input + "</div>";
        });
    }

    private static String onSubmit(String action) {
        String safeAction = HtmlEscaper.escape(action.replace("\\", "\\\\").replace("'", "\\'"));
        return "event.preventDefault(); "
                + "const formData = Object.fromEntries(new FormData(event.target)); "
                + "window.parent.postMessage({ type: 'form:submit', action: '" + safeAction + "', formData }, '*');";
    }
}
