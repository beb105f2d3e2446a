package com.ciro.ncl.component;

import java.util.HashMap;
import java.util.Map;

public class NButton extends PreviewComponent {

    @Override
    protected String template() {
        return """
            {{#if href}}
            <a href="{{href}}"{{#if id}} id="{{id}}"{{/if}} class="{{classes}}"{{#if onclick}} onclick="{{onclick}}"{{/if}}{{extra}}>{{slot}}</a>
            {{else}}
            <button type="{{type}}"{{#if id}} id="{{id}}"{{/if}} class="{{classes}}"{{#if onclick}} onclick="{{onclick}}"{{/if}}{{#if disabled}} disabled{{/if}}{{extra}}>{{slot}}</button>
            {{/if}}
            """;
    }

    @Override
    protected Map<String, Object> model(ComponentAttributes attrs, String body) {
        String classes = "btn btn-" + attrs.getOrDefault("variant", "primary")
                + " btn-" + normalizeSize(attrs.get("size"));
        if (attrs.has("class")) classes += " " + attrs.get("class");

        Map<String, Object> m = new HashMap<>();
        m.put("href", attrs.get("href"));
        m.put("id", attrs.get("id"));
        m.put("type", attrs.getOrDefault("type", "button"));
        m.put("onclick", attrs.get("onclick"));
        m.put("disabled", attrs.flag("disabled"));
        m.put("classes", classes);
        // data-n-action y compañía deben llegar al DOM
        m.put("extra", attrs.passThrough("data-") + attrs.passThrough("aria-"));
        return m;
    }
}
