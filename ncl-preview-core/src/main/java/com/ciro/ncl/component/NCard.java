package com.ciro.ncl.component;

import java.util.HashMap;
import java.util.Map;

public class NCard extends PreviewComponent {

    @Override
    protected String template() {
        return """
            <div class="card card-{{variant}}{{#if glass}} glass{{/if}}{{#if extraClass}} {{extraClass}}{{/if}}">{{slot}}</div>
            """;
    }

    @Override
    protected Map<String, Object> model(ComponentAttributes attrs, String body) {
        Map<String, Object> m = new HashMap<>();
        m.put("variant", attrs.getOrDefault("variant", "default"));
        m.put("glass", attrs.flag("glass"));
        m.put("extraClass", attrs.get("class"));
        return m;
    }
}
