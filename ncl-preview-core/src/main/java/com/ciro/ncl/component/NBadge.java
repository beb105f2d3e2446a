package com.ciro.ncl.component;

import java.util.HashMap;
import java.util.Map;

public class NBadge extends PreviewComponent {

    @Override
    protected String template() {
        return """
            <span class="badge badge-{{variant}}">{{#if icon}}{{icon}} {{/if}}{{slot}}</span>
            """;
    }

    @Override
    protected Map<String, Object> model(ComponentAttributes attrs, String body) {
        Map<String, Object> m = new HashMap<>();
        m.put("variant", attrs.getOrDefault("variant", "default"));
        m.put("icon", attrs.get("icon"));
        return m;
    }
}
