package com.ciro.ncl.component;

import java.util.HashMap;
import java.util.Map;

public class NNavItem extends PreviewComponent {

    @Override
    protected String template() {
        return """
            <a href="{{href}}" class="nav-item{{#if active}} active{{/if}}">{{#if icon}}<span class="nav-icon">{{icon}}</span> {{/if}}{{slot}}</a>
            """;
    }

    @Override
    protected Map<String, Object> model(ComponentAttributes attrs, String body) {
        Map<String, Object> m = new HashMap<>();
        m.put("href", attrs.getOrDefault("href", "#"));
        m.put("icon", attrs.get("icon"));
        m.put("active", attrs.flag("active"));
        return m;
    }
}
