package com.ciro.ncl.component;

import java.util.HashMap;
import java.util.Map;

public class NStatCard extends PreviewComponent {

    @Override
    protected String template() {
        return """
            <div class="stat-card{{#if highlight}} highlight{{/if}}">
              <div class="stat-value">{{value}}</div>
              <div class="stat-label">{{label}}</div>
              {{#if trend}}<div class="stat-trend {{trendClass}}">{{trend}}</div>{{/if}}
            </div>
            """;
    }

    @Override
    protected Map<String, Object> model(ComponentAttributes attrs, String body) {
        String trend = attrs.get("trend");
        Map<String, Object> m = new HashMap<>();
        m.put("value", attrs.getOrDefault("value", ""));
        m.put("label", attrs.getOrDefault("label", ""));
        m.put("trend", trend);
        m.put("trendClass", trend != null && trend.trim().startsWith("-") ? "trend-down" : "trend-up");
        m.put("highlight", attrs.flag("highlight"));
        return m;
    }
}
