package com.ciro.ncl.component;

import java.util.HashMap;
import java.util.Map;

public class NFeatureCard extends PreviewComponent {

    @Override
    protected String template() {
        return """
            <div class="feature-card">
              <div class="feature-icon">{{icon}}</div>
              <h3 class="feature-title">{{title}}</h3>
              {{#if description}}<p class="feature-description">{{description}}</p>{{/if}}
              {{slot}}
            </div>
            """;
    }

    @Override
    protected Map<String, Object> model(ComponentAttributes attrs, String body) {
        Map<String, Object> m = new HashMap<>();
        m.put("icon", attrs.getOrDefault("icon", "🚀"));
        m.put("title", attrs.getOrDefault("title", ""));
        m.put("description", attrs.get("description"));
        return m;
    }
}
