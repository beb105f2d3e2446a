package com.ciro.ncl.component;

import java.util.HashMap;
import java.util.Map;

public class NCheckbox extends PreviewComponent {

    @Override
    protected String template() {
        return """
            {{#if toggle}}
            <label class="toggle">
              <input type="checkbox" name="{{name}}"{{#if required}} required{{/if}}{{#if checked}} checked{{/if}} class="toggle-input">
              <span class="toggle-track"></span>
              <span class="toggle-label">{{label}}</span>
            </label>
            {{else}}
            <div class="form-field checkbox-field">
              <label><input type="checkbox" name="{{name}}"{{#if required}} required{{/if}}{{#if checked}} checked{{/if}}> {{label}}</label>
            </div>
            {{/if}}
            """;
    }

    @Override
    protected Map<String, Object> model(ComponentAttributes attrs, String body) {
        String label = attrs.getOrDefault("label", body);
        Map<String, Object> m = new HashMap<>();
        m.put("name", attrs.getOrDefault("name", ""));
        m.put("label", label);
        m.put("required", attrs.flag("required"));
        m.put("checked", attrs.flag("checked"));
        m.put("toggle", "toggle".equals(attrs.get("variant")));
        return m;
    }
}
