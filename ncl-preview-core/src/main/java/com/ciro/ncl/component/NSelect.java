package com.ciro.ncl.component;

import java.util.HashMap;
import java.util.Map;

public class NSelect extends PreviewComponent {

    @Override
    protected String template() {
        return """
            <div class="form-field">
              {{#if label}}<label for="{{name}}">{{label}}{{#if required}} *{{/if}}</label>{{/if}}
              <select id="{{name}}" name="{{name}}"{{#if required}} required{{/if}} class="form-select{{#if error}} has-error{{/if}}">
                {{slot}}
              </select>
              {{#if error}}<p class="form-error">{{error}}</p>{{/if}}
            </div>
            """;
    }

    @Override
    protected Map<String, Object> model(ComponentAttributes attrs, String body) {
        String name = attrs.getOrDefault("name", "");
        Map<String, Object> m = new HashMap<>();
        m.put("name", name);
        m.put("label", attrs.getOrDefault("label", name));
        m.put("required", attrs.flag("required"));
        m.put("error", attrs.get("error"));
        return m;
    }
}
