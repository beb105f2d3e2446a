package com.ciro.ncl.component;

import java.util.HashMap;
import java.util.Map;

public class NTextInput extends PreviewComponent {

    @Override
    protected String template() {
        return """
            <div class="form-field{{#if variantClass}} {{variantClass}}{{/if}}"{{#if dependsOn}} data-depends-on="{{dependsOn}}"{{/if}}>
              {{#if label}}<label for="{{name}}"{{#if error}} class="has-error"{{/if}}>{{label}}{{#if required}} *{{/if}}</label>{{/if}}
              <div class="input-wrap">
                {{#if icon}}<span class="input-icon">{{icon}}</span>{{/if}}
                <input type="{{type}}" id="{{name}}" name="{{name}}"{{#if placeholder}} placeholder="{{placeholder}}"{{/if}}{{#if value}} value="{{value}}"{{/if}}{{#if required}} required{{/if}}{{#if disabled}} disabled{{/if}} class="{{inputClasses}}">
              </div>
              {{#if help}}<p class="form-help">{{help}}</p>{{/if}}
              {{#if error}}<p class="form-error">{{error}}</p>{{/if}}
            </div>
            """;
    }

    @Override
    protected Map<String, Object> model(ComponentAttributes attrs, String body) {
        String name = attrs.getOrDefault("name", "");
        String variant = attrs.getOrDefault("variant", "default");
        String size = normalizeSize(attrs.get("size"));

        String inputClasses = "form-input form-input-" + size;
        if (attrs.has("error")) inputClasses += " has-error";
        if (attrs.has("icon")) inputClasses += " has-icon";

        Map<String, Object> m = new HashMap<>();
        m.put("name", name);
        m.put("type", attrs.getOrDefault("type", "text"));
        m.put("label", attrs.getOrDefault("label", name));
        m.put("placeholder", attrs.get("placeholder"));
        m.put("value", attrs.get("value"));
        m.put("required", attrs.flag("required"));
        m.put("disabled", attrs.flag("disabled"));
        m.put("help", attrs.get("help"));
        m.put("error", attrs.get("error"));
        m.put("icon", attrs.get("icon"));
        m.put("dependsOn", attrs.get("depends_on"));
        m.put("variantClass", "default".equals(variant) ? null : "form-field-" + variant);
        m.put("inputClasses", inputClasses);
        return m;
    }
}
