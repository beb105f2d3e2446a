package com.ciro.ncl.component;

import java.util.HashMap;
import java.util.Map;

public class NFormGroup extends PreviewComponent {

    @Override
    protected String template() {
        return """
            <fieldset class="form-group-set">
              {{#if legend}}<legend>{{legend}}</legend>{{/if}}
              <div class="grid grid-cols-{{columns}}">
                {{slot}}
              </div>
            </fieldset>
            """;
    }

    @Override
    protected Map<String, Object> model(ComponentAttributes attrs, String body) {
        String columns = attrs.getOrDefault("columns", "1").trim();
        if (!columns.matches("\\d{1,2}")) columns = "1";

        Map<String, Object> m = new HashMap<>();
        m.put("legend", attrs.get("legend"));
        m.put("columns", columns);
        return m;
    }
}
