package com.opentext.tasklist.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Singular;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Caller-supplied task fields for create and update.
 * A {@code null} field means "not supplied": it takes the default on create and is left
 * unchanged on update. There is no way to clear an optional field through a patch.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskPatch {
    private String title;
    private Boolean completed;
    private String priority;
    private String category;

    @Singular
    private Map<String, Object> extensions;

    @JsonAnyGetter
    public Map<String, Object> getExtensions() {
        return extensions == null ? Map.of() : extensions;
    }

    @JsonAnySetter
    public void putExtension(String name, Object value) {
        // builder-made maps are unmodifiable
        if (!(extensions instanceof LinkedHashMap)) {
            extensions = extensions == null ? new LinkedHashMap<>() : new LinkedHashMap<>(extensions);
        }
        extensions.put(name, value);
    }
}
