package com.opentext.tasklist.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One persisted task record.
 * <p>
 * - {@code id} is assigned by the repository and never changes afterwards.
 * - {@code priority} and {@code category} are optional and omitted from the file when unset.
 * - Any other member found in the file is kept in {@link #getExtensions()} and written back as-is.
 * </p>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id", "title", "completed", "priority", "category"})
public class Task {

    /** Member names with a dedicated field; extensions may not reuse them. */
    public static final Set<String> RESERVED_FIELDS = Set.of("id", "title", "completed", "priority", "category");

    private long id;
    private String title;
    private boolean completed;
    private String priority;
    private String category;

    @Setter(AccessLevel.NONE)
    private Map<String, Object> extensions = new LinkedHashMap<>();

    public Task(long id, String title, boolean completed) {
        this.id = id;
        this.title = title;
        this.completed = completed;
    }

    @JsonAnyGetter
    public Map<String, Object> getExtensions() {
        return extensions;
    }

    @JsonAnySetter
    public void putExtension(String name, Object value) {
        extensions.put(name, value);
    }
}
