package com.loopflow.loopflow_engine.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decrypted credential as handed out by the credential lookup.
 * {@code type} names the service ("slack", "discord", "twitter", "openai", ...).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Credential {

    private String type;
    private Map<String, String> data = new LinkedHashMap<>();

    /** First non-blank value among {@code fields}, or null. */
    public String firstField(String... fields) {
        if (data == null) return null;
        for (String field : fields) {
            String value = data.get(field);
            if (value != null && !value.isBlank()) return value;
        }
        return null;
    }

    public boolean isOfType(String expected) {
        return type != null && type.equalsIgnoreCase(expected);
    }
}
