package dev.quorum.dto.request;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Free-form flag map so unknown keys reach validation instead of being dropped by binding.
 */
public class SettingsUpdateRequest {

    private final Map<String, Boolean> flags = new LinkedHashMap<>();

    @JsonAnySetter
    public void put(String key, Boolean value) {
        flags.put(key, value);
    }

    @JsonAnyGetter
    public Map<String, Boolean> flags() {
        return flags;
    }
}
