package org.caureq.hostwatch.service.alerts;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.caureq.hostwatch.domain.CheckType;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns the JSON parameter columns into typed parameters: check type defaults first, then the
 * host override on top, key by key.
 */
@Component
@RequiredArgsConstructor
public class CheckConfigResolver {
    private static final TypeReference<LinkedHashMap<String, Object>> MAP = new TypeReference<>() {};

    private final CheckRegistry registry;
    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * @throws UnknownCheckKindException if no evaluator handles the check type's key
     * @throws InvalidCheckConfigException if either JSON document or the merged values are invalid
     */
    public ResolvedCheck<?> resolve(CheckType type, String overrideJson) {
        var evaluator = registry.find(type.getCheckKey())
                .orElseThrow(() -> new UnknownCheckKindException(type.getCheckKey()));
        return bind(evaluator, mergedParams(type, overrideJson));
    }

    /** Defaults of the check type with the host override applied, untyped. */
    public Map<String, Object> mergedParams(CheckType type, String overrideJson) {
        return merge(parse(type.getCheckKey(), type.getParams()), parse(type.getCheckKey(), overrideJson));
    }

    static Map<String, Object> merge(Map<String, Object> defaults, Map<String, Object> overrides) {
        var merged = new LinkedHashMap<>(defaults);
        merged.putAll(overrides);
        return merged;
    }

    public Map<String, Object> parse(String checkKey, String json) {
        if (json == null || json.isBlank()) return Map.of();
        try {
            var node = objectMapper.readTree(json);
            if (node == null || node.isNull()) return Map.of();
            if (!node.isObject()) {
                throw new InvalidCheckConfigException(checkKey, "parameters must be a JSON object: " + json);
            }
            return objectMapper.convertValue(node, MAP);
        } catch (JsonProcessingException e) {
            throw new InvalidCheckConfigException(checkKey, "malformed parameters JSON: " + e.getOriginalMessage(), e);
        }
    }

    public String toJson(Map<String, Object> params) {
        if (params == null || params.isEmpty()) return null;
        try {
            return objectMapper.writeValueAsString(params);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("parameters are not serializable: " + e.getOriginalMessage(), e);
        }
    }

    private static <P> ResolvedCheck<P> bind(CheckEvaluator<P> evaluator, Map<String, Object> merged) {
        return new ResolvedCheck<>(evaluator, evaluator.parse(merged));
    }
}
