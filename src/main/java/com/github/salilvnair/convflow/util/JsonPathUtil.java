package com.github.salilvnair.convflow.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.jayway.jsonpath.Configuration;
import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.Option;
import com.jayway.jsonpath.TypeRef;
import com.jayway.jsonpath.spi.json.JacksonJsonNodeJsonProvider;
import com.jayway.jsonpath.spi.mapper.JacksonMappingProvider;
import lombok.experimental.UtilityClass;

import java.util.List;

@UtilityClass
public class JsonPathUtil {

    private static final Configuration SEARCH_CONFIG =
            Configuration.builder()
                    .jsonProvider(new JacksonJsonNodeJsonProvider())
                    .mappingProvider(new JacksonMappingProvider())
                    .options(Option.ALWAYS_RETURN_LIST, Option.SUPPRESS_EXCEPTIONS)
                    .build();

    public static List<Object> search(Object jsonObject, String path) {
        if (jsonObject == null || path == null || path.isBlank()) {
            return List.of();
        }
        List<Object> result = JsonPath.using(SEARCH_CONFIG).parse(jsonObject).read(path, new TypeRef<List<Object>>() {});
        return result == null ? List.of() : result;
    }

    /**
     * Resolves a dotted variable name such as {@code lead.stage} against a map or
     * bean. Returns {@code null} when any segment is missing.
     */
    public static Object readDotted(Object source, String dottedName) {
        if (source == null || dottedName == null || dottedName.isBlank()) {
            return null;
        }
        JsonNode tree = JsonUtil.toTree(source);
        List<Object> matches = search(tree, "$." + dottedName.trim());
        if (matches.isEmpty()) {
            return null;
        }
        return unwrap(matches.get(0));
    }

    private static Object unwrap(Object value) {
        if (!(value instanceof JsonNode node)) {
            return value;
        }
        if (node.isNull() || node.isMissingNode()) return null;
        if (node.isTextual()) return node.asText();
        if (node.isBoolean()) return node.asBoolean();
        if (node.isIntegralNumber()) return node.asLong();
        if (node.isNumber()) return node.asDouble();
        return JsonUtil.mapper().convertValue(node, Object.class);
    }
}
