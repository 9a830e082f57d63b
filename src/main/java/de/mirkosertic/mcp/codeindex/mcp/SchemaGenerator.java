package de.mirkosertic.mcp.codeindex.mcp;

import io.modelcontextprotocol.spec.McpSchema;
import org.jspecify.annotations.Nullable;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derives the JSON input schema of a tool from its request record.
 * <p>
 * Every component becomes a property; components without {@link Nullable} are required.
 * {@link Description} annotations become property descriptions.
 */
public final class SchemaGenerator {

    private SchemaGenerator() {
    }

    public static McpSchema.JsonSchema generateSchema(final Class<? extends Record> recordClass) {
        final Map<String, Object> properties = new LinkedHashMap<>();
        final List<String> required = new ArrayList<>();

        for (final RecordComponent component : recordClass.getRecordComponents()) {
            properties.put(component.getName(), propertySchema(component));
            if (!isNullable(component)) {
                required.add(component.getName());
            }
        }

        return new McpSchema.JsonSchema("object", properties, required, null, null, null);
    }

    // @Nullable is a type-use annotation and sits on the component's type, not the component
    static boolean isNullable(final RecordComponent component) {
        return component.getAnnotatedType().isAnnotationPresent(Nullable.class);
    }

    private static Map<String, Object> propertySchema(final RecordComponent component) {
        final Map<String, Object> schema = new LinkedHashMap<>();
        final Description description = component.getAnnotation(Description.class);
        if (description != null) {
            schema.put("description", description.value());
        }

        final Type type = component.getGenericType();
        if (type instanceof Class<?> clazz) {
            schema.put("type", jsonType(clazz));
        } else if (type instanceof ParameterizedType paramType
                && paramType.getRawType() instanceof Class<?> rawClass
                && (List.class.isAssignableFrom(rawClass) || Set.class.isAssignableFrom(rawClass))) {
            schema.put("type", "array");
            final Type itemType = paramType.getActualTypeArguments()[0];
            schema.put("items", Map.of("type", itemType instanceof Class<?> itemClass ? jsonType(itemClass) : "object"));
        } else {
            schema.put("type", "object");
        }
        return schema;
    }

    static String jsonType(final Class<?> clazz) {
        if (clazz == String.class) {
            return "string";
        }
        if (clazz == Integer.class || clazz == int.class || clazz == Long.class || clazz == long.class) {
            return "integer";
        }
        if (clazz == Double.class || clazz == double.class || clazz == Float.class || clazz == float.class) {
            return "number";
        }
        if (clazz == Boolean.class || clazz == boolean.class) {
            return "boolean";
        }
        return "object";
    }
}
