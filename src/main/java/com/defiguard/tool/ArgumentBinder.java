package com.defiguard.tool;

import com.defiguard.exception.SchemaViolationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Binds a script's raw JSON arguments to a tool's argument DTO and validates it.
 *
 * <p>Uses a strict copy of the application mapper: unknown properties and nulls for
 * primitives are rejected. Error messages name the offending field but never echo
 * the submitted value, since arguments may hold sensitive payloads.
 */
@Component
public class ArgumentBinder {

    private static final PropertyNamingStrategies.NamingBase SNAKE_CASE =
            (PropertyNamingStrategies.NamingBase) PropertyNamingStrategies.SNAKE_CASE;

    /** {@code @AssertTrue} getters whose message already names the fields involved. */
    private static final Set<String> CROSS_FIELD_CHECKS = Set.of(
            "knownNetwork", "distinctPair", "singleSource", "swapFieldsPresent", "queryParamsPresent");

    private final ObjectMapper strictMapper;
    private final Validator validator;

    public ArgumentBinder(ObjectMapper objectMapper, Validator validator) {
        this.strictMapper = objectMapper
                .copy()
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.validator = validator;
    }

    public <A extends ToolArguments> A bind(ToolName toolName, JsonNode rawArguments, Class<A> type) {
        JsonNode arguments = rawArguments == null || rawArguments.isNull()
                ? strictMapper.createObjectNode()
                : rawArguments;
        if (!arguments.isObject()) {
            throw new SchemaViolationException("Arguments for " + toolName + " must be a JSON object");
        }

        A bound;
        try {
            bound = strictMapper.treeToValue(arguments, type);
        } catch (UnrecognizedPropertyException e) {
            throw new SchemaViolationException(
                    "Unknown argument '" + e.getPropertyName() + "' for " + toolName,
                    Map.of("field", String.valueOf(e.getPropertyName())));
        } catch (JsonMappingException e) {
            String field = fieldPath(e);
            throw new SchemaViolationException(
                    "Argument '" + field + "' for " + toolName + " has the wrong type", Map.of("field", field));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new SchemaViolationException("Arguments for " + toolName + " could not be read");
        }
        if (bound == null) {
            throw new SchemaViolationException("Arguments for " + toolName + " are required");
        }

        Set<ConstraintViolation<A>> violations = validator.validate(bound);
        if (!violations.isEmpty()) {
            Map<String, Object> details = new LinkedHashMap<>();
            List<String> problems = new ArrayList<>();
            violations.forEach(violation -> {
                String property = violation.getPropertyPath().toString();
                details.put(fieldName(property), violation.getMessage());
                problems.add(CROSS_FIELD_CHECKS.contains(property)
                        ? violation.getMessage()
                        : fieldName(property) + " " + violation.getMessage());
            });
            String summary = problems.stream().sorted().collect(Collectors.joining("; "));
            throw new SchemaViolationException("Invalid arguments for " + toolName + ": " + summary, details);
        }
        return bound;
    }

    private static String fieldPath(JsonMappingException e) {
        String path = e.getPath().stream()
                .map(reference -> reference.getFieldName() != null
                        ? reference.getFieldName()
                        : String.valueOf(reference.getIndex()))
                .collect(Collectors.joining("."));
        return path.isEmpty() ? "<root>" : path;
    }

    /** Wire-style name of a violated property. */
    private static String fieldName(String propertyPath) {
        return propertyPath.isEmpty() ? "arguments" : SNAKE_CASE.translate(propertyPath);
    }
}
