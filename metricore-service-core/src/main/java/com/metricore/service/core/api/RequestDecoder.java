package com.metricore.service.core.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.metricore.metric.error.MetricsEngineException;
import com.metricore.metric.expression.Aggregation;
import com.metricore.metric.expression.ArithmeticOperation;
import com.metricore.metric.expression.Expression;
import com.metricore.metric.expression.MetricFunction;
import com.metricore.metric.expression.MetricQuery;
import com.metricore.metric.filter.CompareOperation;
import com.metricore.metric.filter.FilterExpression;
import com.metricore.metric.filter.TransformExpression;
import com.metricore.metric.model.MetricKind;
import com.metricore.metric.model.Point;
import com.metricore.metric.model.Tag;
import com.metricore.metric.model.TimeRange;
import com.metricore.service.core.query.ExpressionQueryRequest;
import com.metricore.service.core.query.LegacyQueryRequest;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Turns JSON request bodies into typed requests. Variants are externally tagged:
 *
 * <pre>
 *   {"Arithmetic": {"operation": "Divide", "left": {...}, "right": {"Value": 2.0}}}
 *   {"Percentile": {"metric": "latency", "query": {"group_by": "host"}, "percentile": 95}}
 *   {"Compare": {"operation": "GreaterThan", "left": {"Value": "InputValue"}, "right": {"Value": 0.7}}}
 * </pre>
 *
 * Unknown variants, missing fields and wrong JSON types are rejected with INVALID_ARGUMENT.
 */
@Component
@RequiredArgsConstructor
public class RequestDecoder {

    private final ObjectMapper objectMapper;

    public record Registration(String name, MetricKind kind) {}

    public Registration decodeRegistration(String body) {
        JsonNode root = parse(body);
        return new Registration(requiredText(root, "name"), MetricKind.fromValue(requiredText(root, "kind")));
    }

    public String decodeAutoPrimaryTagKey(String body) {
        return requiredText(parse(body), "key");
    }

    /** Counter points may carry their value under {@code count}. */
    public List<Point> decodePoints(String body, MetricKind kind) {
        JsonNode root = parse(body);
        if (!root.isArray()) {
            throw MetricsEngineException.invalidArgument("Expected an array of points");
        }
        List<Point> points = new ArrayList<>(root.size());
        for (JsonNode node : root) {
            requireObject(node, "point");
            double time = requiredNumber(node, "time");
            String valueField = kind == MetricKind.COUNTER && node.has("count") ? "count" : "value";
            double value = requiredNumber(node, valueField);
            points.add(Point.of(time, value, decodeTags(node.get("tags"))));
        }
        return points;
    }

    public LegacyQueryRequest decodeLegacyQuery(String metric, String body) {
        JsonNode root = parse(body);
        requireObject(root, "query");
        String operation = requiredText(root, "operation");
        Aggregation aggregation = "Percentile".equals(operation)
                ? Aggregation.percentile(requiredNumber(root, "percentile"))
                : Aggregation.fromName(operation);
        TimeRange range = new TimeRange(requiredNumber(root, "start"), requiredNumber(root, "end"));
        MetricQuery query = new MetricQuery(
                optionalText(root, "group_by"), decodeTags(root.get("tags")), decodeOptionalFilter(root.get("output_filter")));
        return new LegacyQueryRequest(
                metric, aggregation, range, optionalNumber(root, "duration"), query, decodeTimeout(root));
    }

    public ExpressionQueryRequest decodeExpressionQuery(String body) {
        JsonNode root = parse(body);
        requireObject(root, "query");
        JsonNode rangeNode = root.get("time_range");
        requireObject(rangeNode, "time_range");
        TimeRange range = new TimeRange(requiredNumber(rangeNode, "start"), requiredNumber(rangeNode, "end"));
        Expression expression = decodeExpression(required(root, "expression"));
        return new ExpressionQueryRequest(
                range,
                optionalNumber(root, "duration"),
                expression,
                decodeOptionalFilter(root.get("output_filter")),
                decodeTimeout(root));
    }

    Expression decodeExpression(JsonNode node) {
        Map.Entry<String, JsonNode> variant = variant(node, "expression");
        JsonNode body = variant.getValue();
        return switch (variant.getKey()) {
            case "Average", "Sum", "Min", "Max", "Count" -> new Expression.MetricRef(
                    requiredText(body, "metric"), Aggregation.fromName(variant.getKey()), decodeMetricQuery(body.get("query")));
            case "Percentile" -> new Expression.MetricRef(
                    requiredText(body, "metric"),
                    Aggregation.percentile(requiredNumber(body, "percentile")),
                    decodeMetricQuery(body.get("query")));
            case "Value" -> new Expression.Value(number(body, "Value"));
            case "Arithmetic" -> new Expression.Arithmetic(
                    ArithmeticOperation.fromValue(requiredText(body, "operation")),
                    decodeExpression(required(body, "left")),
                    decodeExpression(required(body, "right")));
            case "Function" -> {
                List<Expression> arguments = new ArrayList<>();
                for (JsonNode argument : requiredArray(body, "arguments")) {
                    arguments.add(decodeExpression(argument));
                }
                yield new Expression.FunctionCall(MetricFunction.fromValue(requiredText(body, "function")), arguments);
            }
            default -> throw MetricsEngineException.invalidArgument("Unknown expression variant: " + variant.getKey());
        };
    }

    MetricQuery decodeMetricQuery(JsonNode node) {
        if (node == null || node.isNull()) {
            return MetricQuery.all();
        }
        requireObject(node, "query");
        return new MetricQuery(
                optionalText(node, "group_by"), decodeTags(node.get("tags")), decodeOptionalFilter(node.get("output_filter")));
    }

    FilterExpression decodeFilter(JsonNode node) {
        Map.Entry<String, JsonNode> variant = variant(node, "filter");
        JsonNode body = variant.getValue();
        return switch (variant.getKey()) {
            case "Compare" -> new FilterExpression.Compare(
                    CompareOperation.fromValue(requiredText(body, "operation")),
                    decodeOperand(required(body, "left")),
                    decodeOperand(required(body, "right")));
            case "And" -> new FilterExpression.And(
                    decodeFilter(required(body, "left")), decodeFilter(required(body, "right")));
            case "Or" -> new FilterExpression.Or(
                    decodeFilter(required(body, "left")), decodeFilter(required(body, "right")));
            default -> throw MetricsEngineException.invalidArgument("Unknown filter variant: " + variant.getKey());
        };
    }

    TransformExpression decodeTransform(JsonNode node) {
        if (node != null && node.isTextual()) {
            if ("InputValue".equals(node.asText())) {
                return TransformExpression.INPUT_VALUE;
            }
            throw MetricsEngineException.invalidArgument("Unknown transform variant: " + node.asText());
        }
        Map.Entry<String, JsonNode> variant = variant(node, "transform");
        JsonNode body = variant.getValue();
        return switch (variant.getKey()) {
            case "Value" -> TransformExpression.value(number(body, "Value"));
            case "Arithmetic" -> new TransformExpression.Arithmetic(
                    ArithmeticOperation.fromValue(requiredText(body, "operation")),
                    decodeTransform(required(body, "left")),
                    decodeTransform(required(body, "right")));
            case "Function" -> {
                List<TransformExpression> arguments = new ArrayList<>();
                for (JsonNode argument : requiredArray(body, "arguments")) {
                    arguments.add(decodeTransform(argument));
                }
                yield new TransformExpression.Function(
                        MetricFunction.fromValue(requiredText(body, "function")), arguments);
            }
            default -> throw MetricsEngineException.invalidArgument("Unknown transform variant: " + variant.getKey());
        };
    }

    // Compare operands may be wrapped as {"Value": <transform>} or {"Transform": <transform>}
    private TransformExpression decodeOperand(JsonNode node) {
        if (node.isObject() && node.size() == 1) {
            JsonNode inner = node.has("Value") ? node.get("Value") : node.get("Transform");
            if (inner != null) {
                return inner.isNumber() ? TransformExpression.value(inner.doubleValue()) : decodeTransform(inner);
            }
        }
        return decodeTransform(node);
    }

    private FilterExpression decodeOptionalFilter(JsonNode node) {
        return node == null || node.isNull() ? null : decodeFilter(node);
    }

    private List<Tag> decodeTags(JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw MetricsEngineException.invalidArgument("Tags must be an array of key:value strings");
        }
        List<Tag> tags = new ArrayList<>(node.size());
        for (JsonNode tag : node) {
            if (!tag.isTextual()) {
                throw MetricsEngineException.invalidArgument("Tag must be a string, got " + tag);
            }
            tags.add(Tag.parse(tag.asText()));
        }
        return tags;
    }

    private Duration decodeTimeout(JsonNode root) {
        Double seconds = optionalNumber(root, "timeout");
        return seconds == null ? null : Duration.ofNanos((long) (seconds * 1_000_000_000L));
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            throw MetricsEngineException.invalidArgument("Request body is required");
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException ex) {
            throw MetricsEngineException.invalidArgument("Malformed JSON: " + ex.getOriginalMessage());
        }
    }

    private static Map.Entry<String, JsonNode> variant(JsonNode node, String what) {
        if (node == null || !node.isObject() || node.size() != 1) {
            throw MetricsEngineException.invalidArgument("Expected a single-variant " + what + " object, got " + node);
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        return fields.next();
    }

    private static void requireObject(JsonNode node, String what) {
        if (node == null || !node.isObject()) {
            throw MetricsEngineException.invalidArgument("Expected a JSON object for " + what);
        }
    }

    private static JsonNode required(JsonNode node, String field) {
        requireObject(node, field);
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw MetricsEngineException.invalidArgument("Missing field '" + field + "'");
        }
        return value;
    }

    private static JsonNode requiredArray(JsonNode node, String field) {
        JsonNode value = required(node, field);
        if (!value.isArray()) {
            throw MetricsEngineException.invalidArgument("Field '" + field + "' must be an array");
        }
        return value;
    }

    private static String requiredText(JsonNode node, String field) {
        JsonNode value = required(node, field);
        if (!value.isTextual()) {
            throw MetricsEngineException.invalidArgument("Field '" + field + "' must be a string");
        }
        return value.asText();
    }

    private static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw MetricsEngineException.invalidArgument("Field '" + field + "' must be a string");
        }
        return value.asText();
    }

    private static double requiredNumber(JsonNode node, String field) {
        return number(required(node, field), field);
    }

    private static Double optionalNumber(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : number(value, field);
    }

    private static double number(JsonNode value, String field) {
        if (value == null || !value.isNumber()) {
            throw MetricsEngineException.invalidArgument("Field '" + field + "' must be a number");
        }
        return value.doubleValue();
    }
}
