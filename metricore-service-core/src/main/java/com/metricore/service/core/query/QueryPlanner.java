package com.metricore.service.core.query;

import com.metricore.metric.error.MetricsEngineException;
import com.metricore.metric.expression.Expression;
import com.metricore.metric.filter.FilterExpression;
import com.metricore.metric.filter.TransformExpression;
import com.metricore.metric.model.LabeledSeries;
import com.metricore.metric.model.QueryResult;
import com.metricore.service.core.aggregate.ReferenceAggregator;
import com.metricore.service.core.aggregate.WindowAggregator;
import com.metricore.service.core.catalog.MetricCatalog;
import com.metricore.service.core.expression.EvaluatedValue;
import com.metricore.service.core.expression.ExpressionEvaluator;
import com.metricore.service.core.filter.OutputFilter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Drives a query through {@code PARSED -> RESOLVED -> AGGREGATED -> EVALUATED -> FILTERED ->
 * RESPONDED}. Any failure ends the run in {@code FAILED}; queries never touch stored data.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryPlanner {

    private final MetricCatalog catalog;
    private final ReferenceAggregator referenceAggregator;
    private final ExpressionEvaluator evaluator;
    private final OutputFilter outputFilter;

    public QueryResult execute(ExpressionQueryRequest request, QueryDeadline deadline) {
        return execute(request, deadline, new QueryRun());
    }

    QueryResult execute(ExpressionQueryRequest request, QueryDeadline deadline, QueryRun run) {
        try {
            validate(request);
            run.advance(QueryState.PARSED);

            Set<Expression.MetricRef> refs = new LinkedHashSet<>();
            collectReferences(request.expression(), refs);
            for (Expression.MetricRef ref : refs) {
                catalog.lookup(ref.metric());
            }
            run.advance(QueryState.RESOLVED);

            Map<Expression.MetricRef, EvaluatedValue> aggregated = new LinkedHashMap<>();
            for (Expression.MetricRef ref : refs) {
                deadline.check();
                aggregated.put(ref, referenceAggregator.aggregate(ref, request.range(), request.duration(), deadline));
            }
            run.advance(QueryState.AGGREGATED);

            QueryResult evaluated = evaluator.evaluate(request.expression(), aggregated).toResult();
            run.advance(QueryState.EVALUATED);

            QueryResult filtered = dropEmptyGroups(outputFilter.apply(request.outputFilter(), evaluated));
            run.advance(QueryState.FILTERED);

            deadline.check();
            run.respond(filtered);
            log.debug("Query responded trail={}", run.trail());
            return filtered;
        } catch (MetricsEngineException ex) {
            run.fail(ex);
            log.debug("Query failed kind={} trail={} message={}", ex.getKind(), run.trail(), ex.getMessage());
            throw ex;
        } catch (RuntimeException ex) {
            MetricsEngineException internal = MetricsEngineException.internal("Query failed unexpectedly", ex);
            run.fail(internal);
            log.error("Query failed unexpectedly trail={}", run.trail(), ex);
            throw internal;
        }
    }

    /** Shape checks only; nothing is looked up or read. */
    void validate(ExpressionQueryRequest request) {
        WindowAggregator.validateDuration(request.duration());
        validateExpression(request.expression());
        validateFilter(request.outputFilter());
    }

    private void validateExpression(Expression expression) {
        if (expression instanceof Expression.MetricRef ref) {
            if (ref.metric().isBlank()) {
                throw MetricsEngineException.invalidArgument("Metric name must not be blank");
            }
            validateFilter(ref.query().outputFilter());
        } else if (expression instanceof Expression.Arithmetic arithmetic) {
            validateExpression(arithmetic.left());
            validateExpression(arithmetic.right());
        } else if (expression instanceof Expression.FunctionCall call) {
            call.function().checkArity(call.arguments().size());
            call.arguments().forEach(this::validateExpression);
        } else if (!(expression instanceof Expression.Value)) {
            throw MetricsEngineException.invalidArgument("Unsupported expression " + expression);
        }
    }

    private void validateFilter(FilterExpression filter) {
        if (filter == null) {
            return;
        }
        if (filter instanceof FilterExpression.Compare compare) {
            validateTransform(compare.left());
            validateTransform(compare.right());
        } else if (filter instanceof FilterExpression.And and) {
            validateFilter(and.left());
            validateFilter(and.right());
        } else if (filter instanceof FilterExpression.Or or) {
            validateFilter(or.left());
            validateFilter(or.right());
        }
    }

    private void validateTransform(TransformExpression transform) {
        if (transform instanceof TransformExpression.Arithmetic arithmetic) {
            validateTransform(arithmetic.left());
            validateTransform(arithmetic.right());
        } else if (transform instanceof TransformExpression.Function function) {
            function.function().checkArity(function.arguments().size());
            function.arguments().forEach(this::validateTransform);
        }
    }

    private static void collectReferences(Expression expression, Set<Expression.MetricRef> refs) {
        if (expression instanceof Expression.MetricRef ref) {
            refs.add(ref);
        } else if (expression instanceof Expression.Arithmetic arithmetic) {
            collectReferences(arithmetic.left(), refs);
            collectReferences(arithmetic.right(), refs);
        } else if (expression instanceof Expression.FunctionCall call) {
            call.arguments().forEach(argument -> collectReferences(argument, refs));
        }
    }

    private static QueryResult dropEmptyGroups(QueryResult result) {
        if (result instanceof QueryResult.Grouped grouped) {
            List<LabeledSeries> kept = new ArrayList<>(grouped.groups().size());
            for (LabeledSeries series : grouped.groups()) {
                if (!series.points().isEmpty()) {
                    kept.add(series);
                }
            }
            return new QueryResult.Grouped(kept);
        }
        return result;
    }
}
