package com.pipestudio.pipestudio_backend.executor;

import com.pipestudio.pipestudio_backend.executor.impl.ScriptStageLauncher;
import com.pipestudio.pipestudio_backend.model.config.AggregationSpec;
import com.pipestudio.pipestudio_backend.model.config.PredicateClause;
import com.pipestudio.pipestudio_backend.model.config.ProcessingNodeConfig;
import com.pipestudio.pipestudio_backend.model.config.TransformStep;
import com.pipestudio.pipestudio_backend.model.context.NodeExecutionContext;
import com.pipestudio.pipestudio_backend.model.domain.NodeType;
import com.pipestudio.pipestudio_backend.model.domain.PipelineNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes PROCESSING nodes against the upstream {@code data} payload.
 *
 * processingType:
 *   transform: transformations[] applied in order (map / sort / group / noop)
 *   filter: filters[] applied conjunctively to every record
 *   aggregate: aggregations[] of count / sum / avg, keyed by field
 *   script: user code run in a worker process
 *   stage: a stage worker script from the stages directory
 *   anything else passes the data through unchanged.
 *
 * Output: { "data": result } (stage nodes add "outputs" and "artifacts").
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProcessingNodeExecutor implements NodeExecutor {

    private final NodeConfigBinder    configBinder;
    private final PredicateEvaluator  predicates;
    private final ScriptStageLauncher scriptStageLauncher;

    @Override
    public NodeType supportedType() {
        return NodeType.PROCESSING;
    }

    @Override
    public Map<String, Object> execute(PipelineNode node, NodeExecutionContext context) {
        ProcessingNodeConfig config = configBinder.bind(node, ProcessingNodeConfig.class);
        Object data = context.upstreamData();
        String processingType = config.getProcessingType() != null ? config.getProcessingType().toLowerCase() : "";

        switch (processingType) {
            case "script":
                return scriptStageLauncher.runScript(node, context, config);
            case "stage":
                return scriptStageLauncher.runStage(node, context, config);
            default:
                break;
        }

        Object result = switch (processingType) {
            case "transform" -> transform(data, config.getTransformations());
            case "filter"    -> filter(data, config.getFilters());
            case "aggregate" -> aggregate(data, config.getAggregations());
            default -> {
                log.debug("Node {} has processingType '{}', passing data through", node.getId(), processingType);
                yield data;
            }
        };

        Map<String, Object> outputs = new LinkedHashMap<>();
        outputs.put(NodeExecutionContext.DATA_KEY, result);
        return outputs;
    }

    // ── transform ─────────────────────────────────────────────────────────────

    private Object transform(Object data, List<TransformStep> steps) {
        Object result = data;
        if (steps == null) return result;

        for (TransformStep step : steps) {
            String type = step.getType() != null ? step.getType().toLowerCase() : "";
            result = switch (type) {
                case "map"   -> mapRecords(asList(result, "map"), step.getFields());
                case "sort"  -> sortRecords(asList(result, "sort"), step.getKey(), step.getOrder());
                case "group" -> groupRecords(asList(result, "group"), step.getKey());
                case "noop"  -> result;
                default -> throw new NodeExecutionException("Unknown transformation type: " + step.getType());
            };
        }
        return result;
    }

    private List<Object> mapRecords(List<Object> records, Map<String, String> fields) {
        if (fields == null || fields.isEmpty()) return records;
        List<Object> mapped = new ArrayList<>(records.size());
        for (Object record : records) {
            Map<String, Object> projected = new LinkedHashMap<>();
            fields.forEach((target, source) -> projected.put(target, field(record, source)));
            mapped.add(projected);
        }
        return mapped;
    }

    private List<Object> sortRecords(List<Object> records, String key, String order) {
        Comparator<Object> byKey = (a, b) -> compareValues(key == null ? a : field(a, key), key == null ? b : field(b, key));
        if ("desc".equalsIgnoreCase(order)) {
            byKey = byKey.reversed();
        }
        List<Object> sorted = new ArrayList<>(records);
        sorted.sort(byKey);
        return sorted;
    }

    private Map<String, List<Object>> groupRecords(List<Object> records, String key) {
        if (key == null || key.isBlank()) {
            throw new NodeExecutionException("group transformation requires a key");
        }
        Map<String, List<Object>> groups = new LinkedHashMap<>();
        for (Object record : records) {
            String group = String.valueOf(field(record, key));
            groups.computeIfAbsent(group, g -> new ArrayList<>()).add(record);
        }
        return groups;
    }

    // numbers (numerically), then everything else (by string form), then nulls
    private int compareValues(Object a, Object b) {
        int byRank = Integer.compare(sortRank(a), sortRank(b));
        if (byRank != 0 || a == null) return byRank;
        if (a instanceof Number x && b instanceof Number y) {
            return Double.compare(x.doubleValue(), y.doubleValue());
        }
        return String.valueOf(a).compareTo(String.valueOf(b));
    }

    private int sortRank(Object value) {
        if (value == null) return 2;
        return value instanceof Number ? 0 : 1;
    }

    // ── filter ────────────────────────────────────────────────────────────────

    private List<Object> filter(Object data, List<PredicateClause> clauses) {
        List<Object> result = asList(data, "filter");
        if (clauses == null) return result;
        for (PredicateClause clause : clauses) {
            List<Object> kept = new ArrayList<>();
            for (Object record : result) {
                if (predicates.test(record, clause)) kept.add(record);
            }
            result = kept;
        }
        return result;
    }

    // ── aggregate ─────────────────────────────────────────────────────────────

    /**
     * Missing fields count as 0 and non-numeric values as NaN; avg over no records is NaN.
     */
    private Map<String, Object> aggregate(Object data, List<AggregationSpec> aggregations) {
        List<Object> records = asList(data, "aggregate");
        Map<String, Object> result = new LinkedHashMap<>();
        if (aggregations == null) return result;

        for (AggregationSpec agg : aggregations) {
            String type = agg.getType() != null ? agg.getType().toLowerCase() : "";
            String key = agg.getField() != null ? agg.getField() : type;
            switch (type) {
                case "count" -> result.put(key, records.size());
                case "sum"   -> result.put(key, sum(records, agg.getField()));
                case "avg"   -> result.put(key, sum(records, agg.getField()) / records.size());
                default -> throw new NodeExecutionException("Unknown aggregation type: " + agg.getType());
            }
        }
        return result;
    }

    private double sum(List<Object> records, String fieldName) {
        double total = 0;
        for (Object record : records) {
            total += numeric(field(record, fieldName));
        }
        return total;
    }

    private double numeric(Object value) {
        if (value == null) return 0;
        if (value instanceof Number n) return n.doubleValue();
        if (value instanceof Boolean b) return b ? 1 : 0;
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return Double.NaN;
            }
        }
        return Double.NaN;
    }

    // ── helpers ───────────────────────────────────────────────────────────────

    @SuppressWarnings("unchecked")
    private List<Object> asList(Object data, String operation) {
        if (data instanceof List<?> list) {
            return (List<Object>) list;
        }
        String actual = data == null ? "nothing" : data.getClass().getSimpleName();
        throw new NodeExecutionException(operation + " expects an array of records but received " + actual);
    }

    private Object field(Object record, String name) {
        if (name == null || !(record instanceof Map<?, ?> map)) return null;
        return map.get(name);
    }
}
