package com.pipestudio.pipestudio_backend.model.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** { "field": "age", "operator": "gte", "value": 18 }. Operators: eq, ne, gt, lt, gte, lte, contains. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PredicateClause {
    private String field;
    private String operator;
    private Object value;
}
