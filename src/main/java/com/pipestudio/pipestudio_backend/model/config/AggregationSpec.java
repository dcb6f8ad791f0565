package com.pipestudio.pipestudio_backend.model.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** { "type": "sum", "field": "amount" }. Types: count, sum, avg. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AggregationSpec {
    private String type;
    private String field;
}
