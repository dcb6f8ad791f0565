package com.pipestudio.pipestudio_backend.model.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConditionNodeConfig {
    private PredicateClause condition;
}
