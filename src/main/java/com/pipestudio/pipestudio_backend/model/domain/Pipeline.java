package com.pipestudio.pipestudio_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Pipeline {

    private String id;
    private String name;
    private String description;

    @Builder.Default
    private List<PipelineNode> nodes = new ArrayList<>();

    @Builder.Default
    private List<Connection> edges = new ArrayList<>();

    public List<PipelineNode> getNodes() {
        return nodes != null ? nodes : List.of();
    }

    public List<Connection> getEdges() {
        return edges != null ? edges : List.of();
    }

    public Optional<PipelineNode> findNode(String nodeId) {
        return getNodes().stream()
                .filter(n -> n.getId() != null && n.getId().equals(nodeId))
                .findFirst();
    }
}
