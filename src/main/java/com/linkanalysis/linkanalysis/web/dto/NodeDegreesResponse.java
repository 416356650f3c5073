package com.linkanalysis.linkanalysis.web.dto;

import java.util.Map;

import com.linkanalysis.linkanalysis.domain.model.NodeDegree;

public record NodeDegreesResponse(Map<String, NodeDegree> nodeDegrees) {
}
