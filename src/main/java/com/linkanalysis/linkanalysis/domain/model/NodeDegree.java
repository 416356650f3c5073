package com.linkanalysis.linkanalysis.domain.model;

public record NodeDegree(int inDegree, int outDegree, int totalDegree) {
}
