package com.linkanalysis.linkanalysis.web.dto;

import java.util.List;

public record NetworkListResponse(List<NetworkSummary> networks) {
}
