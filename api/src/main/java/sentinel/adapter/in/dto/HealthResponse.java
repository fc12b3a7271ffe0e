package sentinel.adapter.in.dto;

import java.util.List;

public record HealthResponse(String status, List<String> services) {}
