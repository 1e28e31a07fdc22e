package com.agentexec.engine.coordinator;

import com.agentexec.engine.coordinator.findings.BestPracticesFindings;
import com.agentexec.engine.coordinator.findings.CodebaseFindings;
import com.agentexec.engine.coordinator.findings.FeasibilityFindings;
import com.agentexec.engine.coordinator.findings.RoleOutput;
import com.agentexec.engine.coordinator.findings.UnrecognizedOutput;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.Map;

/**
 * Decodes a role's response content into its typed output, once, at the boundary.
 *
 * <p>The content must contain a JSON object carrying at least one of the role's marker
 * fields. Surrounding prose or code fences are ignored. Anything else becomes an
 * {@link UnrecognizedOutput}.</p>
 */
public class RoleOutputDecoder {

    private static final Map<ResearchRole, List<String>> MARKERS = Map.of(
        ResearchRole.FEASIBILITY, List.of("feasible", "approaches", "risks"),
        ResearchRole.CODEBASE, List.of("similarFeatures", "conventions", "integrationPoints"),
        ResearchRole.BEST_PRACTICES, List.of("bestPractices", "pitfalls", "securityConsiderations")
    );

    private final ObjectMapper objectMapper;

    public RoleOutputDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public RoleOutput decode(ResearchRole role, String agentId, String content) {
        if (content == null || content.isBlank()) {
            return new UnrecognizedOutput(role, agentId, content, "Empty response");
        }
        int start = content.indexOf('{');
        int end = content.lastIndexOf('}');
        if (start < 0 || end < start) {
            return new UnrecognizedOutput(role, agentId, content, "No JSON object in response");
        }
        try {
            JsonNode node = objectMapper.readTree(content.substring(start, end + 1));
            if (MARKERS.get(role).stream().noneMatch(node::has)) {
                return new UnrecognizedOutput(role, agentId, content,
                    "Response has none of the " + role.value() + " fields " + MARKERS.get(role));
            }
            return switch (role) {
                case FEASIBILITY -> objectMapper.treeToValue(node, FeasibilityFindings.class);
                case CODEBASE -> objectMapper.treeToValue(node, CodebaseFindings.class);
                case BEST_PRACTICES -> objectMapper.treeToValue(node, BestPracticesFindings.class);
            };
        } catch (JsonProcessingException e) {
            return new UnrecognizedOutput(role, agentId, content, "Malformed JSON: " + e.getOriginalMessage());
        }
    }
}
