package com.agentexec.core.model;

public record ResumeAlternative(ResumeAction action, String reason, double confidence) {
}
