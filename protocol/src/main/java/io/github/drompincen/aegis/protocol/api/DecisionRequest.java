package io.github.drompincen.aegis.protocol.api;

public record DecisionRequest(ApprovalRequestDto.ApprovalStatus decision) {}
