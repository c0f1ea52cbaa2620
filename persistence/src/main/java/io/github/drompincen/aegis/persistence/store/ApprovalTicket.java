package io.github.drompincen.aegis.persistence.store;

/**
 * Result of a find-or-create: the id of the unresolved request for the pair
 * and whether this call inserted it.
 */
public record ApprovalTicket(long approvalId, boolean created) {}
