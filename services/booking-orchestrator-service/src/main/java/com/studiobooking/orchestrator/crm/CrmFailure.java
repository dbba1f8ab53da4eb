package com.studiobooking.orchestrator.crm;

/**
 * A classified CRM failure. {@code userMessage} is safe to show as is; internal error text never
 * leaves the adapter.
 */
public record CrmFailure(CrmFailureKind kind, String userMessage, boolean fallbackEnqueued) {}
