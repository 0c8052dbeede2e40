package io.facetrelay.observability;

import io.facetrelay.runtime.FacetRelayRuntime;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(FacetRelayRuntime.StatsOutcome stats, String namespace) {
        StringBuilder sb = new StringBuilder();
        appendGauge(sb, "facetrelay_messages_total", "Messages grouped by outcome", "outcome", "sent", stats.sentTotal());
        appendGauge(sb, "facetrelay_messages_total", "Messages grouped by outcome", "outcome", "received", stats.receivedTotal());
        appendGauge(sb, "facetrelay_messages_total", "Messages grouped by outcome", "outcome", "applied", stats.appliedTotal());
        appendGauge(sb, "facetrelay_messages_total", "Messages grouped by outcome", "outcome", "failed", stats.failedTotal());
        appendGauge(sb, "facetrelay_messages_total", "Messages grouped by outcome", "outcome", "recovered", stats.recoveredTotal());
        appendGauge(sb, "facetrelay_messages_total", "Messages grouped by outcome", "outcome", "retry_failed", stats.retryFailedTotal());
        appendGauge(sb, "facetrelay_messages_total", "Messages grouped by outcome", "outcome", "rejected", stats.rejectedTotal());
        appendGauge(sb, "facetrelay_post_commit_failures_total", "Side effects that failed after their outcome was final", null, null, stats.postCommitFailures());
        appendGauge(sb, "facetrelay_failed_messages_pending", "Failure ledger records awaiting recovery", null, null, stats.pendingFailures());
        appendGauge(sb, "facetrelay_recovered_messages_total", "Recovery trail rows", null, null, stats.recoveredRecords());
        appendGauge(sb, "facetrelay_allowlist_entries", "Allowlist entries grouped by kind", "kind", "destination", stats.allowedDestinations());
        appendGauge(sb, "facetrelay_allowlist_entries", "Allowlist entries grouped by kind", "kind", "source", stats.allowedSources());
        appendGauge(sb, "facetrelay_allowlist_entries", "Allowlist entries grouped by kind", "kind", "sender", stats.allowedSenders());
        appendGauge(sb, "facetrelay_facets", "Facets reachable through the dispatch table", null, null, stats.facets());
        appendGauge(sb, "facetrelay_selectors", "Selectors routed by the dispatch table", null, null, stats.selectors());
        appendGauge(sb, "facetrelay_initialized", "Whether the unit is initialized (1=yes,0=no)", null, null, stats.initialized() ? 1 : 0);
        String base = sb.toString();
        String normalizedNamespace = namespace == null ? "" : namespace.trim();
        if (normalizedNamespace.isBlank()) {
            return base;
        }
        String escapedNs = escapeLabel(normalizedNamespace);
        StringBuilder withNamespace = new StringBuilder(base.length() + 128);
        withNamespace.append(base);
        withNamespace.append("# HELP facetrelay_namespace_info Runtime namespace marker\n");
        withNamespace.append("# TYPE facetrelay_namespace_info gauge\n");
        withNamespace.append("facetrelay_namespace_info{namespace=\"").append(escapedNs)
                .append("\",chain=\"").append(escapeLabel(stats.chainSelector()))
                .append("\",unit=\"").append(escapeLabel(stats.unitAddress())).append("\"} 1\n");
        return withNamespace.toString();
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String label, String labelValue, long value) {
        if (!sb.toString().contains("# HELP " + metric + " ")) {
            sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
            sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        }
        sb.append(metric);
        if (label != null && labelValue != null) {
            sb.append('{').append(label).append("=\"").append(escapeLabel(labelValue)).append("\"}");
        }
        sb.append(' ').append(value).append('\n');
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
