package my.loanmetrics.app.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An officer's identity together with the snapshot and derived metrics of the current cycle.
 * Either metrics value may be absent.
 */
public record OfficerMetrics(@JsonProperty("officer_id") String officerId,
							 String name,
							 String region,
							 String branch,
							 String channel,
							 RawMetrics rawMetrics,
							 CalculatedMetrics calculatedMetrics,
							 RiskBand riskBand) {
}
