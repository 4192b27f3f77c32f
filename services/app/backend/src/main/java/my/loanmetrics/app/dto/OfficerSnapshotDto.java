package my.loanmetrics.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import my.loanmetrics.app.model.RawMetrics;

@Schema(description = "One officer's identity and raw counters for the current calculation cycle.")
public record OfficerSnapshotDto(
		@Schema(description = "Officer identifier.")
		@JsonProperty("officer_id") @NotBlank String officerId,
		@Schema(description = "Officer display name.")
		String name,
		String region,
		String branch,
		String channel,
		@Schema(description = "Raw counters. Officers without a snapshot are counted but not scored.")
		RawMetrics rawMetrics
) {
}
