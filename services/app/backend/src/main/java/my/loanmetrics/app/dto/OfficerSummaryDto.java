package my.loanmetrics.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import my.loanmetrics.app.model.RiskBand;

@Schema(description = "Display view of an officer's headline metrics with ratios rounded for presentation.")
public record OfficerSummaryDto(@JsonProperty("officer_id") String officerId,
								String name,
								String region,
								String branch,
								RiskBand riskBand,
								Integer riskScore,
								Integer dqi,
								Double fimr,
								Double porr,
								Double ayr,
								Double repaymentDelayRate) {
}
