package my.loanmetrics.app.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import my.loanmetrics.app.model.OfficerMetrics;
import my.loanmetrics.app.model.PortfolioMetrics;

import java.util.List;

public record PortfolioReportDto(
		@Schema(description = "Portfolio-wide KPIs. Averages are zero when no officers were supplied.")
		PortfolioMetrics portfolio,
		@Schema(description = "Officer records in input order.")
		List<OfficerMetrics> officers,
		@Schema(description = "Rounded per-officer summaries in input order.")
		List<OfficerSummaryDto> summaries
) {
}
