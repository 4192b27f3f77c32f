package my.loanmetrics.app.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Portfolio-wide KPIs for one cycle. Averages are only meaningful when {@code totalOfficers > 0}.
 */
public record PortfolioMetrics(int totalOfficers,
							   int totalLoans,
							   double totalPortfolio,
							   double totalOverdue15d,
							   @JsonProperty("avgDQI") int avgDqi,
							   int avgRiskScore,
							   @JsonProperty("avgAYR") double avgAyr,
							   TopOfficer topOfficer,
							   int watchlistCount,
							   double watchlistPortfolio,
							   double avgRepaymentDelayRate,
							   int atRiskOfficersCount,
							   double atRiskOfficersPercentage) {

	public static PortfolioMetrics empty() {
		return new PortfolioMetrics(0, 0, 0.0, 0.0, 0, 0, 0.0, null, 0, 0.0, 0.0, 0, 0.0);
	}
}
