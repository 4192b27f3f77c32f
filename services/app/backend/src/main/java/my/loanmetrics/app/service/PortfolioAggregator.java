package my.loanmetrics.app.service;

import my.loanmetrics.app.model.CalculatedMetrics;
import my.loanmetrics.app.model.OfficerMetrics;
import my.loanmetrics.app.model.PortfolioMetrics;
import my.loanmetrics.app.model.RawMetrics;
import my.loanmetrics.app.model.RiskBand;
import my.loanmetrics.app.model.TopOfficer;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Folds per-officer metrics into portfolio KPIs in a single pass over the input order.
 * <p>
 * Officers without calculated metrics still count towards {@code totalOfficers} and therefore dilute the averages.
 * The top officer is the first one to reach the highest AYR; later officers with an equal AYR do not replace it.
 */
@Service
public class PortfolioAggregator {
	static final int WATCHLIST_THRESHOLD = RiskBand.WATCH.getMinScore();
	static final double AT_RISK_DAYS_SINCE_REPAYMENT = 10.0;
	static final double AT_RISK_LOAN_AGE = 14.0;

	public PortfolioMetrics aggregate(List<OfficerMetrics> officers) {
		if (officers == null || officers.isEmpty()) {
			return PortfolioMetrics.empty();
		}
		int totalOfficers = officers.size();
		double totalOverdue15d = 0.0;
		int totalDqi = 0;
		double totalAyr = 0.0;
		int totalRiskScore = 0;
		int totalLoans = 0;
		double totalPortfolio = 0.0;
		int watchlistCount = 0;
		double watchlistPortfolio = 0.0;
		double topAyr = 0.0;
		TopOfficer topOfficer = null;
		double totalRepaymentDelayRate = 0.0;
		int officersWithDelayRate = 0;
		int atRiskOfficersCount = 0;

		for (OfficerMetrics officer : officers) {
			if (officer == null) {
				continue;
			}
			CalculatedMetrics calculated = officer.calculatedMetrics();
			RawMetrics raw = officer.rawMetrics();
			if (calculated != null) {
				totalOverdue15d += calculated.overdue15dVolume();
				totalDqi += calculated.dqi();
				totalAyr += calculated.ayr();
				totalRiskScore += calculated.riskScore();

				if (calculated.ayr() > topAyr) {
					topAyr = calculated.ayr();
					topOfficer = new TopOfficer(officer.officerId(), officer.name(), calculated.ayr());
				}

				if (calculated.riskScore() < WATCHLIST_THRESHOLD) {
					watchlistCount += 1;
					if (raw != null) {
						watchlistPortfolio += raw.totalPortfolio();
					}
				}

				if (calculated.repaymentDelayRate() != 0.0) {
					totalRepaymentDelayRate += calculated.repaymentDelayRate();
					officersWithDelayRate += 1;
				}

				if (calculated.avgDaysSinceLastRepayment() > AT_RISK_DAYS_SINCE_REPAYMENT
						&& calculated.avgLoanAge() > AT_RISK_LOAN_AGE) {
					atRiskOfficersCount += 1;
				}
			}
			if (raw != null) {
				totalLoans += raw.disbursed();
				totalPortfolio += raw.totalPortfolio();
			}
		}

		double avgRepaymentDelayRate = officersWithDelayRate > 0
				? totalRepaymentDelayRate / officersWithDelayRate
				: 0.0;
		return new PortfolioMetrics(
				totalOfficers,
				totalLoans,
				totalPortfolio,
				totalOverdue15d,
				totalDqi / totalOfficers,
				totalRiskScore / totalOfficers,
				totalAyr / totalOfficers,
				topOfficer,
				watchlistCount,
				watchlistPortfolio,
				avgRepaymentDelayRate,
				atRiskOfficersCount,
				((double) atRiskOfficersCount / totalOfficers) * 100
		);
	}
}
