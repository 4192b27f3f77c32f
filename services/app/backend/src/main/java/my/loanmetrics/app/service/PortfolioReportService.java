package my.loanmetrics.app.service;

import my.loanmetrics.app.config.AppProperties;
import my.loanmetrics.app.dto.DpdClassificationDto;
import my.loanmetrics.app.dto.OfficerSnapshotDto;
import my.loanmetrics.app.dto.OfficerSummaryDto;
import my.loanmetrics.app.dto.PortfolioReportDto;
import my.loanmetrics.app.model.CalculatedMetrics;
import my.loanmetrics.app.model.DpdStatus;
import my.loanmetrics.app.model.OfficerMetrics;
import my.loanmetrics.app.model.PortfolioMetrics;
import my.loanmetrics.app.model.RiskBand;
import my.loanmetrics.app.model.RollDirection;
import my.loanmetrics.app.service.util.RoundingUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class PortfolioReportService {
	private static final Logger logger = LoggerFactory.getLogger(PortfolioReportService.class);

	private final ScoreCalculator scoreCalculator;
	private final PortfolioAggregator portfolioAggregator;
	private final AppProperties properties;

	public PortfolioReportService(ScoreCalculator scoreCalculator,
								  PortfolioAggregator portfolioAggregator,
								  AppProperties properties) {
		this.scoreCalculator = scoreCalculator;
		this.portfolioAggregator = portfolioAggregator;
		this.properties = properties;
	}

	public OfficerMetrics calculateOfficer(OfficerSnapshotDto snapshot) {
		if (snapshot == null) {
			throw new IllegalArgumentException("Officer snapshot is required");
		}
		if (snapshot.rawMetrics() == null) {
			throw new IllegalArgumentException("Raw metrics are required for officer " + snapshot.officerId());
		}
		return toOfficerMetrics(snapshot);
	}

	public PortfolioReportDto buildReport(List<OfficerSnapshotDto> snapshots) {
		List<OfficerSnapshotDto> cycle = snapshots == null ? List.of() : new ArrayList<>(snapshots);
		int maxOfficers = properties.maxOfficers();
		if (cycle.size() > maxOfficers) {
			throw new IllegalArgumentException("Too many officers in one cycle: " + cycle.size() + " > " + maxOfficers);
		}
		logger.debug("Calculating metrics for {} officers", cycle.size());

		List<OfficerMetrics> officers = new ArrayList<>(cycle.size());
		for (OfficerSnapshotDto snapshot : cycle) {
			if (snapshot == null) {
				throw new IllegalArgumentException("Officer snapshot entries must not be null");
			}
			officers.add(toOfficerMetrics(snapshot));
		}
		PortfolioMetrics portfolio = portfolioAggregator.aggregate(officers);
		logger.info("Portfolio metrics calculated (officers={}, avgRiskScore={}, watchlist={}).",
				portfolio.totalOfficers(), portfolio.avgRiskScore(), portfolio.watchlistCount());

		int decimals = properties.displayDecimals();
		List<OfficerSummaryDto> summaries = officers.stream()
				.map(officer -> summarize(officer, decimals))
				.toList();
		return new PortfolioReportDto(portfolio, List.copyOf(officers), summaries);
	}

	public DpdClassificationDto classifyDelinquency(int currentDpd, Integer previousDpd) {
		int previous = previousDpd == null ? currentDpd : previousDpd;
		return new DpdClassificationDto(currentDpd,
				previous,
				DpdStatus.fromDpd(currentDpd),
				RollDirection.between(currentDpd, previous));
	}

	private OfficerMetrics toOfficerMetrics(OfficerSnapshotDto snapshot) {
		CalculatedMetrics calculated = snapshot.rawMetrics() == null
				? null
				: scoreCalculator.calculate(snapshot.rawMetrics());
		RiskBand band = calculated == null ? null : RiskBand.fromScore(calculated.riskScore());
		return new OfficerMetrics(snapshot.officerId(),
				snapshot.name(),
				snapshot.region(),
				snapshot.branch(),
				snapshot.channel(),
				snapshot.rawMetrics(),
				calculated,
				band);
	}

	static OfficerSummaryDto summarize(OfficerMetrics officer, int decimals) {
		CalculatedMetrics calculated = officer.calculatedMetrics();
		if (calculated == null) {
			return new OfficerSummaryDto(officer.officerId(), officer.name(), officer.region(), officer.branch(),
					null, null, null, null, null, null, null);
		}
		return new OfficerSummaryDto(officer.officerId(),
				officer.name(),
				officer.region(),
				officer.branch(),
				officer.riskBand(),
				calculated.riskScore(),
				calculated.dqi(),
				RoundingUtil.round(calculated.fimr(), decimals),
				RoundingUtil.round(calculated.porr(), decimals),
				RoundingUtil.round(calculated.ayr(), decimals),
				RoundingUtil.round(calculated.repaymentDelayRate(), decimals));
	}
}
