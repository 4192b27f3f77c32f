package my.loanmetrics.app.service;

import my.loanmetrics.app.model.CalculatedMetrics;
import my.loanmetrics.app.model.RawMetrics;
import my.loanmetrics.app.service.util.RoundingUtil;
import org.springframework.stereotype.Service;

import static my.loanmetrics.app.service.util.RoundingUtil.ratio;

/**
 * Turns one officer's raw counters into composite quality and risk indicators.
 * Stateless; safe to share across threads as long as each call gets its own snapshot.
 */
@Service
public class ScoreCalculator {
	static final double CHANNEL_PURITY = 1.0;

	static final double PORR_WEIGHT = 0.25;
	static final double FIMR_WEIGHT = 0.20;
	static final double ROLL_WEIGHT = 0.15;
	static final double WAIVER_WEIGHT = 0.10;
	static final double BACKDATED_WEIGHT = 0.10;
	static final double REVERSAL_WEIGHT = 0.10;
	static final double FLOAT_GAP_PENALTY = 0.10;

	static final double DQI_RISK_WEIGHT = 0.40;
	static final double DQI_ON_TIME_WEIGHT = 0.30;
	static final double DQI_CHANNEL_WEIGHT = 0.20;
	static final double DQI_FIMR_WEIGHT = 0.10;

	private static final double EXPECTED_REPAYMENT_INTERVAL_RATIO = 0.25;

	public CalculatedMetrics calculate(RawMetrics raw) {
		if (raw == null) {
			throw new IllegalArgumentException("Raw metrics are required to calculate officer metrics");
		}
		double fimr = ratio(raw.firstMiss(), raw.disbursed());
		double slippage = ratio(raw.dpd1to6Bal(), raw.amountDue7d());
		double roll = ratio(raw.movedTo7to30(), raw.prevDpd1to6Bal());
		double frr = ratio(raw.feesCollected(), raw.feesDue());
		double ayr = ratio(raw.interestCollected() + raw.feesCollected(), raw.par15MidMonth());
		double porr = ratio(raw.overdue15d(), raw.totalPortfolio());
		double onTimeRate = Math.max(0.0, 1.0 - slippage);

		double riskScoreNorm = riskScoreNorm(raw, porr, fimr, roll);
		int riskScore = (int) (riskScoreNorm * 100);
		int dqi = dqi(riskScoreNorm, onTimeRate, CHANNEL_PURITY, fimr);

		return CalculatedMetrics.builder()
				.fimr(fimr)
				.slippage(slippage)
				.roll(roll)
				.frr(frr)
				.ayr(ayr)
				.yield(raw.interestCollected() + raw.feesCollected())
				.overdue15dVolume(raw.overdue15d())
				.porr(porr)
				.channelPurity(CHANNEL_PURITY)
				.onTimeRate(onTimeRate)
				.riskScoreNorm(riskScoreNorm)
				.riskScore(riskScore)
				.dqi(dqi)
				.avgTimelinessScore(raw.avgTimelinessScore())
				.avgRepaymentHealth(raw.avgRepaymentHealth())
				.avgDaysSinceLastRepayment(raw.avgDaysSinceLastRepayment())
				.avgLoanAge(raw.avgLoanAge())
				.repaymentDelayRate(repaymentDelayRate(raw.avgDaysSinceLastRepayment(), raw.avgLoanAge()))
				.build();
	}

	/**
	 * Starts at 1.0 and subtracts weighted penalties, then clamps into [0, 1].
	 * Waiver, backdating and reversal penalties only apply when their denominators are positive.
	 */
	static double riskScoreNorm(RawMetrics raw, double porr, double fimr, double roll) {
		double score = 1.0;
		score -= porr * PORR_WEIGHT;
		score -= fimr * FIMR_WEIGHT;
		score -= roll * ROLL_WEIGHT;
		if (raw.totalPortfolio() > 0) {
			score -= (raw.waivers() / raw.totalPortfolio()) * WAIVER_WEIGHT;
		}
		if (raw.entries() > 0) {
			score -= ((double) raw.backdated() / raw.entries()) * BACKDATED_WEIGHT;
			score -= ((double) raw.reversals() / raw.entries()) * REVERSAL_WEIGHT;
		}
		if (raw.hadFloatGap()) {
			score -= FLOAT_GAP_PENALTY;
		}
		return RoundingUtil.clamp(score, 0.0, 1.0);
	}

	static int dqi(double riskScoreNorm, double onTimeRate, double channelPurity, double fimr) {
		double dqi = riskScoreNorm * DQI_RISK_WEIGHT
				+ onTimeRate * DQI_ON_TIME_WEIGHT
				+ channelPurity * DQI_CHANNEL_WEIGHT
				+ (1.0 - fimr) * DQI_FIMR_WEIGHT;
		// (1 - fimr) goes negative for fimr > 1, hence the clamp before narrowing.
		return (int) RoundingUtil.clamp(RoundingUtil.round(dqi * 100, 0), 0.0, 100.0);
	}

	/**
	 * Signed and unclamped: above 100 when repayments are more recent than expected, negative when they lag.
	 */
	static double repaymentDelayRate(double avgDaysSinceLastRepayment, double avgLoanAge) {
		if (avgLoanAge > 0) {
			double normalized = (avgDaysSinceLastRepayment / avgLoanAge) / EXPECTED_REPAYMENT_INTERVAL_RATIO;
			return (1.0 - normalized) * 100;
		}
		return 0.0;
	}
}
