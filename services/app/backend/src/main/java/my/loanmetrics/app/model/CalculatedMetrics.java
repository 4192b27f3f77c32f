package my.loanmetrics.app.model;

import lombok.Builder;

/**
 * Composite quality and risk indicators derived from a single {@link RawMetrics} value.
 * <p>
 * {@code riskScoreNorm} and {@code onTimeRate} are within [0, 1], {@code riskScore} and {@code dqi} within [0, 100].
 * The remaining ratios are not clamped. {@code repaymentDelayRate} is signed.
 */
@Builder
public record CalculatedMetrics(
		double fimr,
		double slippage,
		double roll,
		double frr,
		double ayr,
		int dqi,
		int riskScore,
		double yield,
		double overdue15dVolume,
		double riskScoreNorm,
		double onTimeRate,
		double channelPurity,
		double porr,
		double avgTimelinessScore,
		double avgRepaymentHealth,
		double avgDaysSinceLastRepayment,
		double avgLoanAge,
		double repaymentDelayRate
) {
}
