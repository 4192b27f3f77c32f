package my.loanmetrics.app.model;

import lombok.Builder;

/**
 * Per-officer counters for one calculation cycle, as produced by the snapshot query.
 * <p>
 * Counters with no underlying activity are expected to be zero. The calculator treats zero and unknown alike.
 */
@Builder(toBuilder = true)
public record RawMetrics(
		int firstMiss,
		int disbursed,
		double dpd1to6Bal,
		double amountDue7d,
		double movedTo7to30,
		double prevDpd1to6Bal,
		double feesCollected,
		double feesDue,
		double interestCollected,
		double overdue15d,
		double totalPortfolio,
		double par15MidMonth,
		double waivers,
		int backdated,
		int entries,
		int reversals,
		boolean hadFloatGap,
		double avgTimelinessScore,
		double avgRepaymentHealth,
		double avgDaysSinceLastRepayment,
		double avgLoanAge,
		int activeLoansCount
) {
}
