package my.loanmetrics.app.service.util;

public final class RoundingUtil {
	private RoundingUtil() {
	}

	/**
	 * Rounds half away from zero after scaling by {@code 10^places}.
	 * <p>
	 * Scaling happens in binary floating point, so {@code round(1.005, 2)} is {@code 1.0}: {@code 1.005 * 100}
	 * evaluates to {@code 100.49999999999999}. Not suitable for monetary exactness.
	 */
	public static double round(double value, int places) {
		if (Double.isNaN(value) || Double.isInfinite(value)) {
			return value;
		}
		double multiplier = Math.pow(10, places);
		return roundHalfAwayFromZero(value * multiplier) / multiplier;
	}

	static double roundHalfAwayFromZero(double value) {
		double magnitude = Math.abs(value);
		double truncated = Math.floor(magnitude);
		if (magnitude - truncated >= 0.5) {
			truncated += 1.0;
		}
		return Math.copySign(truncated, value);
	}

	public static double clamp(double value, double min, double max) {
		if (value < min) {
			return min;
		}
		if (value > max) {
			return max;
		}
		return value;
	}

	/**
	 * Returns {@code numerator / denominator} when the denominator is positive, otherwise {@code 0}.
	 * No data and a verified zero rate both come out as {@code 0}.
	 */
	public static double ratio(double numerator, double denominator) {
		if (denominator > 0) {
			return numerator / denominator;
		}
		return 0.0;
	}
}
