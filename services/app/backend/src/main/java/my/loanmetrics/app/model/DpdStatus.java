package my.loanmetrics.app.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DpdStatus {
	CURRENT("Current"),
	D1_3("D1-3"),
	D4_6("D4-6"),
	ROLLED_D7_15("Rolled to D7-15"),
	ROLLED_D16_30("Rolled to D16-30"),
	OVERDUE("Overdue");

	private final String label;

	DpdStatus(String label) {
		this.label = label;
	}

	public static DpdStatus fromDpd(int dpd) {
		if (dpd == 0) {
			return CURRENT;
		}
		if (dpd >= 1 && dpd <= 3) {
			return D1_3;
		}
		if (dpd >= 4 && dpd <= 6) {
			return D4_6;
		}
		if (dpd >= 7 && dpd <= 15) {
			return ROLLED_D7_15;
		}
		if (dpd >= 16 && dpd <= 30) {
			return ROLLED_D16_30;
		}
		// Negative values fall through here as well.
		return OVERDUE;
	}

	@JsonValue
	public String getLabel() {
		return label;
	}
}
