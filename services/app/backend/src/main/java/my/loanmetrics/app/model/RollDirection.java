package my.loanmetrics.app.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RollDirection {
	WORSENING("Worsening"),
	IMPROVING("Improving"),
	STABLE("Stable");

	private final String label;

	RollDirection(String label) {
		this.label = label;
	}

	public static RollDirection between(int currentDpd, int previousDpd) {
		if (currentDpd > previousDpd) {
			return WORSENING;
		}
		if (currentDpd < previousDpd) {
			return IMPROVING;
		}
		return STABLE;
	}

	@JsonValue
	public String getLabel() {
		return label;
	}
}
