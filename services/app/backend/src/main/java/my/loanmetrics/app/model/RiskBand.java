package my.loanmetrics.app.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RiskBand {
	GREEN("Green", 80),
	WATCH("Watch", 60),
	AMBER("Amber", 40),
	RED("Red", Integer.MIN_VALUE);

	private final String label;
	private final int minScore;

	RiskBand(String label, int minScore) {
		this.label = label;
		this.minScore = minScore;
	}

	/**
	 * Lower bounds are inclusive: 80 is Green, 79 is Watch.
	 */
	public static RiskBand fromScore(int score) {
		for (RiskBand band : values()) {
			if (score >= band.minScore) {
				return band;
			}
		}
		return RED;
	}

	@JsonValue
	public String getLabel() {
		return label;
	}

	public int getMinScore() {
		return minScore;
	}
}
