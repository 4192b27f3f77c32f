package my.loanmetrics.app.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RiskBandTest {
	@Test
	void lowerBoundsAreInclusive() {
		assertThat(RiskBand.fromScore(100)).isEqualTo(RiskBand.GREEN);
		assertThat(RiskBand.fromScore(80)).isEqualTo(RiskBand.GREEN);
		assertThat(RiskBand.fromScore(79)).isEqualTo(RiskBand.WATCH);
		assertThat(RiskBand.fromScore(60)).isEqualTo(RiskBand.WATCH);
		assertThat(RiskBand.fromScore(59)).isEqualTo(RiskBand.AMBER);
		assertThat(RiskBand.fromScore(40)).isEqualTo(RiskBand.AMBER);
		assertThat(RiskBand.fromScore(39)).isEqualTo(RiskBand.RED);
		assertThat(RiskBand.fromScore(0)).isEqualTo(RiskBand.RED);
	}

	@Test
	void exposesDisplayLabels() {
		assertThat(RiskBand.GREEN.getLabel()).isEqualTo("Green");
		assertThat(RiskBand.WATCH.getLabel()).isEqualTo("Watch");
		assertThat(RiskBand.AMBER.getLabel()).isEqualTo("Amber");
		assertThat(RiskBand.RED.getLabel()).isEqualTo("Red");
	}
}
