package my.loanmetrics.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.List;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		@Valid Metrics metrics,
		@Valid Team team
) {
	public static final int DEFAULT_MAX_OFFICERS = 100_000;
	public static final int DEFAULT_DISPLAY_DECIMALS = 4;

	public int maxOfficers() {
		if (metrics == null || metrics.maxOfficers() == null) {
			return DEFAULT_MAX_OFFICERS;
		}
		return metrics.maxOfficers();
	}

	public int displayDecimals() {
		if (metrics == null || metrics.displayDecimals() == null) {
			return DEFAULT_DISPLAY_DECIMALS;
		}
		return metrics.displayDecimals();
	}

	public List<Team.Member> teamMembers() {
		if (team == null || team.members() == null) {
			return List.of();
		}
		return team.members();
	}

	public record Metrics(
			@Positive Integer maxOfficers,
			@Min(0) @Max(10) Integer displayDecimals
	) {
	}

	public record Team(
			List<@Valid Member> members
	) {
		public record Member(
				String id,
				@NotBlank String name,
				String role
		) {
		}
	}
}
