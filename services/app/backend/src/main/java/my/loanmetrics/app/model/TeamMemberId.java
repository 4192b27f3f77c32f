package my.loanmetrics.app.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Identifier of an audit team member. Upstream rosters carry either a numeric id, a textual id, or the literal
 * {@code 0} when the member has no id.
 * <p>
 * JSON encoding: {@link Kind#INTEGER} as a number, {@link Kind#TEXT} as a string, {@link Kind#ABSENT} as {@code 0}.
 */
public final class TeamMemberId {
	private static final TeamMemberId ABSENT = new TeamMemberId(Kind.ABSENT, 0L, null);
	private static final Pattern INTEGER_LITERAL = Pattern.compile("[+-]?\\d{1,18}");

	public enum Kind {
		INTEGER,
		TEXT,
		ABSENT
	}

	private final Kind kind;
	private final long number;
	private final String text;

	private TeamMemberId(Kind kind, long number, String text) {
		this.kind = kind;
		this.number = number;
		this.text = text;
	}

	/**
	 * Zero is reserved for the absent id, so {@code ofInteger(0)} yields {@link #absent()}.
	 */
	public static TeamMemberId ofInteger(long value) {
		if (value == 0L) {
			return ABSENT;
		}
		return new TeamMemberId(Kind.INTEGER, value, null);
	}

	public static TeamMemberId ofText(String value) {
		if (value == null || value.isEmpty()) {
			return ABSENT;
		}
		return new TeamMemberId(Kind.TEXT, 0L, value);
	}

	public static TeamMemberId absent() {
		return ABSENT;
	}

	/**
	 * Parses a configured id: blank or {@code "0"} is absent, an integer literal is numeric, anything else is text.
	 */
	public static TeamMemberId parse(String raw) {
		if (raw == null || raw.isBlank()) {
			return ABSENT;
		}
		String trimmed = raw.trim();
		if (INTEGER_LITERAL.matcher(trimmed).matches()) {
			return ofInteger(Long.parseLong(trimmed));
		}
		return ofText(trimmed);
	}

	@JsonCreator(mode = JsonCreator.Mode.DELEGATING)
	public static TeamMemberId fromJson(Object raw) {
		if (raw == null) {
			return ABSENT;
		}
		if (raw instanceof String value) {
			return ofText(value);
		}
		if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
			return ofInteger(((Number) raw).longValue());
		}
		try {
			if (raw instanceof BigInteger value) {
				return ofInteger(value.longValueExact());
			}
			if (raw instanceof Number value) {
				BigDecimal decimal = new BigDecimal(value.toString());
				if (decimal.stripTrailingZeros().scale() <= 0) {
					return ofInteger(decimal.longValueExact());
				}
				throw new IllegalArgumentException("Team member id must be an integer, got " + value);
			}
		} catch (ArithmeticException ex) {
			throw new IllegalArgumentException("Team member id is out of range: " + raw, ex);
		}
		throw new IllegalArgumentException("Unsupported team member id type: " + raw.getClass().getSimpleName());
	}

	@JsonValue
	public Object toJson() {
		return switch (kind) {
			case INTEGER -> number;
			case TEXT -> text;
			case ABSENT -> 0;
		};
	}

	public Kind getKind() {
		return kind;
	}

	public boolean isAbsent() {
		return kind == Kind.ABSENT;
	}

	public long getNumber() {
		if (kind != Kind.INTEGER) {
			throw new IllegalStateException("Team member id is not numeric: " + kind);
		}
		return number;
	}

	public String getText() {
		if (kind != Kind.TEXT) {
			throw new IllegalStateException("Team member id is not textual: " + kind);
		}
		return text;
	}

	@Override
	public boolean equals(Object other) {
		if (this == other) {
			return true;
		}
		if (!(other instanceof TeamMemberId that)) {
			return false;
		}
		return kind == that.kind && number == that.number && Objects.equals(text, that.text);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, number, text);
	}

	@Override
	public String toString() {
		return switch (kind) {
			case INTEGER -> "TeamMemberId[" + number + "]";
			case TEXT -> "TeamMemberId[\"" + text + "\"]";
			case ABSENT -> "TeamMemberId[absent]";
		};
	}
}
