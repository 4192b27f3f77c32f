package my.loanmetrics.app.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TopOfficer(@JsonProperty("officer_id") String officerId,
						 String name,
						 double ayr) {
}
