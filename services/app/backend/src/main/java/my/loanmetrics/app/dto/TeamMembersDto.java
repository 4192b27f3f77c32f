package my.loanmetrics.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import my.loanmetrics.app.model.TeamMember;

import java.util.List;

public record TeamMembersDto(@JsonProperty("team_members") List<TeamMember> teamMembers) {
}
