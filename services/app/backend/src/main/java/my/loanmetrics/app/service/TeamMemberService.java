package my.loanmetrics.app.service;

import my.loanmetrics.app.config.AppProperties;
import my.loanmetrics.app.model.TeamMember;
import my.loanmetrics.app.model.TeamMemberId;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class TeamMemberService {
	private final AppProperties properties;

	public TeamMemberService(AppProperties properties) {
		this.properties = properties;
	}

	public List<TeamMember> listMembers() {
		return properties.teamMembers().stream()
				.map(member -> new TeamMember(TeamMemberId.parse(member.id()), member.name(), member.role()))
				.toList();
	}
}
