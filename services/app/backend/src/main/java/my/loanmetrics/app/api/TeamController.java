package my.loanmetrics.app.api;

import my.loanmetrics.app.dto.TeamMembersDto;
import my.loanmetrics.app.service.TeamMemberService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/team-members")
public class TeamController {
	private final TeamMemberService teamMemberService;

	public TeamController(TeamMemberService teamMemberService) {
		this.teamMemberService = teamMemberService;
	}

	@GetMapping
	public TeamMembersDto list() {
		return new TeamMembersDto(teamMemberService.listMembers());
	}
}
