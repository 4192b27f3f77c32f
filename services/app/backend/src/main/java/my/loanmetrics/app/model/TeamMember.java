package my.loanmetrics.app.model;

public record TeamMember(TeamMemberId id, String name, String role) {
	public TeamMember {
		if (id == null) {
			id = TeamMemberId.absent();
		}
	}
}
