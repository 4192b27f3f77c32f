package my.loanmetrics.app.api;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(classes = my.loanmetrics.app.AppApplication.class)
@ActiveProfiles("test")
class MetricsApiIntegrationTest {
	private MockMvc mockMvc;

	@Autowired
	private WebApplicationContext context;

	@BeforeEach
	void setUp() {
		mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
	}

	@Test
	void portfolioReportAggregatesOfficers() throws Exception {
		String body = """
				[
				  {
				    "officer_id": "OF-1",
				    "name": "Chidi Okafor",
				    "region": "Lagos",
				    "branch": "Lekki",
				    "channel": "Direct",
				    "rawMetrics": {
				      "disbursed": 40,
				      "overdue15d": 150000,
				      "totalPortfolio": 1000000,
				      "interestCollected": 40000,
				      "feesCollected": 10000,
				      "par15MidMonth": 100000
				    }
				  },
				  {
				    "officer_id": "OF-2",
				    "name": "Funke Ade",
				    "region": "Lagos",
				    "branch": "Ikeja",
				    "channel": "Agent",
				    "rawMetrics": {
				      "firstMiss": 30,
				      "disbursed": 10,
				      "interestCollected": 25000,
				      "feesCollected": 25000,
				      "par15MidMonth": 100000
				    }
				  },
				  {
				    "officer_id": "OF-3",
				    "name": "No Snapshot"
				  }
				]
				""";

		mockMvc.perform(post("/api/metrics/portfolio")
						.contentType(MediaType.APPLICATION_JSON)
						.content(body))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.portfolio.totalOfficers").value(3))
				.andExpect(jsonPath("$.portfolio.totalLoans").value(50))
				.andExpect(jsonPath("$.portfolio.avgRiskScore").value(45))
				.andExpect(jsonPath("$.portfolio.avgAYR").value(1.0 / 3.0))
				.andExpect(jsonPath("$.portfolio.watchlistCount").value(1))
				.andExpect(jsonPath("$.portfolio.topOfficer.officer_id").value("OF-1"))
				.andExpect(jsonPath("$.portfolio.topOfficer.ayr").value(0.5))
				.andExpect(jsonPath("$.officers[0].calculatedMetrics.porr").value(0.15))
				.andExpect(jsonPath("$.officers[0].calculatedMetrics.riskScore").value(96))
				.andExpect(jsonPath("$.officers[0].riskBand").value("Green"))
				.andExpect(jsonPath("$.officers[1].riskBand").value("Red"))
				.andExpect(jsonPath("$.officers[2].calculatedMetrics").isEmpty())
				.andExpect(jsonPath("$.summaries[1].fimr").value(3.0));
	}

	@Test
	void emptyPortfolioIsNotAnError() throws Exception {
		mockMvc.perform(post("/api/metrics/portfolio")
						.contentType(MediaType.APPLICATION_JSON)
						.content("[]"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.portfolio.totalOfficers").value(0))
				.andExpect(jsonPath("$.portfolio.avgDQI").value(0))
				.andExpect(jsonPath("$.portfolio.topOfficer").isEmpty());
	}

	@Test
	void oversizedPortfolioIsRejected() throws Exception {
		String officer = "{\"officer_id\":\"OF\",\"rawMetrics\":{}}";
		String body = "[" + String.join(",", officer, officer, officer, officer, officer, officer) + "]";

		mockMvc.perform(post("/api/metrics/portfolio")
						.contentType(MediaType.APPLICATION_JSON)
						.content(body))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.title").value("Bad Request"))
				.andExpect(jsonPath("$.path").value("/api/metrics/portfolio"));
	}

	@Test
	void calculatesSingleOfficer() throws Exception {
		mockMvc.perform(post("/api/metrics/officers/calculate")
						.contentType(MediaType.APPLICATION_JSON)
						.content("{\"officer_id\":\"OF-7\",\"rawMetrics\":{\"firstMiss\":10,\"disbursed\":100,\"hadFloatGap\":true}}"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.officer_id").value("OF-7"))
				.andExpect(jsonPath("$.calculatedMetrics.fimr").value(0.1))
				.andExpect(jsonPath("$.calculatedMetrics.channelPurity").value(1.0))
				.andExpect(jsonPath("$.riskBand").value("Green"));
	}

	@Test
	void singleOfficerRequiresIdentityAndSnapshot() throws Exception {
		mockMvc.perform(post("/api/metrics/officers/calculate")
						.contentType(MediaType.APPLICATION_JSON)
						.content("{\"rawMetrics\":{}}"))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.title").value("Validation failed"));

		mockMvc.perform(post("/api/metrics/officers/calculate")
						.contentType(MediaType.APPLICATION_JSON)
						.content("{\"officer_id\":\"OF-7\"}"))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.title").value("Bad Request"));
	}

	@Test
	void missingCountersDefaultToZero() throws Exception {
		mockMvc.perform(post("/api/metrics/officers/calculate")
						.contentType(MediaType.APPLICATION_JSON)
						.content("{\"officer_id\":\"A\",\"rawMetrics\":{\"firstMiss\":10,\"disbursed\":100}}"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.rawMetrics.entries").value(0))
				.andExpect(jsonPath("$.rawMetrics.hadFloatGap").value(false))
				.andExpect(jsonPath("$.calculatedMetrics.fimr").value(0.1))
				.andExpect(jsonPath("$.calculatedMetrics.riskScore").value(98))
				.andExpect(jsonPath("$.calculatedMetrics.dqi").value(98));

		mockMvc.perform(post("/api/metrics/officers/calculate")
						.contentType(MediaType.APPLICATION_JSON)
						.content("{\"officer_id\":\"B\",\"rawMetrics\":{\"overdue15d\":150000,\"totalPortfolio\":1000000,\"waivers\":null}}"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.calculatedMetrics.porr").value(0.15))
				.andExpect(jsonPath("$.calculatedMetrics.riskScore").value(96));
	}

	@Test
	void mistypedCounterNamesTheProperty() throws Exception {
		mockMvc.perform(post("/api/metrics/portfolio")
						.contentType(MediaType.APPLICATION_JSON)
						.content("[{\"officer_id\":\"A\",\"rawMetrics\":{\"firstMiss\":\"many\"}}]"))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.title").value("Invalid request body"))
				.andExpect(jsonPath("$.detail", containsString("rawMetrics.firstMiss")))
				.andExpect(jsonPath("$.errors[0]", containsString("rawMetrics.firstMiss")));
	}

	@Test
	void malformedBodyIsBadRequest() throws Exception {
		mockMvc.perform(post("/api/metrics/portfolio")
						.contentType(MediaType.APPLICATION_JSON)
						.content("{not json"))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.title").value("Malformed request"));
	}

	@Test
	void classifiesRiskBand() throws Exception {
		mockMvc.perform(get("/api/metrics/risk-band").param("score", "59"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.score").value(59))
				.andExpect(jsonPath("$.band").value("Amber"));
	}

	@Test
	void classifiesDpdStatus() throws Exception {
		mockMvc.perform(get("/api/metrics/dpd-status")
						.param("currentDpd", "16")
						.param("previousDpd", "20"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.status").value("Rolled to D16-30"))
				.andExpect(jsonPath("$.rollDirection").value("Improving"));

		mockMvc.perform(get("/api/metrics/dpd-status"))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.title").value("Invalid parameter"));
	}

	@Test
	void listsTeamMembersWithTaggedIds() throws Exception {
		mockMvc.perform(get("/api/team-members"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.team_members[0].id").value(12))
				.andExpect(jsonPath("$.team_members[0].name").value("Ada Obi"))
				.andExpect(jsonPath("$.team_members[1].id").value("AUD-7"))
				.andExpect(jsonPath("$.team_members[2].id").value(0));
	}

	@Test
	void unknownRouteIsNotFound() throws Exception {
		mockMvc.perform(get("/api/unknown"))
				.andExpect(status().isNotFound())
				.andExpect(jsonPath("$.title").value("Not Found"));
	}
}
