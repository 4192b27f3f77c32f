package my.loanmetrics.app.api;

import jakarta.validation.Valid;
import my.loanmetrics.app.dto.DpdClassificationDto;
import my.loanmetrics.app.dto.OfficerSnapshotDto;
import my.loanmetrics.app.dto.PortfolioReportDto;
import my.loanmetrics.app.dto.RiskBandDto;
import my.loanmetrics.app.model.OfficerMetrics;
import my.loanmetrics.app.model.RiskBand;
import my.loanmetrics.app.service.PortfolioReportService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/metrics")
public class MetricsController {
	private final PortfolioReportService portfolioReportService;

	public MetricsController(PortfolioReportService portfolioReportService) {
		this.portfolioReportService = portfolioReportService;
	}

	@PostMapping("/officers/calculate")
	public OfficerMetrics calculateOfficer(@Valid @RequestBody OfficerSnapshotDto snapshot) {
		return portfolioReportService.calculateOfficer(snapshot);
	}

	@PostMapping("/portfolio")
	public PortfolioReportDto portfolio(@RequestBody List<@Valid OfficerSnapshotDto> snapshots) {
		return portfolioReportService.buildReport(snapshots);
	}

	@GetMapping("/risk-band")
	public RiskBandDto riskBand(@RequestParam int score) {
		return new RiskBandDto(score, RiskBand.fromScore(score));
	}

	@GetMapping("/dpd-status")
	public DpdClassificationDto dpdStatus(@RequestParam int currentDpd,
										  @RequestParam(required = false) Integer previousDpd) {
		return portfolioReportService.classifyDelinquency(currentDpd, previousDpd);
	}
}
