package my.loanmetrics.app.dto;

import my.loanmetrics.app.model.RiskBand;

public record RiskBandDto(int score, RiskBand band) {
}
