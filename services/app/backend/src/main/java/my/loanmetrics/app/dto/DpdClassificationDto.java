package my.loanmetrics.app.dto;

import my.loanmetrics.app.model.DpdStatus;
import my.loanmetrics.app.model.RollDirection;

public record DpdClassificationDto(int currentDpd,
								   int previousDpd,
								   DpdStatus status,
								   RollDirection rollDirection) {
}
