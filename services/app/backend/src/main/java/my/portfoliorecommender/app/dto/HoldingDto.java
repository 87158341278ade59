package my.portfoliorecommender.app.dto;

import jakarta.validation.constraints.PositiveOrZero;

public record HoldingDto(
		String ticker,
		@PositiveOrZero Double shares,
		@PositiveOrZero Double pricePaid
) {
}
