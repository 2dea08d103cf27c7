package com.optiontracker.pricing.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ExpirationResponse {

    /** yyyy-MM-dd, occasionally a full ISO timestamp. */
    @JsonAlias("formatted_date")
    private String date;

    private int daysToExpiration;
}
