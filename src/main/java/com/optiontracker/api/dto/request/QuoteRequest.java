package com.optiontracker.api.dto.request;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Latest quote for a position's contract. Either side may be missing. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class QuoteRequest {

    private BigDecimal bid;
    private BigDecimal ask;
}
