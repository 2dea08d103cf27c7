package com.optiontracker.api.controller;

import com.optiontracker.aggregation.PositionAggregator;
import com.optiontracker.api.dto.request.CreatePositionRequest;
import com.optiontracker.api.dto.request.MarkPriceRequest;
import com.optiontracker.api.dto.request.QuoteRequest;
import com.optiontracker.api.dto.response.CalculationStateResponse;
import com.optiontracker.calculation.CalculationOrchestrator;
import com.optiontracker.calculation.MarkPriceDeriver;
import com.optiontracker.domain.enums.CalculationMetric;
import com.optiontracker.domain.enums.CalculationState;
import com.optiontracker.domain.enums.PositionAction;
import com.optiontracker.domain.model.BatchCalculationResult;
import com.optiontracker.domain.model.CalculationOutcome;
import com.optiontracker.domain.model.GroupedPosition;
import com.optiontracker.domain.model.Position;
import com.optiontracker.exception.BusinessException;
import com.optiontracker.mapper.ApiDtoMapper;
import com.optiontracker.position.PositionBook;
import jakarta.validation.Valid;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for the position book and its calculations.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/positions -- list positions</li>
 *   <li>GET /api/positions/grouped -- positions grouped by underlying with totals</li>
 *   <li>POST /api/positions -- add a position</li>
 *   <li>PUT /api/positions/{id}/mark-price -- manual mark price (sets the override)</li>
 *   <li>PUT /api/positions/{id}/quote -- automatic mark price from a quote</li>
 *   <li>POST /api/positions/recalculate?metric= -- recalculate the whole book</li>
 *   <li>POST /api/positions/recalculate/theoretical-bulk -- theoretical P&L via the bulk call</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/positions")
public class PositionController {

    private static final Logger log = LoggerFactory.getLogger(PositionController.class);

    private final PositionBook positionBook;
    private final PositionAggregator positionAggregator;
    private final CalculationOrchestrator calculationOrchestrator;
    private final MarkPriceDeriver markPriceDeriver;
    private final ApiDtoMapper apiDtoMapper;

    public PositionController(
            PositionBook positionBook,
            PositionAggregator positionAggregator,
            CalculationOrchestrator calculationOrchestrator,
            MarkPriceDeriver markPriceDeriver,
            ApiDtoMapper apiDtoMapper) {
        this.positionBook = positionBook;
        this.positionAggregator = positionAggregator;
        this.calculationOrchestrator = calculationOrchestrator;
        this.markPriceDeriver = markPriceDeriver;
        this.apiDtoMapper = apiDtoMapper;
    }

    @GetMapping
    public List<Position> listPositions() {
        return positionBook.findAll();
    }

    @GetMapping("/{id}")
    public Position getPosition(@PathVariable String id) {
        return positionBook.getById(id);
    }

    /** Derived on every call from the current book. */
    @GetMapping("/grouped")
    public List<GroupedPosition> getGroupedPositions() {
        return positionAggregator.groupByUnderlying(positionBook.findAll());
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Position createPosition(@RequestBody @Valid CreatePositionRequest request) {
        if (request.getQuantity() == 0) {
            throw new BusinessException("Quantity must not be zero");
        }
        Position position = apiDtoMapper.toDomain(request);
        if (position.getAction() == null) {
            position.setAction(PositionAction.BUY);
        }
        if (position.getMarkPrice() == null) {
            position.setMarkPrice(markPriceDeriver.derive(request.getBid(), request.getAsk()));
        }
        return positionBook.add(position);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deletePosition(@PathVariable String id) {
        positionBook.remove(id);
    }

    @PutMapping("/{id}/mark-price")
    public Position overrideMarkPrice(@PathVariable String id, @RequestBody @Valid MarkPriceRequest request) {
        return positionBook.overrideMarkPrice(id, request.getMarkPrice());
    }

    @DeleteMapping("/{id}/mark-price-override")
    public Position clearMarkPriceOverride(@PathVariable String id) {
        return positionBook.clearMarkPriceOverride(id);
    }

    @PutMapping("/{id}/quote")
    public Position applyQuote(@PathVariable String id, @RequestBody QuoteRequest request) {
        return positionBook.applyQuote(id, request.getBid(), request.getAsk());
    }

    @PostMapping("/recalculate")
    public BatchCalculationResult recalculateAll(@RequestParam CalculationMetric metric) {
        log.info("Recalculation of {} requested", metric);
        return calculationOrchestrator.recalculateAll(metric);
    }

    @PostMapping("/recalculate/theoretical-bulk")
    public BatchCalculationResult recalculateTheoreticalBulk() {
        return calculationOrchestrator.recalculateTheoreticalBulk();
    }

    @PostMapping("/{id}/recalculate")
    public CalculationOutcome<?> recalculate(@PathVariable String id, @RequestParam CalculationMetric metric) {
        return calculationOrchestrator.recalculate(id, metric);
    }

    @GetMapping("/{id}/calculation-state")
    public CalculationStateResponse getCalculationState(@PathVariable String id) {
        positionBook.getById(id);
        Map<String, CalculationState> states = new LinkedHashMap<>();
        for (CalculationMetric metric : CalculationMetric.values()) {
            states.put(metric.name(), calculationOrchestrator.getState(id, metric));
        }
        return CalculationStateResponse.builder().positionId(id).states(states).build();
    }
}
