package com.tradestager.mapper;

import com.tradestager.api.dto.request.LegRequest;
import com.tradestager.api.dto.request.PortfolioRequest;
import com.tradestager.api.dto.request.PositionRequest;
import com.tradestager.api.dto.request.StageStrategyRequest;
import com.tradestager.api.dto.response.OrderResponse;
import com.tradestager.api.dto.response.StrategyResponse;
import com.tradestager.domain.enums.StrategyArchetype;
import com.tradestager.domain.model.Leg;
import com.tradestager.domain.model.OrderRecord;
import com.tradestager.domain.model.PortfolioPosition;
import com.tradestager.domain.model.PortfolioSnapshot;
import com.tradestager.domain.model.StrategyCandidate;
import com.tradestager.domain.model.StrategySnapshot;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper for the staging API DTOs.
 *
 * <p>Requests map to the domain candidate and portfolio snapshot; ledger projections map to
 * flat response DTOs. Archetypes travel as their snake_case code; an unknown code maps to a
 * null archetype, which the structural validator reports as unsupported.
 */
@Mapper
public interface StagingDtoMapper {

    // Request -> Domain

    @Mapping(target = "id", source = "candidateId")
    StrategyCandidate toCandidate(StageStrategyRequest request);

    Leg toLeg(LegRequest request);

    PortfolioSnapshot toPortfolio(PortfolioRequest request);

    PortfolioPosition toPosition(PositionRequest request);

    // Domain -> Response

    @Mapping(target = "side", source = "leg.side")
    @Mapping(target = "optionType", source = "leg.optionType")
    @Mapping(target = "strike", source = "leg.strike")
    @Mapping(target = "quantity", source = "leg.quantity")
    OrderResponse toResponse(OrderRecord order);

    List<OrderResponse> toOrderResponseList(List<OrderRecord> orders);

    @Mapping(target = "id", source = "strategy.id")
    @Mapping(target = "candidateId", source = "strategy.candidate.id")
    @Mapping(target = "symbol", source = "strategy.candidate.symbol")
    @Mapping(target = "archetype", source = "strategy.candidate.archetype")
    @Mapping(target = "declaredMaxRisk", source = "strategy.candidate.declaredMaxRisk")
    @Mapping(target = "createdAt", source = "strategy.createdAt")
    @Mapping(target = "assessment", source = "strategy.assessment")
    StrategyResponse toResponse(StrategySnapshot snapshot);

    List<StrategyResponse> toStrategyResponseList(List<StrategySnapshot> snapshots);

    default StrategyArchetype toArchetype(String code) {
        return StrategyArchetype.fromCode(code).orElse(null);
    }

    default String toArchetypeCode(StrategyArchetype archetype) {
        return archetype != null ? archetype.getCode() : null;
    }
}
