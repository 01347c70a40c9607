package com.barthel.fragility.adapter.out.climate;

import com.barthel.fragility.application.port.out.FetchPreparedClimatePort;
import com.barthel.fragility.config.FragilityProperties;
import com.barthel.fragility.domain.model.GridBounds;
import com.barthel.fragility.domain.model.GridCell;
import com.barthel.fragility.domain.model.PreparedClimateData;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * WebClient based adapter fetching prepared climate datasets from the
 * climate service.
 */
@Component
@Slf4j
public class ClimateServiceClient implements FetchPreparedClimatePort {

    private final WebClient webClient;
    private final Duration timeout;

    public ClimateServiceClient(WebClient.Builder webClientBuilder, FragilityProperties properties) {
        this.webClient = webClientBuilder
                .baseUrl(properties.getClimateService().getBaseUrl())
                .build();
        this.timeout = properties.getClimateService().getTimeout();
    }

    @Override
    public Optional<PreparedClimateData> fetchPrepared(String hazard) {
        log.info("Fetching prepared climate data for hazard={}", hazard);
        PreparedResponse response = webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/prepared")
                        .queryParam("hazard", hazard)
                        .build())
                .exchangeToMono(clientResponse -> {
                    if (clientResponse.statusCode().value() == HttpStatus.NOT_FOUND.value()) {
                        return Mono.<PreparedResponse>empty();
                    }
                    if (clientResponse.statusCode().isError()) {
                        return clientResponse.createException()
                                .flatMap(e -> Mono.<PreparedResponse>error(e));
                    }
                    return clientResponse.bodyToMono(PreparedResponse.class);
                })
                .block(timeout);

        if (response == null) {
            log.warn("No climate data found for hazard={}", hazard);
            return Optional.empty();
        }
        return Optional.of(response.toDomain());
    }

    private record PreparedResponse(List<String> variables, List<String> times, List<GridResponse> data) {
        PreparedClimateData toDomain() {
            List<GridCell> cells = data == null
                    ? List.of()
                    : data.stream().map(GridResponse::toDomain).toList();
            return new PreparedClimateData(variables, times, cells);
        }
    }

    private record GridResponse(
            @JsonProperty("grid_index") int gridIndex,
            BoundsResponse bounds,
            Map<String, List<Double>> climate) {
        GridCell toDomain() {
            return new GridCell(gridIndex, bounds == null ? null : bounds.toDomain(), climate);
        }
    }

    private record BoundsResponse(
            @JsonProperty("min_lat") double minLat,
            @JsonProperty("max_lat") double maxLat,
            @JsonProperty("min_lon") double minLon,
            @JsonProperty("max_lon") double maxLon) {
        GridBounds toDomain() {
            return new GridBounds(minLat, maxLat, minLon, maxLon);
        }
    }
}
