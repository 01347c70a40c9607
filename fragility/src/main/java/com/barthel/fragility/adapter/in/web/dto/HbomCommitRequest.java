package com.barthel.fragility.adapter.in.web.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record HbomCommitRequest(
        @NotBlank String sector,
        @NotEmpty List<@Valid ComponentInputDto> components) {
}
