package com.barthel.fragility.adapter.in.web.dto;

import java.util.List;

public record GridCurveDto(List<Double> xValues, List<Double> fcValues, Double finalPof) {
}
