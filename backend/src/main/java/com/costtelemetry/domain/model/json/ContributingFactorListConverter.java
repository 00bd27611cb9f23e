package com.costtelemetry.domain.model.json;

import com.costtelemetry.domain.model.ContributingFactor;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.List;

@Converter
public class ContributingFactorListConverter extends JsonAttributeConverter<List<ContributingFactor>> {

    public ContributingFactorListConverter() {
        super(new TypeReference<>() {});
    }
}
