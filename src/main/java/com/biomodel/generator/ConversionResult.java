package com.biomodel.generator;

import java.nio.file.Path;

import com.biomodel.generator.model.OdeModel;

import lombok.Builder;
import lombok.Data;

/**
 * Result of converting a model text.
 */
@Data
@Builder
public class ConversionResult {
    private boolean success;
    private String errorMessage;
    private int errorLine;

    private OdeModel model;
    private Path reportPath;

    private int reactionCount;
    private int speciesCount;
    private int parameterCount;
    private int excludedParameterCount;
    private int observableCount;
    private int conditionCount;

    public static ConversionResult failure(String errorMessage) {
        return ConversionResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }

    public static ConversionResult failure(String errorMessage, int errorLine) {
        return ConversionResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .errorLine(errorLine)
                .build();
    }
}
