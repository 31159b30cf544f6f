package com.biomodel.generator.patient;

import java.util.Optional;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of running one patient-specific model: either a value or the
 * failure that stopped it.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PatientResult<R> {
    String patient;
    R value;
    Throwable failure;

    public static <R> PatientResult<R> success(String patient, R value) {
        return new PatientResult<>(patient, value, null);
    }

    public static <R> PatientResult<R> failure(String patient, Throwable failure) {
        return new PatientResult<>(patient, null, failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public Optional<R> getValueIfPresent() {
        return Optional.ofNullable(value);
    }
}
