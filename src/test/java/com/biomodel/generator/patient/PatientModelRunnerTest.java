package com.biomodel.generator.patient;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class PatientModelRunnerTest {

    @Test
    void testRunsEveryPatient() {
        PatientModelRunner runner = new PatientModelRunner(List.of("P1", "P22", "P333"));

        List<PatientResult<Integer>> results = runner.run(String::length, 2);

        assertThat(results).hasSize(3).allMatch(PatientResult::isSuccess);
        Map<String, Integer> values = results.stream()
                .collect(Collectors.toMap(PatientResult::getPatient, PatientResult::getValue));
        assertThat(values).containsEntry("P1", 2).containsEntry("P22", 3).containsEntry("P333", 4);
    }

    @Test
    void testFailureIsIsolated() {
        PatientModelRunner runner = new PatientModelRunner(List.of("ok", "bad", "fine"));

        List<PatientResult<String>> results = runner.run(patient -> {
            if (patient.equals("bad")) {
                throw new IllegalStateException("simulation diverged");
            }
            return patient.toUpperCase();
        }, 3);

        assertThat(results).hasSize(3);
        PatientResult<String> failed = results.stream().filter(r -> !r.isSuccess()).findFirst().orElseThrow();
        assertThat(failed.getPatient()).isEqualTo("bad");
        assertThat(failed.getFailure()).hasMessage("simulation diverged");
        assertThat(failed.getValueIfPresent()).isEmpty();
        assertThat(results.stream().filter(PatientResult::isSuccess).count()).isEqualTo(2);
    }

    @Test
    void testErrorThrownByModelIsIsolated() {
        PatientModelRunner runner = new PatientModelRunner(List.of("ok", "broken", "linked", "fine"));

        List<PatientResult<String>> results = runner.run(patient -> {
            if (patient.equals("broken")) {
                throw new AssertionError("negative concentration");
            }
            if (patient.equals("linked")) {
                throw new ExceptionInInitializerError("solver class failed to load");
            }
            return patient.toUpperCase();
        }, 2);

        assertThat(results).hasSize(4);
        Map<String, PatientResult<String>> byPatient = results.stream()
                .collect(Collectors.toMap(PatientResult::getPatient, r -> r));
        assertThat(byPatient.get("broken").getFailure())
                .isInstanceOf(AssertionError.class)
                .hasMessage("negative concentration");
        assertThat(byPatient.get("linked").getFailure()).isInstanceOf(ExceptionInInitializerError.class);
        assertThat(byPatient.get("ok").getValue()).isEqualTo("OK");
        assertThat(byPatient.get("fine").getValue()).isEqualTo("FINE");
    }

    @Test
    void testDuplicatePatients() {
        assertThatThrownBy(() -> new PatientModelRunner(List.of("a", "b", "a")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Duplicate patient: a");
    }

    @Test
    void testEmptyPatientList() {
        assertThat(new PatientModelRunner(List.of()).run(String::length)).isEmpty();
    }

    @Test
    void testInvalidPoolSize() {
        PatientModelRunner runner = new PatientModelRunner(List.of("a"));

        assertThatThrownBy(() -> runner.run(String::length, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testDefaultPoolSize() {
        assertThat(PatientModelRunner.defaultPoolSize()).isGreaterThanOrEqualTo(1);
    }
}
