package com.biomodel.generator.patient;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one independent model per patient on a fixed worker pool.
 *
 * <p>Results are returned in completion order. A failing patient yields a
 * failed {@link PatientResult} and does not affect the others.
 */
public class PatientModelRunner {
    private static final Logger log = LoggerFactory.getLogger(PatientModelRunner.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final List<String> patients;

    public PatientModelRunner(List<String> patients) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String patient : patients) {
            counts.merge(patient, 1, Integer::sum);
        }
        List<String> duplicates = counts.entrySet().stream()
                .filter(entry -> entry.getValue() > 1)
                .map(Map.Entry::getKey)
                .toList();
        if (!duplicates.isEmpty()) {
            throw new IllegalArgumentException("Duplicate patient: " + String.join(", ", duplicates));
        }
        this.patients = List.copyOf(patients);
    }

    public List<String> getPatients() {
        return patients;
    }

    /**
     * One worker per available processor, leaving one for the caller.
     */
    public static int defaultPoolSize() {
        return Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
    }

    public <R> List<PatientResult<R>> run(Function<String, R> model) {
        return run(model, defaultPoolSize());
    }

    public <R> List<PatientResult<R>> run(Function<String, R> model, int poolSize) {
        if (poolSize < 1) {
            throw new IllegalArgumentException("Pool size must be positive, got " + poolSize);
        }
        List<PatientResult<R>> results = new ArrayList<>(patients.size());
        if (patients.isEmpty()) {
            return results;
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(poolSize, patients.size()));
        CompletionService<PatientResult<R>> completion = new ExecutorCompletionService<>(executor);
        try {
            for (String patient : patients) {
                completion.submit(() -> execute(model, patient));
            }
            for (int done = 1; done <= patients.size(); done++) {
                PatientResult<R> result = completion.take().get();
                results.add(result);
                log.info("[{}/{}] {} {}", done, patients.size(), result.getPatient(),
                        result.isSuccess() ? "finished" : "failed");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while running patient models", e);
        } catch (ExecutionException e) {
            // only a VirtualMachineError escapes execute()
            throw new IllegalStateException("Patient worker failed unexpectedly", e.getCause());
        } finally {
            shutdown(executor);
        }
        return results;
    }

    private static <R> PatientResult<R> execute(Function<String, R> model, String patient) {
        try {
            return PatientResult.success(patient, model.apply(patient));
        } catch (Exception | LinkageError | AssertionError e) {
            // VirtualMachineError still aborts the whole run
            log.warn("Patient {} failed: {}", patient, e.toString());
            return PatientResult.failure(patient, e);
        }
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Patient workers did not terminate gracefully, forcing shutdown.");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
