package eu.nebulouscloud.ensembleforecaster.ensembling;

import eu.nebulouscloud.ensembleforecaster.dataset.TimeSeriesDataset;
import eu.nebulouscloud.ensembleforecaster.exception.ComponentTrainingException;
import eu.nebulouscloud.ensembleforecaster.exception.ForecastingException;
import eu.nebulouscloud.ensembleforecaster.model.ForecastModel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Splits data chronologically and trains component models in parallel on a bounded pool.
 * <p>
 * Every job is joined before {@link #train} returns. A job that fails only removes its own model
 * from the outcome.
 */
@Slf4j
@Getter
public class TrainingCoordinator {

    private final double validationFraction;
    private final int maxParallelism;

    public TrainingCoordinator(double validationFraction, int maxParallelism) {
        if (!(validationFraction >= 0 && validationFraction < 1)) {
            throw new IllegalArgumentException("Validation fraction must be in [0, 1), got " + validationFraction);
        }
        if (maxParallelism < 1) {
            throw new IllegalArgumentException("Maximum parallelism must be positive, got " + maxParallelism);
        }
        this.validationFraction = validationFraction;
        this.maxParallelism = maxParallelism;
    }

    /**
     * Training slice is the first {@code floor(N * (1 - validationFraction))} rows, validation the rest.
     */
    public DataSplit split(TimeSeriesDataset dataset) {
        int splitIndex = (int) Math.floor(dataset.size() * (1 - validationFraction));
        log.debug("Splitting {} rows at index {}", dataset.size(), splitIndex);
        return new DataSplit(
                dataset.slice(0, splitIndex),
                dataset.slice(splitIndex, dataset.size()),
                splitIndex);
    }

    public TrainingOutcome train(List<ForecastModel> models, TimeSeriesDataset trainingData, String targetField) {
        if (models.isEmpty()) {
            return new TrainingOutcome(List.of(), Map.of());
        }
        int poolSize = Math.min(models.size(), maxParallelism);
        log.info("Training {} component models on {} rows with {} workers",
                models.size(), trainingData.size(), poolSize);

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setThreadNamePrefix("ensemble-training-");
        // dispatched jobs are never cancelled
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();

        try {
            List<Future<ForecastModel>> jobs = new ArrayList<>(models.size());
            for (ForecastModel model : models) {
                jobs.add(executor.submit(() -> trainOne(model, trainingData, targetField)));
            }

            List<ForecastModel> trained = new ArrayList<>();
            Map<String, ComponentTrainingException> failures = new LinkedHashMap<>();
            for (int i = 0; i < jobs.size(); i++) {
                String name = models.get(i).getName();
                try {
                    trained.add(jobs.get(i).get());
                } catch (ExecutionException e) {
                    ComponentTrainingException failure = new ComponentTrainingException(name, e.getCause());
                    log.error("Error training {}, excluding it from the roster: {}", name, e.getCause().getMessage());
                    failures.put(name, failure);
                }
            }
            log.info("Training finished: {} succeeded, {} failed {}", trained.size(), failures.size(),
                    failures.keySet());
            return new TrainingOutcome(trained, failures);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ForecastingException("Interrupted while waiting for component models to train", e);
        } finally {
            executor.shutdown();
        }
    }

    private static ForecastModel trainOne(ForecastModel model, TimeSeriesDataset trainingData, String targetField) {
        long start = System.currentTimeMillis();
        model.fit(trainingData, targetField);
        log.debug("Trained {} in {} ms", model.getName(), System.currentTimeMillis() - start);
        return model;
    }
}
