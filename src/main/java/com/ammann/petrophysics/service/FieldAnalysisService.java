/* (C)2026 */
package com.ammann.petrophysics.service;

import com.ammann.petrophysics.enumeration.RankingCriterion;
import com.ammann.petrophysics.model.Interval;
import com.ammann.petrophysics.model.WellLogDataset;
import com.ammann.petrophysics.service.WellAnalysisService.PorosityAnalysis;
import com.ammann.petrophysics.service.WellAnalysisService.PorosityAnalysisOptions;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Runs the porosity workflow over several wells concurrently.
 *
 * <p>One task per well is submitted to the bounded {@code well-analysis-executor}.
 * Each task uses the safe porosity workflow, so a well without usable curves shows
 * up as unavailable instead of failing the whole field. Results keep the input order.
 */
@ApplicationScoped
public class FieldAnalysisService
{

    private static final Logger LOG = Logger.getLogger(FieldAnalysisService.class);

    private final WellAnalysisService wellAnalysisService;
    private final Executor executor;

    @Inject
    public FieldAnalysisService(WellAnalysisService wellAnalysisService,
                                @Named("well-analysis-executor") ManagedExecutor executor)
    {
        this(wellAnalysisService, (Executor) executor);
    }

    FieldAnalysisService(WellAnalysisService wellAnalysisService, Executor executor)
    {
        this.wellAnalysisService = wellAnalysisService;
        this.executor = executor;
    }

    /**
     * Analyzes every dataset and picks the well whose primary target scores highest by
     * mean porosity times thickness.
     *
     * @param datasets wells to analyze
     * @param options  porosity options applied to every well, may be {@code null}
     * @return per-well results in input order plus field totals
     */
    public FieldAnalysis analyzeWells(List<WellLogDataset> datasets, PorosityAnalysisOptions options)
    {
        long startNs = System.nanoTime();

        List<CompletableFuture<PorosityAnalysis>> futures = new ArrayList<>(datasets.size());
        for (WellLogDataset dataset : datasets) {
            futures.add(CompletableFuture.supplyAsync(
                    () -> wellAnalysisService.analyzePorositySafely(dataset, options), executor));
        }

        List<PorosityAnalysis> results = new ArrayList<>(datasets.size());
        for (int i = 0; i < futures.size(); i++) {
            results.add(awaitResult(futures.get(i), datasets.get(i).getWellName()));
        }

        int analyzed = 0;
        String bestWell = null;
        Interval bestTarget = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (PorosityAnalysis result : results) {
            if (!result.available()) {
                continue;
            }
            analyzed++;
            Interval target = result.primaryTarget();
            if (target != null) {
                double score = RankingCriterion.VALUE_THICKNESS.score(target);
                if (score > bestScore) {
                    bestScore = score;
                    bestWell = result.wellName();
                    bestTarget = target;
                }
            }
        }

        long durationMs = (System.nanoTime() - startNs) / 1_000_000;
        LOG.infof("Field porosity analysis: %d wells, %d analyzed, %d unavailable, best well %s (%d ms)",
                results.size(), analyzed, results.size() - analyzed, bestWell, durationMs);

        return new FieldAnalysis(results, analyzed, results.size() - analyzed, bestWell, bestTarget);
    }

    private static PorosityAnalysis awaitResult(CompletableFuture<PorosityAnalysis> future, String wellName)
    {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            LOG.errorf(cause, "Porosity analysis task for well %s failed", wellName);
            return PorosityAnalysis.unavailable(wellName, "Analysis failed: " + cause.getMessage());
        }
    }

    /**
     * Field-level porosity result.
     *
     * @param wells            per-well results in input order
     * @param wellsAnalyzed    wells with an available result
     * @param wellsUnavailable wells that could not be analyzed
     * @param bestWell         well with the highest-scoring primary target, {@code null} if none
     * @param bestTarget       that well's primary target
     */
    public record FieldAnalysis(
            List<PorosityAnalysis> wells,
            int wellsAnalyzed,
            int wellsUnavailable,
            String bestWell,
            Interval bestTarget
    ) {}
}
