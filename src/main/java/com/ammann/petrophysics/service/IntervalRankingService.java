/* (C)2026 */
package com.ammann.petrophysics.service;

import com.ammann.petrophysics.enumeration.HighPorosityZoneQuality;
import com.ammann.petrophysics.enumeration.PorosityQuality;
import com.ammann.petrophysics.enumeration.RankingCriterion;
import com.ammann.petrophysics.enumeration.ShaleQuality;
import com.ammann.petrophysics.model.Interval;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Attaches quality labels to intervals and orders them by a composite score.
 *
 * <p>Ranking is a stable descending sort, so intervals with equal scores keep their
 * depth order. Ranks are 1-based and the interval ranked 1 is the primary target.
 */
@ApplicationScoped
public class IntervalRankingService
{

    private static final Logger LOG = Logger.getLogger(IntervalRankingService.class);

    /**
     * Returns the quality label for an interval according to its kind.
     */
    public String classify(Interval interval)
    {
        return switch (interval.kind()) {
            case RESERVOIR -> PorosityQuality.fromPorosity(interval.meanValue()).name();
            case HIGH_POROSITY -> HighPorosityZoneQuality.fromPorosity(interval.meanValue()).name();
            case CLEAN_SAND -> ShaleQuality.fromShaleVolume(interval.meanValue()).name();
        };
    }

    public List<Interval> classifyAll(List<Interval> intervals)
    {
        List<Interval> labelled = new ArrayList<>(intervals.size());
        for (Interval interval : intervals) {
            labelled.add(interval.withQualityLabel(classify(interval)));
        }
        return labelled;
    }

    /**
     * Sorts a copy of {@code intervals} by descending score and assigns ranks 1..n.
     *
     * @param intervals intervals in depth order
     * @param criterion score to sort by
     * @return ranked copy; the input list is not modified
     */
    public List<Interval> rank(List<Interval> intervals, RankingCriterion criterion)
    {
        List<Interval> sorted = new ArrayList<>(intervals);
        sorted.sort(Comparator.<Interval>comparingDouble(criterion::score).reversed());

        List<Interval> ranked = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            ranked.add(sorted.get(i).withRank(i + 1));
        }

        if (!ranked.isEmpty()) {
            Interval top = ranked.get(0);
            LOG.debugf("Ranked %d intervals by %s, primary target %.2f-%.2f (score %.4f)",
                    ranked.size(), criterion, top.topDepth(), top.bottomDepth(), criterion.score(top));
        }
        return ranked;
    }

    /**
     * Classifies and ranks in one step with the default criterion of the set's kind.
     */
    public List<Interval> classifyAndRank(List<Interval> intervals)
    {
        if (intervals.isEmpty()) {
            return List.of();
        }
        return rank(classifyAll(intervals), RankingCriterion.defaultFor(intervals.get(0).kind()));
    }

    public Optional<Interval> primaryTarget(List<Interval> ranked)
    {
        return ranked.stream().filter(interval -> interval.rank() == 1).findFirst();
    }
}
