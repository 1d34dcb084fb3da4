/**
 *
 */
package org.theseed.community.sim;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.community.MetaModel;

/**
 * This class performs flux variability analysis with an LP solver.  The model is first solved
 * for its own objective.  The objective is then constrained to the specified fraction of the
 * optimum, and each reaction of interest is minimized and maximized.  The individual
 * optimizations are independent and run in a worker pool.
 */
public class SimplexFluxVariability implements FluxVariability {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(SimplexFluxVariability.class);
    /** solver for the optimizations */
    private LpSolver solver;
    /** fraction of the optimum the objective must retain */
    private double fraction;
    /** number of parallel workers */
    private int workers;
    /** default optimum fraction */
    public static final double DEFAULT_FRACTION = 0.9999;

    /**
     * Construct a flux variability analyzer.
     *
     * @param solver		LP solver to use
     * @param fraction		fraction of the optimum the objective must retain
     * @param workers		number of parallel workers
     */
    public SimplexFluxVariability(LpSolver solver, double fraction, int workers) {
        this.solver = solver;
        this.fraction = fraction;
        this.workers = Math.max(1, workers);
    }

    @Override
    public Map<String, FluxRange> compute(MetaModel model, Collection<String> reactionIds) {
        Map<String, FluxRange> retVal = new LinkedHashMap<String, FluxRange>(reactionIds.size() * 4 / 3 + 1);
        LpProblem base = new LpProblem(model);
        SolveResult optimum = this.solver.solve(base);
        if (! optimum.isOptimal()) {
            log.warn("Flux variability for {} failed: base problem is {}.", model.getName(), optimum.getStatus());
            for (String reactionId : reactionIds)
                retVal.put(reactionId, new FluxRange(Double.NaN, Double.NaN));
        } else {
            final LpProblem constrained = this.constrainObjective(base, optimum.getObjectiveValue());
            List<String> ids = new ArrayList<String>(reactionIds);
            List<FluxRange> ranges;
            if (this.workers <= 1)
                ranges = ids.stream().map(x -> this.range(constrained, x)).collect(Collectors.toList());
            else {
                ForkJoinPool pool = new ForkJoinPool(this.workers);
                try {
                    ranges = pool.submit(() -> ids.parallelStream().map(x -> this.range(constrained, x))
                            .collect(Collectors.toList())).get();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Flux variability interrupted.", e);
                } catch (ExecutionException e) {
                    throw new IllegalStateException("Flux variability failed: " + e.getCause().toString(), e.getCause());
                } finally {
                    pool.shutdown();
                }
            }
            for (int i = 0; i < ids.size(); i++)
                retVal.put(ids.get(i), ranges.get(i));
            log.debug("Flux variability computed for {} reactions in {}.", ids.size(), model.getName());
        }
        return retVal;
    }

    /**
     * @return a copy of a problem with the objective held near its optimum
     *
     * @param base			base problem
     * @param optimum		optimal objective value
     */
    protected LpProblem constrainObjective(LpProblem base, double optimum) {
        double slack = Math.abs(optimum) * (1.0 - this.fraction);
        LpProblem retVal;
        if (base.isMaximize())
            retVal = base.withConstraint(base.getObjective(), optimum - slack, Double.POSITIVE_INFINITY);
        else
            retVal = base.withConstraint(base.getObjective(), Double.NEGATIVE_INFINITY, optimum + slack);
        return retVal;
    }

    /**
     * @return the flux range for one reaction
     *
     * @param problem		problem with the objective constrained
     * @param reactionId	ID of the reaction of interest
     */
    private FluxRange range(LpProblem problem, String reactionId) {
        SolveResult min = this.solver.solve(problem.withObjective(reactionId, false));
        SolveResult max = this.solver.solve(problem.withObjective(reactionId, true));
        return new FluxRange(min.getObjectiveValue(), max.getObjectiveValue());
    }

}
