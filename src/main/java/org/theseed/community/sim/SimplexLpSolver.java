/**
 *
 */
package org.theseed.community.sim;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.exception.TooManyIterationsException;
import org.apache.commons.math3.optim.MaxIter;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.linear.LinearConstraint;
import org.apache.commons.math3.optim.linear.LinearConstraintSet;
import org.apache.commons.math3.optim.linear.LinearObjectiveFunction;
import org.apache.commons.math3.optim.linear.NoFeasibleSolutionException;
import org.apache.commons.math3.optim.linear.NonNegativeConstraint;
import org.apache.commons.math3.optim.linear.Relationship;
import org.apache.commons.math3.optim.linear.SimplexSolver;
import org.apache.commons.math3.optim.linear.UnboundedSolutionException;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This solver uses the Apache Commons Math simplex implementation.  Column bounds are converted to
 * single-variable constraint rows, and the variables are unrestricted in sign.  It is suitable
 * for small and medium models; the problem is held in dense form.
 */
public class SimplexLpSolver implements LpSolver {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(SimplexLpSolver.class);
    /** maximum number of simplex iterations */
    private int maxIter;
    /** default iteration limit */
    public static final int DEFAULT_MAX_ITER = 100000;

    /**
     * Construct a simplex solver with the default iteration limit.
     */
    public SimplexLpSolver() {
        this(DEFAULT_MAX_ITER);
    }

    /**
     * Construct a simplex solver.
     *
     * @param maxIter	maximum number of simplex iterations
     */
    public SimplexLpSolver(int maxIter) {
        this.maxIter = maxIter;
    }

    @Override
    public SolveResult solve(LpProblem problem) {
        final int width = problem.width();
        List<LinearConstraint> constraints = new ArrayList<LinearConstraint>(width * 2 + problem.getRows().size());
        // Convert the column bounds.
        for (int col = 0; col < width; col++) {
            double lb = problem.getLower(col);
            double ub = problem.getUpper(col);
            if (lb > ub) {
                log.debug("Column {} has lower bound {} above upper bound {}.", problem.getColumns().get(col), lb, ub);
                return new SolveResult(problem, SolveResult.Status.INFEASIBLE);
            }
            double[] unit = new double[width];
            unit[col] = 1.0;
            if (lb == ub)
                constraints.add(new LinearConstraint(unit, Relationship.EQ, lb));
            else {
                if (lb != Double.NEGATIVE_INFINITY)
                    constraints.add(new LinearConstraint(unit, Relationship.GEQ, lb));
                if (ub != Double.POSITIVE_INFINITY)
                    constraints.add(new LinearConstraint(unit, Relationship.LEQ, ub));
            }
        }
        // Convert the rows.  An empty row is satisfied only if its range contains 0.
        for (LpProblem.Row row : problem.getRows()) {
            if (row.isEmpty()) {
                if (row.getMin() > 0.0 || row.getMax() < 0.0)
                    return new SolveResult(problem, SolveResult.Status.INFEASIBLE);
            } else {
                double[] coeffs = row.toDense(width);
                if (row.isEquality())
                    constraints.add(new LinearConstraint(coeffs, Relationship.EQ, row.getMin()));
                else {
                    if (row.getMin() != Double.NEGATIVE_INFINITY)
                        constraints.add(new LinearConstraint(coeffs, Relationship.GEQ, row.getMin()));
                    if (row.getMax() != Double.POSITIVE_INFINITY)
                        constraints.add(new LinearConstraint(coeffs, Relationship.LEQ, row.getMax()));
                }
            }
        }
        LinearObjectiveFunction function = new LinearObjectiveFunction(problem.getObjective(), 0.0);
        GoalType goal = (problem.isMaximize() ? GoalType.MAXIMIZE : GoalType.MINIMIZE);
        SolveResult retVal;
        try {
            SimplexSolver solver = new SimplexSolver();
            PointValuePair solution = solver.optimize(new MaxIter(this.maxIter), function,
                    new LinearConstraintSet(constraints), goal, new NonNegativeConstraint(false));
            retVal = new SolveResult(problem, solution.getValue(), solution.getPoint());
        } catch (NoFeasibleSolutionException e) {
            retVal = new SolveResult(problem, SolveResult.Status.INFEASIBLE);
        } catch (UnboundedSolutionException e) {
            retVal = new SolveResult(problem, SolveResult.Status.UNBOUNDED);
        } catch (TooManyIterationsException e) {
            log.warn("Simplex iteration limit of {} exceeded.", this.maxIter);
            retVal = new SolveResult(problem, SolveResult.Status.ITERATION_LIMIT);
        } catch (MathIllegalStateException e) {
            log.warn("Simplex solver failed: {}", e.getMessage());
            retVal = new SolveResult(problem, SolveResult.Status.ERROR);
        }
        log.debug("Solve of {} columns and {} constraints returned {}.", width, constraints.size(), retVal);
        return retVal;
    }

}
