/**
 *
 */
package org.theseed.community.sim;

/**
 * This interface describes a linear-program solver.  The solver must report infeasible and
 * unbounded problems through the result status rather than by throwing.
 */
public interface LpSolver {

    /**
     * @return the solution of a linear program
     *
     * @param problem	problem to solve
     */
    public SolveResult solve(LpProblem problem);

}
