/**
 *
 */
package org.theseed.community.sim;

import java.util.List;

/**
 * This object contains the outcome of a linear-program solve:  a status, the objective value,
 * and the primal flux values by column.  Only an optimal result has meaningful values.
 */
public class SolveResult {

    // FIELDS
    /** solution status */
    private Status status;
    /** objective value */
    private double objectiveValue;
    /** primal values, by column */
    private double[] primal;
    /** column IDs */
    private List<String> columns;

    /**
     * This enumeration describes the possible solution states.
     */
    public static enum Status {
        OPTIMAL, INFEASIBLE, UNBOUNDED, ITERATION_LIMIT, ERROR;
    }

    /**
     * Construct an optimal solve result.
     *
     * @param problem			problem solved
     * @param objectiveValue	optimal objective value
     * @param primal			primal values, by column
     */
    public SolveResult(LpProblem problem, double objectiveValue, double[] primal) {
        this.status = Status.OPTIMAL;
        this.objectiveValue = objectiveValue;
        this.primal = primal;
        this.columns = problem.getColumns();
    }

    /**
     * Construct a failed solve result.
     *
     * @param problem		problem solved
     * @param status		reason for the failure
     */
    public SolveResult(LpProblem problem, Status status) {
        this.status = status;
        this.objectiveValue = Double.NaN;
        this.primal = new double[0];
        this.columns = problem.getColumns();
    }

    /**
     * @return the solution status
     */
    public Status getStatus() {
        return this.status;
    }

    /**
     * @return TRUE if an optimal solution was found
     */
    public boolean isOptimal() {
        return this.status == Status.OPTIMAL;
    }

    /**
     * @return the objective value (NaN if the solve failed)
     */
    public double getObjectiveValue() {
        return this.objectiveValue;
    }

    /**
     * @return the primal value of a column (NaN if the solve failed)
     *
     * @param col	index of the column
     */
    public double getPrimal(int col) {
        double retVal = Double.NaN;
        if (this.isOptimal())
            retVal = this.primal[col];
        return retVal;
    }

    /**
     * @return the flux through a reaction (NaN if the solve failed)
     *
     * @param reactionId	ID of the reaction of interest
     */
    public double getFlux(String reactionId) {
        int col = this.columns.indexOf(reactionId);
        if (col < 0)
            throw new IllegalArgumentException("Reaction " + reactionId + " is not in the solution.");
        return this.getPrimal(col);
    }

    @Override
    public String toString() {
        return this.status + (this.isOptimal() ? " " + this.objectiveValue : "");
    }

}
