/**
 *
 */
package org.theseed.community.sim;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.theseed.community.MetaModel;
import org.theseed.community.Reaction;

/**
 * This object describes a linear program over the fluxes of a metabolic model.  There is one
 * column per reaction, with the reaction's flux bounds, and one steady-state row per metabolite
 * (the weighted flux sum must be 0).  Additional rows can be added with arbitrary bounds.
 *
 * The objects are immutable:  the "with" methods return a modified copy that shares the
 * unchanged parts of this one.
 */
public class LpProblem {

    // FIELDS
    /** reaction IDs, in column order */
    private List<String> columns;
    /** map of reaction IDs to column indices */
    private Map<String, Integer> columnMap;
    /** lower bounds, by column */
    private double[] lower;
    /** upper bounds, by column */
    private double[] upper;
    /** objective coefficients, by column */
    private double[] objective;
    /** TRUE to maximize, FALSE to minimize */
    private boolean maximize;
    /** constraint rows */
    private List<Row> rows;

    /**
     * This object represents a sparse constraint row, bounded on both sides.
     */
    public static class Row {

        /** column indices of the nonzero coefficients */
        private int[] indices;
        /** nonzero coefficients */
        private double[] coeffs;
        /** minimum value of the row */
        private double min;
        /** maximum value of the row */
        private double max;

        /**
         * Construct a constraint row.
         *
         * @param indices	column indices of the nonzero coefficients
         * @param coeffs	coefficient values, parallel to the indices
         * @param min		minimum row value (may be negative infinity)
         * @param max		maximum row value (may be positive infinity)
         */
        public Row(int[] indices, double[] coeffs, double min, double max) {
            this.indices = indices;
            this.coeffs = coeffs;
            this.min = min;
            this.max = max;
        }

        /**
         * @return the column indices of the nonzero coefficients
         */
        public int[] getIndices() {
            return this.indices;
        }

        /**
         * @return the nonzero coefficients
         */
        public double[] getCoeffs() {
            return this.coeffs;
        }

        /**
         * @return the minimum row value
         */
        public double getMin() {
            return this.min;
        }

        /**
         * @return the maximum row value
         */
        public double getMax() {
            return this.max;
        }

        /**
         * @return TRUE if this row has no nonzero coefficients
         */
        public boolean isEmpty() {
            return this.indices.length == 0;
        }

        /**
         * @return TRUE if this is an equality row
         */
        public boolean isEquality() {
            return this.min == this.max;
        }

        /**
         * @return the dense form of this row's coefficients
         *
         * @param width		number of columns in the problem
         */
        public double[] toDense(int width) {
            double[] retVal = new double[width];
            for (int i = 0; i < this.indices.length; i++)
                retVal[this.indices[i]] += this.coeffs[i];
            return retVal;
        }

    }

    /**
     * Construct a problem by copying the fields of another.
     */
    private LpProblem(LpProblem source) {
        this.columns = source.columns;
        this.columnMap = source.columnMap;
        this.lower = source.lower;
        this.upper = source.upper;
        this.objective = source.objective;
        this.maximize = source.maximize;
        this.rows = source.rows;
    }

    /**
     * Construct the steady-state flux problem for a model.  The objective is to maximize the
     * objective coefficients of the reactions.
     *
     * @param model		source metabolic model
     */
    public LpProblem(MetaModel model) {
        final int width = model.getReactionCount();
        this.columns = new ArrayList<String>(width);
        this.columnMap = new HashMap<String, Integer>(width * 4 / 3 + 1);
        this.lower = new double[width];
        this.upper = new double[width];
        this.objective = new double[width];
        this.maximize = true;
        // Build the columns and accumulate the sparse metabolite rows.
        Map<String, List<Integer>> rowCols = new HashMap<String, List<Integer>>(model.getMetaboliteCount() * 4 / 3 + 1);
        Map<String, List<Double>> rowVals = new HashMap<String, List<Double>>(model.getMetaboliteCount() * 4 / 3 + 1);
        int col = 0;
        for (Reaction reaction : model.getReactions()) {
            this.columns.add(reaction.getId());
            this.columnMap.put(reaction.getId(), col);
            this.lower[col] = reaction.getLowerBound();
            this.upper[col] = reaction.getUpperBound();
            this.objective[col] = reaction.getObjective();
            for (Map.Entry<String, Double> entry : reaction.getStoichiometry().entrySet()) {
                rowCols.computeIfAbsent(entry.getKey(), x -> new ArrayList<Integer>()).add(col);
                rowVals.computeIfAbsent(entry.getKey(), x -> new ArrayList<Double>()).add(entry.getValue());
            }
            col++;
        }
        this.rows = new ArrayList<Row>(model.getMetaboliteCount());
        for (String metId : model.getMetabolites()) {
            List<Integer> cols = rowCols.getOrDefault(metId, Collections.emptyList());
            List<Double> vals = rowVals.getOrDefault(metId, Collections.emptyList());
            int[] indices = new int[cols.size()];
            double[] coeffs = new double[cols.size()];
            for (int i = 0; i < indices.length; i++) {
                indices[i] = cols.get(i);
                coeffs[i] = vals.get(i);
            }
            this.rows.add(new Row(indices, coeffs, 0.0, 0.0));
        }
        this.columns = Collections.unmodifiableList(this.columns);
    }

    /**
     * @return a copy of this problem with a different objective
     *
     * @param newObjective	objective coefficients, by column
     * @param max			TRUE to maximize, FALSE to minimize
     */
    public LpProblem withObjective(double[] newObjective, boolean max) {
        if (newObjective.length != this.columns.size())
            throw new IllegalArgumentException("Objective has " + newObjective.length + " coefficients but the problem has "
                    + this.columns.size() + " columns.");
        LpProblem retVal = new LpProblem(this);
        retVal.objective = Arrays.copyOf(newObjective, newObjective.length);
        retVal.maximize = max;
        return retVal;
    }

    /**
     * @return a copy of this problem optimizing the flux of a single reaction
     *
     * @param reactionId	ID of the reaction whose flux is the objective
     * @param max			TRUE to maximize, FALSE to minimize
     */
    public LpProblem withObjective(String reactionId, boolean max) {
        double[] newObjective = new double[this.columns.size()];
        newObjective[this.getColumn(reactionId)] = 1.0;
        return this.withObjective(newObjective, max);
    }

    /**
     * @return a copy of this problem with an additional dense constraint row
     *
     * @param coeffs	row coefficients, by column
     * @param min		minimum row value
     * @param max		maximum row value
     */
    public LpProblem withConstraint(double[] coeffs, double min, double max) {
        int count = 0;
        for (double coeff : coeffs) {
            if (coeff != 0.0) count++;
        }
        int[] indices = new int[count];
        double[] vals = new double[count];
        int j = 0;
        for (int i = 0; i < coeffs.length; i++) {
            if (coeffs[i] != 0.0) {
                indices[j] = i;
                vals[j] = coeffs[i];
                j++;
            }
        }
        LpProblem retVal = new LpProblem(this);
        retVal.rows = new ArrayList<Row>(this.rows);
        retVal.rows.add(new Row(indices, vals, min, max));
        return retVal;
    }

    /**
     * @return the column index of a reaction
     *
     * @param reactionId	ID of the reaction of interest
     *
     * @throws IllegalArgumentException if the reaction is not in the problem
     */
    public int getColumn(String reactionId) {
        Integer retVal = this.columnMap.get(reactionId);
        if (retVal == null)
            throw new IllegalArgumentException("Reaction " + reactionId + " is not in the problem.");
        return retVal;
    }

    /**
     * @return the reaction IDs, in column order
     */
    public List<String> getColumns() {
        return this.columns;
    }

    /**
     * @return the number of columns
     */
    public int width() {
        return this.columns.size();
    }

    /**
     * @return the lower bound of a column
     *
     * @param col	index of the column
     */
    public double getLower(int col) {
        return this.lower[col];
    }

    /**
     * @return the upper bound of a column
     *
     * @param col	index of the column
     */
    public double getUpper(int col) {
        return this.upper[col];
    }

    /**
     * @return a copy of the objective coefficients
     */
    public double[] getObjective() {
        return Arrays.copyOf(this.objective, this.objective.length);
    }

    /**
     * @return TRUE if the objective is maximized
     */
    public boolean isMaximize() {
        return this.maximize;
    }

    /**
     * @return the constraint rows
     */
    public List<Row> getRows() {
        return Collections.unmodifiableList(this.rows);
    }

}
