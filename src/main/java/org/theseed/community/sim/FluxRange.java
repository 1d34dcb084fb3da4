/**
 *
 */
package org.theseed.community.sim;

/**
 * This object contains the minimum and maximum feasible flux through a reaction.  Either value
 * is NaN if the corresponding optimization failed.
 */
public class FluxRange {

    // FIELDS
    /** minimum flux */
    private double min;
    /** maximum flux */
    private double max;

    /**
     * Construct a flux range.
     *
     * @param min	minimum flux
     * @param max	maximum flux
     */
    public FluxRange(double min, double max) {
        this.min = min;
        this.max = max;
    }

    /**
     * @return the minimum flux
     */
    public double getMin() {
        return this.min;
    }

    /**
     * @return the maximum flux
     */
    public double getMax() {
        return this.max;
    }

    @Override
    public String toString() {
        return "[" + this.min + ", " + this.max + "]";
    }

}
