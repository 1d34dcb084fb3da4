/**
 *
 */
package org.theseed.community.sim;

import java.math.BigDecimal;

import com.github.cliftonlabs.json_simple.JsonArray;

/**
 * This object contains a pair of flux values for one exchanged metabolite:  a diet exchange flux
 * and a fecal exchange flux.  A value that could not be computed is NaN.
 */
public class ExchangeFlux {

    // FIELDS
    /** flux through the diet exchange */
    private double diet;
    /** flux through the fecal exchange */
    private double fecal;

    /**
     * Construct an exchange flux pair.
     *
     * @param diet		flux through the diet exchange
     * @param fecal		flux through the fecal exchange
     */
    public ExchangeFlux(double diet, double fecal) {
        // Adding zero turns -0.0 into 0.0, which is what JSON gives back.
        this.diet = diet + 0.0;
        this.fecal = fecal + 0.0;
    }

    /**
     * Construct an exchange flux pair from a JSON array.
     *
     * @param json		two-element array of diet and fecal fluxes; NULL elements are NaN
     */
    public ExchangeFlux(JsonArray json) {
        this.diet = fromJson(json.get(0));
        this.fecal = fromJson(json.get(1));
    }

    /**
     * @return the diet exchange flux
     */
    public double getDiet() {
        return this.diet;
    }

    /**
     * @return the fecal exchange flux
     */
    public double getFecal() {
        return this.fecal;
    }

    /**
     * @return a JSON array for this flux pair
     */
    public JsonArray toJson() {
        JsonArray retVal = new JsonArray();
        retVal.add(toJson(this.diet));
        retVal.add(toJson(this.fecal));
        return retVal;
    }

    /**
     * @return a JSON value for a flux (NULL for NaN, which JSON cannot represent)
     *
     * @param value		flux value to convert
     */
    public static Object toJson(double value) {
        Object retVal = null;
        if (! Double.isNaN(value) && ! Double.isInfinite(value))
            retVal = BigDecimal.valueOf(value);
        return retVal;
    }

    /**
     * @return the flux value of a JSON element (NaN for NULL)
     *
     * @param value		JSON element to convert
     */
    public static double fromJson(Object value) {
        double retVal = Double.NaN;
        if (value != null)
            retVal = ((Number) value).doubleValue();
        return retVal;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + Double.hashCode(this.diet);
        result = prime * result + Double.hashCode(this.fecal);
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (! (obj instanceof ExchangeFlux))
            return false;
        ExchangeFlux other = (ExchangeFlux) obj;
        return Double.compare(this.diet, other.diet) == 0 && Double.compare(this.fecal, other.fecal) == 0;
    }

    @Override
    public String toString() {
        return "(diet " + this.diet + ", fecal " + this.fecal + ")";
    }

}
