/**
 *
 */
package org.theseed.community;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * This object represents a reaction in a stoichiometric model.  The reaction has flux bounds, an
 * objective coefficient, a role computed from its ID, and a sparse column of stoichiometric
 * coefficients keyed by metabolite ID.  Negative coefficients are reactants and positive ones
 * are products.
 */
public class Reaction implements Comparable<Reaction> {

    // FIELDS
    /** reaction ID */
    private String id;
    /** role of the reaction in the community */
    private ReactionRole role;
    /** lower flux bound */
    private double lowerBound;
    /** upper flux bound */
    private double upperBound;
    /** objective coefficient */
    private double objective;
    /** map of metabolite IDs to stoichiometric coefficients, in insertion order */
    private Map<String, Double> stoich;
    /** default flux limit */
    public static final double DEFAULT_LIMIT = 1000.0;

    /**
     * Construct a reaction with the default reversible bounds.
     *
     * @param id	ID of the new reaction
     */
    public Reaction(String id) {
        this(id, -DEFAULT_LIMIT, DEFAULT_LIMIT);
    }

    /**
     * Construct a reaction with specified bounds.
     *
     * @param id		ID of the new reaction
     * @param lower		lower flux bound
     * @param upper		upper flux bound
     */
    public Reaction(String id, double lower, double upper) {
        this.setId(id);
        this.lowerBound = lower;
        this.upperBound = upper;
        this.objective = 0.0;
        this.stoich = new LinkedHashMap<String, Double>();
    }

    /**
     * Construct a copy of a reaction with a new ID.
     *
     * @param id		ID of the new reaction
     * @param source	reaction to copy
     */
    public Reaction(String id, Reaction source) {
        this.setId(id);
        this.lowerBound = source.lowerBound;
        this.upperBound = source.upperBound;
        this.objective = source.objective;
        this.stoich = new LinkedHashMap<String, Double>(source.stoich);
    }

    /**
     * @return a copy of this reaction
     */
    public Reaction copy() {
        return new Reaction(this.id, this);
    }

    /**
     * Change the ID of this reaction.  The role is recomputed.
     *
     * @param id	new reaction ID
     */
    protected void setId(String id) {
        this.id = id;
        this.role = ReactionRole.classify(id);
    }

    /**
     * Specify the stoichiometric coefficient for a metabolite.  A coefficient of 0 removes the
     * metabolite from the reaction.
     *
     * @param metId		ID of the metabolite
     * @param coeff		coefficient (negative for a reactant, positive for a product)
     *
     * @return this object, for chaining
     */
    public Reaction setCoefficient(String metId, double coeff) {
        if (coeff == 0.0)
            this.stoich.remove(metId);
        else
            this.stoich.put(metId, coeff);
        return this;
    }

    /**
     * @return the stoichiometric coefficient for a metabolite (0 if it is not in this reaction)
     *
     * @param metId		ID of the metabolite of interest
     */
    public double getCoefficient(String metId) {
        return this.stoich.getOrDefault(metId, 0.0);
    }

    /**
     * @return TRUE if the specified metabolite participates in this reaction
     *
     * @param metId		ID of the metabolite of interest
     */
    public boolean contains(String metId) {
        return this.stoich.containsKey(metId);
    }

    /**
     * @return an unmodifiable view of the metabolite-to-coefficient map
     */
    public Map<String, Double> getStoichiometry() {
        return Collections.unmodifiableMap(this.stoich);
    }

    /**
     * Rename the metabolites in this reaction.
     *
     * @param renames	map of old metabolite IDs to new ones; unmapped IDs are kept
     */
    protected void renameMetabolites(Map<String, String> renames) {
        Map<String, Double> newStoich = new LinkedHashMap<String, Double>(this.stoich.size() * 4 / 3 + 1);
        for (Map.Entry<String, Double> entry : this.stoich.entrySet())
            newStoich.put(renames.getOrDefault(entry.getKey(), entry.getKey()), entry.getValue());
        this.stoich = newStoich;
    }

    /**
     * @return the reaction ID
     */
    public String getId() {
        return this.id;
    }

    /**
     * @return the role of this reaction in the community
     */
    public ReactionRole getRole() {
        return this.role;
    }

    /**
     * @return the organism prefix for a demand or sink reaction (empty if there is none)
     */
    public String getOwner() {
        return ReactionRole.owner(this.id);
    }

    /**
     * @return the lower flux bound
     */
    public double getLowerBound() {
        return this.lowerBound;
    }

    /**
     * Specify a new lower flux bound.
     *
     * @param lowerBound 	the lower bound to set
     */
    public void setLowerBound(double lowerBound) {
        this.lowerBound = lowerBound;
    }

    /**
     * @return the upper flux bound
     */
    public double getUpperBound() {
        return this.upperBound;
    }

    /**
     * Specify a new upper flux bound.
     *
     * @param upperBound 	the upper bound to set
     */
    public void setUpperBound(double upperBound) {
        this.upperBound = upperBound;
    }

    /**
     * Specify both flux bounds.
     *
     * @param lower		new lower bound
     * @param upper		new upper bound
     */
    public void setBounds(double lower, double upper) {
        this.lowerBound = lower;
        this.upperBound = upper;
    }

    /**
     * @return the objective coefficient
     */
    public double getObjective() {
        return this.objective;
    }

    /**
     * Specify the objective coefficient.
     *
     * @param objective 	the objective coefficient to set
     */
    public void setObjective(double objective) {
        this.objective = objective;
    }

    /**
     * @return the reaction formula as a readable string
     */
    public String getFormula() {
        String left = this.stoich.entrySet().stream().filter(x -> x.getValue() < 0)
                .map(x -> term(-x.getValue(), x.getKey())).collect(Collectors.joining(" + "));
        String right = this.stoich.entrySet().stream().filter(x -> x.getValue() > 0)
                .map(x -> term(x.getValue(), x.getKey())).collect(Collectors.joining(" + "));
        String arrow = (this.lowerBound < 0 ? " <=> " : " --> ");
        return left + arrow + right;
    }

    /**
     * @return a formula term for a metabolite
     *
     * @param coeff		absolute value of the coefficient
     * @param metId		metabolite ID
     */
    private static String term(double coeff, String metId) {
        String retVal;
        if (coeff == 1.0)
            retVal = metId;
        else
            retVal = String.format("%g*%s", coeff, metId);
        return retVal;
    }

    @Override
    public int compareTo(Reaction o) {
        return this.id.compareTo(o.id);
    }

    @Override
    public String toString() {
        return "Reaction " + this.id + " [" + this.lowerBound + ", " + this.upperBound + "]";
    }

    @Override
    public int hashCode() {
        return this.id.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        Reaction other = (Reaction) obj;
        return this.id.equals(other.id);
    }

}
