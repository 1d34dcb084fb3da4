/**
 *
 */
package org.theseed.community.sim;

/**
 * This object contains the tuning parameters for the community constraint policy.  The setters
 * return the object itself so that they can be chained.
 */
public class PolicyParameters {

    // FIELDS
    /** lower bound for the community biomass reaction */
    private double lowerBiomassBound;
    /** ID of the host biomass reaction (without the host prefix), or NULL if there is no host */
    private String hostBiomassReaction;
    /** upper bound for the host biomass reaction */
    private double hostBiomassCap;
    /** TRUE to allow uptake of host-derived metabolites in the diet scenarios */
    private boolean includeHumanMets;
    /** default community biomass lower bound */
    public static final double DEFAULT_LOWER_BIOMASS = 0.4;
    /** default host biomass upper bound */
    public static final double DEFAULT_HOST_CAP = 1.0;

    /**
     * Construct a parameter object with default values.
     */
    public PolicyParameters() {
        this.lowerBiomassBound = DEFAULT_LOWER_BIOMASS;
        this.hostBiomassReaction = null;
        this.hostBiomassCap = DEFAULT_HOST_CAP;
        this.includeHumanMets = false;
    }

    /**
     * @return the community biomass lower bound
     */
    public double getLowerBiomassBound() {
        return this.lowerBiomassBound;
    }

    /**
     * Specify the community biomass lower bound.
     *
     * @param lowerBiomassBound 	the bound to set
     */
    public PolicyParameters setLowerBiomassBound(double lowerBiomassBound) {
        this.lowerBiomassBound = lowerBiomassBound;
        return this;
    }

    /**
     * @return the host biomass reaction ID, or NULL if there is no host
     */
    public String getHostBiomassReaction() {
        return this.hostBiomassReaction;
    }

    /**
     * Specify the host biomass reaction.
     *
     * @param hostBiomassReaction 	the reaction ID to set, or NULL for no host
     */
    public PolicyParameters setHostBiomassReaction(String hostBiomassReaction) {
        this.hostBiomassReaction = hostBiomassReaction;
        return this;
    }

    /**
     * @return TRUE if the community is coupled to a host
     */
    public boolean hasHost() {
        return this.hostBiomassReaction != null;
    }

    /**
     * @return the host biomass upper bound
     */
    public double getHostBiomassCap() {
        return this.hostBiomassCap;
    }

    /**
     * Specify the host biomass upper bound.
     *
     * @param hostBiomassCap 	the bound to set
     */
    public PolicyParameters setHostBiomassCap(double hostBiomassCap) {
        this.hostBiomassCap = hostBiomassCap;
        return this;
    }

    /**
     * @return TRUE if host-derived metabolites are available in the diet scenarios
     */
    public boolean isIncludeHumanMets() {
        return this.includeHumanMets;
    }

    /**
     * Specify whether host-derived metabolites are available in the diet scenarios.
     *
     * @param includeHumanMets 	TRUE to make them available
     */
    public PolicyParameters setIncludeHumanMets(boolean includeHumanMets) {
        this.includeHumanMets = includeHumanMets;
        return this;
    }

}
