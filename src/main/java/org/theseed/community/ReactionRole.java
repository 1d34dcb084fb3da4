/**
 *
 */
package org.theseed.community;

import org.apache.commons.lang3.StringUtils;

/**
 * This enumeration describes the role a reaction plays in a community model.  The role is
 * computed from the reaction ID once, when the ID is assigned, so that the constraint rules can
 * select reactions by category instead of searching ID strings.
 */
public enum ReactionRole {
    /** aggregate growth of all the organisms in the community */
    COMMUNITY_BIOMASS,
    /** growth reaction of a single organism or of the host */
    BIOMASS,
    /** exchange with the diet compartment */
    DIET_EXCHANGE,
    /** exchange with the fecal compartment */
    FECAL_EXCHANGE,
    /** host exchange with the body fluids */
    HOST_BLOOD_EXCHANGE,
    /** host uptake or secretion into the lumen */
    HOST_LUMEN_EXCHANGE,
    /** organism uptake or secretion into the lumen */
    LUMEN_EXCHANGE,
    /** diet to lumen transport */
    DIET_TRANSPORT,
    /** lumen to fecal transport */
    FECAL_TRANSPORT,
    /** demand reaction */
    DEMAND,
    /** sink reaction */
    SINK,
    /** any other exchange reaction */
    EXCHANGE,
    /** everything else */
    INTERNAL;

    /** ID of the community biomass reaction */
    public static final String COMMUNITY_BIOMASS_ID = "communityBiomass";
    /** demand reaction marker */
    private static final String DEMAND_MARK = "DM_";
    /** sink reaction marker */
    private static final String SINK_MARK = "sink_";

    /**
     * Compute the role of a reaction from its ID.
     *
     * @param id	reaction ID to classify
     *
     * @return the role of the reaction
     */
    public static ReactionRole classify(String id) {
        ReactionRole retVal;
        if (id.equals(COMMUNITY_BIOMASS_ID))
            retVal = COMMUNITY_BIOMASS;
        else if (id.startsWith("Host_EX_"))
            retVal = HOST_BLOOD_EXCHANGE;
        else if (id.startsWith("Host_IEX_"))
            retVal = HOST_LUMEN_EXCHANGE;
        else if (id.contains("_IEX_"))
            retVal = LUMEN_EXCHANGE;
        else if (id.startsWith("Diet_EX_"))
            retVal = DIET_EXCHANGE;
        else if (id.startsWith("EX_")) {
            if (id.endsWith(Compartment.DIET.getSuffix()))
                retVal = DIET_EXCHANGE;
            else if (id.endsWith(Compartment.FECAL.getSuffix()))
                retVal = FECAL_EXCHANGE;
            else
                retVal = EXCHANGE;
        } else if (id.startsWith("DUt_"))
            retVal = DIET_TRANSPORT;
        else if (id.startsWith("UFEt_"))
            retVal = FECAL_TRANSPORT;
        else if (isMarked(id, DEMAND_MARK))
            retVal = DEMAND;
        else if (isMarked(id, SINK_MARK))
            retVal = SINK;
        else if (id.contains("biomass"))
            retVal = BIOMASS;
        else
            retVal = INTERNAL;
        return retVal;
    }

    /**
     * @return TRUE if the reaction ID starts with the marker or has it after an organism prefix
     *
     * @param id		reaction ID to check
     * @param mark		marker for the reaction type
     */
    private static boolean isMarked(String id, String mark) {
        return id.startsWith(mark) || id.contains("_" + mark);
    }

    /**
     * @return the organism prefix of a demand or sink reaction, or an empty string if there is none
     *
     * @param id	ID of the reaction
     */
    public static String owner(String id) {
        String retVal = "";
        ReactionRole role = classify(id);
        if (role == DEMAND)
            retVal = StringUtils.substringBefore(id, "_" + DEMAND_MARK);
        else if (role == SINK)
            retVal = StringUtils.substringBefore(id, "_" + SINK_MARK);
        // A reaction with the marker at the front has no owner.
        if (retVal.equals(id))
            retVal = "";
        return retVal;
    }

}
