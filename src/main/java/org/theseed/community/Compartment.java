/**
 *
 */
package org.theseed.community;

import org.apache.commons.lang3.StringUtils;

/**
 * This enumeration describes the compartments that can appear as a metabolite ID suffix.  The
 * suffix is the compartment code in square brackets at the end of the ID (e.g. "glc_D[e]").
 * The diet, lumen, fecal, and body-fluid compartments are the connector compartments created
 * when a community is assembled, and metabolites in them are shared between member models.
 */
public enum Compartment {
    CYTOSOL("c", false), EXTRACELLULAR("e", false), DIET("d", true), LUMEN("u", true),
    FECAL("fe", true), BODY_FLUID("b", true), OTHER("", false);

    /** compartment code */
    private final String code;
    /** TRUE if this is a community connector compartment */
    private final boolean connector;

    private Compartment(String code, boolean connector) {
        this.code = code;
        this.connector = connector;
    }

    /**
     * @return the compartment code (without brackets)
     */
    public String getCode() {
        return this.code;
    }

    /**
     * @return the ID suffix for this compartment
     */
    public String getSuffix() {
        return "[" + this.code + "]";
    }

    /**
     * @return TRUE if metabolites in this compartment may be shared between merged models
     */
    public boolean isConnector() {
        return this.connector;
    }

    /**
     * @return the compartment of the specified metabolite
     *
     * @param metId		metabolite ID to parse
     */
    public static Compartment of(String metId) {
        Compartment retVal = OTHER;
        String code = code(metId);
        if (code != null) {
            for (Compartment comp : Compartment.values()) {
                if (comp != OTHER && comp.code.equals(code))
                    retVal = comp;
            }
        }
        return retVal;
    }

    /**
     * @return the compartment code of a metabolite ID, or NULL if it has no bracketed suffix
     *
     * @param metId		metabolite ID to parse
     */
    private static String code(String metId) {
        String retVal = null;
        if (metId.endsWith("]")) {
            int start = metId.lastIndexOf('[');
            if (start >= 0)
                retVal = metId.substring(start + 1, metId.length() - 1);
        }
        return retVal;
    }

    /**
     * @return the base name of a metabolite ID (the ID with the compartment suffix removed)
     *
     * @param metId		metabolite ID to parse
     */
    public static String baseName(String metId) {
        String retVal = metId;
        if (code(metId) != null)
            retVal = StringUtils.substringBeforeLast(metId, "[");
        return retVal;
    }

    /**
     * @return the ID of the same metabolite in this compartment
     *
     * @param metId		metabolite ID to convert
     */
    public String convert(String metId) {
        return baseName(metId) + this.getSuffix();
    }

}
