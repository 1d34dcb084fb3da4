/**
 *
 */
package org.theseed.community.sim;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.LineIterator;
import org.apache.commons.lang3.StringUtils;
import org.theseed.community.Compartment;

/**
 * This object contains a diet:  a map of diet exchange reaction IDs to lower flux bounds.  The
 * input file is tab-delimited with a header line.  The first column contains an exchange reaction
 * ID and the second the uptake rate.  Uptake rates are positive in the file and are stored
 * negated, since uptake is negative flux through an exchange.
 *
 * Exchange IDs are normalized to the community diet form, so that "EX_glc_D(e)" becomes
 * "Diet_EX_glc_D[d]".
 */
public class DietTable {

    // FIELDS
    /** map of diet exchange IDs to lower bounds */
    private Map<String, Double> bounds;
    /** prefix for diet exchange reactions */
    public static final String DIET_PREFIX = "Diet_";

    /**
     * Construct an empty diet.
     */
    public DietTable() {
        this.bounds = new LinkedHashMap<String, Double>();
    }

    /**
     * Load a diet from a file.
     *
     * @param inFile	tab-delimited diet file
     *
     * @throws IOException
     */
    public DietTable(File inFile) throws IOException {
        this();
        try (LineIterator iter = FileUtils.lineIterator(inFile, StandardCharsets.UTF_8.name())) {
            if (! iter.hasNext())
                throw new IOException("Diet file " + inFile + " is empty.");
            // Skip the header.
            iter.nextLine();
            int lineNum = 1;
            while (iter.hasNext()) {
                String line = iter.nextLine();
                lineNum++;
                if (! StringUtils.isBlank(line)) {
                    String[] fields = StringUtils.splitPreserveAllTokens(line, '\t');
                    if (fields.length < 2)
                        throw new IOException("Line " + lineNum + " of diet file " + inFile + " has no flux value.");
                    try {
                        this.put(fields[0], Double.parseDouble(fields[1]));
                    } catch (NumberFormatException e) {
                        throw new IOException("Invalid flux \"" + fields[1] + "\" on line " + lineNum
                                + " of diet file " + inFile + ".");
                    }
                }
            }
        }
    }

    /**
     * Add an uptake rate to this diet.
     *
     * @param exchangeId	exchange reaction ID, in any supported form
     * @param uptake		uptake rate (positive)
     */
    public void put(String exchangeId, double uptake) {
        this.bounds.put(normalize(exchangeId), -uptake);
    }

    /**
     * @return the community diet exchange ID for an exchange reaction ID
     *
     * @param exchangeId	exchange reaction ID to normalize
     */
    public static String normalize(String exchangeId) {
        String retVal = exchangeId.trim();
        if (retVal.startsWith("EX_"))
            retVal = DIET_PREFIX + retVal;
        if (retVal.endsWith("(e)"))
            retVal = StringUtils.removeEnd(retVal, "(e)") + Compartment.DIET.getSuffix();
        else if (Compartment.of(retVal) == Compartment.EXTRACELLULAR)
            retVal = Compartment.DIET.convert(retVal);
        return retVal;
    }

    /**
     * @return the map of diet exchange IDs to lower bounds
     */
    public Map<String, Double> getBounds() {
        return Collections.unmodifiableMap(this.bounds);
    }

    /**
     * @return the number of exchanges in this diet
     */
    public int size() {
        return this.bounds.size();
    }

}
