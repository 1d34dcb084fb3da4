/**
 *
 */
package org.theseed.community.sim;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.LineIterator;
import org.apache.commons.lang3.StringUtils;

/**
 * This object contains a separate diet for each sample.  The input file is tab-delimited.  The
 * header line contains the sample IDs after the first column, and each data line contains an
 * exchange reaction ID followed by the uptake rate for each sample.
 */
public class PersonalizedDietTable {

    // FIELDS
    /** map of sample IDs to diets */
    private Map<String, DietTable> diets;

    /**
     * Load the personalized diets from a file.
     *
     * @param inFile	tab-delimited personalized diet file
     *
     * @throws IOException
     */
    public PersonalizedDietTable(File inFile) throws IOException {
        this.diets = new LinkedHashMap<String, DietTable>();
        try (LineIterator iter = FileUtils.lineIterator(inFile, StandardCharsets.UTF_8.name())) {
            if (! iter.hasNext())
                throw new IOException("Personalized diet file " + inFile + " is empty.");
            String[] samples = StringUtils.splitPreserveAllTokens(iter.nextLine(), '\t');
            for (int i = 1; i < samples.length; i++)
                this.diets.put(samples[i], new DietTable());
            int lineNum = 1;
            while (iter.hasNext()) {
                String line = iter.nextLine();
                lineNum++;
                if (! StringUtils.isBlank(line)) {
                    String[] fields = StringUtils.splitPreserveAllTokens(line, '\t');
                    if (fields.length != samples.length)
                        throw new IOException("Line " + lineNum + " of " + inFile + " has " + fields.length
                                + " columns, but " + samples.length + " were expected.");
                    for (int i = 1; i < fields.length; i++) {
                        if (! StringUtils.isBlank(fields[i])) {
                            try {
                                this.diets.get(samples[i]).put(fields[0], Double.parseDouble(fields[i]));
                            } catch (NumberFormatException e) {
                                throw new IOException("Invalid flux \"" + fields[i] + "\" on line " + lineNum
                                        + " of " + inFile + ".");
                            }
                        }
                    }
                }
            }
        }
    }

    /**
     * @return the diet for a sample, or NULL if the sample has none
     *
     * @param sampleId	ID of the sample of interest
     */
    public DietTable getDiet(String sampleId) {
        return this.diets.get(sampleId);
    }

}
