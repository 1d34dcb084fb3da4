/**
 *
 */
package org.theseed.community;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.LineIterator;
import org.apache.commons.lang3.StringUtils;

/**
 * This object contains the relative organism abundances for a set of samples.  The input file is
 * tab-delimited with headers.  The first column contains organism names and each remaining
 * column contains the abundances for one sample, with the sample ID as the column heading.
 * The abundances for each sample are normalized to sum to 1, and organisms with an abundance of
 * 0 are not considered present.
 */
public class AbundanceTable {

    // FIELDS
    /** sample IDs, in order */
    private List<String> samples;
    /** map of sample IDs to organism abundance maps */
    private Map<String, Map<String, Double>> abundances;

    /**
     * Load an abundance table from a file.
     *
     * @param inFile	tab-delimited abundance file
     *
     * @throws IOException
     */
    public AbundanceTable(File inFile) throws IOException {
        this.samples = new ArrayList<String>();
        this.abundances = new LinkedHashMap<String, Map<String, Double>>();
        try (LineIterator iter = FileUtils.lineIterator(inFile, StandardCharsets.UTF_8.name())) {
            if (! iter.hasNext())
                throw new IOException("Abundance file " + inFile + " is empty.");
            String[] headers = StringUtils.splitPreserveAllTokens(iter.nextLine(), '\t');
            for (int i = 1; i < headers.length; i++) {
                this.samples.add(headers[i]);
                this.abundances.put(headers[i], new LinkedHashMap<String, Double>());
            }
            int lineNum = 1;
            while (iter.hasNext()) {
                String line = iter.nextLine();
                lineNum++;
                if (! StringUtils.isBlank(line)) {
                    String[] fields = StringUtils.splitPreserveAllTokens(line, '\t');
                    if (fields.length != headers.length)
                        throw new IOException("Line " + lineNum + " of " + inFile + " has " + fields.length
                                + " columns, but " + headers.length + " were expected.");
                    for (int i = 1; i < fields.length; i++) {
                        double value;
                        try {
                            value = Double.parseDouble(fields[i]);
                        } catch (NumberFormatException e) {
                            throw new IOException("Invalid abundance \"" + fields[i] + "\" on line " + lineNum
                                    + " of " + inFile + ".");
                        }
                        if (value > 0.0)
                            this.abundances.get(headers[i]).put(fields[0], value);
                    }
                }
            }
        }
        // Normalize the abundances.
        for (Map<String, Double> sampleMap : this.abundances.values()) {
            double total = sampleMap.values().stream().mapToDouble(x -> x).sum();
            sampleMap.replaceAll((k, v) -> v / total);
        }
    }

    /**
     * @return the sample IDs, in order
     */
    public List<String> getSamples() {
        return Collections.unmodifiableList(this.samples);
    }

    /**
     * @return the normalized abundances of the organisms present in a sample
     *
     * @param sampleId		ID of the sample of interest
     *
     * @throws IllegalArgumentException if the sample is not in the table
     */
    public Map<String, Double> getAbundances(String sampleId) {
        Map<String, Double> retVal = this.abundances.get(sampleId);
        if (retVal == null)
            throw new IllegalArgumentException("Sample " + sampleId + " is not in the abundance table.");
        return Collections.unmodifiableMap(retVal);
    }

}
