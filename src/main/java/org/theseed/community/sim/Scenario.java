/**
 *
 */
package org.theseed.community.sim;

/**
 * This enumeration describes the dietary scenarios simulated for each sample.
 */
public enum Scenario {
    /** all diet exchanges open */
    RICH("Rich", "microbiota_model_"),
    /** uptake limited to the standard diet */
    STANDARD("Diet", "microbiota_model_diet_"),
    /** uptake limited to the sample's own diet */
    PERSONALIZED("Personalized", "microbiota_model_pDiet_");

    // FIELDS
    /** result subdirectory for constrained models */
    private String folder;
    /** model name prefix for constrained models */
    private String prefix;

    private Scenario(String folder, String prefix) {
        this.folder = folder;
        this.prefix = prefix;
    }

    /**
     * @return the result subdirectory for constrained models
     */
    public String getFolder() {
        return this.folder;
    }

    /**
     * @return the storage name of a constrained model for a sample
     *
     * @param sampleId	ID of the sample
     */
    public String modelName(String sampleId) {
        return this.folder + "/" + this.prefix + sampleId;
    }

}
