/**
 *
 */
package org.theseed.community;

import java.io.IOException;

/**
 * This interface describes a persistent store of metabolic models addressed by name.  Organism
 * models are stored under the organism name, and community models under a name computed from the
 * sample ID.
 */
public interface ModelStore {

    /**
     * @return the model with the specified name
     *
     * @param name		name of the model
     *
     * @throws IOException
     */
    public MetaModel load(String name) throws IOException;

    /**
     * Store a model under the specified name, replacing any previous version.
     *
     * @param name		name under which to store the model
     * @param model		model to store
     *
     * @throws IOException
     */
    public void save(String name, MetaModel model) throws IOException;

    /**
     * @return TRUE if a model with the specified name exists
     *
     * @param name		name of the model
     */
    public boolean contains(String name);

    /**
     * @return the storage name of the community model for a sample
     *
     * @param sampleId		ID of the sample
     * @param host			TRUE for the host-coupled variant
     */
    public static String communityName(String sampleId, boolean host) {
        return (host ? "host_microbiota_model_samp_" : "microbiota_model_samp_") + sampleId;
    }

}
