/**
 *
 */
package org.theseed.community;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This class assembles a complete community model for one sample.  The organisms present are
 * merged by the merge-tree scheduler, then the adapted host (if any) is merged in, then the
 * diet, lumen and fecal compartments, and finally the community biomass reaction.  Every
 * metabolite the unadapted host exchanges gets diet, lumen and fecal compartments, even if the
 * host adapter pruned it.
 *
 * The community biomass reaction consumes each organism's biomass metabolite in proportion to
 * its relative abundance and produces "microbeBiomass[u]", which is moved to the fecal
 * compartment by "UFEt_microbeBiomass" and removed by "EX_microbeBiomass[fe]".
 */
public class CommunityAssembler {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(CommunityAssembler.class);
    /** merge scheduler for the organisms */
    private MergeTreeScheduler scheduler;
    /** ID of the organism biomass objective reaction */
    private String objective;
    /** adapted host model, or NULL if there is no host */
    private MetaModel host;
    /** metabolites exchanged by the unadapted host */
    private List<String> hostExchanged;
    /** community biomass metabolite base name */
    public static final String COMMUNITY_BIOMASS_MET = "microbeBiomass";
    /** ID of the fecal community biomass exchange */
    public static final String COMMUNITY_OBJECTIVE = "EX_microbeBiomass[fe]";

    /**
     * Construct a community assembler.
     *
     * @param scheduler		merge scheduler for the organism models
     * @param objective		ID of the organism biomass objective reaction
     * @param host			unadapted host model, or NULL if there is no host
     */
    public CommunityAssembler(MergeTreeScheduler scheduler, String objective, MetaModel host) {
        this.scheduler = scheduler;
        this.objective = objective;
        if (host == null) {
            this.host = null;
            this.hostExchanged = Collections.emptyList();
        } else {
            this.hostExchanged = HostAdapter.exchangeMetabolites(host);
            this.host = HostAdapter.adapt(host);
            log.info("Host model adapted: {}.  {} host metabolites are exchanged.", this.host,
                    this.hostExchanged.size());
        }
    }

    /**
     * @return TRUE if this assembler couples the community to a host
     */
    public boolean hasHost() {
        return this.host != null;
    }

    /**
     * Assemble the community model for a sample.
     *
     * @param sampleId		ID of the sample
     * @param abundances	map of organism names to relative abundances
     * @param loader		loader for the adapted organism models
     *
     * @return the complete community model
     *
     * @throws IOException
     */
    public MetaModel assemble(String sampleId, Map<String, Double> abundances, MergeTreeScheduler.ModelLoader loader)
            throws IOException {
        List<String> organisms = new ArrayList<String>(abundances.keySet());
        MetaModel retVal = this.scheduler.merge(organisms, loader);
        retVal.setName(sampleId);
        if (this.host != null)
            ModelMerger.mergeInto(retVal, this.host, ModelMerger.Mode.DISJOINT, false);
        // The lumen metabolites of the organisms determine the compartments to build.
        List<String> exchanged = retVal.getMetabolites(Compartment.LUMEN);
        MetaModel compartments = CompartmentBuilder.build(exchanged, this.hostExchanged, this.objective);
        ModelMerger.mergeInto(retVal, compartments, ModelMerger.Mode.GLUED, false);
        this.addCommunityBiomass(retVal, abundances);
        retVal.validate();
        log.info("Community model for sample {} has {} organisms, {} metabolites and {} reactions.", sampleId,
                organisms.size(), retVal.getMetaboliteCount(), retVal.getReactionCount());
        return retVal;
    }

    /**
     * Add the community biomass reactions to a merged community model.
     *
     * @param model			community model to update
     * @param abundances	map of organism names to relative abundances
     *
     * @throws ModelStructureException if an organism's biomass metabolite is missing
     */
    protected void addCommunityBiomass(MetaModel model, Map<String, Double> abundances) {
        String biomassMet = CompartmentBuilder.biomassMetabolite(this.objective);
        String lumen = Compartment.LUMEN.convert(COMMUNITY_BIOMASS_MET);
        String fecal = Compartment.FECAL.convert(COMMUNITY_BIOMASS_MET);
        model.addMetabolite(lumen);
        model.addMetabolite(fecal);
        Reaction community = new Reaction(ReactionRole.COMMUNITY_BIOMASS_ID, 0.4, 1.0);
        for (Map.Entry<String, Double> entry : abundances.entrySet()) {
            String orgBiomass = entry.getKey() + "_" + biomassMet;
            if (! model.hasMetabolite(orgBiomass))
                throw new ModelStructureException("Biomass metabolite " + orgBiomass + " not found in community "
                        + model.getName() + ".");
            community.setCoefficient(orgBiomass, -entry.getValue());
        }
        community.setCoefficient(lumen, 1.0);
        model.addReaction(community);
        model.addReaction(new Reaction("UFEt_" + COMMUNITY_BIOMASS_MET, 0.0, Reaction.DEFAULT_LIMIT)
                .setCoefficient(lumen, -1.0).setCoefficient(fecal, 1.0));
        model.addReaction(new Reaction(COMMUNITY_OBJECTIVE, -Reaction.DEFAULT_LIMIT, Reaction.DEFAULT_LIMIT)
                .setCoefficient(fecal, -1.0));
    }

}
