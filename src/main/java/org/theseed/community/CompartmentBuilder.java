/**
 *
 */
package org.theseed.community;

import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This class builds the diet, lumen and fecal compartments of a community model.  Diet enters
 * through the diet compartment [d], moves by a one-way transporter into the lumen [u], where the
 * organisms and the host exchange metabolites, and leaves by another one-way transporter into
 * the fecal compartment [fe].
 *
 * For each extracellular metabolite "m[e]" the builder creates the metabolites m[d], m[u] and
 * m[fe] and four reactions, grouped together in this order:
 *
 * EX_m[d]		m[d] <=>			diet exchange
 * DUt_m		m[d] --> m[u]		diet to lumen transport
 * UFEt_m		m[u] --> m[fe]		lumen to fecal transport
 * EX_m[fe]		m[fe] <=>			fecal exchange
 *
 * The organism biomass metabolite is never given compartments.
 */
public class CompartmentBuilder {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(CompartmentBuilder.class);
    /** name of the compartment model */
    public static final String MODEL_NAME = "diet_lumen_fecal";

    /**
     * Compute the biomass metabolite corresponding to an organism objective reaction.  Thus,
     * "EX_biomass(e)" becomes "biomass[c]".
     *
     * @param objective		ID of the organism biomass objective reaction
     *
     * @return the ID of the biomass metabolite
     */
    public static String biomassMetabolite(String objective) {
        String retVal = StringUtils.removeStart(objective, "EX_");
        retVal = StringUtils.replace(retVal, "(e)", "[c]");
        retVal = StringUtils.replace(retVal, "[e]", "[c]");
        return retVal;
    }

    /**
     * Build the compartment model.
     *
     * @param exchanged		IDs of the extracellular metabolites exchanged by the organisms
     * @param hostExchanged	IDs of extracellular metabolites exchanged by the host (may be empty)
     * @param objective		ID of the organism biomass objective reaction
     *
     * @return a model containing the diet, lumen and fecal metabolites and reactions
     */
    public static MetaModel build(Collection<String> exchanged, Collection<String> hostExchanged, String objective) {
        // Get the unique base names, sorted, without the biomass.
        String biomass = Compartment.baseName(biomassMetabolite(objective));
        Set<String> bases = new TreeSet<String>();
        for (String metId : exchanged)
            bases.add(Compartment.baseName(metId));
        for (String metId : hostExchanged)
            bases.add(Compartment.baseName(metId));
        bases.remove(biomass);
        MetaModel retVal = new MetaModel(MODEL_NAME);
        for (String base : bases) {
            String diet = Compartment.DIET.convert(base);
            String lumen = Compartment.LUMEN.convert(base);
            String fecal = Compartment.FECAL.convert(base);
            retVal.addMetabolite(diet);
            retVal.addMetabolite(lumen);
            retVal.addMetabolite(fecal);
            retVal.addReaction(new Reaction("EX_" + diet, -Reaction.DEFAULT_LIMIT, Reaction.DEFAULT_LIMIT)
                    .setCoefficient(diet, -1.0));
            retVal.addReaction(new Reaction("DUt_" + base, 0.0, Reaction.DEFAULT_LIMIT)
                    .setCoefficient(diet, -1.0).setCoefficient(lumen, 1.0));
            retVal.addReaction(new Reaction("UFEt_" + base, 0.0, Reaction.DEFAULT_LIMIT)
                    .setCoefficient(lumen, -1.0).setCoefficient(fecal, 1.0));
            retVal.addReaction(new Reaction("EX_" + fecal, -Reaction.DEFAULT_LIMIT, Reaction.DEFAULT_LIMIT)
                    .setCoefficient(fecal, -1.0));
        }
        log.info("Compartment model built for {} exchanged metabolites.", bases.size());
        return retVal;
    }

}
