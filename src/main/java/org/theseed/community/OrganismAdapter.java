/**
 *
 */
package org.theseed.community;

import java.util.List;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This class prepares a single-organism reconstruction for inclusion in a community.  The
 * organism's exchange reactions are removed, and each of its extracellular metabolites is
 * instead connected to the shared lumen by a reversible transporter "Org_IEX_m[u]tr".  The
 * biomass reaction is made to produce a biomass metabolite so the community biomass reaction can
 * consume it.  Every organism metabolite and reaction gets the organism name as a prefix; only
 * the lumen metabolites remain unprefixed so that the organisms can share them.
 */
public class OrganismAdapter {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(OrganismAdapter.class);

    /**
     * Adapt an organism model for community membership.  The incoming model is not modified.
     *
     * @param raw			organism reconstruction
     * @param organism		organism name, used as the identifier prefix
     * @param objective		ID of the organism biomass objective reaction (e.g. "EX_biomass(e)")
     *
     * @return the adapted organism model
     *
     * @throws ModelStructureException if the organism has no biomass reaction
     */
    public static MetaModel adapt(MetaModel raw, String organism, String objective) {
        final String prefix = organism + "_";
        String biomassMet = CompartmentBuilder.biomassMetabolite(objective);
        MetaModel model = raw.copy();
        // Insure there is a biomass metabolite produced by the biomass reaction.
        if (! model.hasMetabolite(biomassMet)) {
            List<Reaction> growth = model.getReactions(ReactionRole.BIOMASS).stream()
                    .filter(x -> x.getObjective() != 0.0).collect(Collectors.toList());
            if (growth.isEmpty())
                growth = model.getReactions(ReactionRole.BIOMASS);
            if (growth.isEmpty())
                throw new ModelStructureException("No biomass reaction found in organism " + organism + ".");
            model.addMetabolite(biomassMet);
            for (Reaction reaction : growth)
                reaction.setCoefficient(biomassMet, 1.0);
            log.debug("Biomass metabolite {} added to {} reactions in {}.", biomassMet, growth.size(), organism);
        }
        // Remove the exchanges.  This includes the biomass exchange.
        List<String> exchanges = model.getReactions(ReactionRole.EXCHANGE).stream().map(x -> x.getId())
                .collect(Collectors.toList());
        model.removeReactions(exchanges, true);
        MetaModel retVal = model.renamed(organism, x -> prefix + x, x -> prefix + x);
        // Connect the extracellular metabolites to the lumen.
        int count = 0;
        for (String metId : retVal.getMetabolites(Compartment.EXTRACELLULAR)) {
            String lumenMet = Compartment.LUMEN.convert(StringUtils.removeStart(metId, prefix));
            retVal.addMetabolite(lumenMet);
            retVal.addReaction(new Reaction(prefix + "IEX_" + lumenMet + "tr", -Reaction.DEFAULT_LIMIT, Reaction.DEFAULT_LIMIT)
                    .setCoefficient(metId, -1.0).setCoefficient(lumenMet, 1.0));
            count++;
        }
        log.debug("Organism {} adapted with {} lumen transporters.", organism, count);
        return retVal;
    }

}
