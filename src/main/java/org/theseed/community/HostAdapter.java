/**
 *
 */
package org.theseed.community;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This class prepares a host model for coupling to a microbial community.  The host's
 * extracellular space is split in two.  Every reaction that touches an extracellular metabolite
 * is copied into a new body-fluid compartment [b] (with the suffix "b" on its ID), and the
 * original exchange reactions are removed.  The remaining extracellular metabolites are then
 * connected to the lumen [u] by reversible transporters named "Host_IEX_m[u]tr".  All host
 * metabolites and reactions are given the prefix "Host_".
 *
 * The result exposes only body-fluid exchanges and lumen transporters to the outside.
 */
public class HostAdapter {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(HostAdapter.class);
    /** prefix for host identifiers */
    public static final String PREFIX = "Host_";

    /**
     * @return the metabolites of the host's exchange reactions, in model order
     *
     * These are taken from the unadapted host, so metabolites that the adapter prunes because only
     * exchanges used them are included.  Biomass exchanges are skipped.
     *
     * @param host		unadapted host model
     */
    public static List<String> exchangeMetabolites(MetaModel host) {
        Set<String> found = new HashSet<String>();
        for (Reaction reaction : host.getReactions(ReactionRole.EXCHANGE)) {
            if (! StringUtils.containsIgnoreCase(reaction.getId(), "biomass"))
                found.addAll(reaction.getStoichiometry().keySet());
        }
        return host.getMetabolites().stream().filter(x -> found.contains(x)).collect(Collectors.toList());
    }

    /**
     * Adapt a host model for community coupling.  The incoming model is not modified.
     *
     * @param host		host model to adapt
     *
     * @return the adapted host model
     */
    public static MetaModel adapt(MetaModel host) {
        Set<String> exMets = new HashSet<String>(host.getMetabolites(Compartment.EXTRACELLULAR));
        List<String> exRxns = host.getReactions(ReactionRole.EXCHANGE).stream().map(x -> x.getId())
                .collect(Collectors.toList());
        log.info("Host {} has {} extracellular metabolites and {} exchange reactions.", host.getName(),
                exMets.size(), exRxns.size());
        // Build the body-fluid connector from every reaction touching the extracellular space.
        MetaModel bodyFluid = new MetaModel(PREFIX + "body_fluid");
        for (Reaction reaction : host.getReactions()) {
            boolean touches = reaction.getStoichiometry().keySet().stream().anyMatch(x -> exMets.contains(x));
            if (touches) {
                Reaction copy = new Reaction(PREFIX + reaction.getId() + "b", reaction.getLowerBound(),
                        reaction.getUpperBound());
                copy.setObjective(reaction.getObjective());
                for (Map.Entry<String, Double> entry : reaction.getStoichiometry().entrySet()) {
                    String metId = entry.getKey();
                    if (exMets.contains(metId))
                        metId = Compartment.BODY_FLUID.convert(metId);
                    metId = PREFIX + metId;
                    bodyFluid.addMetabolite(metId);
                    copy.setCoefficient(metId, entry.getValue());
                }
                bodyFluid.addReaction(copy);
            }
        }
        // Remove the exchanges and namespace everything else.
        MetaModel stripped = host.copy();
        stripped.removeReactions(exRxns, true);
        MetaModel retVal = stripped.renamed(PREFIX + host.getName(), x -> PREFIX + x, x -> PREFIX + x);
        ModelMerger.mergeInto(retVal, bodyFluid, ModelMerger.Mode.GLUED, false);
        // Connect the remaining extracellular metabolites to the lumen.
        MetaModel lumen = new MetaModel(PREFIX + "lumen");
        for (String metId : retVal.getMetabolites(Compartment.EXTRACELLULAR)) {
            String lumenMet = Compartment.LUMEN.convert(StringUtils.removeStart(metId, PREFIX));
            lumen.addMetabolite(metId);
            lumen.addMetabolite(lumenMet);
            lumen.addReaction(new Reaction(PREFIX + "IEX_" + lumenMet + "tr", -Reaction.DEFAULT_LIMIT, Reaction.DEFAULT_LIMIT)
                    .setCoefficient(metId, -1.0).setCoefficient(lumenMet, 1.0));
        }
        ModelMerger.mergeInto(retVal, lumen, ModelMerger.Mode.GLUED, false);
        log.info("Adapted host has {} body-fluid reactions and {} lumen transporters.", bodyFluid.getReactionCount(),
                lumen.getReactionCount());
        return retVal;
    }

}
