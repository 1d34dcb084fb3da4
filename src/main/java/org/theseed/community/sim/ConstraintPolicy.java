/**
 *
 */
package org.theseed.community.sim;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.community.CommunityAssembler;
import org.theseed.community.MetaModel;
import org.theseed.community.Reaction;
import org.theseed.community.ReactionRole;

/**
 * This class applies the simulation constraints to a community model.  The base constraints are
 * the same for every scenario; the scenario constraints then close or limit the diet.  Neither
 * operation modifies its input:  each returns a constrained copy.
 */
public class ConstraintPolicy {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ConstraintPolicy.class);
    /** tuning parameters */
    private PolicyParameters parms;
    /** upper bound for open diet and fecal reactions */
    public static final double OPEN_LIMIT = 1000000.0;
    /** host blood exchanges allowed to take up metabolites */
    private static final List<String> BLOOD_UPTAKE = Arrays.asList("h2o", "hco3", "o2");
    /** host blood uptake limit */
    private static final double BLOOD_UPTAKE_BOUND = -100.0;
    /** host lumen exchange uptake limit */
    private static final double LUMEN_UPTAKE_BOUND = -1000.0;
    /** host biomass minimum flux */
    private static final double HOST_BIOMASS_MIN = 0.001;
    /** sink reaction lower bound */
    private static final double SINK_BOUND = -1.0;
    /** suffix of an organism biomass metabolite */
    private static final String BIOMASS_SUFFIX = "_biomass[c]";

    /** map of host-derived gut metabolites to their diet uptake limits */
    public static final Map<String, Double> HUMAN_METS;
    static {
        Map<String, Double> humanMets = new LinkedHashMap<String, Double>();
        // primary bile acids and amines
        for (String met : new String[] { "gchola", "tdchola", "tchola", "dgchol", "34dhphe", "5htrp", "Lkynr" })
            humanMets.put(met, -10.0);
        // mucins and host glycans
        for (String met : new String[] { "f1a", "gncore1", "gncore2", "dsT_antigen", "sTn_antigen", "core8",
                "core7", "core5", "core4", "ha", "cspg_a", "cspg_b", "cspg_c", "cspg_d", "cspg_e", "hspg" })
            humanMets.put(met, -1.0);
        HUMAN_METS = Collections.unmodifiableMap(humanMets);
    }

    /**
     * Construct a constraint policy.
     *
     * @param parms		tuning parameters
     */
    public ConstraintPolicy(PolicyParameters parms) {
        this.parms = parms;
    }

    /**
     * @return the tuning parameters
     */
    public PolicyParameters getParms() {
        return this.parms;
    }

    /**
     * @return a copy of a community model with the scenario-independent constraints applied
     *
     * @param model		community model to constrain
     *
     * @throws org.theseed.community.ModelStructureException if a required reaction is missing
     */
    public MetaModel applyBase(MetaModel model) {
        MetaModel retVal = model.copy();
        // Organism biomass reactions may not run backward.
        for (Reaction reaction : retVal.getReactions(ReactionRole.BIOMASS))
            reaction.setLowerBound(0.0);
        // Relax the demand and sink reactions of the community members.
        Reaction community = retVal.requireReaction(ReactionRole.COMMUNITY_BIOMASS_ID);
        Set<String> members = members(community);
        int demands = 0;
        int sinks = 0;
        for (Reaction reaction : retVal.getReactions()) {
            if (members.contains(reaction.getOwner())) {
                if (reaction.getRole() == ReactionRole.DEMAND) {
                    reaction.setLowerBound(0.0);
                    demands++;
                } else if (reaction.getRole() == ReactionRole.SINK) {
                    reaction.setLowerBound(SINK_BOUND);
                    sinks++;
                }
            }
        }
        log.debug("{} demand and {} sink reactions relaxed for {} community members.", demands, sinks, members.size());
        retVal.setObjective(CommunityAssembler.COMMUNITY_OBJECTIVE);
        // Diet exchanges get a distinct prefix.
        Map<String, String> renames = new HashMap<String, String>();
        for (Reaction reaction : retVal.getReactions(ReactionRole.DIET_EXCHANGE)) {
            if (reaction.getId().startsWith("EX_"))
                renames.put(reaction.getId(), DietTable.DIET_PREFIX + reaction.getId());
        }
        retVal.renameReactions(renames);
        community.setBounds(this.parms.getLowerBiomassBound(), 1.0);
        for (Reaction reaction : retVal.getReactions()) {
            switch (reaction.getRole()) {
            case DIET_TRANSPORT :
            case FECAL_TRANSPORT :
            case DIET_EXCHANGE :
            case FECAL_EXCHANGE :
            case EXCHANGE :
                reaction.setUpperBound(OPEN_LIMIT);
                break;
            default :
                break;
            }
        }
        if (this.parms.hasHost())
            this.applyHost(retVal);
        return retVal;
    }

    /**
     * Apply the host constraints to a community model.
     *
     * @param model		host-coupled community model to update
     */
    private void applyHost(MetaModel model) {
        for (Reaction reaction : model.getReactions(ReactionRole.HOST_BLOOD_EXCHANGE))
            reaction.setLowerBound(0.0);
        for (String met : BLOOD_UPTAKE)
            this.setLower(model, "Host_EX_" + met + "[e]b", BLOOD_UPTAKE_BOUND);
        for (Reaction reaction : model.getReactions(ReactionRole.HOST_LUMEN_EXCHANGE))
            reaction.setLowerBound(0.0);
        for (String met : HUMAN_METS.keySet())
            this.setLower(model, "Host_IEX_" + met + "[u]tr", LUMEN_UPTAKE_BOUND);
        Reaction hostBiomass = model.requireReaction("Host_" + this.parms.getHostBiomassReaction());
        hostBiomass.setBounds(HOST_BIOMASS_MIN, this.parms.getHostBiomassCap());
    }

    /**
     * @return a copy of a base-constrained model with the diet constraints for a scenario applied
     *
     * @param base			model with the base constraints applied
     * @param scenario		scenario to simulate
     * @param diet			diet for the scenario (ignored for the rich scenario)
     */
    public MetaModel applyScenario(MetaModel base, Scenario scenario, DietTable diet) {
        MetaModel retVal = base.copy();
        if (scenario != Scenario.RICH) {
            for (Reaction reaction : retVal.getReactions(ReactionRole.DIET_EXCHANGE))
                reaction.setLowerBound(0.0);
            int found = 0;
            for (Map.Entry<String, Double> entry : diet.getBounds().entrySet()) {
                if (this.setLower(retVal, entry.getKey(), entry.getValue()))
                    found++;
            }
            log.debug("{} of {} diet constraints applied to {} for {} scenario.", found, diet.size(),
                    retVal.getName(), scenario);
            if (this.parms.isIncludeHumanMets()) {
                for (Map.Entry<String, Double> entry : HUMAN_METS.entrySet())
                    this.setLower(retVal, DietTable.DIET_PREFIX + "EX_" + entry.getKey() + "[d]", entry.getValue());
            }
        }
        return retVal;
    }

    /**
     * @return a fully-constrained copy of a community model for a scenario
     *
     * @param model			community model to constrain
     * @param scenario		scenario to simulate
     * @param diet			diet for the scenario
     */
    public MetaModel apply(MetaModel model, Scenario scenario, DietTable diet) {
        return this.applyScenario(this.applyBase(model), scenario, diet);
    }

    /**
     * Set the lower bound of a reaction if it is present.
     *
     * @param model			model to update
     * @param reactionId	ID of the reaction to constrain
     * @param bound			new lower bound
     *
     * @return TRUE if the reaction was found
     */
    private boolean setLower(MetaModel model, String reactionId, double bound) {
        Reaction reaction = model.getReaction(reactionId);
        boolean retVal = (reaction != null);
        if (retVal)
            reaction.setLowerBound(bound);
        else if (log.isDebugEnabled())
            log.debug("Reaction {} not found in {}.", reactionId, model.getName());
        return retVal;
    }

    /**
     * @return the names of the organisms consumed by the community biomass reaction
     *
     * @param community		community biomass reaction
     */
    public static Set<String> members(Reaction community) {
        Set<String> retVal = new TreeSet<String>();
        for (Map.Entry<String, Double> entry : community.getStoichiometry().entrySet()) {
            String metId = entry.getKey();
            if (entry.getValue() < 0 && metId.endsWith(BIOMASS_SUFFIX))
                retVal.add(StringUtils.removeEnd(metId, BIOMASS_SUFFIX));
        }
        return retVal;
    }

}
