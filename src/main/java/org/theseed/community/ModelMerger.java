/**
 *
 */
package org.theseed.community;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This class combines two metabolic models into one.  The metabolite and reaction sets of the
 * result are the unions of the inputs.  Bounds, objective coefficients and roles are carried
 * over unchanged, and each reaction keeps its own column, so the stoichiometric matrix of the
 * result is the inputs' columns concatenated with shared metabolite rows unified.
 *
 * Reaction IDs may never be shared.  Whether metabolite IDs may be shared depends on the merge
 * mode.
 */
public class ModelMerger {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ModelMerger.class);

    /**
     * This enumeration describes how shared metabolites are handled.
     */
    public static enum Mode {
        /** any metabolite present in both models is unified into one row */
        GLUED {
            @Override
            public boolean canShare(String metId) {
                return true;
            }
        },
        /** the models are namespaced; only connector-compartment metabolites may be shared */
        DISJOINT {
            @Override
            public boolean canShare(String metId) {
                return Compartment.of(metId).isConnector();
            }
        };

        /**
         * @return TRUE if the specified metabolite may appear in both input models
         *
         * @param metId		ID of the shared metabolite
         */
        public abstract boolean canShare(String metId);
    }

    /**
     * Merge two models into a new one.  Neither input is modified.
     *
     * @param a				first model
     * @param b				second model
     * @param mode			shared-metabolite mode
     * @param mergeGenes	if TRUE, the gene tables are merged; otherwise the result has none
     *
     * @return the merged model
     *
     * @throws ModelStructureException if the models have conflicting identifiers
     */
    public static MetaModel merge(MetaModel a, MetaModel b, Mode mode, boolean mergeGenes) {
        MetaModel retVal = a.copy();
        mergeInto(retVal, b, mode, mergeGenes);
        return retVal;
    }

    /**
     * Merge a model into a target model.  The target is modified; the source is not.  All the
     * conflicts are checked before the target is changed.
     *
     * @param target		model to receive the merged data
     * @param source		model to merge in
     * @param mode			shared-metabolite mode
     * @param mergeGenes	if TRUE, the gene tables are merged; otherwise the target's table is cleared
     *
     * @throws ModelStructureException if the models have conflicting identifiers
     */
    public static void mergeInto(MetaModel target, MetaModel source, Mode mode, boolean mergeGenes) {
        // Check for conflicts.
        List<String> newMets = new ArrayList<String>(source.getMetaboliteCount());
        int shared = 0;
        for (String metId : source.getMetabolites()) {
            if (! target.hasMetabolite(metId))
                newMets.add(metId);
            else if (mode.canShare(metId))
                shared++;
            else
                throw new ModelStructureException("Metabolite " + metId + " appears in both " + target.getName()
                        + " and " + source.getName() + " but is not in a connector compartment.");
        }
        for (Reaction reaction : source.getReactions()) {
            if (target.hasReaction(reaction.getId()))
                throw new ModelStructureException("Reaction " + reaction.getId() + " appears in both "
                        + target.getName() + " and " + source.getName() + ".");
        }
        // Now add the metabolites and the reaction columns.
        target.addMetabolites(newMets);
        for (Reaction reaction : source.getReactions())
            target.addReaction(reaction.copy());
        if (mergeGenes)
            target.getGenes().merge(source.getGenes());
        else
            target.setGenes(new GeneAssociations());
        log.debug("Merged {} into {}: {} new metabolites, {} shared, {} reactions added.", source.getName(),
                target.getName(), newMets.size(), shared, source.getReactionCount());
    }

}
