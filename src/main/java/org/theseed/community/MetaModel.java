/**
 *
 */
package org.theseed.community;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This object represents a stoichiometric metabolic model.  The model consists of an ordered set
 * of metabolite IDs, an ordered set of reactions (each of which carries its own sparse column of
 * the stoichiometric matrix), and an optional gene table.  Metabolite IDs carry a compartment
 * suffix, and reaction IDs determine the reaction role.
 *
 * The stoichiometric matrix has one row per metabolite and one column per reaction.  Every
 * reaction may only reference metabolites in the model.  Flux bounds are not required to be
 * ordered:  a constraint rule can produce a lower bound above the upper bound, and it is the
 * solver's job to report such a model as infeasible.
 */
public class MetaModel {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(MetaModel.class);
    /** name of the model */
    private String name;
    /** metabolite IDs, in order */
    private Set<String> metabolites;
    /** map of reaction IDs to reactions, in order */
    private Map<String, Reaction> reactions;
    /** gene-reaction rules */
    private GeneAssociations genes;

    /**
     * Construct an empty model.
     *
     * @param name	name of the model
     */
    public MetaModel(String name) {
        this.name = name;
        this.metabolites = new LinkedHashSet<String>();
        this.reactions = new LinkedHashMap<String, Reaction>();
        this.genes = new GeneAssociations();
    }

    /**
     * @return a deep copy of this model
     */
    public MetaModel copy() {
        MetaModel retVal = new MetaModel(this.name);
        retVal.metabolites.addAll(this.metabolites);
        for (Reaction reaction : this.reactions.values())
            retVal.reactions.put(reaction.getId(), reaction.copy());
        retVal.genes = this.genes.copy();
        return retVal;
    }

    /**
     * @return the model name
     */
    public String getName() {
        return this.name;
    }

    /**
     * Change the model name.
     *
     * @param name 	the new name
     */
    public void setName(String name) {
        this.name = name;
    }

    /**
     * Add a metabolite to the model.
     *
     * @param metId		ID of the metabolite to add
     *
     * @return TRUE if the metabolite was added, FALSE if it was already present
     */
    public boolean addMetabolite(String metId) {
        return this.metabolites.add(metId);
    }

    /**
     * Add a collection of metabolites to the model.  Metabolites already present are ignored.
     *
     * @param metIds	IDs of the metabolites to add
     */
    public void addMetabolites(Collection<String> metIds) {
        this.metabolites.addAll(metIds);
    }

    /**
     * @return TRUE if the specified metabolite is in the model
     *
     * @param metId		ID of the metabolite of interest
     */
    public boolean hasMetabolite(String metId) {
        return this.metabolites.contains(metId);
    }

    /**
     * @return an unmodifiable view of the metabolite IDs, in order
     */
    public Set<String> getMetabolites() {
        return Collections.unmodifiableSet(this.metabolites);
    }

    /**
     * @return the IDs of the metabolites in the specified compartment, in order
     *
     * @param comp		compartment of interest
     */
    public List<String> getMetabolites(Compartment comp) {
        return this.metabolites.stream().filter(x -> Compartment.of(x) == comp).collect(Collectors.toList());
    }

    /**
     * @return the number of metabolites (rows of the stoichiometric matrix)
     */
    public int getMetaboliteCount() {
        return this.metabolites.size();
    }

    /**
     * @return the number of reactions (columns of the stoichiometric matrix)
     */
    public int getReactionCount() {
        return this.reactions.size();
    }

    /**
     * Add a reaction to the model.  All of its metabolites must already be present.
     *
     * @param reaction	reaction to add
     *
     * @throws ModelStructureException if the reaction ID is a duplicate or a metabolite is unknown
     */
    public void addReaction(Reaction reaction) {
        String id = reaction.getId();
        if (this.reactions.containsKey(id))
            throw new ModelStructureException("Duplicate reaction " + id + " in model " + this.name + ".");
        for (String metId : reaction.getStoichiometry().keySet()) {
            if (! this.metabolites.contains(metId))
                throw new ModelStructureException("Reaction " + id + " references unknown metabolite "
                        + metId + " in model " + this.name + ".");
        }
        this.reactions.put(id, reaction);
    }

    /**
     * @return TRUE if the specified reaction is in the model
     *
     * @param reactionId	ID of the reaction of interest
     */
    public boolean hasReaction(String reactionId) {
        return this.reactions.containsKey(reactionId);
    }

    /**
     * @return the reaction with the specified ID, or NULL if there is none
     *
     * @param reactionId	ID of the desired reaction
     */
    public Reaction getReaction(String reactionId) {
        return this.reactions.get(reactionId);
    }

    /**
     * @return the reaction with the specified ID
     *
     * @param reactionId	ID of the desired reaction
     *
     * @throws ModelStructureException if the reaction is not in the model
     */
    public Reaction requireReaction(String reactionId) {
        Reaction retVal = this.reactions.get(reactionId);
        if (retVal == null)
            throw new ModelStructureException("Required reaction " + reactionId + " not found in model "
                    + this.name + ".");
        return retVal;
    }

    /**
     * @return an unmodifiable view of the reactions, in order
     */
    public Collection<Reaction> getReactions() {
        return Collections.unmodifiableCollection(this.reactions.values());
    }

    /**
     * @return the reactions with the specified role, in order
     *
     * @param role		role of interest
     */
    public List<Reaction> getReactions(ReactionRole role) {
        return this.reactions.values().stream().filter(x -> x.getRole() == role).collect(Collectors.toList());
    }

    /**
     * @return the reactions in which the specified metabolite participates
     *
     * @param metId		ID of the metabolite of interest
     */
    public List<Reaction> getReactionsFor(String metId) {
        return this.reactions.values().stream().filter(x -> x.contains(metId)).collect(Collectors.toList());
    }

    /**
     * @return the stoichiometric coefficient at the specified row and column (0 if none)
     *
     * @param metId			metabolite ID (row)
     * @param reactionId	reaction ID (column)
     */
    public double getCoefficient(String metId, String reactionId) {
        double retVal = 0.0;
        Reaction reaction = this.reactions.get(reactionId);
        if (reaction != null)
            retVal = reaction.getCoefficient(metId);
        return retVal;
    }

    /**
     * Remove reactions from the model.
     *
     * @param reactionIds	IDs of the reactions to remove
     * @param prune			if TRUE, metabolites no longer used by any reaction are removed as well
     *
     * @return the set of metabolites removed
     */
    public Set<String> removeReactions(Collection<String> reactionIds, boolean prune) {
        Set<String> candidates = new HashSet<String>();
        for (String reactionId : reactionIds) {
            Reaction reaction = this.reactions.remove(reactionId);
            if (reaction != null)
                candidates.addAll(reaction.getStoichiometry().keySet());
        }
        this.genes.remove(reactionIds);
        Set<String> retVal = new LinkedHashSet<String>();
        if (prune && ! candidates.isEmpty()) {
            Set<String> used = new HashSet<String>(this.metabolites.size());
            for (Reaction reaction : this.reactions.values())
                used.addAll(reaction.getStoichiometry().keySet());
            for (String metId : candidates) {
                if (! used.contains(metId)) {
                    this.metabolites.remove(metId);
                    retVal.add(metId);
                }
            }
        }
        log.debug("{} reactions and {} metabolites removed from {}.", reactionIds.size(), retVal.size(), this.name);
        return retVal;
    }

    /**
     * Rename reactions in place.  The model order is preserved and the roles are recomputed.
     *
     * @param renames	map of old reaction IDs to new ones
     *
     * @throws ModelStructureException if a new ID collides with an existing reaction
     */
    public void renameReactions(Map<String, String> renames) {
        Map<String, Reaction> newMap = new LinkedHashMap<String, Reaction>(this.reactions.size() * 4 / 3 + 1);
        for (Reaction reaction : this.reactions.values()) {
            String newId = renames.getOrDefault(reaction.getId(), reaction.getId());
            if (newMap.put(newId, reaction) != null)
                throw new ModelStructureException("Renaming creates duplicate reaction " + newId
                        + " in model " + this.name + ".");
        }
        // No collisions, so the reactions can be updated.
        for (Map.Entry<String, Reaction> entry : newMap.entrySet())
            entry.getValue().setId(entry.getKey());
        this.reactions = newMap;
        this.genes.rename(renames);
    }

    /**
     * Create a copy of this model with every metabolite and reaction renamed.
     *
     * @param newName		name for the new model
     * @param metRename		function to compute new metabolite IDs
     * @param rxnRename		function to compute new reaction IDs
     *
     * @return the renamed copy
     */
    public MetaModel renamed(String newName, UnaryOperator<String> metRename, UnaryOperator<String> rxnRename) {
        MetaModel retVal = new MetaModel(newName);
        Map<String, String> metMap = new LinkedHashMap<String, String>(this.metabolites.size() * 4 / 3 + 1);
        for (String metId : this.metabolites) {
            String newId = metRename.apply(metId);
            metMap.put(metId, newId);
            if (! retVal.addMetabolite(newId))
                throw new ModelStructureException("Renaming creates duplicate metabolite " + newId + ".");
        }
        Map<String, String> rxnMap = new LinkedHashMap<String, String>(this.reactions.size() * 4 / 3 + 1);
        for (Reaction reaction : this.reactions.values()) {
            String newId = rxnRename.apply(reaction.getId());
            rxnMap.put(reaction.getId(), newId);
            Reaction newReaction = new Reaction(newId, reaction);
            newReaction.renameMetabolites(metMap);
            retVal.addReaction(newReaction);
        }
        retVal.genes = this.genes.copy();
        retVal.genes.rename(rxnMap);
        return retVal;
    }

    /**
     * Make the specified reaction the sole objective.
     *
     * @param reactionId	ID of the objective reaction
     *
     * @throws ModelStructureException if the reaction is not in the model
     */
    public void setObjective(String reactionId) {
        Reaction target = this.requireReaction(reactionId);
        for (Reaction reaction : this.reactions.values())
            reaction.setObjective(0.0);
        target.setObjective(1.0);
    }

    /**
     * @return the IDs of the reactions with a nonzero objective coefficient
     */
    public List<String> getObjectiveReactions() {
        List<String> retVal = new ArrayList<String>();
        for (Reaction reaction : this.reactions.values()) {
            if (reaction.getObjective() != 0.0)
                retVal.add(reaction.getId());
        }
        return retVal;
    }

    /**
     * @return the gene table
     */
    public GeneAssociations getGenes() {
        return this.genes;
    }

    /**
     * Replace the gene table.
     *
     * @param genes		new gene table
     */
    public void setGenes(GeneAssociations genes) {
        this.genes = genes;
    }

    /**
     * Verify the structural consistency of the model.
     *
     * @throws ModelStructureException if a reaction references a metabolite not in the model
     */
    public void validate() {
        for (Reaction reaction : this.reactions.values()) {
            for (String metId : reaction.getStoichiometry().keySet()) {
                if (! this.metabolites.contains(metId))
                    throw new ModelStructureException("Reaction " + reaction.getId() + " references unknown metabolite "
                            + metId + " in model " + this.name + ".");
            }
        }
    }

    @Override
    public String toString() {
        return "Model " + this.name + " (" + this.metabolites.size() + " metabolites, "
                + this.reactions.size() + " reactions)";
    }

}
