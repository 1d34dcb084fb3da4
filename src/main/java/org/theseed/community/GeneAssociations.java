/**
 *
 */
package org.theseed.community;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.apache.commons.lang3.StringUtils;

/**
 * This is the gene side-table of a model.  It maps reaction IDs to gene-reaction rules (text
 * such as "b0241 or (b0929 and b1377)").  The gene list is derived from the rules.  The table
 * takes no part in the stoichiometry, and a merge can drop it entirely.
 */
public class GeneAssociations {

    // FIELDS
    /** map of reaction IDs to rules */
    private Map<String, String> rules;
    /** connective words in a rule */
    private static final Set<String> CONNECTIVES = Set.of("and", "or", "AND", "OR");

    /**
     * Construct an empty gene table.
     */
    public GeneAssociations() {
        this.rules = new LinkedHashMap<String, String>();
    }

    /**
     * @return a copy of this gene table
     */
    public GeneAssociations copy() {
        GeneAssociations retVal = new GeneAssociations();
        retVal.rules.putAll(this.rules);
        return retVal;
    }

    /**
     * Specify the rule for a reaction.  A blank rule removes the association.
     *
     * @param reactionId	ID of the reaction
     * @param rule			gene-reaction rule text
     */
    public void setRule(String reactionId, String rule) {
        if (StringUtils.isBlank(rule))
            this.rules.remove(reactionId);
        else
            this.rules.put(reactionId, rule);
    }

    /**
     * @return the rule for a reaction, or an empty string if there is none
     *
     * @param reactionId	ID of the reaction of interest
     */
    public String getRule(String reactionId) {
        return this.rules.getOrDefault(reactionId, "");
    }

    /**
     * @return the set of genes mentioned in the rules
     */
    public Set<String> getGenes() {
        Set<String> retVal = new TreeSet<String>();
        for (String rule : this.rules.values()) {
            String[] tokens = StringUtils.split(rule, " ()");
            for (String token : tokens) {
                if (! CONNECTIVES.contains(token))
                    retVal.add(token);
            }
        }
        return retVal;
    }

    /**
     * @return an unmodifiable view of the reaction-to-rule map
     */
    public Map<String, String> getRules() {
        return Collections.unmodifiableMap(this.rules);
    }

    /**
     * @return the number of reactions with rules
     */
    public int size() {
        return this.rules.size();
    }

    /**
     * @return TRUE if there are no rules
     */
    public boolean isEmpty() {
        return this.rules.isEmpty();
    }

    /**
     * Add the rules from another gene table.
     *
     * @param other		gene table to merge in
     */
    public void merge(GeneAssociations other) {
        this.rules.putAll(other.rules);
    }

    /**
     * Remove the rules for the specified reactions.
     *
     * @param reactionIds	IDs of the reactions being removed
     */
    public void remove(Collection<String> reactionIds) {
        for (String reactionId : reactionIds)
            this.rules.remove(reactionId);
    }

    /**
     * Rename the reactions in this table.
     *
     * @param renames	map of old reaction IDs to new ones; unmapped IDs are kept
     */
    public void rename(Map<String, String> renames) {
        Map<String, String> newRules = new LinkedHashMap<String, String>(this.rules.size() * 4 / 3 + 1);
        for (Map.Entry<String, String> entry : this.rules.entrySet())
            newRules.put(renames.getOrDefault(entry.getKey(), entry.getKey()), entry.getValue());
        this.rules = newRules;
    }

}
